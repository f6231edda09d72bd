package com.seveninterprise.stackforge.model.compose;

/**
 * Tipos de recursos nomeados declarados na raiz de um documento compose.
 */
public enum ResourceKind {

    VOLUME("volumes"),
    NETWORK("networks"),
    CONFIG("configs"),
    SECRET("secrets");

    private final String key;

    ResourceKind(String key) {
        this.key = key;
    }

    /**
     * Nome da seção no documento (ex: "volumes")
     */
    public String getKey() {
        return key;
    }

    /**
     * Resolve o tipo a partir do nome da seção
     *
     * @param key Nome da seção (ex: "networks")
     * @return Tipo correspondente ou null se não for uma seção de recursos
     */
    public static ResourceKind fromKey(String key) {
        for (ResourceKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        return null;
    }
}
