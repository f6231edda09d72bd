package com.seveninterprise.stackforge.model.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utilitários para valores YAML não tipados (mapas, listas e escalares)
 * e para a composição de nomes com sufixo.
 */
public final class ComposeValues {

    private ComposeValues() {
    }

    /**
     * Anexa o sufixo ao nome: {name}-{suffix}
     */
    public static String suffixed(String name, String suffix) {
        return name + "-" + suffix;
    }

    /**
     * Cópia profunda de um valor carregado do YAML.
     * Mapas e listas são recriados preservando a ordem; escalares são imutáveis.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    public static Map<String, Object> deepCopyMap(Map<String, ?> value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : value.entrySet()) {
            copy.put(entry.getKey(), deepCopy(entry.getValue()));
        }
        return copy;
    }

    /**
     * Cópia profunda somente leitura: mapas e listas aninhados também ficam imutáveis.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), immutableCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(immutableCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return deepCopy(value);
    }

    public static Map<String, Object> immutableCopyMap(Map<String, ?> value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : value.entrySet()) {
            copy.put(entry.getKey(), immutableCopy(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Retorna o valor como mapa de chaves String, ou null se o valor não for
     * um mapa.
     *
     * Chaves numéricas ou booleanas (ex: um serviço chamado 8080) são
     * convertidas para String, como o Compose faz. Retorna null se alguma chave
     * for nula ou não escalar, ou se duas chaves colidirem após a conversão.
     * Quando todas as chaves já são String, a própria instância é retornada.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asStringKeyedMap(Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        boolean allStrings = true;
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                if (!(key instanceof Number) && !(key instanceof Boolean)) {
                    return null;
                }
                allStrings = false;
            }
        }
        if (allStrings) {
            return (Map<String, Object>) value;
        }

        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (converted.containsKey(key)) {
                return null;
            }
            converted.put(key, entry.getValue());
        }
        return converted;
    }

    /**
     * Retorna o valor como lista de Strings, ou null se algum item não for String.
     */
    public static List<String> asStringList(Object value) {
        if (!(value instanceof List)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                return null;
            }
            result.add((String) item);
        }
        return result;
    }
}
