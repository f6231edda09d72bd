package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ComposeValues;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renomeia as chaves de uma seção da raiz (volumes, networks, configs, secrets).
 *
 * Cada definição é copiada sem inspeção; apenas a chave muda para {nome}-{sufixo}.
 * Seção ausente (null) continua ausente.
 */
@Component
public class RootSectionRenamer {

    public Map<String, Object> renameRoot(Map<String, Object> definitions, String suffix) {
        return renameRoot(definitions, suffix, Collections.emptySet());
    }

    /**
     * @param definitions Seção original (pode ser null)
     * @param suffix Sufixo a anexar
     * @param preservedNames Nomes copiados sem renomear (ex: rede compartilhada da plataforma)
     * @return Nova seção com as chaves renomeadas, ou null se a seção não existia
     */
    public Map<String, Object> renameRoot(Map<String, Object> definitions, String suffix, Set<String> preservedNames) {
        if (definitions == null) {
            return null;
        }

        Map<String, Object> renamed = new LinkedHashMap<>();
        definitions.forEach((name, definition) -> {
            String key = preservedNames.contains(name) ? name : ComposeValues.suffixed(name, suffix);
            renamed.put(key, ComposeValues.deepCopy(definition));
        });
        return renamed;
    }
}
