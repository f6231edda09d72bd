package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Reescreve, nos serviços, as referências a um tipo de recurso da raiz.
 *
 * Apenas o identificador da referência muda; caminhos do host, caminhos
 * dentro do container e aliases permanecem como estão.
 */
public interface ServiceReferenceRewriter {

    /**
     * Tipo de recurso cujas referências este componente reescreve
     */
    ResourceKind getKind();

    /**
     * @param services Mapa de serviços (não é alterado)
     * @param suffix Sufixo a anexar aos nomes referenciados
     * @param preservedNames Nomes de recursos que não são renomeados
     * @return Novo mapa de serviços, ou null se services for null
     */
    Map<String, ServiceDefinition> rewrite(Map<String, ServiceDefinition> services, String suffix, Set<String> preservedNames);

    default Map<String, ServiceDefinition> rewrite(Map<String, ServiceDefinition> services, String suffix) {
        return rewrite(services, suffix, Collections.emptySet());
    }
}
