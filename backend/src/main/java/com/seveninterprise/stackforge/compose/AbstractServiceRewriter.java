package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ComposeValues;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Base dos reescritores: copia cada serviço e delega a reescrita do campo
 * correspondente à subclasse. As chaves do mapa de serviços não mudam.
 */
public abstract class AbstractServiceRewriter implements ServiceReferenceRewriter {

    @Override
    public Map<String, ServiceDefinition> rewrite(Map<String, ServiceDefinition> services, String suffix, Set<String> preservedNames) {
        if (services == null) {
            return null;
        }

        Map<String, ServiceDefinition> rewritten = new LinkedHashMap<>();
        services.forEach((name, service) -> {
            ServiceDefinition copy = service.copy();
            rewriteService(copy, suffix, preservedNames);
            rewritten.put(name, copy);
        });
        return rewritten;
    }

    /**
     * Reescreve as referências do serviço já copiado
     */
    protected abstract void rewriteService(ServiceDefinition service, String suffix, Set<String> preservedNames);

    protected String rename(String name, String suffix, Set<String> preservedNames) {
        return preservedNames.contains(name) ? name : ComposeValues.suffixed(name, suffix);
    }
}
