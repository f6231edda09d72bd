package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ComposeValues;
import com.seveninterprise.stackforge.model.compose.NetworkAttachments;
import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reescreve o campo networks dos serviços.
 *
 * Formas suportadas:
 * - lista de nomes: cada nome recebe o sufixo
 * - mapa com aliases: a chave recebe o sufixo, os aliases não mudam
 * - mapa com valor vazio: a chave recebe o sufixo, o valor null é mantido
 */
@Component
public class ServiceNetworkRewriter extends AbstractServiceRewriter {

    @Override
    public ResourceKind getKind() {
        return ResourceKind.NETWORK;
    }

    @Override
    protected void rewriteService(ServiceDefinition service, String suffix, Set<String> preservedNames) {
        if (service.getNetworks() == null) {
            return;
        }

        service.setNetworks(service.getNetworks().match(
            list -> {
                List<String> names = new ArrayList<>();
                list.getNames().forEach(name -> names.add(rename(name, suffix, preservedNames)));
                return NetworkAttachments.ofNames(names);
            },
            map -> {
                Map<String, Object> attachments = new LinkedHashMap<>();
                // aliases são hostnames dentro da rede, não recursos declarados
                map.getAttachments().forEach((name, attributes) ->
                    attachments.put(rename(name, suffix, preservedNames), ComposeValues.deepCopy(attributes)));
                return NetworkAttachments.ofAttachments(attachments);
            }
        ));
    }
}
