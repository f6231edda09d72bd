package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ComposeValues;
import com.seveninterprise.stackforge.model.compose.DependsOn;
import com.seveninterprise.stackforge.model.compose.ExtendsReference;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renomeia os serviços e todas as referências entre serviços irmãos.
 *
 * Campos atualizados em cada serviço copiado:
 * - depends_on (lista ou mapa com condições)
 * - container_name
 * - links (service[:alias])
 * - volumes_from (service[:mode]; entradas container:... não mudam)
 * - extends (nome ou {service, file})
 *
 * Não verifica se o nome referenciado existe em services.
 */
@Component
public class ServiceNameRenamer {

    private static final String CONTAINER_PREFIX = "container:";

    public Map<String, ServiceDefinition> renameServices(Map<String, ServiceDefinition> services, String suffix) {
        if (services == null) {
            return null;
        }

        Map<String, ServiceDefinition> renamed = new LinkedHashMap<>();
        services.forEach((name, service) -> {
            ServiceDefinition copy = service.copy();

            if (copy.getDependsOn() != null) {
                copy.setDependsOn(renameDependsOn(copy.getDependsOn(), suffix));
            }
            if (copy.getContainerName() != null) {
                copy.setContainerName(ComposeValues.suffixed(copy.getContainerName(), suffix));
            }
            if (copy.getLinks() != null) {
                copy.setLinks(renameLinks(copy.getLinks(), suffix));
            }
            if (copy.getVolumesFrom() != null) {
                copy.setVolumesFrom(renameVolumesFrom(copy.getVolumesFrom(), suffix));
            }
            if (copy.getExtends() != null) {
                copy.setExtends(renameExtends(copy.getExtends(), suffix));
            }

            renamed.put(ComposeValues.suffixed(name, suffix), copy);
        });
        return renamed;
    }

    DependsOn renameDependsOn(DependsOn dependsOn, String suffix) {
        return dependsOn.match(
            list -> {
                List<String> services = new ArrayList<>();
                list.getServices().forEach(service -> services.add(ComposeValues.suffixed(service, suffix)));
                return DependsOn.ofServices(services);
            },
            map -> {
                Map<String, Object> conditions = new LinkedHashMap<>();
                map.getConditions().forEach((service, condition) ->
                    conditions.put(ComposeValues.suffixed(service, suffix), ComposeValues.deepCopy(condition)));
                return DependsOn.ofConditions(conditions);
            }
        );
    }

    List<String> renameLinks(List<String> links, String suffix) {
        List<String> renamed = new ArrayList<>();
        for (String link : links) {
            int colon = link.indexOf(':');
            if (colon < 0) {
                renamed.add(ComposeValues.suffixed(link, suffix));
            } else {
                // service:alias - o alias é o hostname visto pelo container
                renamed.add(ComposeValues.suffixed(link.substring(0, colon), suffix) + link.substring(colon));
            }
        }
        return renamed;
    }

    List<String> renameVolumesFrom(List<String> volumesFrom, String suffix) {
        List<String> renamed = new ArrayList<>();
        for (String entry : volumesFrom) {
            if (entry.startsWith(CONTAINER_PREFIX)) {
                renamed.add(entry);
                continue;
            }
            int colon = entry.indexOf(':');
            if (colon < 0) {
                renamed.add(ComposeValues.suffixed(entry, suffix));
            } else {
                renamed.add(ComposeValues.suffixed(entry.substring(0, colon), suffix) + entry.substring(colon));
            }
        }
        return renamed;
    }

    ExtendsReference renameExtends(ExtendsReference reference, String suffix) {
        return reference.match(
            name -> ExtendsReference.ofService(ComposeValues.suffixed(name.getService(), suffix)),
            detailed -> detailed.getService() instanceof String
                ? detailed.withService(ComposeValues.suffixed((String) detailed.getService(), suffix))
                : detailed
        );
    }
}
