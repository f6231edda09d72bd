package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ComposeDocument;
import com.seveninterprise.stackforge.model.compose.ComposeValues;
import com.seveninterprise.stackforge.model.compose.DependsOn;
import com.seveninterprise.stackforge.model.compose.ExtendsReference;
import com.seveninterprise.stackforge.model.compose.NetworkAttachments;
import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ResourceMount;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import com.seveninterprise.stackforge.model.compose.VolumeMount;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converte entre o mapa YAML carregado e o ComposeDocument tipado.
 *
 * Um campo cuja forma não é reconhecida fica como valor literal, de modo que
 * a renomeação passa por ele sem alterá-lo. O mesmo vale para o corpo de um
 * serviço que não é mapa: o serviço fica literal e só o nome é renomeado.
 * Chaves numéricas ou booleanas viram String. Fora isso, toMap(fromMap(m))
 * reproduz m.
 */
@Component
public class ComposeDocumentMapper {

    public ComposeDocument fromMap(Map<String, Object> root) {
        ComposeDocument document = new ComposeDocument();

        root.forEach((key, value) -> {
            if (ComposeDocument.SERVICES.equals(key)) {
                Map<String, ServiceDefinition> services = toServices(value);
                if (services != null) {
                    document.setServices(services);
                    return;
                }
            }
            ResourceKind kind = ResourceKind.fromKey(key);
            if (kind != null) {
                Map<String, Object> definitions = ComposeValues.asStringKeyedMap(value);
                if (definitions != null) {
                    document.setSection(kind, ComposeValues.deepCopyMap(definitions));
                    return;
                }
            }
            document.putAttribute(key, ComposeValues.deepCopy(value));
        });

        return document;
    }

    public Map<String, Object> toMap(ComposeDocument document) {
        Map<String, Object> root = new LinkedHashMap<>();

        for (String key : document.getFieldOrder()) {
            ResourceKind kind = ResourceKind.fromKey(key);
            if (ComposeDocument.SERVICES.equals(key) && document.getServices() != null) {
                Map<String, Object> services = new LinkedHashMap<>();
                document.getServices().forEach((name, service) ->
                    services.put(name, service.isLiteral() ? service.getLiteralBody() : serviceToMap(service)));
                root.put(key, services);
            } else if (kind != null && document.getSection(kind) != null) {
                root.put(key, ComposeValues.deepCopyMap(document.getSection(kind)));
            } else {
                root.put(key, ComposeValues.deepCopy(document.getAttribute(key)));
            }
        }

        return root;
    }

    public ServiceDefinition toService(Map<String, Object> raw) {
        ServiceDefinition service = new ServiceDefinition();

        raw.forEach((key, value) -> {
            if (!applyTyped(service, key, value)) {
                service.putAttribute(key, ComposeValues.deepCopy(value));
            }
        });

        return service;
    }

    public Map<String, Object> serviceToMap(ServiceDefinition service) {
        Map<String, Object> raw = new LinkedHashMap<>();
        for (String key : service.getFieldOrder()) {
            raw.put(key, service.toYamlValue(key));
        }
        return raw;
    }

    private Map<String, ServiceDefinition> toServices(Object value) {
        Map<String, Object> raw = ComposeValues.asStringKeyedMap(value);
        if (raw == null) {
            return null;
        }

        Map<String, ServiceDefinition> services = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Map<String, Object> definition = ComposeValues.asStringKeyedMap(entry.getValue());
            if (definition == null) {
                services.put(entry.getKey(), ServiceDefinition.ofLiteral(entry.getValue()));
                continue;
            }
            services.put(entry.getKey(), toService(definition));
        }
        return services;
    }

    private boolean applyTyped(ServiceDefinition service, String key, Object value) {
        switch (key) {
            case ServiceDefinition.DEPENDS_ON:
                DependsOn dependsOn = toDependsOn(value);
                if (dependsOn != null) {
                    service.setDependsOn(dependsOn);
                    return true;
                }
                return false;
            case ServiceDefinition.VOLUMES:
                List<VolumeMount> volumes = toVolumes(value);
                if (volumes != null) {
                    service.setVolumes(volumes);
                    return true;
                }
                return false;
            case ServiceDefinition.NETWORKS:
                NetworkAttachments networks = toNetworks(value);
                if (networks != null) {
                    service.setNetworks(networks);
                    return true;
                }
                return false;
            case ServiceDefinition.CONFIGS:
                List<ResourceMount> configs = toResourceMounts(value);
                if (configs != null) {
                    service.setConfigs(configs);
                    return true;
                }
                return false;
            case ServiceDefinition.SECRETS:
                List<ResourceMount> secrets = toResourceMounts(value);
                if (secrets != null) {
                    service.setSecrets(secrets);
                    return true;
                }
                return false;
            case ServiceDefinition.CONTAINER_NAME:
                if (value instanceof String) {
                    service.setContainerName((String) value);
                    return true;
                }
                return false;
            case ServiceDefinition.LINKS:
                List<String> links = ComposeValues.asStringList(value);
                if (links != null) {
                    service.setLinks(links);
                    return true;
                }
                return false;
            case ServiceDefinition.VOLUMES_FROM:
                List<String> volumesFrom = ComposeValues.asStringList(value);
                if (volumesFrom != null) {
                    service.setVolumesFrom(volumesFrom);
                    return true;
                }
                return false;
            case ServiceDefinition.EXTENDS:
                ExtendsReference reference = toExtends(value);
                if (reference != null) {
                    service.setExtends(reference);
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    private DependsOn toDependsOn(Object value) {
        List<String> services = ComposeValues.asStringList(value);
        if (services != null) {
            return DependsOn.ofServices(services);
        }
        Map<String, Object> conditions = ComposeValues.asStringKeyedMap(value);
        if (conditions != null) {
            return DependsOn.ofConditions(conditions);
        }
        return null;
    }

    private List<VolumeMount> toVolumes(Object value) {
        if (!(value instanceof List)) {
            return null;
        }
        List<VolumeMount> volumes = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof String) {
                volumes.add(VolumeMount.shortSyntax((String) item));
                continue;
            }
            Map<String, Object> attributes = ComposeValues.asStringKeyedMap(item);
            if (attributes == null) {
                return null;
            }
            volumes.add(VolumeMount.longSyntax(attributes));
        }
        return volumes;
    }

    private NetworkAttachments toNetworks(Object value) {
        List<String> names = ComposeValues.asStringList(value);
        if (names != null) {
            return NetworkAttachments.ofNames(names);
        }
        Map<String, Object> attachments = ComposeValues.asStringKeyedMap(value);
        if (attachments != null) {
            return NetworkAttachments.ofAttachments(attachments);
        }
        return null;
    }

    private List<ResourceMount> toResourceMounts(Object value) {
        if (!(value instanceof List)) {
            return null;
        }
        List<ResourceMount> mounts = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof String) {
                mounts.add(ResourceMount.bareName((String) item));
                continue;
            }
            Map<String, Object> attributes = ComposeValues.asStringKeyedMap(item);
            if (attributes == null) {
                return null;
            }
            mounts.add(ResourceMount.longSyntax(attributes));
        }
        return mounts;
    }

    private ExtendsReference toExtends(Object value) {
        if (value instanceof String) {
            return ExtendsReference.ofService((String) value);
        }
        Map<String, Object> attributes = ComposeValues.asStringKeyedMap(value);
        if (attributes != null) {
            return ExtendsReference.ofDetails(attributes);
        }
        return null;
    }
}
