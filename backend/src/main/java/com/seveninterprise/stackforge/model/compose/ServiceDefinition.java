package com.seveninterprise.stackforge.model.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Definição de um serviço dentro de services.
 *
 * Campos que referenciam outros recursos pelo nome ficam tipados; todos os
 * demais (image, command, environment, ports, healthcheck, deploy, ...) são
 * mantidos como valores YAML literais. A ordem original dos campos é preservada.
 */
public class ServiceDefinition {

    public static final String DEPENDS_ON = "depends_on";
    public static final String VOLUMES = "volumes";
    public static final String NETWORKS = "networks";
    public static final String CONFIGS = "configs";
    public static final String SECRETS = "secrets";
    public static final String CONTAINER_NAME = "container_name";
    public static final String LINKS = "links";
    public static final String VOLUMES_FROM = "volumes_from";
    public static final String EXTENDS = "extends";

    private final List<String> fieldOrder = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private DependsOn dependsOn;
    private List<VolumeMount> volumes;
    private NetworkAttachments networks;
    private List<ResourceMount> configs;
    private List<ResourceMount> secrets;
    private String containerName;
    private List<String> links;
    private List<String> volumesFrom;
    private ExtendsReference extendsReference;

    private boolean literal;
    private Object literalBody;

    public ServiceDefinition() {
    }

    /**
     * Serviço cujo corpo não é um mapa (ex: "web:" sem corpo, ou um valor
     * inválido). O corpo é mantido como está e só o nome do serviço é renomeado.
     */
    public static ServiceDefinition ofLiteral(Object body) {
        ServiceDefinition service = new ServiceDefinition();
        service.literal = true;
        service.literalBody = ComposeValues.deepCopy(body);
        return service;
    }

    /**
     * Cópia profunda: variantes tipadas são imutáveis, atributos literais são copiados
     */
    public ServiceDefinition copy() {
        ServiceDefinition copy = new ServiceDefinition();
        copy.fieldOrder.addAll(fieldOrder);
        copy.attributes.putAll(ComposeValues.deepCopyMap(attributes));
        copy.dependsOn = dependsOn;
        copy.volumes = volumes;
        copy.networks = networks;
        copy.configs = configs;
        copy.secrets = secrets;
        copy.containerName = containerName;
        copy.links = links;
        copy.volumesFrom = volumesFrom;
        copy.extendsReference = extendsReference;
        copy.literal = literal;
        copy.literalBody = ComposeValues.deepCopy(literalBody);
        return copy;
    }

    public boolean isLiteral() {
        return literal;
    }

    public Object getLiteralBody() {
        return ComposeValues.deepCopy(literalBody);
    }

    public List<String> getFieldOrder() {
        return Collections.unmodifiableList(fieldOrder);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * Define um campo literal. Se o campo já estiver tipado, o valor tipado é descartado.
     */
    public void putAttribute(String key, Object value) {
        clearTyped(key);
        attributes.put(key, value);
        track(key, true);
    }

    public DependsOn getDependsOn() {
        return dependsOn;
    }

    public void setDependsOn(DependsOn dependsOn) {
        this.dependsOn = dependsOn;
        typed(DEPENDS_ON, dependsOn != null);
    }

    public List<VolumeMount> getVolumes() {
        return volumes;
    }

    public void setVolumes(List<VolumeMount> volumes) {
        this.volumes = immutable(volumes);
        typed(VOLUMES, volumes != null);
    }

    public NetworkAttachments getNetworks() {
        return networks;
    }

    public void setNetworks(NetworkAttachments networks) {
        this.networks = networks;
        typed(NETWORKS, networks != null);
    }

    public List<ResourceMount> getConfigs() {
        return configs;
    }

    public void setConfigs(List<ResourceMount> configs) {
        this.configs = immutable(configs);
        typed(CONFIGS, configs != null);
    }

    public List<ResourceMount> getSecrets() {
        return secrets;
    }

    public void setSecrets(List<ResourceMount> secrets) {
        this.secrets = immutable(secrets);
        typed(SECRETS, secrets != null);
    }

    public String getContainerName() {
        return containerName;
    }

    public void setContainerName(String containerName) {
        this.containerName = containerName;
        typed(CONTAINER_NAME, containerName != null);
    }

    public List<String> getLinks() {
        return links;
    }

    public void setLinks(List<String> links) {
        this.links = immutable(links);
        typed(LINKS, links != null);
    }

    public List<String> getVolumesFrom() {
        return volumesFrom;
    }

    public void setVolumesFrom(List<String> volumesFrom) {
        this.volumesFrom = immutable(volumesFrom);
        typed(VOLUMES_FROM, volumesFrom != null);
    }

    public ExtendsReference getExtends() {
        return extendsReference;
    }

    public void setExtends(ExtendsReference extendsReference) {
        this.extendsReference = extendsReference;
        typed(EXTENDS, extendsReference != null);
    }

    /**
     * Valor YAML do campo, tipado ou literal, na forma em que deve ser serializado
     */
    public Object toYamlValue(String key) {
        switch (key) {
            case DEPENDS_ON:
                if (dependsOn != null) {
                    return dependsOn.toYamlValue();
                }
                break;
            case VOLUMES:
                if (volumes != null) {
                    List<Object> items = new ArrayList<>();
                    volumes.forEach(volume -> items.add(volume.toYamlValue()));
                    return items;
                }
                break;
            case NETWORKS:
                if (networks != null) {
                    return networks.toYamlValue();
                }
                break;
            case CONFIGS:
                if (configs != null) {
                    return mountsToYaml(configs);
                }
                break;
            case SECRETS:
                if (secrets != null) {
                    return mountsToYaml(secrets);
                }
                break;
            case CONTAINER_NAME:
                if (containerName != null) {
                    return containerName;
                }
                break;
            case LINKS:
                if (links != null) {
                    return new ArrayList<>(links);
                }
                break;
            case VOLUMES_FROM:
                if (volumesFrom != null) {
                    return new ArrayList<>(volumesFrom);
                }
                break;
            case EXTENDS:
                if (extendsReference != null) {
                    return extendsReference.toYamlValue();
                }
                break;
            default:
                break;
        }
        return ComposeValues.deepCopy(attributes.get(key));
    }

    private static List<Object> mountsToYaml(List<ResourceMount> mounts) {
        List<Object> items = new ArrayList<>();
        mounts.forEach(mount -> items.add(mount.toYamlValue()));
        return items;
    }

    private static <T> List<T> immutable(List<T> values) {
        return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private void typed(String key, boolean present) {
        if (present) {
            attributes.remove(key);
        }
        track(key, present || attributes.containsKey(key));
    }

    private void clearTyped(String key) {
        switch (key) {
            case DEPENDS_ON: dependsOn = null; break;
            case VOLUMES: volumes = null; break;
            case NETWORKS: networks = null; break;
            case CONFIGS: configs = null; break;
            case SECRETS: secrets = null; break;
            case CONTAINER_NAME: containerName = null; break;
            case LINKS: links = null; break;
            case VOLUMES_FROM: volumesFrom = null; break;
            case EXTENDS: extendsReference = null; break;
            default: break;
        }
    }

    private void track(String key, boolean present) {
        if (present) {
            // qualquer campo definido transforma o corpo em mapa
            literal = false;
            literalBody = null;
        }
        if (present && !fieldOrder.contains(key)) {
            fieldOrder.add(key);
        } else if (!present) {
            fieldOrder.remove(key);
        }
    }
}
