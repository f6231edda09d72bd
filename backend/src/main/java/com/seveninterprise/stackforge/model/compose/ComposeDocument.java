package com.seveninterprise.stackforge.model.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Documento compose estruturado.
 *
 * Mantém services, as quatro seções de recursos da raiz (volumes, networks,
 * configs, secrets) e os demais campos da raiz (version, name, x-*) na ordem
 * original. Uma seção ausente é diferente de uma seção vazia: getSection
 * retorna null apenas quando a chave não existe no documento.
 */
public class ComposeDocument {

    public static final String SERVICES = "services";

    private final List<String> fieldOrder = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<ResourceKind, Map<String, Object>> sections = new EnumMap<>(ResourceKind.class);
    private Map<String, ServiceDefinition> services;

    public ComposeDocument() {
    }

    public ComposeDocument copy() {
        ComposeDocument copy = new ComposeDocument();
        copy.fieldOrder.addAll(fieldOrder);
        copy.attributes.putAll(ComposeValues.deepCopyMap(attributes));
        sections.forEach((kind, definitions) -> copy.sections.put(kind, ComposeValues.deepCopyMap(definitions)));
        if (services != null) {
            Map<String, ServiceDefinition> servicesCopy = new LinkedHashMap<>();
            services.forEach((name, service) -> servicesCopy.put(name, service.copy()));
            copy.services = servicesCopy;
        }
        return copy;
    }

    public List<String> getFieldOrder() {
        return Collections.unmodifiableList(fieldOrder);
    }

    public Map<String, ServiceDefinition> getServices() {
        return services == null ? null : Collections.unmodifiableMap(services);
    }

    public void setServices(Map<String, ServiceDefinition> services) {
        this.services = services == null ? null : new LinkedHashMap<>(services);
        if (services != null) {
            attributes.remove(SERVICES);
        }
        track(SERVICES, services != null || attributes.containsKey(SERVICES));
    }

    public Map<String, Object> getSection(ResourceKind kind) {
        Map<String, Object> definitions = sections.get(kind);
        return definitions == null ? null : Collections.unmodifiableMap(definitions);
    }

    public void setSection(ResourceKind kind, Map<String, Object> definitions) {
        if (definitions == null) {
            sections.remove(kind);
        } else {
            sections.put(kind, new LinkedHashMap<>(definitions));
            attributes.remove(kind.getKey());
        }
        track(kind.getKey(), definitions != null || attributes.containsKey(kind.getKey()));
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * Define um campo literal da raiz, descartando a versão tipada se houver.
     */
    public void putAttribute(String key, Object value) {
        if (SERVICES.equals(key)) {
            services = null;
        }
        ResourceKind kind = ResourceKind.fromKey(key);
        if (kind != null) {
            sections.remove(kind);
        }
        attributes.put(key, value);
        track(key, true);
    }

    private void track(String key, boolean present) {
        if (present && !fieldOrder.contains(key)) {
            fieldOrder.add(key);
        } else if (!present) {
            fieldOrder.remove(key);
        }
    }
}
