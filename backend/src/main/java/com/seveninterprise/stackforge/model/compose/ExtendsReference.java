package com.seveninterprise.stackforge.model.compose;

import java.util.Map;
import java.util.function.Function;

/**
 * Campo extends de um serviço: nome do serviço base ou {service, file}.
 */
public abstract class ExtendsReference {

    private ExtendsReference() {
    }

    public static ExtendsReference ofService(String service) {
        return new ServiceName(service);
    }

    public static ExtendsReference ofDetails(Map<String, Object> attributes) {
        return new Detailed(attributes);
    }

    public abstract <R> R match(Function<ServiceName, R> nameCase, Function<Detailed, R> detailedCase);

    public abstract Object toYamlValue();

    public static final class ServiceName extends ExtendsReference {

        private final String service;

        private ServiceName(String service) {
            this.service = service;
        }

        public String getService() {
            return service;
        }

        @Override
        public <R> R match(Function<ServiceName, R> nameCase, Function<Detailed, R> detailedCase) {
            return nameCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return service;
        }
    }

    public static final class Detailed extends ExtendsReference {

        private final Map<String, Object> attributes;

        private Detailed(Map<String, Object> attributes) {
            this.attributes = ComposeValues.immutableCopyMap(attributes);
        }

        public Map<String, Object> getAttributes() {
            return attributes;
        }

        public Object getService() {
            return attributes.get("service");
        }

        public Detailed withService(String service) {
            Map<String, Object> copy = ComposeValues.deepCopyMap(attributes);
            copy.put("service", service);
            return new Detailed(copy);
        }

        @Override
        public <R> R match(Function<ServiceName, R> nameCase, Function<Detailed, R> detailedCase) {
            return detailedCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return ComposeValues.deepCopyMap(attributes);
        }
    }
}
