package com.seveninterprise.stackforge.model.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Campo depends_on de um serviço.
 *
 * Duas formas possíveis:
 * - lista de nomes de serviços irmãos
 * - mapa nome do serviço -> {condition, ...}
 */
public abstract class DependsOn {

    private DependsOn() {
    }

    public static DependsOn ofServices(List<String> services) {
        return new ServiceList(services);
    }

    public static DependsOn ofConditions(Map<String, Object> conditions) {
        return new ConditionMap(conditions);
    }

    public abstract <R> R match(Function<ServiceList, R> listCase, Function<ConditionMap, R> mapCase);

    /**
     * Representação YAML (nova cópia)
     */
    public abstract Object toYamlValue();

    public static final class ServiceList extends DependsOn {

        private final List<String> services;

        private ServiceList(List<String> services) {
            this.services = Collections.unmodifiableList(new ArrayList<>(services));
        }

        public List<String> getServices() {
            return services;
        }

        @Override
        public <R> R match(Function<ServiceList, R> listCase, Function<ConditionMap, R> mapCase) {
            return listCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return new ArrayList<>(services);
        }
    }

    public static final class ConditionMap extends DependsOn {

        private final Map<String, Object> conditions;

        private ConditionMap(Map<String, Object> conditions) {
            this.conditions = ComposeValues.immutableCopyMap(conditions);
        }

        /**
         * Serviço -> metadados (condition, restart, required); valores podem ser null
         */
        public Map<String, Object> getConditions() {
            return conditions;
        }

        @Override
        public <R> R match(Function<ServiceList, R> listCase, Function<ConditionMap, R> mapCase) {
            return mapCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return ComposeValues.deepCopyMap(conditions);
        }
    }
}
