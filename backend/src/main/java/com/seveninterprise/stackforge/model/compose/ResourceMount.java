package com.seveninterprise.stackforge.model.compose;

import java.util.Map;
import java.util.function.Function;

/**
 * Item das listas configs e secrets de um serviço.
 *
 * - BareName: "web_config"
 * - LongSyntax: {source, target, uid, gid, mode}
 */
public abstract class ResourceMount {

    private ResourceMount() {
    }

    public static ResourceMount bareName(String name) {
        return new BareName(name);
    }

    public static ResourceMount longSyntax(Map<String, Object> attributes) {
        return new LongSyntax(attributes);
    }

    public abstract <R> R match(Function<BareName, R> nameCase, Function<LongSyntax, R> longCase);

    public abstract Object toYamlValue();

    public static final class BareName extends ResourceMount {

        private final String name;

        private BareName(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <R> R match(Function<BareName, R> nameCase, Function<LongSyntax, R> longCase) {
            return nameCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return name;
        }
    }

    public static final class LongSyntax extends ResourceMount {

        private final Map<String, Object> attributes;

        private LongSyntax(Map<String, Object> attributes) {
            this.attributes = ComposeValues.immutableCopyMap(attributes);
        }

        public Map<String, Object> getAttributes() {
            return attributes;
        }

        public Object getSource() {
            return attributes.get("source");
        }

        public LongSyntax withSource(String source) {
            Map<String, Object> copy = ComposeValues.deepCopyMap(attributes);
            copy.put("source", source);
            return new LongSyntax(copy);
        }

        @Override
        public <R> R match(Function<BareName, R> nameCase, Function<LongSyntax, R> longCase) {
            return longCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return ComposeValues.deepCopyMap(attributes);
        }
    }
}
