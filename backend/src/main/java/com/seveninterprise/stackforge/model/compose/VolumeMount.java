package com.seveninterprise.stackforge.model.compose;

import java.util.Map;
import java.util.function.Function;

/**
 * Item da lista volumes de um serviço.
 *
 * - ShortSyntax: "source[:target[:mode]]"
 * - LongSyntax: {type, source, target, ...}
 */
public abstract class VolumeMount {

    public static final String TYPE_VOLUME = "volume";

    private VolumeMount() {
    }

    public static VolumeMount shortSyntax(String value) {
        return new ShortSyntax(value);
    }

    public static VolumeMount longSyntax(Map<String, Object> attributes) {
        return new LongSyntax(attributes);
    }

    public abstract <R> R match(Function<ShortSyntax, R> shortCase, Function<LongSyntax, R> longCase);

    public abstract Object toYamlValue();

    public static final class ShortSyntax extends VolumeMount {

        private final String value;

        private ShortSyntax(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R> R match(Function<ShortSyntax, R> shortCase, Function<LongSyntax, R> longCase) {
            return shortCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return value;
        }
    }

    public static final class LongSyntax extends VolumeMount {

        private final Map<String, Object> attributes;

        private LongSyntax(Map<String, Object> attributes) {
            this.attributes = ComposeValues.immutableCopyMap(attributes);
        }

        public Map<String, Object> getAttributes() {
            return attributes;
        }

        public Object getType() {
            return attributes.get("type");
        }

        public Object getSource() {
            return attributes.get("source");
        }

        /**
         * Nova montagem com o source substituído; demais atributos copiados
         */
        public LongSyntax withSource(String source) {
            Map<String, Object> copy = ComposeValues.deepCopyMap(attributes);
            copy.put("source", source);
            return new LongSyntax(copy);
        }

        @Override
        public <R> R match(Function<ShortSyntax, R> shortCase, Function<LongSyntax, R> longCase) {
            return longCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return ComposeValues.deepCopyMap(attributes);
        }
    }
}
