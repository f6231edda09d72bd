package com.seveninterprise.stackforge.model.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Campo networks de um serviço.
 *
 * - NameList: lista de nomes de redes
 * - AttachmentMap: nome da rede -> {aliases, ipv4_address, ...} ou null
 */
public abstract class NetworkAttachments {

    private NetworkAttachments() {
    }

    public static NetworkAttachments ofNames(List<String> names) {
        return new NameList(names);
    }

    public static NetworkAttachments ofAttachments(Map<String, Object> attachments) {
        return new AttachmentMap(attachments);
    }

    public abstract <R> R match(Function<NameList, R> listCase, Function<AttachmentMap, R> mapCase);

    public abstract Object toYamlValue();

    public static final class NameList extends NetworkAttachments {

        private final List<String> names;

        private NameList(List<String> names) {
            this.names = Collections.unmodifiableList(new ArrayList<>(names));
        }

        public List<String> getNames() {
            return names;
        }

        @Override
        public <R> R match(Function<NameList, R> listCase, Function<AttachmentMap, R> mapCase) {
            return listCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return new ArrayList<>(names);
        }
    }

    public static final class AttachmentMap extends NetworkAttachments {

        private final Map<String, Object> attachments;

        private AttachmentMap(Map<String, Object> attachments) {
            this.attachments = ComposeValues.immutableCopyMap(attachments);
        }

        public Map<String, Object> getAttachments() {
            return attachments;
        }

        @Override
        public <R> R match(Function<NameList, R> listCase, Function<AttachmentMap, R> mapCase) {
            return mapCase.apply(this);
        }

        @Override
        public Object toYamlValue() {
            return ComposeValues.deepCopyMap(attachments);
        }
    }
}
