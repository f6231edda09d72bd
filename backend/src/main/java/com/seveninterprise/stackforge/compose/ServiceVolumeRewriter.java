package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import com.seveninterprise.stackforge.model.compose.VolumeMount;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reescreve as referências a volumes nomeados na lista volumes dos serviços.
 *
 * Sintaxe curta "source[:target[:mode]]": se source for um caminho do host
 * (bind mount) a entrada fica intacta; caso contrário o nome do volume recebe
 * o sufixo e o restante é mantido. Sub-caminhos ("dados/cache:/cache") renomeiam
 * apenas o nome antes da primeira barra.
 *
 * Sintaxe longa: apenas type: volume tem o source renomeado.
 */
@Component
public class ServiceVolumeRewriter extends AbstractServiceRewriter {

    private static final String[] HOST_PATH_PREFIXES = {"/", "./", "../", "~"};

    @Override
    public ResourceKind getKind() {
        return ResourceKind.VOLUME;
    }

    @Override
    protected void rewriteService(ServiceDefinition service, String suffix, Set<String> preservedNames) {
        if (service.getVolumes() == null) {
            return;
        }

        List<VolumeMount> volumes = new ArrayList<>();
        for (VolumeMount volume : service.getVolumes()) {
            volumes.add(volume.match(
                shortSyntax -> VolumeMount.shortSyntax(rewriteShortSyntax(shortSyntax.getValue(), suffix, preservedNames)),
                longSyntax -> rewriteLongSyntax(longSyntax, suffix, preservedNames)
            ));
        }
        service.setVolumes(volumes);
    }

    String rewriteShortSyntax(String value, String suffix, Set<String> preservedNames) {
        int colon = value.indexOf(':');
        String source = colon < 0 ? value : value.substring(0, colon);
        String remainder = colon < 0 ? "" : value.substring(colon);

        if (source.isEmpty() || isHostPath(source)) {
            return value;
        }
        return rewriteSource(source, suffix, preservedNames) + remainder;
    }

    private VolumeMount rewriteLongSyntax(VolumeMount.LongSyntax volume, String suffix, Set<String> preservedNames) {
        if (!VolumeMount.TYPE_VOLUME.equals(volume.getType())) {
            return volume;
        }
        Object source = volume.getSource();
        if (!(source instanceof String) || ((String) source).isEmpty()) {
            return volume;
        }
        return volume.withSource(rename((String) source, suffix, preservedNames));
    }

    private String rewriteSource(String source, String suffix, Set<String> preservedNames) {
        int slash = source.indexOf('/');
        if (slash < 0) {
            return rename(source, suffix, preservedNames);
        }
        return rename(source.substring(0, slash), suffix, preservedNames) + source.substring(slash);
    }

    static boolean isHostPath(String source) {
        for (String prefix : HOST_PATH_PREFIXES) {
            if (source.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
