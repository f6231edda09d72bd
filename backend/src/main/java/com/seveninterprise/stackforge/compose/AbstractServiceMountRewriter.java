package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ResourceMount;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Base comum para configs e secrets: o nome simples ou o source do objeto
 * recebe o sufixo; target e demais atributos são copiados.
 */
public abstract class AbstractServiceMountRewriter extends AbstractServiceRewriter {

    protected abstract List<ResourceMount> getMounts(ServiceDefinition service);

    protected abstract void setMounts(ServiceDefinition service, List<ResourceMount> mounts);

    @Override
    protected void rewriteService(ServiceDefinition service, String suffix, Set<String> preservedNames) {
        List<ResourceMount> mounts = getMounts(service);
        if (mounts == null) {
            return;
        }

        List<ResourceMount> rewritten = new ArrayList<>();
        for (ResourceMount mount : mounts) {
            rewritten.add(mount.match(
                bare -> ResourceMount.bareName(rename(bare.getName(), suffix, preservedNames)),
                detailed -> detailed.getSource() instanceof String
                    ? detailed.withSource(rename((String) detailed.getSource(), suffix, preservedNames))
                    : detailed
            ));
        }
        setMounts(service, rewritten);
    }
}
