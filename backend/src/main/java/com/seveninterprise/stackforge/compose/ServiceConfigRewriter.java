package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ResourceMount;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reescreve as referências em configs dos serviços.
 */
@Component
public class ServiceConfigRewriter extends AbstractServiceMountRewriter {

    @Override
    public ResourceKind getKind() {
        return ResourceKind.CONFIG;
    }

    @Override
    protected List<ResourceMount> getMounts(ServiceDefinition service) {
        return service.getConfigs();
    }

    @Override
    protected void setMounts(ServiceDefinition service, List<ResourceMount> mounts) {
        service.setConfigs(mounts);
    }
}
