package com.seveninterprise.stackforge.compose;

import com.seveninterprise.stackforge.model.compose.ResourceKind;
import com.seveninterprise.stackforge.model.compose.ResourceMount;
import com.seveninterprise.stackforge.model.compose.ServiceDefinition;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reescreve as referências em secrets dos serviços.
 */
@Component
public class ServiceSecretRewriter extends AbstractServiceMountRewriter {

    @Override
    public ResourceKind getKind() {
        return ResourceKind.SECRET;
    }

    @Override
    protected List<ResourceMount> getMounts(ServiceDefinition service) {
        return service.getSecrets();
    }

    @Override
    protected void setMounts(ServiceDefinition service, List<ResourceMount> mounts) {
        service.setSecrets(mounts);
    }
}
