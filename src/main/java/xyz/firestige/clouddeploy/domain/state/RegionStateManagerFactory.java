package xyz.firestige.clouddeploy.domain.state;

import xyz.firestige.clouddeploy.domain.config.CloudProvider;

/**
 * 每个云厂商的 infra 目录各有一份状态
 */
@FunctionalInterface
public interface RegionStateManagerFactory {

    RegionStateManager forProvider(CloudProvider provider);
}
