package xyz.firestige.clouddeploy.infrastructure.cloud;

import xyz.firestige.clouddeploy.domain.config.CloudProvider;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public class CloudPlatformRegistry {

    private final Map<CloudProvider, CloudPlatform> platforms = new EnumMap<>(CloudProvider.class);

    public CloudPlatformRegistry(Collection<? extends CloudPlatform> platforms) {
        platforms.forEach(p -> this.platforms.put(p.provider(), p));
    }

    public CloudPlatform get(CloudProvider provider) {
        CloudPlatform platform = platforms.get(provider);
        if (platform == null) {
            throw new IllegalArgumentException("No platform registered for " + provider);
        }
        return platform;
    }
}
