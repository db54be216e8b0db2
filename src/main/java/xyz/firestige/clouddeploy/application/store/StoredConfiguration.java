package xyz.firestige.clouddeploy.application.store;

import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;

import java.time.LocalDateTime;

/**
 * .setup-current.json 的内容
 */
public record StoredConfiguration(LocalDateTime timestamp, CloudProvider cloudProvider, DeploymentConfig configuration) {
}
