package xyz.firestige.clouddeploy.application.collect;

import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;

/**
 * 收集结果：完整且已确认的配置记录，或用户放弃
 */
public sealed interface CollectionResult permits CollectionResult.Completed, CollectionResult.Aborted {

    record Completed(DeploymentConfig config) implements CollectionResult {
    }

    record Aborted(String reason) implements CollectionResult {
    }
}
