package xyz.firestige.clouddeploy.application.execution.phases;

import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;

import java.util.Optional;

/**
 * 读取 infra 输出的 Phase 共用前置条件：当前状态必须属于配置记录中的区域
 */
final class RegionOwnership {

    private RegionOwnership() {
    }

    static Optional<String> conflict(RegionStateManagerFactory regionStates, DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        RegionStateManager states = regionStates.forProvider(config.getCloudProvider());
        if (states.check(config.getRegion()) == RegionCheck.CONFLICT) {
            return Optional.of("Terraform state belongs to region '" + states.currentRegion().orElse("unknown")
                    + "', not '" + config.getRegion() + "'");
        }
        return Optional.empty();
    }
}
