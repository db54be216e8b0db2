package xyz.firestige.clouddeploy.domain.phase;

import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

import java.util.List;
import java.util.Optional;

/**
 * 部署流水线中的一个有序 Phase
 */
public interface DeploymentPhase {

    String getName();

    /**
     * 前置条件检查
     *
     * @return 未满足时返回原因；满足返回 empty
     */
    Optional<String> checkPrecondition(DeploymentSession session);

    /**
     * @return 需要跳过时返回原因
     */
    Optional<String> skipReason(DeploymentSession session);

    PhaseResult execute(DeploymentSession session);

    List<PhaseStep> getSteps();
}
