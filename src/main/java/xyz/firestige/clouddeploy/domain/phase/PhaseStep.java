package xyz.firestige.clouddeploy.domain.phase;

import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

/**
 * Phase 内部的单个步骤。抛出异常即视为步骤失败，由所属 Phase 转换为失败结果。
 */
public interface PhaseStep {
    String getStepName();
    void execute(DeploymentSession session) throws Exception;
}
