package xyz.firestige.clouddeploy.application.execution.phases;

import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Phase 2：kubeconfig、集群 Secret、ingress 控制器、应用 release（TLS 关闭）、就绪等待
 */
public class ApplicationPhase extends CompositePhase {

    public static final String NAME = "Application";

    private final RegionStateManagerFactory regionStates;

    public ApplicationPhase(List<PhaseStep> steps, RegionStateManagerFactory regionStates) {
        super(NAME, steps);
        this.regionStates = regionStates;
    }

    @Override
    public Optional<String> checkPrecondition(DeploymentSession session) {
        return RegionOwnership.conflict(regionStates, session);
    }

    @Override
    public Optional<String> skipReason(DeploymentSession session) {
        if (session.getMode() == DeployMode.UPDATE_TLS) {
            return Optional.of("--update-tls: application already deployed");
        }
        return Optional.empty();
    }
}
