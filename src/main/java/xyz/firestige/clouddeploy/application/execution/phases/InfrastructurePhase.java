package xyz.firestige.clouddeploy.application.execution.phases;

import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Phase 1：infra 引擎 init/plan/apply。目标区域必须为空或已是当前区域。
 */
public class InfrastructurePhase extends CompositePhase {

    public static final String NAME = "Infrastructure";

    private final RegionStateManagerFactory regionStates;

    public InfrastructurePhase(List<PhaseStep> steps, RegionStateManagerFactory regionStates) {
        super(NAME, steps);
        this.regionStates = regionStates;
    }

    @Override
    public Optional<String> checkPrecondition(DeploymentSession session) {
        return RegionOwnership.conflict(regionStates, session);
    }

    @Override
    public Optional<String> skipReason(DeploymentSession session) {
        DeployMode mode = session.getMode();
        if (mode == DeployMode.SKIP_INFRASTRUCTURE) {
            return Optional.of("--skip-terraform: using existing infrastructure");
        }
        if (mode == DeployMode.UPDATE_TLS) {
            return Optional.of("--update-tls: infrastructure unchanged");
        }
        return Optional.empty();
    }
}
