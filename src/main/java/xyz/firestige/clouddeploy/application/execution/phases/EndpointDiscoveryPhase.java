package xyz.firestige.clouddeploy.application.execution.phases;

import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Phase 3：只读，获取 LoadBalancer 外部地址
 */
public class EndpointDiscoveryPhase extends CompositePhase {

    public static final String NAME = "Endpoint Discovery";

    private final RegionStateManagerFactory regionStates;

    public EndpointDiscoveryPhase(List<PhaseStep> steps, RegionStateManagerFactory regionStates) {
        super(NAME, steps);
        this.regionStates = regionStates;
    }

    @Override
    public Optional<String> checkPrecondition(DeploymentSession session) {
        return RegionOwnership.conflict(regionStates, session);
    }
}
