package xyz.firestige.clouddeploy.application.execution.phases;

import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

import java.util.List;
import java.util.Optional;

/**
 * Phase 4：按 TLS 模式与基础认证开关升级 release
 */
public class TlsAuthUpgradePhase extends CompositePhase {

    public static final String NAME = "TLS & Auth Upgrade";

    public TlsAuthUpgradePhase(List<PhaseStep> steps) {
        super(NAME, steps);
    }

    @Override
    public Optional<String> checkPrecondition(DeploymentSession session) {
        if (session.getEndpoint().isEmpty()) {
            return Optional.of("LoadBalancer endpoint is unknown");
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> skipReason(DeploymentSession session) {
        if (!session.getConfig().requestsTlsOrAuth()) {
            return Optional.of("TLS and basic auth not requested");
        }
        return Optional.empty();
    }
}
