package xyz.firestige.clouddeploy.application.execution.steps;

import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

public class EnsureNamespaceStep extends AbstractPhaseStep {

    private final KubectlClient kubectl;

    public EnsureNamespaceStep(KubectlClient kubectl) {
        super("ensure-namespace");
        this.kubectl = kubectl;
    }

    @Override
    public void execute(DeploymentSession session) {
        kubectl.ensureNamespace(session.getConfig().getNamespace(), session.getCancellationToken());
    }
}
