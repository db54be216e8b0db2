package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ReadinessPoller;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.time.Duration;

/**
 * 轮询 Deployment 直到 availableReplicas >= 1
 */
public class WorkloadReadinessStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(WorkloadReadinessStep.class);

    private final KubectlClient kubectl;
    private final ReadinessPoller poller;
    private final String deployment;
    private final Duration timeout;

    public WorkloadReadinessStep(KubectlClient kubectl, ReadinessPoller poller, String deployment, Duration timeout) {
        super("workload-readiness");
        this.kubectl = kubectl;
        this.poller = poller;
        this.deployment = deployment;
        this.timeout = timeout;
    }

    @Override
    public void execute(DeploymentSession session) {
        String namespace = session.getConfig().getNamespace();
        try {
            poller.awaitTrue("deployment/" + deployment, timeout, session.getCancellationToken(),
                    () -> kubectl.availableReplicas(deployment, namespace, session.getCancellationToken()) >= 1);
        } catch (PollTimeoutException e) {
            throw e.withHint("Inspect the pods with 'kubectl get pods -n " + namespace
                    + "' and 'kubectl describe deployment " + deployment + " -n " + namespace + "'");
        }
        log.info("[WorkloadReadinessStep] deployment {} available", deployment);
    }
}
