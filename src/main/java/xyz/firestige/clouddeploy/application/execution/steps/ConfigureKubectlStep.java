package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

public class ConfigureKubectlStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(ConfigureKubectlStep.class);

    private final CloudPlatformRegistry platforms;
    private final KubectlClient kubectl;

    public ConfigureKubectlStep(CloudPlatformRegistry platforms, KubectlClient kubectl) {
        super("configure-kubectl");
        this.platforms = platforms;
        this.kubectl = kubectl;
    }

    @Override
    public void execute(DeploymentSession session) {
        if (session.isKubectlConfigured()) {
            return;
        }
        platforms.get(session.getConfig().getCloudProvider()).configureKubectl(session);
        if (!kubectl.clusterReachable(session.getCancellationToken())) {
            throw new ExternalToolException("kubectl get namespaces", "Cluster is not reachable with the new kubeconfig", null)
                    .withHint("Check network access to the cluster API endpoint and run 'kubectl get nodes'");
        }
        session.markKubectlConfigured();
        log.info("[ConfigureKubectlStep] cluster reachable");
    }
}
