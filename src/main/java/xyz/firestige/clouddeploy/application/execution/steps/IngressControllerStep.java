package xyz.firestige.clouddeploy.application.execution.steps;

import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmUpgradeCommand;

/**
 * ingress-nginx 安装或升级
 */
public class IngressControllerStep extends AbstractPhaseStep {

    private final HelmClient helm;
    private final DeployerProperties properties;

    public IngressControllerStep(HelmClient helm, DeployerProperties properties) {
        super("ingress-controller");
        this.helm = helm;
        this.properties = properties;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeployerProperties.Releases releases = properties.getReleases();
        helm.addRepo(releases.getIngress(), releases.getIngressRepo(), session.getCancellationToken());
        HelmUpgradeCommand command = HelmUpgradeCommand
                .release(releases.getIngress(), releases.getIngress() + "/" + releases.getIngress())
                .namespace(releases.getIngressNamespace())
                .createNamespace()
                .waitFor(properties.getTimeouts().getHelm())
                .build();
        helm.upgradeInstall(command, session.getCancellationToken());
    }
}
