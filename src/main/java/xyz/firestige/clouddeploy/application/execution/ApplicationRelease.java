package xyz.firestige.clouddeploy.application.execution;

import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.infrastructure.helm.HelmValues;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmUpgradeCommand;

/**
 * 应用 release 的安装与增量升级
 */
public class ApplicationRelease {

    private final HelmClient helm;
    private final WorkspaceLayout layout;
    private final DeployerProperties properties;

    public ApplicationRelease(HelmClient helm, WorkspaceLayout layout, DeployerProperties properties) {
        this.helm = helm;
        this.layout = layout;
        this.properties = properties;
    }

    public String name() {
        return properties.getReleases().getApplication();
    }

    /**
     * 首次安装或按 override 文件整体升级
     */
    public void install(DeploymentSession session) {
        HelmUpgradeCommand command = HelmUpgradeCommand.release(name(), layout.chartDir().toString())
                .namespace(session.getConfig().getNamespace())
                .createNamespace()
                .valuesFile(layout.valuesOverride(session.getConfig().getCloudProvider()))
                .waitFor(properties.getTimeouts().getHelm())
                .build();
        helm.upgradeInstall(command, session.getCancellationToken());
    }

    /**
     * 在已有取值基础上叠加
     */
    public void upgrade(DeploymentSession session, HelmValues values) {
        HelmUpgradeCommand command = HelmUpgradeCommand.release(name(), layout.chartDir().toString())
                .namespace(session.getConfig().getNamespace())
                .reuseValues()
                .values(values)
                .waitFor(properties.getTimeouts().getHelm())
                .build();
        helm.upgradeInstall(command, session.getCancellationToken());
    }
}
