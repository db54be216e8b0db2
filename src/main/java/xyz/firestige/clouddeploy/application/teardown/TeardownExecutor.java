package xyz.firestige.clouddeploy.application.teardown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.application.execution.ReadinessPoller;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 反向流水线，与部署流水线分开建模：
 * 1. 卸载 release 并等待 LoadBalancer 释放
 * 2. 删除集群内资源（PVC、Secret、ClusterIssuer、namespace）
 * 3. 关闭数据库删除保护，terraform destroy，清除区域标记
 * 4. 确认后删除云密钥存储条目
 * 每一阶段把"已不存在"视为成功，可以对半拆除的环境重复执行。
 */
public class TeardownExecutor {

    private static final Logger log = LoggerFactory.getLogger(TeardownExecutor.class);

    static final String STAGE_RELEASES = "Uninstall releases";
    static final String STAGE_CLUSTER = "Cluster resources";
    static final String STAGE_INFRA = "Infrastructure destroy";
    static final String STAGE_SECRETS = "Secret store cleanup";

    private final CloudPlatformRegistry platforms;
    private final TerraformClient terraform;
    private final HelmClient helm;
    private final KubectlClient kubectl;
    private final WorkspaceLayout layout;
    private final RegionStateManagerFactory regionStates;
    private final Console console;
    private final DeployerProperties properties;

    public TeardownExecutor(CloudPlatformRegistry platforms,
                            TerraformClient terraform,
                            HelmClient helm,
                            KubectlClient kubectl,
                            WorkspaceLayout layout,
                            RegionStateManagerFactory regionStates,
                            Console console,
                            DeployerProperties properties) {
        this.platforms = platforms;
        this.terraform = terraform;
        this.helm = helm;
        this.kubectl = kubectl;
        this.layout = layout;
        this.regionStates = regionStates;
        this.console = console;
        this.properties = properties;
    }

    public TeardownResult execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        CloudPlatform platform = platforms.get(config.getCloudProvider());
        CancellationToken token = session.getCancellationToken();
        RegionStateManager states = regionStates.forProvider(config.getCloudProvider());
        if (states.check(config.getRegion()) == RegionCheck.CONFLICT) {
            throw new PreconditionException("Terraform state belongs to region '"
                    + states.currentRegion().orElse("unknown") + "', not '" + config.getRegion() + "'",
                    "Use --list-states to inspect snapshots before tearing down");
        }

        if (!confirm(config, token)) {
            log.info("teardown 已被用户取消");
            return TeardownResult.abortedByUser();
        }

        captureOutputs(session, platform);
        boolean reachable = connect(session, platform);

        List<TeardownStageResult> stages = new ArrayList<>();
        if (!runStage(session, stages, STAGE_RELEASES, () -> uninstallReleases(session, reachable))) {
            return new TeardownResult(false, stages);
        }
        if (!runStage(session, stages, STAGE_CLUSTER, () -> deleteClusterResources(session, reachable))) {
            return new TeardownResult(false, stages);
        }
        if (!runStage(session, stages, STAGE_INFRA, () -> destroyInfrastructure(session, platform))) {
            return new TeardownResult(false, stages);
        }
        runStage(session, stages, STAGE_SECRETS, () -> cleanupSecrets(session, platform));
        return new TeardownResult(false, stages);
    }

    private boolean confirm(DeploymentConfig config, CancellationToken token) {
        console.header("Teardown");
        console.warn("This permanently deletes the " + config.getCloudProvider().getDisplayName()
                + " deployment in " + config.getRegion() + ":");
        console.println("  - helm releases and all data in namespace " + config.getNamespace());
        console.println("  - Kubernetes cluster " + config.getClusterName());
        console.println("  - " + (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase
                ? "managed PostgreSQL database" : "persistent volume with the SQLite database"));
        if (!console.confirm("Destroy this deployment?", false)) {
            return false;
        }
        String typed = console.prompt("Type the cluster name (" + config.getClusterName() + ") to confirm", null);
        if (!config.getClusterName().equals(typed)) {
            console.error("Cluster name does not match, teardown cancelled");
            return false;
        }
        int seconds = properties.getCountdownSeconds();
        for (int i = seconds; i > 0; i--) {
            console.println("  Starting teardown in " + i + "s... (Ctrl+C to abort)");
            token.sleep(Duration.ofSeconds(1));
        }
        return true;
    }

    /**
     * destroy 之后输出就不可用了，先读出来
     */
    private void captureOutputs(DeploymentSession session, CloudPlatform platform) {
        DeploymentConfig config = session.getConfig();
        try {
            Map<String, String> outputs = terraform.outputs(layout.terraformDir(config.getCloudProvider()),
                    platform.toolEnvironment(config), session.getCancellationToken());
            session.putInfraOutputs(outputs);
        } catch (SetupInterruptedException e) {
            throw e;
        } catch (DeployerException e) {
            log.warn("无法读取 terraform 输出，继续: {}", e.getMessage());
        }
    }

    private boolean connect(DeploymentSession session, CloudPlatform platform) {
        if (session.infraOutput("cluster_name").isEmpty()) {
            log.info("没有 cluster_name 输出，视集群为已删除");
            return false;
        }
        try {
            platform.configureKubectl(session);
            boolean reachable = kubectl.clusterReachable(session.getCancellationToken());
            if (reachable) {
                session.markKubectlConfigured();
            }
            return reachable;
        } catch (SetupInterruptedException e) {
            throw e;
        } catch (DeployerException e) {
            log.warn("集群不可达，跳过集群内清理: {}", e.getMessage());
            return false;
        }
    }

    private boolean runStage(DeploymentSession session, List<TeardownStageResult> stages, String name, StageAction action) {
        session.injectMdc(name);
        console.header("Teardown: " + name);
        TeardownStageResult result;
        try {
            result = action.run();
        } catch (SetupInterruptedException e) {
            throw e;
        } catch (DeployerException e) {
            log.error("teardown 阶段失败: {}", name, e);
            result = TeardownStageResult.failed(name, e.toFailureInfo(name));
        } catch (RuntimeException e) {
            log.error("teardown 阶段异常: {}", name, e);
            result = TeardownStageResult.failed(name, FailureInfo.fromException(e, name));
        } finally {
            session.injectMdc(null);
        }
        stages.add(result);
        switch (result.status()) {
            case SUCCEEDED -> console.success(name + ": " + result.message());
            case ALREADY_ABSENT -> console.info(name + ": already absent (" + result.message() + ")");
            case SKIPPED -> console.info(name + ": skipped (" + result.message() + ")");
            case FAILED -> {
                console.error(name + " failed: " + result.message());
                if (result.failureInfo().getRemediationHint() != null) {
                    console.info("Hint: " + result.failureInfo().getRemediationHint());
                }
            }
        }
        return !result.isFailed();
    }

    private TeardownStageResult uninstallReleases(DeploymentSession session, boolean reachable) {
        if (!reachable) {
            return TeardownStageResult.alreadyAbsent(STAGE_RELEASES, "cluster not reachable");
        }
        CancellationToken token = session.getCancellationToken();
        DeployerProperties.Releases releases = properties.getReleases();
        List<String> removed = new ArrayList<>();
        if (helm.uninstall(releases.getApplication(), session.getConfig().getNamespace(), token)) {
            removed.add(releases.getApplication());
        }
        if (helm.uninstall(releases.getCertManager(), releases.getCertManagerNamespace(), token)) {
            removed.add(releases.getCertManager());
        }
        boolean ingressRemoved = helm.uninstall(releases.getIngress(), releases.getIngressNamespace(), token);
        if (ingressRemoved) {
            removed.add(releases.getIngress());
        }
        if (removed.isEmpty()) {
            return TeardownStageResult.alreadyAbsent(STAGE_RELEASES, "no releases installed");
        }
        if (ingressRemoved) {
            awaitLoadBalancerRelease(session);
        }
        return TeardownStageResult.succeeded(STAGE_RELEASES, "uninstalled " + String.join(", ", removed));
    }

    private void awaitLoadBalancerRelease(DeploymentSession session) {
        ReadinessPoller poller = new ReadinessPoller(properties.getPolling().getInterval());
        String namespace = properties.getReleases().getIngressNamespace();
        console.info("Waiting for the cloud load balancer to be released...");
        try {
            poller.awaitTrue("LoadBalancer release", properties.getPolling().getLoadBalancerDrain(),
                    session.getCancellationToken(),
                    () -> kubectl.get("service", ClusterResources.INGRESS_CONTROLLER_SERVICE, namespace,
                            session.getCancellationToken()).isEmpty());
        } catch (PollTimeoutException e) {
            log.warn("等待 LoadBalancer 释放超时，继续");
            console.warn("Load balancer still present after " + e.getDeadline().toSeconds()
                    + "s; continuing, terraform destroy may need a second run");
        }
    }

    private TeardownStageResult deleteClusterResources(DeploymentSession session, boolean reachable) {
        if (!reachable) {
            return TeardownStageResult.alreadyAbsent(STAGE_CLUSTER, "cluster not reachable");
        }
        CancellationToken token = session.getCancellationToken();
        String namespace = session.getConfig().getNamespace();
        kubectl.deleteAll("pvc", namespace, token);
        for (String secret : List.of(ClusterResources.ENCRYPTION_KEY_SECRET, ClusterResources.DB_CREDENTIALS_SECRET,
                ClusterResources.TLS_SECRET, ClusterResources.BASIC_AUTH_SECRET)) {
            kubectl.delete("secret", secret, namespace, token);
        }
        for (String environment : List.of(TlsConfig.TlsAutomatic.PRODUCTION, TlsConfig.TlsAutomatic.STAGING)) {
            deleteClusterIssuer("letsencrypt-" + environment, token);
        }
        kubectl.delete("namespace", namespace, null, token);
        return TeardownStageResult.succeeded(STAGE_CLUSTER, "namespace " + namespace + " and its resources deleted");
    }

    /**
     * cert-manager 卸载后 CRD 可能已不存在
     */
    private void deleteClusterIssuer(String name, CancellationToken token) {
        try {
            kubectl.delete("clusterissuer", name, null, token);
        } catch (ExternalToolException e) {
            String output = e.getToolOutput() == null ? "" : e.getToolOutput();
            if (!output.contains("doesn't have a resource type")) {
                throw e;
            }
            log.info("ClusterIssuer CRD 不存在，跳过: {}", name);
        }
    }

    private TeardownStageResult destroyInfrastructure(DeploymentSession session, CloudPlatform platform) {
        DeploymentConfig config = session.getConfig();
        RegionStateManager states = regionStates.forProvider(config.getCloudProvider());
        if (states.currentRegion().isEmpty()) {
            states.clearMarker();
            return TeardownStageResult.alreadyAbsent(STAGE_INFRA, "terraform state is empty");
        }
        if (platform.clearDatabaseDeletionProtection(session)) {
            console.info("Deletion protection on the managed database was disabled");
        }
        Path dir = layout.terraformDir(config.getCloudProvider());
        terraform.destroy(dir, platform.toolEnvironment(config), session.getCancellationToken());
        states.clearMarker();
        return TeardownStageResult.succeeded(STAGE_INFRA, "terraform destroy completed");
    }

    private TeardownStageResult cleanupSecrets(DeploymentSession session, CloudPlatform platform) {
        List<String> entries;
        try {
            entries = platform.listAppSecrets(session);
        } catch (SetupInterruptedException e) {
            throw e;
        } catch (DeployerException e) {
            log.warn("无法列出密钥存储条目: {}", e.getMessage());
            return TeardownStageResult.skipped(STAGE_SECRETS, "secret store not accessible: " + e.getMessage());
        }
        if (entries.isEmpty()) {
            return TeardownStageResult.alreadyAbsent(STAGE_SECRETS, "no entries tagged app=n8n");
        }
        console.info("Secret store entries for this deployment:");
        entries.forEach(e -> console.println("  - " + e));
        if (!console.confirm("Delete these " + entries.size() + " entries?", false)) {
            return TeardownStageResult.skipped(STAGE_SECRETS, "kept at user request");
        }
        int deleted = 0;
        for (String entry : entries) {
            if (platform.deleteSecret(session, entry)) {
                deleted++;
            }
        }
        return TeardownStageResult.succeeded(STAGE_SECRETS, "deleted " + deleted + " of " + entries.size());
    }

    @FunctionalInterface
    private interface StageAction {
        TeardownStageResult run();
    }
}
