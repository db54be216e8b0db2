package xyz.firestige.clouddeploy.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.backup.BackupManager;
import xyz.firestige.clouddeploy.application.collect.CollectionResult;
import xyz.firestige.clouddeploy.application.collect.InteractiveCollector;
import xyz.firestige.clouddeploy.application.dependency.DependencyChecker;
import xyz.firestige.clouddeploy.application.dependency.DependencyReport;
import xyz.firestige.clouddeploy.application.dependency.ToolCheckResult;
import xyz.firestige.clouddeploy.application.execution.PhaseExecutor;
import xyz.firestige.clouddeploy.application.execution.PipelineResult;
import xyz.firestige.clouddeploy.application.execution.phases.DeploymentPhaseFactory;
import xyz.firestige.clouddeploy.application.store.ConfigStore;
import xyz.firestige.clouddeploy.application.store.StoredConfiguration;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.application.teardown.TeardownExecutor;
import xyz.firestige.clouddeploy.application.teardown.TeardownResult;
import xyz.firestige.clouddeploy.domain.backup.BackupRecord;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.phase.PhaseResult;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;
import xyz.firestige.clouddeploy.domain.state.RegionStateSnapshot;
import xyz.firestige.clouddeploy.domain.state.RestoreOutcome;
import xyz.firestige.clouddeploy.infrastructure.catalog.CloudProviderCatalogLoader;
import xyz.firestige.clouddeploy.infrastructure.catalog.ToolDefinition;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.console.InterruptHandler;
import xyz.firestige.clouddeploy.infrastructure.metrics.MetricsRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 一次调用的总控：
 * 1. 依赖检查（第一道闸，之前不提问、不写文件）
 * 2. 收集或加载配置记录
 * 3. 区域状态准备
 * 4. 快照将被改写的文件，然后运行流水线
 * 5. 硬失败或中断时恢复快照，成功或部分成功时丢弃快照并记录历史
 * <p>
 * 所有错误在这里转换为退出码，堆栈只进日志。
 */
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_PRECONDITION = 2;
    public static final int EXIT_PARTIAL = 3;
    public static final int EXIT_INTERRUPTED = 130;

    private final Console console;
    private final CancellationToken token;
    private final DependencyChecker dependencyChecker;
    private final CloudProviderCatalogLoader catalog;
    private final InteractiveCollector collector;
    private final ConfigStore configStore;
    private final WorkspaceLayout layout;
    private final BackupManager backupManager;
    private final RegionStateManagerFactory regionStates;
    private final DeploymentPhaseFactory phaseFactory;
    private final PhaseExecutor phaseExecutor;
    private final TeardownExecutor teardownExecutor;
    private final MetricsRegistry metrics;
    private final InterruptHandler interruptHandler;

    public SessionController(Console console,
                             CancellationToken token,
                             DependencyChecker dependencyChecker,
                             CloudProviderCatalogLoader catalog,
                             InteractiveCollector collector,
                             ConfigStore configStore,
                             WorkspaceLayout layout,
                             BackupManager backupManager,
                             RegionStateManagerFactory regionStates,
                             DeploymentPhaseFactory phaseFactory,
                             PhaseExecutor phaseExecutor,
                             TeardownExecutor teardownExecutor,
                             MetricsRegistry metrics,
                             InterruptHandler interruptHandler) {
        this.console = console;
        this.token = token;
        this.dependencyChecker = dependencyChecker;
        this.catalog = catalog;
        this.collector = collector;
        this.configStore = configStore;
        this.layout = layout;
        this.backupManager = backupManager;
        this.regionStates = regionStates;
        this.phaseFactory = phaseFactory;
        this.phaseExecutor = phaseExecutor;
        this.teardownExecutor = teardownExecutor;
        this.metrics = metrics;
        this.interruptHandler = interruptHandler;
    }

    /**
     * @param cloud 命令行指定的云厂商，可为 null
     * @return 进程退出码
     */
    public int run(DeployMode mode, CloudProvider cloud) {
        DeploymentSession session = new DeploymentSession(mode, token);
        session.injectMdc(null);
        log.info("[SessionController] 会话开始, mode: {}, cloud: {}", mode, cloud != null ? cloud.getId() : "-");
        try {
            return switch (mode) {
                case DEPLOY -> deploy(session, cloud);
                case SKIP_INFRASTRUCTURE, UPDATE_TLS -> redeploy(session, cloud);
                case TEARDOWN -> teardown(session, cloud);
                case LIST_STATES -> listStates(cloud);
            };
        } catch (SetupInterruptedException e) {
            log.warn("[SessionController] 会话中断: {}", e.getMessage());
            if (token.isCancelled()) {
                console.warn("Interrupted by user");
                return EXIT_INTERRUPTED;
            }
            console.warn(e.getMessage());
            return EXIT_FAILED;
        } catch (DeployerException e) {
            log.error("[SessionController] 会话失败: {}", e.getMessage(), e);
            console.error(e.getMessage());
            if (e.getRemediationHint() != null) {
                console.info("Hint: " + e.getRemediationHint());
            }
            return e.getErrorType() == ErrorType.PRECONDITION_ERROR ? EXIT_PRECONDITION : EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("[SessionController] 未预期的错误", e);
            console.error("Unexpected error: " + e.getMessage() + " (details in logs/cloud-deploy.log)");
            return EXIT_FAILED;
        } finally {
            logMetrics();
            session.clearMdc();
            interruptHandler.cleanupComplete();
        }
    }

    private int deploy(DeploymentSession session, CloudProvider cloud) {
        CloudProvider provider = cloud;
        if (provider == null) {
            requireTools(catalog.commonTools(), session);
            provider = collector.chooseProvider();
            requireTools(catalog.provider(provider).getTools(), session);
        } else {
            requireTools(catalog.toolsFor(provider), session);
        }

        CollectionResult collected = collector.collect(provider, session);
        if (collected instanceof CollectionResult.Aborted aborted) {
            console.warn(aborted.reason() + ". No changes were made.");
            return EXIT_FAILED;
        }
        DeploymentConfig config = ((CollectionResult.Completed) collected).config();
        session.setConfig(config);
        prepareRegion(config);
        return runPipeline(session);
    }

    /**
     * --skip-terraform 与 --update-tls 共用：加载已保存的配置记录后进入流水线
     */
    private int redeploy(DeploymentSession session, CloudProvider cloud) {
        DeploymentConfig saved = loadSaved(cloud);
        requireTools(catalog.toolsFor(saved.getCloudProvider()), session);
        requireSavedRegionOwnsState(saved);

        CollectionResult collected = session.getMode() == DeployMode.UPDATE_TLS
                ? collector.collectTlsUpdate(saved, session)
                : collector.reuse(saved, session);
        if (collected instanceof CollectionResult.Aborted aborted) {
            console.warn(aborted.reason() + ". No changes were made.");
            return EXIT_FAILED;
        }
        session.setConfig(((CollectionResult.Completed) collected).config());
        return runPipeline(session);
    }

    private int runPipeline(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        List<BackupRecord> backups = backupManager.snapshot(layout.mutableFiles(config.getCloudProvider()));
        session.addBackups(backups);

        PipelineResult result;
        try {
            configStore.save(config);
            result = phaseExecutor.execute(phaseFactory.buildPhases(), session);
        } catch (RuntimeException e) {
            rollback(session);
            throw e;
        }

        if (result.isSuccess()) {
            commit(session, "SUCCEEDED");
            printSuccess(session);
            return EXIT_OK;
        }
        if (result.isSoftFailure()) {
            commit(session, "PARTIAL");
            PhaseResult failed = result.failedPhase().orElseThrow();
            console.warn("Deployment partially complete: '" + failed.getPhaseName()
                    + "' did not finish. Infrastructure and application are running.");
            return EXIT_PARTIAL;
        }

        rollback(session);
        PhaseResult failed = result.failedPhase().orElseThrow();
        FailureInfo failure = failed.getFailureInfo();
        console.error("Deployment failed at phase '" + failed.getPhaseName() + "': " + failure.getErrorMessage());
        console.info("Local configuration files were restored. Cloud resources that were already created are left in place.");
        return exitCodeFor(failure);
    }

    private int teardown(DeploymentSession session, CloudProvider cloud) {
        DeploymentConfig saved = loadSaved(cloud);
        requireTools(catalog.toolsFor(saved.getCloudProvider()), session);
        session.setConfig(saved);

        TeardownResult result = teardownExecutor.execute(session);
        if (result.aborted()) {
            console.info("Teardown cancelled. Nothing was deleted.");
            return EXIT_FAILED;
        }
        if (result.isSuccess()) {
            configStore.appendHistory(DeployMode.TEARDOWN, "SUCCEEDED", saved);
            console.success("Teardown complete");
            return EXIT_OK;
        }
        configStore.appendHistory(DeployMode.TEARDOWN, "FAILED", saved);
        result.failedStage().ifPresent(stage -> console.error("Teardown halted at '" + stage.stage() + "': "
                + stage.message() + ". Fix the problem and run --teardown again."));
        return EXIT_FAILED;
    }

    private int listStates(CloudProvider cloud) {
        List<CloudProvider> providers = cloud != null ? List.of(cloud) : Arrays.asList(CloudProvider.values());
        for (CloudProvider provider : providers) {
            RegionStateManager states = regionStates.forProvider(provider);
            console.header(provider.getDisplayName() + " region states");
            console.println("  Current region: " + states.currentRegion().orElse("(none)"));
            List<RegionStateSnapshot> snapshots = states.list();
            if (snapshots.isEmpty()) {
                console.println("  No snapshots");
                continue;
            }
            for (RegionStateSnapshot s : snapshots) {
                console.println(String.format("  %-20s %-20s %s%s", s.region(), s.timestamp(),
                        s.file().getFileName(), s.partial() ? " (partial)" : ""));
            }
        }
        return EXIT_OK;
    }

    /**
     * 目标区域与当前状态冲突时，用户确认后快照并切换；否则拒绝继续
     */
    private void prepareRegion(DeploymentConfig config) {
        RegionStateManager states = regionStates.forProvider(config.getCloudProvider());
        String target = config.getRegion();
        RegionCheck check = states.check(target);
        boolean hasSnapshot = states.list().stream().anyMatch(s -> s.region().equals(target));

        if (check == RegionCheck.CONFLICT) {
            String current = states.currentRegion().orElse("unknown");
            console.warn("Terraform state belongs to region '" + current + "', but you chose '" + target + "'.");
            if (!console.confirm("Snapshot the current state and switch to " + target + "?", false)) {
                throw new PreconditionException("Terraform state belongs to region '" + current + "'",
                        "Re-run and choose region '" + current + "', or allow the state switch");
            }
            if (states.restoreFor(target) == RestoreOutcome.NOT_FOUND) {
                states.snapshotAndClear();
            }
            log.info("[SessionController] 区域状态已切换: {} -> {}", current, target);
        } else if (check == RegionCheck.CLEAR && hasSnapshot
                && console.confirm("A saved state exists for " + target + ". Restore it?", true)) {
            states.restoreFor(target);
            log.info("[SessionController] 已恢复区域状态: {}", target);
        }
    }

    /**
     * 复用模式不切换区域：当前状态属于其他区域时读出的 infra 输出与配置记录不一致
     */
    private void requireSavedRegionOwnsState(DeploymentConfig saved) {
        RegionStateManager states = regionStates.forProvider(saved.getCloudProvider());
        if (states.check(saved.getRegion()) == RegionCheck.CONFLICT) {
            String current = states.currentRegion().orElse("unknown");
            throw new PreconditionException("Terraform state belongs to region '" + current
                    + "', but the saved configuration targets '" + saved.getRegion() + "'",
                    "Run a full deployment to switch regions, or inspect the state with --list-states");
        }
    }

    private DeploymentConfig loadSaved(CloudProvider cloud) {
        StoredConfiguration stored = configStore.load()
                .orElseThrow(() -> new PreconditionException("No saved configuration found at " + layout.currentConfig(),
                        "Run a full deployment first"));
        DeploymentConfig config = stored.configuration();
        if (cloud != null && cloud != config.getCloudProvider()) {
            throw new PreconditionException("Saved configuration is for " + config.getCloudProvider().getId()
                    + ", not " + cloud.getId(), "Omit --cloud or pass --cloud " + config.getCloudProvider().getId());
        }
        console.info("Loaded configuration saved at " + stored.timestamp());
        return config;
    }

    private void requireTools(List<ToolDefinition> tools, DeploymentSession session) {
        console.header("Checking dependencies");
        DependencyReport report = dependencyChecker.check(tools, session.getCancellationToken());
        for (ToolCheckResult r : report.results()) {
            if (r.blocking()) {
                console.error(r.describe());
            } else if (!r.found() || r.versionUnknown()) {
                console.warn(r.describe());
            } else {
                console.success(r.describe());
            }
        }
        if (!report.satisfied()) {
            report.blocking().forEach(r -> console.info("Install " + r.name() + ": " + r.tool().getInstallUrl()));
            throw new PreconditionException("Missing or outdated required tools");
        }
    }

    private void commit(DeploymentSession session, String outcome) {
        backupManager.discard(session.getActiveBackups());
        session.clearBackups();
        configStore.appendHistory(session.getMode(), outcome, session.getConfig());
    }

    private void rollback(DeploymentSession session) {
        List<BackupRecord> backups = session.getActiveBackups();
        if (backups.isEmpty()) {
            return;
        }
        log.warn("[SessionController] 恢复 {} 个文件快照", backups.size());
        backupManager.restore(backups);
        session.clearBackups();
    }

    private void printSuccess(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        console.header("Deployment complete");
        String scheme = config.getTls().isEnabled() ? "https" : "http";
        console.success("n8n is available at " + scheme + "://" + config.getHost());
        session.getEndpoint().ifPresent(endpoint ->
                console.info("Point a DNS record for " + config.getHost() + " at " + endpoint));
        console.info("Configuration saved to " + layout.currentConfig());
    }

    private int exitCodeFor(FailureInfo failure) {
        if (failure.getErrorType() == ErrorType.INTERRUPTED) {
            return token.isCancelled() ? EXIT_INTERRUPTED : EXIT_FAILED;
        }
        return failure.getErrorType() == ErrorType.PRECONDITION_ERROR ? EXIT_PRECONDITION : EXIT_FAILED;
    }

    private void logMetrics() {
        Map<String, String> summary = metrics.summary();
        if (!summary.isEmpty()) {
            summary.forEach((name, value) -> log.info("[SessionController] metric {} = {}", name, value));
        }
    }
}
