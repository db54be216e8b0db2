package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;
import xyz.firestige.clouddeploy.domain.state.RegionStateSnapshot;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * init → plan → 用户确认 → apply。
 * 成功后按区域快照状态；失败时保存部分状态（.partial），标记仍指向该区域。
 */
public class TerraformApplyStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(TerraformApplyStep.class);

    private final TerraformClient terraform;
    private final CloudPlatformRegistry platforms;
    private final WorkspaceLayout layout;
    private final RegionStateManagerFactory regionStates;
    private final Console console;

    public TerraformApplyStep(TerraformClient terraform, CloudPlatformRegistry platforms, WorkspaceLayout layout,
                              RegionStateManagerFactory regionStates, Console console) {
        super("terraform-apply");
        this.terraform = terraform;
        this.platforms = platforms;
        this.layout = layout;
        this.regionStates = regionStates;
        this.console = console;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        Path dir = layout.terraformDir(config.getCloudProvider());
        Map<String, String> env = platforms.get(config.getCloudProvider()).toolEnvironment(config);
        RegionStateManager states = regionStates.forProvider(config.getCloudProvider());

        terraform.init(dir, env, session.getCancellationToken());
        terraform.plan(dir, env, session.getCancellationToken());
        if (!console.confirm("Apply this infrastructure plan?", false)) {
            throw new SetupInterruptedException("Infrastructure plan was not approved");
        }
        try {
            terraform.apply(dir, env, session.getCancellationToken());
        } catch (DeployerException e) {
            keepPartialState(states, config.getRegion(), dir, e);
            throw e;
        }
        RegionStateSnapshot snapshot = states.snapshotFor(config.getRegion());
        states.markCurrent(config.getRegion());
        log.info("[TerraformApplyStep] apply succeeded, state snapshot: {}", snapshot.file());
    }

    /**
     * 快照失败不能覆盖 apply 本身的错误，只作为 suppressed 附加
     */
    private void keepPartialState(RegionStateManager states, String region, Path dir, DeployerException applyError) {
        try {
            Optional<RegionStateSnapshot> partial = states.snapshotPartial(region);
            if (partial.isEmpty()) {
                log.warn("[TerraformApplyStep] apply failed before any state was written");
                return;
            }
            states.markCurrent(region);
            log.warn("[TerraformApplyStep] apply failed, partial state kept: {}", partial.get().file());
            if (applyError.getRemediationHint() == null) {
                applyError.withHint("terraform state still tracks partially created resources; inspect or destroy "
                        + "them with 'terraform -chdir=" + dir + " destroy' (snapshot: "
                        + partial.get().file().getFileName() + ")");
            }
        } catch (RuntimeException snapshotError) {
            log.error("[TerraformApplyStep] failed to keep partial state", snapshotError);
            applyError.addSuppressed(snapshotError);
        }
    }
}
