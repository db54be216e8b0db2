package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;

import java.util.List;
import java.util.Map;

/**
 * 读取 terraform output 并检查必需输出。session 中已有输出时不再读取。
 */
public class CaptureOutputsStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(CaptureOutputsStep.class);

    private final TerraformClient terraform;
    private final CloudPlatformRegistry platforms;
    private final WorkspaceLayout layout;

    public CaptureOutputsStep(TerraformClient terraform, CloudPlatformRegistry platforms, WorkspaceLayout layout) {
        super("capture-outputs");
        this.terraform = terraform;
        this.platforms = platforms;
        this.layout = layout;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        CloudPlatform platform = platforms.get(config.getCloudProvider());
        if (session.getInfraOutputs().isEmpty()) {
            Map<String, String> outputs = terraform.outputs(layout.terraformDir(config.getCloudProvider()),
                    platform.toolEnvironment(config), session.getCancellationToken());
            session.putInfraOutputs(outputs);
            log.info("[CaptureOutputsStep] outputs: {}", outputs.keySet());
        }
        List<String> missing = platform.requiredOutputs(config).stream()
                .filter(name -> session.infraOutput(name).isEmpty())
                .toList();
        if (!missing.isEmpty()) {
            throw new DeployerException(ErrorType.EXTERNAL_TOOL_ERROR, "Infrastructure outputs missing: " + missing)
                    .withHint("Run 'terraform output' in " + layout.terraformDir(config.getCloudProvider())
                            + " and check the apply completed");
        }
    }
}
