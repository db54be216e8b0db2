package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.store.TerraformVarsWriter;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;

import java.nio.file.Path;

/**
 * 生成 terraform.tfvars（不含任何密钥）
 */
public class WriteTerraformVarsStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(WriteTerraformVarsStep.class);

    private final CloudPlatformRegistry platforms;
    private final WorkspaceLayout layout;
    private final TerraformVarsWriter writer;

    public WriteTerraformVarsStep(CloudPlatformRegistry platforms, WorkspaceLayout layout, TerraformVarsWriter writer) {
        super("write-tfvars");
        this.platforms = platforms;
        this.layout = layout;
        this.writer = writer;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        Path file = layout.tfvars(config.getCloudProvider());
        writer.write(file, platforms.get(config.getCloudProvider()).terraformVariables(config));
        log.info("[WriteTerraformVarsStep] tfvars written: {}", file);
    }
}
