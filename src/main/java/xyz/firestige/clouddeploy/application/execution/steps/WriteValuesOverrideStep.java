package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ReleaseValuesMapper;
import xyz.firestige.clouddeploy.application.store.HelmValuesWriter;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

import java.nio.file.Path;

public class WriteValuesOverrideStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(WriteValuesOverrideStep.class);

    private final WorkspaceLayout layout;
    private final HelmValuesWriter writer;

    public WriteValuesOverrideStep(WorkspaceLayout layout, HelmValuesWriter writer) {
        super("write-values-override");
        this.layout = layout;
        this.writer = writer;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        Path file = layout.valuesOverride(config.getCloudProvider());
        writer.write(file, ReleaseValuesMapper.installValues(config, session.getInfraOutputs()));
        log.info("[WriteValuesOverrideStep] values override written: {}", file);
    }
}
