package xyz.firestige.clouddeploy.application.execution.steps;

import xyz.firestige.clouddeploy.application.execution.ApplicationRelease;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

public class ApplicationReleaseStep extends AbstractPhaseStep {

    private final ApplicationRelease release;

    public ApplicationReleaseStep(ApplicationRelease release) {
        super("application-release");
        this.release = release;
    }

    @Override
    public void execute(DeploymentSession session) {
        release.install(session);
    }
}
