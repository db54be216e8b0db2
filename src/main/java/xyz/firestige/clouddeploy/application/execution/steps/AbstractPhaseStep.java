package xyz.firestige.clouddeploy.application.execution.steps;

import xyz.firestige.clouddeploy.domain.phase.PhaseStep;

import java.util.Objects;

public abstract class AbstractPhaseStep implements PhaseStep {

    protected final String stepName;

    protected AbstractPhaseStep(String stepName) {
        this.stepName = Objects.requireNonNull(stepName, "stepName cannot be null");
    }

    @Override
    public String getStepName() {
        return stepName;
    }
}
