package xyz.firestige.clouddeploy.domain.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 组合 Phase：按顺序执行多个 Step，任一步失败则 Phase 失败。
 * 每一步前后检查取消令牌。
 */
public class CompositePhase implements DeploymentPhase {

    private static final Logger log = LoggerFactory.getLogger(CompositePhase.class);

    private final String name;
    private final List<PhaseStep> steps = new ArrayList<>();

    public CompositePhase(String name, List<PhaseStep> steps) {
        this.name = Objects.requireNonNull(name);
        if (steps != null) this.steps.addAll(steps);
    }

    @Override
    public String getName() { return name; }

    @Override
    public Optional<String> checkPrecondition(DeploymentSession session) {
        return Optional.empty();
    }

    @Override
    public Optional<String> skipReason(DeploymentSession session) {
        return Optional.empty();
    }

    @Override
    public PhaseResult execute(DeploymentSession session) {
        PhaseResult result = PhaseResult.start(name);
        for (PhaseStep step : steps) {
            StepResult stepRes = StepResult.start(step.getStepName());
            try {
                session.getCancellationToken().throwIfCancelled();
                log.info("Phase step start: phase={}, step={}", name, step.getStepName());
                step.execute(session);
                session.getCancellationToken().throwIfCancelled();
                stepRes.finishSuccess();
                result.addStepResult(stepRes);
            } catch (Exception ex) {
                log.error("Phase step failed: phase={}, step={}, err={}", name, step.getStepName(), ex.getMessage(), ex);
                stepRes.finishFailure(ex.getMessage());
                result.addStepResult(stepRes);
                result.failure(FailureInfo.fromException(ex, name + "/" + step.getStepName()));
                return result;
            }
        }
        result.success();
        return result;
    }

    @Override
    public List<PhaseStep> getSteps() { return new ArrayList<>(steps); }
}
