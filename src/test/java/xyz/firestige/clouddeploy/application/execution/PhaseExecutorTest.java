package xyz.firestige.clouddeploy.application.execution;

import org.junit.jupiter.api.Test;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.DeploymentPhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseResult;
import xyz.firestige.clouddeploy.domain.phase.PhaseStatus;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseCompletedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseFailedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseSkippedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseStartedEvent;
import xyz.firestige.clouddeploy.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.clouddeploy.support.RecordingEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseExecutorTest {

    private final RecordingEventPublisher events = new RecordingEventPublisher();
    private final PhaseExecutor executor = new PhaseExecutor(events, new NoopMetricsRegistry());
    private final CancellationToken token = new CancellationToken();
    private final DeploymentSession session = new DeploymentSession("s-1", DeployMode.DEPLOY, token);
    private final List<String> trace = new ArrayList<>();

    private PhaseStep step(String name) {
        return new PhaseStep() {
            @Override
            public String getStepName() {
                return name;
            }

            @Override
            public void execute(DeploymentSession s) {
                trace.add(name);
            }
        };
    }

    private PhaseStep failingStep(String name, RuntimeException error) {
        return new PhaseStep() {
            @Override
            public String getStepName() {
                return name;
            }

            @Override
            public void execute(DeploymentSession s) {
                trace.add(name);
                throw error;
            }
        };
    }

    private static DeploymentPhase skippedPhase(String name, String reason, PhaseStep... steps) {
        return new CompositePhase(name, List.of(steps)) {
            @Override
            public Optional<String> skipReason(DeploymentSession session) {
                return Optional.of(reason);
            }
        };
    }

    @Test
    void testPhasesRunInOrder() {
        PipelineResult result = executor.execute(List.of(
                new CompositePhase("infrastructure", List.of(step("apply"), step("outputs"))),
                new CompositePhase("application", List.of(step("release")))), session);

        assertThat(result.isSuccess()).isTrue();
        assertThat(trace).containsExactly("apply", "outputs", "release");
        assertThat(result.phaseResults()).extracting(PhaseResult::getStatus)
                .containsExactly(PhaseStatus.SUCCEEDED, PhaseStatus.SUCCEEDED);
        assertThat(session.getPhaseResults()).hasSize(2);
        assertThat(events.getPublishedEvents()).extracting(e -> e.getClass().getSimpleName())
                .containsExactly("PhaseStartedEvent", "PhaseCompletedEvent", "PhaseStartedEvent", "PhaseCompletedEvent");
    }

    @Test
    void testFailureHaltsPipeline() {
        PipelineResult result = executor.execute(List.of(
                new CompositePhase("infrastructure", List.of(
                        failingStep("apply", new IllegalStateException("boom")), step("outputs"))),
                new CompositePhase("application", List.of(step("release")))), session);

        assertThat(result.isSuccess()).isFalse();
        assertThat(trace).containsExactly("apply");
        assertThat(result.phaseResults()).hasSize(1);
        PhaseResult failed = result.failedPhase().orElseThrow();
        assertThat(failed.getFailureInfo().getErrorType()).isEqualTo(ErrorType.SYSTEM_ERROR);
        assertThat(failed.getFailureInfo().getFailedAt()).isEqualTo("infrastructure/apply");
        assertThat(events.getEventsOfType(PhaseFailedEvent.class)).singleElement()
                .extracting(PhaseEvent::getPhaseName).isEqualTo("infrastructure");
        assertThat(events.getEventsOfType(PhaseStartedEvent.class)).hasSize(1);
    }

    @Test
    void testSkippedPhaseDoesNotRunSteps() {
        PipelineResult result = executor.execute(List.of(
                skippedPhase("infrastructure", "--skip-terraform", step("apply")),
                new CompositePhase("application", List.of(step("release")))), session);

        assertThat(result.isSuccess()).isTrue();
        assertThat(trace).containsExactly("release");
        assertThat(result.phaseResults().get(0).getSkipReason()).isEqualTo("--skip-terraform");
        PhaseSkippedEvent skipped = events.getEventsOfType(PhaseSkippedEvent.class).get(0);
        assertThat(skipped.getIndex()).isEqualTo(1);
        assertThat(skipped.getTotal()).isEqualTo(2);
        assertThat(events.getEventsOfType(PhaseCompletedEvent.class)).singleElement()
                .extracting(PhaseEvent::getIndex).isEqualTo(2);
    }

    @Test
    void testUnmetPreconditionFailsWithoutExecuting() {
        DeploymentPhase guarded = new CompositePhase("application", List.of(step("release"))) {
            @Override
            public Optional<String> checkPrecondition(DeploymentSession session) {
                return Optional.of("kubectl is not configured");
            }
        };

        PipelineResult result = executor.execute(List.of(guarded, new CompositePhase("endpoint", List.of(step("dns")))), session);

        assertThat(trace).isEmpty();
        assertThat(result.failedPhase().orElseThrow().getFailureInfo().getErrorType())
                .isEqualTo(ErrorType.PRECONDITION_ERROR);
        assertThat(result.phaseResults()).hasSize(1);
    }

    @Test
    void testRecoverableFailureIsSoft() {
        PipelineResult result = executor.execute(List.of(
                new CompositePhase("endpoint", List.of(failingStep("discover",
                        new PollTimeoutException("load balancer address", Duration.ofMinutes(5)).recoverable())))), session);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isSoftFailure()).isTrue();
    }

    @Test
    void testCancellationStopsBeforeNextStep() {
        PhaseStep cancelling = new PhaseStep() {
            @Override
            public String getStepName() {
                return "apply";
            }

            @Override
            public void execute(DeploymentSession s) {
                trace.add("apply");
                token.cancel("Interrupted by user");
            }
        };

        PipelineResult result = executor.execute(List.of(
                new CompositePhase("infrastructure", List.of(cancelling, step("outputs")))), session);

        assertThat(trace).containsExactly("apply");
        assertThat(result.failedPhase().orElseThrow().getFailureInfo().getErrorType())
                .isEqualTo(ErrorType.INTERRUPTED);
    }
}
