package xyz.firestige.clouddeploy.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.phase.DeploymentPhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseResult;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.clouddeploy.infrastructure.event.DomainEventPublisher;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseCompletedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseFailedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseSkippedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseStartedEvent;
import xyz.firestige.clouddeploy.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.clouddeploy.infrastructure.metrics.NoopMetricsRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 严格按顺序执行 Phase：
 * 先判断是否跳过，再检查前置条件，前置不满足或执行失败即停止，后续 Phase 不再开始。
 */
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public PhaseExecutor(DomainEventPublisher eventPublisher, MetricsRegistry metrics) {
        this.eventPublisher = eventPublisher;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    public PipelineResult execute(List<DeploymentPhase> phases, DeploymentSession session) {
        List<PhaseResult> results = new ArrayList<>();
        int total = phases.size();
        try {
            for (int i = 0; i < total; i++) {
                DeploymentPhase phase = phases.get(i);
                String name = phase.getName();
                int index = i + 1;
                session.injectMdc(name);

                Optional<String> skip = phase.skipReason(session);
                if (skip.isPresent()) {
                    log.info("Phase 跳过: {}, 原因: {}", name, skip.get());
                    record(session, results, PhaseResult.skipped(name, skip.get()));
                    metrics.incrementCounter("phase_skipped", "phase", name);
                    eventPublisher.publish(new PhaseSkippedEvent(session.getSessionId(), name, index, total, skip.get()));
                    continue;
                }

                eventPublisher.publish(new PhaseStartedEvent(session.getSessionId(), name, index, total));
                PhaseResult result;
                Optional<String> unmet = phase.checkPrecondition(session);
                if (unmet.isPresent()) {
                    log.error("Phase 前置条件不满足: {}, 原因: {}", name, unmet.get());
                    result = PhaseResult.failed(name, FailureInfo.of(ErrorType.PRECONDITION_ERROR, unmet.get(), name));
                } else {
                    log.info("开始执行 Phase: {} ({}/{})", name, index, total);
                    result = phase.execute(session);
                }
                record(session, results, result);

                if (result.isSuccess()) {
                    metrics.incrementCounter("phase_succeeded", "phase", name);
                    metrics.recordDuration("phase_duration", result.getDuration(), "phase", name);
                    log.info("Phase 执行成功: {}, 耗时: {}ms", name, result.getDuration().toMillis());
                    eventPublisher.publish(new PhaseCompletedEvent(session.getSessionId(), name, index, total,
                            result.getDuration()));
                    continue;
                }

                metrics.incrementCounter("phase_failed", "phase", name);
                FailureInfo failure = result.getFailureInfo();
                log.error("Phase 执行失败: {}, 类型: {}, 原因: {}", name,
                        failure.getErrorType(), failure.getErrorMessage());
                eventPublisher.publish(new PhaseFailedEvent(session.getSessionId(), name, index, total, failure));
                break;
            }
        } finally {
            session.injectMdc(null);
        }
        return new PipelineResult(results);
    }

    private void record(DeploymentSession session, List<PhaseResult> results, PhaseResult result) {
        results.add(result);
        session.addPhaseResult(result);
    }
}
