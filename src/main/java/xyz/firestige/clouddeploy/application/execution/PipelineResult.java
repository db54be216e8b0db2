package xyz.firestige.clouddeploy.application.execution;

import xyz.firestige.clouddeploy.domain.phase.PhaseResult;

import java.util.List;
import java.util.Optional;

/**
 * 一次流水线运行的结果；失败时最后一个结果即为失败的 Phase
 */
public record PipelineResult(List<PhaseResult> phaseResults) {

    public PipelineResult {
        phaseResults = List.copyOf(phaseResults);
    }

    public Optional<PhaseResult> failedPhase() {
        return phaseResults.stream().filter(PhaseResult::isFailed).findFirst();
    }

    public boolean isSuccess() {
        return failedPhase().isEmpty();
    }

    /**
     * 失败但可恢复：不回滚，提示用户手动处理
     */
    public boolean isSoftFailure() {
        return failedPhase().map(PhaseResult::isSoftFailure).orElse(false);
    }
}
