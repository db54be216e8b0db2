package xyz.firestige.clouddeploy.domain.phase;

import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Phase 执行结果：succeeded / failed(reason) / skipped(reason)
 */
public class PhaseResult {

    /**
     * Phase 名称
     */
    private final String phaseName;

    private PhaseStatus status = PhaseStatus.PENDING;

    private final List<StepResult> stepResults = new ArrayList<>();

    /**
     * 失败信息（如果失败）
     */
    private FailureInfo failureInfo;

    /**
     * 跳过原因（如果跳过）
     */
    private String skipReason;

    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Duration duration = Duration.ZERO;

    public PhaseResult(String phaseName) {
        this.phaseName = phaseName;
    }

    /**
     * 创建运行中的结果占位符
     */
    public static PhaseResult start(String phaseName) {
        PhaseResult r = new PhaseResult(phaseName);
        r.status = PhaseStatus.RUNNING;
        r.startTime = LocalDateTime.now();
        return r;
    }

    public static PhaseResult skipped(String phaseName, String reason) {
        PhaseResult r = new PhaseResult(phaseName);
        r.status = PhaseStatus.SKIPPED;
        r.skipReason = reason;
        r.startTime = LocalDateTime.now();
        r.endTime = r.startTime;
        return r;
    }

    public static PhaseResult failed(String phaseName, FailureInfo failureInfo) {
        PhaseResult r = start(phaseName);
        r.failure(failureInfo);
        return r;
    }

    public void success() {
        this.status = PhaseStatus.SUCCEEDED;
        finish();
    }

    public void failure(FailureInfo failureInfo) {
        this.status = PhaseStatus.FAILED;
        this.failureInfo = failureInfo;
        finish();
    }

    private void finish() {
        this.endTime = LocalDateTime.now();
        if (startTime != null) {
            this.duration = Duration.between(startTime, endTime);
        }
    }

    public boolean isSuccess() {
        return status == PhaseStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == PhaseStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == PhaseStatus.SKIPPED;
    }

    /**
     * 可恢复的软失败：资源已存在，只需要用户手动跟进，不触发回滚
     */
    public boolean isSoftFailure() {
        return isFailed() && failureInfo != null && failureInfo.isRecoverable();
    }

    public void addStepResult(StepResult stepResult) {
        this.stepResults.add(stepResult);
    }

    public String getPhaseName() {
        return phaseName;
    }

    public PhaseStatus getStatus() {
        return status;
    }

    public List<StepResult> getStepResults() {
        return Collections.unmodifiableList(stepResults);
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "PhaseResult{" +
                "phaseName='" + phaseName + '\'' +
                ", status=" + status +
                ", duration=" + duration +
                (failureInfo != null ? ", failure=" + failureInfo.getErrorMessage() : "") +
                (skipReason != null ? ", skipReason='" + skipReason + '\'' : "") +
                '}';
    }
}
