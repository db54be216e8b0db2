package xyz.firestige.clouddeploy.domain.shared.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * 统一封装 Phase / Step 执行过程中的失败信息，供 Session 决定回滚并向用户展示
 */
public class FailureInfo {

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 失败位置（Phase 名称 / Step 名称）
     */
    private String failedAt;

    /**
     * 修复建议
     */
    private String remediationHint;

    /**
     * 外部工具输出（截断后）
     */
    private String toolOutput;

    /**
     * 软失败：资源很可能已存在，只需提示用户手动处理，不触发回滚
     */
    private boolean recoverable;

    /**
     * 失败时间
     */
    private LocalDateTime timestamp;

    public FailureInfo() {
        this.timestamp = LocalDateTime.now();
    }

    public FailureInfo(ErrorType errorType, String errorMessage, String failedAt) {
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType, errorMessage, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, errorMessage, failedAt);
    }

    /**
     * 根据异常类型归类失败信息
     */
    public static FailureInfo fromException(Exception e, String failedAt) {
        if (e instanceof DeployerException de) {
            FailureInfo info = new FailureInfo(de.getErrorType(), de.getMessage(), failedAt);
            info.setRemediationHint(de.getRemediationHint());
            info.setRecoverable(de.isRecoverable());
            if (e instanceof ExternalToolException te) {
                info.setToolOutput(te.getToolOutput());
            }
            return info;
        }
        if (e instanceof InterruptedException) {
            return new FailureInfo(ErrorType.INTERRUPTED, "Interrupted", failedAt);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new FailureInfo(ErrorType.SYSTEM_ERROR, message, failedAt);
    }

    public FailureInfo withHint(String hint) {
        this.remediationHint = hint;
        return this;
    }

    public FailureInfo asRecoverable() {
        this.recoverable = true;
        return this;
    }

    // Getters and Setters

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public String getRemediationHint() {
        return remediationHint;
    }

    public void setRemediationHint(String remediationHint) {
        this.remediationHint = remediationHint;
    }

    public String getToolOutput() {
        return toolOutput;
    }

    public void setToolOutput(String toolOutput) {
        this.toolOutput = toolOutput;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public void setRecoverable(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorType=" + errorType +
                ", errorMessage='" + errorMessage + '\'' +
                ", failedAt='" + failedAt + '\'' +
                ", recoverable=" + recoverable +
                ", timestamp=" + timestamp +
                '}';
    }
}
