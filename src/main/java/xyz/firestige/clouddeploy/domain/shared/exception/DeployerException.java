package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 部署器基础异常类
 * Step 内部用异常表达失败，Phase 边界统一转换为 {@link FailureInfo}
 */
public class DeployerException extends RuntimeException {

    private final ErrorType errorType;
    private String remediationHint;
    private boolean recoverable;

    public DeployerException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DeployerException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getRemediationHint() {
        return remediationHint;
    }

    public DeployerException withHint(String hint) {
        this.remediationHint = hint;
        return this;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    protected void markRecoverable() {
        this.recoverable = true;
    }

    public FailureInfo toFailureInfo(String failedAt) {
        return FailureInfo.fromException(this, failedAt);
    }
}
