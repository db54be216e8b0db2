package xyz.firestige.clouddeploy.domain.shared.exception;

import java.time.Duration;

/**
 * 就绪/端点轮询超时
 */
public class PollTimeoutException extends DeployerException {

    private final Duration deadline;

    public PollTimeoutException(String what, Duration deadline) {
        super(ErrorType.TIMEOUT_ERROR, what + " not ready after " + deadline.toSeconds() + "s");
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }

    /**
     * 标记为软失败：资源已创建，只是状态未能在时限内确认
     */
    public PollTimeoutException recoverable() {
        markRecoverable();
        return this;
    }
}
