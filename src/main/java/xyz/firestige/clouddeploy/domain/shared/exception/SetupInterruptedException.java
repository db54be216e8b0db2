package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 用户中断（Ctrl+C、EOF 或在确认关口拒绝继续）
 */
public class SetupInterruptedException extends DeployerException {

    public SetupInterruptedException(String message) {
        super(ErrorType.INTERRUPTED, message);
    }
}
