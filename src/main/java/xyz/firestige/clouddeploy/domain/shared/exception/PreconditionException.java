package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 前置条件异常：依赖缺失、身份校验失败、区域状态冲突
 */
public class PreconditionException extends DeployerException {

    public PreconditionException(String message) {
        super(ErrorType.PRECONDITION_ERROR, message);
    }

    public PreconditionException(String message, String hint) {
        super(ErrorType.PRECONDITION_ERROR, message);
        withHint(hint);
    }
}
