package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 错误类型枚举
 * 对应部署流程的错误分类，决定 Session 的回滚与退出码策略
 */
public enum ErrorType {

    /**
     * 前置条件不满足（依赖缺失、身份校验失败、区域状态冲突），尚未发生任何写入
     */
    PRECONDITION_ERROR("前置条件错误", false),

    /**
     * 用户输入校验错误，只在交互收集阶段内部处理
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 外部工具非零退出
     */
    EXTERNAL_TOOL_ERROR("外部工具错误", true),

    /**
     * 就绪轮询超过截止时间
     */
    TIMEOUT_ERROR("超时错误", true),

    /**
     * 用户中断
     */
    INTERRUPTED("用户中断", true),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", true);

    private final String description;
    private final boolean rollbackRequired;

    ErrorType(String description, boolean rollbackRequired) {
        this.description = description;
        this.rollbackRequired = rollbackRequired;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 该类错误是否要求恢复备份文件
     */
    public boolean isRollbackRequired() {
        return rollbackRequired;
    }
}
