package xyz.firestige.clouddeploy.domain.config;

/**
 * 一次调用的运行模式
 */
public enum DeployMode {

    /**
     * 完整部署：infra → 应用 → 端点 → TLS/认证
     */
    DEPLOY,

    /**
     * 复用已有 infra 输出，直接部署应用
     */
    SKIP_INFRASTRUCTURE,

    /**
     * 只更新 TLS / 基础认证
     */
    UPDATE_TLS,

    /**
     * 反向拆除
     */
    TEARDOWN,

    /**
     * 列出区域状态快照
     */
    LIST_STATES
}
