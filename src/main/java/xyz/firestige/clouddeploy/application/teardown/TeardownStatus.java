package xyz.firestige.clouddeploy.application.teardown;

public enum TeardownStatus {
    SUCCEEDED,
    /**
     * 资源本就不存在（重复执行 teardown 时的正常结果）
     */
    ALREADY_ABSENT,
    FAILED,
    SKIPPED
}
