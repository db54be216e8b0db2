package xyz.firestige.clouddeploy.domain.state;

/**
 * 针对目标区域的状态检查结论
 */
public enum RegionCheck {

    /**
     * 当前状态为空，可以直接部署
     */
    CLEAR,

    /**
     * 当前状态属于目标区域
     */
    CURRENT,

    /**
     * 当前状态非空且属于其他区域（或归属未知），必须先快照清空或恢复
     */
    CONFLICT
}
