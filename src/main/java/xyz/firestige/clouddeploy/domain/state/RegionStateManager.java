package xyz.firestige.clouddeploy.domain.state;

import java.util.List;
import java.util.Optional;

/**
 * 按区域管理 infra 引擎状态文件，防止跨区域状态互相覆盖。
 * 任何时刻一个工作目录只有一个"当前"状态。
 */
public interface RegionStateManager {

    /**
     * @return 当前状态所属区域；状态为空时返回 empty
     */
    Optional<String> currentRegion();

    RegionCheck check(String targetRegion);

    /**
     * 为区域保存当前状态的快照（不改动当前状态）
     */
    RegionStateSnapshot snapshotFor(String region);

    /**
     * 失败 apply 之后保存部分状态；apply 尚未写出状态文件时返回 empty
     */
    Optional<RegionStateSnapshot> snapshotPartial(String region);

    /**
     * 快照当前状态并清空，之后目标区域检查结果为 CLEAR
     */
    Optional<RegionStateSnapshot> snapshotAndClear();

    /**
     * 用目标区域最新快照替换当前状态；当前状态非空且属于其他区域时先快照
     */
    RestoreOutcome restoreFor(String region);

    /**
     * 按时间升序列出全部快照
     */
    List<RegionStateSnapshot> list();

    void markCurrent(String region);

    void clearMarker();
}
