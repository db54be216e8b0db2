package xyz.firestige.clouddeploy.domain.state;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * 某个区域的 infra 状态快照
 *
 * @param region    区域标识
 * @param file      快照文件
 * @param timestamp 快照时间（取自文件名）
 * @param partial   失败 apply 后留下的部分状态
 */
public record RegionStateSnapshot(String region, Path file, LocalDateTime timestamp, boolean partial) {
}
