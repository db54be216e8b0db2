package xyz.firestige.clouddeploy.domain.backup;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * 单个被修改文件的备份记录
 *
 * @param source        被保护的文件
 * @param snapshot      快照文件；源文件原本不存在时为 null
 * @param timestamp     快照时间
 * @param existedBefore 快照时源文件是否存在（不存在则恢复=删除）
 */
public record BackupRecord(Path source, Path snapshot, LocalDateTime timestamp, boolean existedBefore) {

    public static BackupRecord ofMissing(Path source, LocalDateTime timestamp) {
        return new BackupRecord(source, null, timestamp, false);
    }
}
