package xyz.firestige.clouddeploy.application.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.backup.BackupRecord;
import xyz.firestige.clouddeploy.domain.shared.exception.BackupRestoreException;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 配置文件备份：写入前快照，失败或中断时整体恢复，成功后丢弃。
 * 调用方必须先拿到快照记录再执行写操作。
 */
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private final Path backupRoot;

    /**
     * @param backupRoot 快照存放目录；为 null 时使用系统临时目录
     */
    public BackupManager(Path backupRoot) {
        this.backupRoot = backupRoot;
    }

    public List<BackupRecord> snapshot(Collection<Path> paths) {
        LocalDateTime now = LocalDateTime.now();
        List<BackupRecord> records = new ArrayList<>();
        Path dir = null;
        try {
            int index = 0;
            for (Path source : new LinkedHashSet<>(paths)) {
                Path abs = source.toAbsolutePath().normalize();
                if (Files.isRegularFile(abs)) {
                    if (dir == null) {
                        dir = createSnapshotDir();
                    }
                    Path copy = dir.resolve((index++) + "-" + abs.getFileName());
                    Files.copy(abs, copy, StandardCopyOption.COPY_ATTRIBUTES);
                    records.add(new BackupRecord(abs, copy, now, true));
                } else {
                    records.add(BackupRecord.ofMissing(abs, now));
                }
            }
        } catch (IOException e) {
            discard(records);
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Failed to back up configuration files: " + e.getMessage(), e);
        }
        log.info("已备份 {} 个文件（其中 {} 个原本不存在）", records.size(),
                records.stream().filter(r -> !r.existedBefore()).count());
        return records;
    }

    /**
     * 全量恢复。逐个尝试全部记录，只要有一个失败就抛出 BackupRestoreException
     */
    public void restore(List<BackupRecord> records) {
        List<Path> failed = new ArrayList<>();
        Throwable firstCause = null;
        for (BackupRecord record : records) {
            try {
                restoreOne(record);
            } catch (IOException | RuntimeException e) {
                log.error("恢复失败: {}, err={}", record.source(), e.getMessage(), e);
                failed.add(record.source());
                if (firstCause == null) {
                    firstCause = e;
                }
            }
        }
        if (!failed.isEmpty()) {
            throw new BackupRestoreException(failed, firstCause);
        }
        log.info("已恢复 {} 个文件", records.size());
        discard(records);
    }

    /**
     * 删除快照副本
     */
    public void discard(List<BackupRecord> records) {
        for (BackupRecord record : records) {
            if (record.snapshot() == null) {
                continue;
            }
            try {
                Files.deleteIfExists(record.snapshot());
                Path parent = record.snapshot().getParent();
                if (parent != null && isEmptyDir(parent)) {
                    Files.deleteIfExists(parent);
                }
            } catch (IOException e) {
                log.warn("删除快照失败: {}, err={}", record.snapshot(), e.getMessage());
            }
        }
    }

    private void restoreOne(BackupRecord record) throws IOException {
        if (record.existedBefore()) {
            if (record.snapshot() == null || !Files.isRegularFile(record.snapshot())) {
                throw new IOException("Snapshot missing for " + record.source());
            }
            if (record.source().getParent() != null) {
                Files.createDirectories(record.source().getParent());
            }
            Files.copy(record.snapshot(), record.source(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.debug("已恢复: {}", record.source());
        } else if (Files.deleteIfExists(record.source())) {
            log.debug("已删除本次运行新建的文件: {}", record.source());
        }
    }

    private Path createSnapshotDir() throws IOException {
        if (backupRoot == null) {
            return Files.createTempDirectory("cloud-deploy-backup-");
        }
        Files.createDirectories(backupRoot);
        return Files.createTempDirectory(backupRoot, "backup-");
    }

    private static boolean isEmptyDir(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (var entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
