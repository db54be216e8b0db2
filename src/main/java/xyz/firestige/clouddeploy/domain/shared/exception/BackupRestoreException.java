package xyz.firestige.clouddeploy.domain.shared.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * 备份恢复不完整：部分文件未能恢复，属于致命的不一致
 */
public class BackupRestoreException extends DeployerException {

    private final List<Path> unrestored;

    public BackupRestoreException(List<Path> unrestored, Throwable firstCause) {
        super(ErrorType.SYSTEM_ERROR, "Failed to restore " + unrestored.size() + " file(s): " + unrestored, firstCause);
        this.unrestored = List.copyOf(unrestored);
    }

    public List<Path> getUnrestored() {
        return unrestored;
    }
}
