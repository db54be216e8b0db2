package xyz.firestige.clouddeploy.application.backup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.domain.backup.BackupRecord;
import xyz.firestige.clouddeploy.domain.shared.exception.BackupRestoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupManagerTest {

    @TempDir
    Path workDir;

    @Test
    void restoreReturnsFilesToTheirPreRunState() throws IOException {
        Path tfvars = workDir.resolve("terraform/aws/terraform.tfvars");
        Files.createDirectories(tfvars.getParent());
        Files.writeString(tfvars, "region = \"us-east-1\"\n");
        Path current = workDir.resolve(".setup-current.json");

        BackupManager manager = new BackupManager(workDir.resolve(".setup-backups"));
        List<BackupRecord> records = manager.snapshot(List.of(tfvars, current));

        assertThat(records).hasSize(2);
        assertThat(records.get(0).existedBefore()).isTrue();
        assertThat(records.get(1).existedBefore()).isFalse();

        Files.writeString(tfvars, "region = \"eu-west-1\"\n");
        Files.writeString(current, "{}");

        manager.restore(records);

        assertThat(Files.readString(tfvars)).isEqualTo("region = \"us-east-1\"\n");
        assertThat(current).doesNotExist();
        assertThat(records.get(0).snapshot()).doesNotExist();
    }

    @Test
    void discardLeavesCurrentFilesUntouched() throws IOException {
        Path values = workDir.resolve("values.yaml");
        Files.writeString(values, "a: 1\n");
        BackupManager manager = new BackupManager(workDir.resolve(".setup-backups"));
        List<BackupRecord> records = manager.snapshot(List.of(values));

        Files.writeString(values, "a: 2\n");
        manager.discard(records);

        assertThat(Files.readString(values)).isEqualTo("a: 2\n");
        assertThat(records.get(0).snapshot()).doesNotExist();
    }

    @Test
    void partialRestoreIsReportedAndRestoresTheRest() throws IOException {
        Path first = workDir.resolve("first.txt");
        Path second = workDir.resolve("second.txt");
        Files.writeString(first, "one");
        Files.writeString(second, "two");
        BackupManager manager = new BackupManager(workDir.resolve(".setup-backups"));
        List<BackupRecord> records = manager.snapshot(List.of(first, second));

        Files.writeString(first, "changed");
        Files.writeString(second, "changed");
        Files.delete(records.get(0).snapshot());

        assertThatThrownBy(() -> manager.restore(records))
                .isInstanceOf(BackupRestoreException.class)
                .satisfies(e -> assertThat(((BackupRestoreException) e).getUnrestored())
                        .containsExactly(first.toAbsolutePath().normalize()));
        assertThat(Files.readString(second)).isEqualTo("two");
    }
}
