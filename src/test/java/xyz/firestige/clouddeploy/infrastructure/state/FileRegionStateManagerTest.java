package xyz.firestige.clouddeploy.infrastructure.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateSnapshot;
import xyz.firestige.clouddeploy.domain.state.RestoreOutcome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileRegionStateManagerTest {

    private static final String NON_EMPTY = "{\"version\":4,\"resources\":[{\"type\":\"aws_eks_cluster\",\"name\":\"%s\"}]}";

    @TempDir
    Path terraformDir;

    private FileRegionStateManager manager;

    @BeforeEach
    void setUp() {
        manager = new FileRegionStateManager(terraformDir, new ObjectMapper());
    }

    private void writeState(String marker) throws IOException {
        Files.writeString(manager.stateFile(), String.format(NON_EMPTY, marker));
    }

    @Test
    void emptyWorkspaceIsClearForAnyRegion() throws IOException {
        assertThat(manager.check("us-east-1")).isEqualTo(RegionCheck.CLEAR);

        Files.writeString(manager.stateFile(), "{\"version\":4,\"resources\":[]}");
        assertThat(manager.currentRegion()).isEmpty();
        assertThat(manager.check("eu-west-1")).isEqualTo(RegionCheck.CLEAR);
    }

    @Test
    void stateOfAnotherRegionConflicts() throws IOException {
        writeState("east");
        manager.markCurrent("us-east-1");

        assertThat(manager.check("us-east-1")).isEqualTo(RegionCheck.CURRENT);
        assertThat(manager.check("eu-west-1")).isEqualTo(RegionCheck.CONFLICT);
    }

    @Test
    void stateWithoutMarkerIsUnknownAndConflicts() throws IOException {
        writeState("orphan");

        assertThat(manager.currentRegion()).contains(FileRegionStateManager.UNKNOWN_REGION);
        assertThat(manager.check("us-east-1")).isEqualTo(RegionCheck.CONFLICT);
    }

    @Test
    void snapshotAndClearMakesTargetClear() throws IOException {
        writeState("east");
        manager.markCurrent("us-east-1");

        RegionStateSnapshot snapshot = manager.snapshotAndClear().orElseThrow();

        assertThat(snapshot.region()).isEqualTo("us-east-1");
        assertThat(snapshot.file()).exists();
        assertThat(manager.stateFile()).doesNotExist();
        assertThat(manager.check("eu-west-1")).isEqualTo(RegionCheck.CLEAR);
    }

    @Test
    void restoreSwitchesBetweenRegionsWithoutLosingEither() throws IOException {
        writeState("east");
        manager.markCurrent("us-east-1");
        manager.snapshotAndClear();

        writeState("west");
        manager.markCurrent("eu-west-1");

        assertThat(manager.restoreFor("us-east-1")).isEqualTo(RestoreOutcome.RESTORED);
        assertThat(Files.readString(manager.stateFile())).contains("east");
        assertThat(manager.currentRegion()).contains("us-east-1");

        assertThat(manager.restoreFor("eu-west-1")).isEqualTo(RestoreOutcome.RESTORED);
        assertThat(Files.readString(manager.stateFile())).contains("west");
        assertThat(manager.currentRegion()).contains("eu-west-1");
    }

    @Test
    void restoreOfUnknownRegionIsNotFound() {
        assertThat(manager.restoreFor("ap-south-1")).isEqualTo(RestoreOutcome.NOT_FOUND);
    }

    @Test
    void listIsOrderedAndMarksPartialSnapshots() throws IOException {
        writeState("east");
        manager.snapshotFor("us-east-1");
        manager.snapshotPartial("us-east-1");
        Files.writeString(manager.statesDir().resolve("notes.txt"), "ignored");

        List<RegionStateSnapshot> snapshots = manager.list();

        assertThat(snapshots).hasSize(2);
        assertThat(snapshots).extracting(RegionStateSnapshot::region).containsOnly("us-east-1");
        assertThat(snapshots).filteredOn(RegionStateSnapshot::partial).hasSize(1);
        assertThat(snapshots.get(0).file().getFileName().toString())
                .startsWith("terraform.tfstate.us-east-1.");
    }

    @Test
    void partialSnapshotWithoutStateFileIsEmpty() {
        assertThat(manager.snapshotPartial("us-east-1")).isEmpty();
        assertThat(manager.list()).isEmpty();
    }

    @Test
    void clearMarkerLeavesStateUnowned() throws IOException {
        writeState("east");
        manager.markCurrent("us-east-1");
        manager.clearMarker();

        assertThat(manager.currentRegion()).contains(FileRegionStateManager.UNKNOWN_REGION);
    }
}
