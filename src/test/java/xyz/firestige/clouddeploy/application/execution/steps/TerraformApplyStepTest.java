package xyz.firestige.clouddeploy.application.execution.steps;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;
import xyz.firestige.clouddeploy.domain.state.RegionStateSnapshot;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.state.FileRegionStateManager;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;
import xyz.firestige.clouddeploy.support.FakeProcessRunner;
import xyz.firestige.clouddeploy.support.ScriptedConsole;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TerraformApplyStepTest {

    private static final String STATE = "{\"version\":4,\"resources\":[{\"type\":\"aws_eks_cluster\",\"name\":\"main\"}]}";

    @TempDir
    Path workDir;

    private final FakeProcessRunner runner = new FakeProcessRunner();
    private final ScriptedConsole console = new ScriptedConsole();

    private FileRegionStateManager states;
    private TerraformApplyStep step;
    private DeploymentSession session;

    @BeforeEach
    void setUp() throws IOException {
        WorkspaceLayout layout = new WorkspaceLayout(workDir);
        Path terraformDir = layout.terraformDir(CloudProvider.AWS);
        Files.createDirectories(terraformDir);
        states = new FileRegionStateManager(terraformDir, new ObjectMapper());

        CloudPlatform platform = mock(CloudPlatform.class);
        when(platform.provider()).thenReturn(CloudProvider.AWS);
        when(platform.toolEnvironment(any())).thenReturn(Map.of("AWS_PROFILE", "default"));

        step = new TerraformApplyStep(new TerraformClient(runner, Duration.ofMinutes(1), new ObjectMapper()),
                new CloudPlatformRegistry(List.of(platform)), layout, provider -> states, console);
        session = new DeploymentSession(DeployMode.DEPLOY, new CancellationToken());
        session.setConfig(TestConfigs.aws());
    }

    private void applyWritesState() {
        runner.on("terraform apply", spec -> {
            try {
                Files.writeString(states.stateFile(), STATE);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return ProcessResult.completed(
                    spec.display(), 0, "Apply complete!", "", Duration.ZERO);
        });
    }

    @Test
    void testSuccessfulApplySnapshotsAndMarksRegion() {
        applyWritesState();
        console.answer("y");

        step.execute(session);

        assertThat(runner.commands()).extracting(c -> c.split(" ")[1])
                .containsExactly("init", "plan", "apply");
        assertThat(states.currentRegion()).contains("us-east-1");
        assertThat(states.list()).singleElement()
                .satisfies(s -> assertThat(s.partial()).isFalse());
    }

    @Test
    void testDeclinedPlanNeverApplies() {
        console.answer("n");

        assertThatThrownBy(() -> step.execute(session)).isInstanceOf(SetupInterruptedException.class);
        assertThat(runner.ran("terraform apply")).isFalse();
    }

    @Test
    void testFailedApplyKeepsPartialStateAndMarker() throws IOException {
        Files.writeString(states.stateFile(), STATE);
        runner.onFailure("terraform apply", 1, "Error: creating RDS instance: quota exceeded");
        console.answer("y");

        assertThatThrownBy(() -> step.execute(session))
                .isInstanceOfSatisfying(ExternalToolException.class, e -> {
                    assertThat(e.getToolOutput()).contains("quota exceeded");
                    assertThat(e.getRemediationHint()).contains("destroy");
                });
        assertThat(states.list()).singleElement().satisfies(s -> assertThat(s.partial()).isTrue());
        assertThat(states.currentRegion()).contains("us-east-1");
    }

    @Test
    void testFailedApplyWithoutStateSurfacesToolError() {
        runner.onFailure("terraform apply", 1, "Error: creating EKS Node Group: AccessDeniedException");
        console.answer("y");

        assertThatThrownBy(() -> step.execute(session))
                .isInstanceOfSatisfying(ExternalToolException.class, e -> {
                    assertThat(e.getToolOutput()).contains("AccessDeniedException");
                    assertThat(e.getSuppressed()).isEmpty();
                });
        assertThat(states.list()).extracting(RegionStateSnapshot::region).isEmpty();
        assertThat(Files.exists(states.stateFile())).isFalse();
    }
}
