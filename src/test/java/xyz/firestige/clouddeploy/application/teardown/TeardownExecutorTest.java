package xyz.firestige.clouddeploy.application.teardown;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;
import xyz.firestige.clouddeploy.support.ScriptedConsole;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TeardownExecutorTest {

    @TempDir
    Path workDir;

    private final CloudPlatform platform = mock(CloudPlatform.class);
    private final TerraformClient terraform = mock(TerraformClient.class);
    private final HelmClient helm = mock(HelmClient.class);
    private final KubectlClient kubectl = mock(KubectlClient.class);
    private final RegionStateManager states = mock(RegionStateManager.class);
    private final ScriptedConsole console = new ScriptedConsole();
    private DeploymentSession session;
    private TeardownExecutor executor;

    @BeforeEach
    void setUp() {
        when(platform.provider()).thenReturn(CloudProvider.AWS);
        when(platform.toolEnvironment(any())).thenReturn(Map.of("AWS_PROFILE", "default"));
        DeployerProperties properties = new DeployerProperties();
        properties.setCountdownSeconds(0);
        properties.getPolling().setInterval(Duration.ofMillis(10));
        properties.getPolling().setLoadBalancerDrain(Duration.ofMillis(50));
        executor = new TeardownExecutor(new CloudPlatformRegistry(List.of(platform)), terraform, helm, kubectl,
                new WorkspaceLayout(workDir), provider -> states, console, properties);

        session = new DeploymentSession(DeployMode.TEARDOWN, new CancellationToken());
        session.setConfig(TestConfigs.aws());
    }

    private void deployedEnvironment() {
        when(states.check("us-east-1")).thenReturn(RegionCheck.CURRENT);
        when(states.currentRegion()).thenReturn(Optional.of("us-east-1"));
        when(terraform.outputs(any(), any(), any())).thenReturn(Map.of("cluster_name", "n8n-eks-cluster"));
        when(kubectl.clusterReachable(any())).thenReturn(true);
        when(helm.uninstall(anyString(), anyString(), any())).thenReturn(true);
        when(kubectl.get(eq("service"), anyString(), anyString(), any())).thenReturn(Optional.empty());
    }

    @Test
    void testFullTeardownDeletesEverythingInOrder() {
        deployedEnvironment();
        when(platform.listAppSecrets(any())).thenReturn(List.of("n8n/encryption-key"));
        when(platform.deleteSecret(any(), eq("n8n/encryption-key"))).thenReturn(true);
        console.answer("y", "n8n-eks-cluster", "y");

        TeardownResult result = executor.execute(session);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stages()).extracting(TeardownStageResult::status).containsExactly(
                TeardownStatus.SUCCEEDED, TeardownStatus.SUCCEEDED, TeardownStatus.SUCCEEDED, TeardownStatus.SUCCEEDED);
        verify(kubectl).deleteAll("pvc", "n8n", session.getCancellationToken());
        verify(kubectl).delete("namespace", "n8n", null, session.getCancellationToken());
        verify(terraform).destroy(any(), any(), any());
        verify(states).clearMarker();
        verify(platform).deleteSecret(session, "n8n/encryption-key");
    }

    @Test
    void testSecondRunReportsAlreadyAbsent() {
        when(states.check("us-east-1")).thenReturn(RegionCheck.CLEAR);
        when(states.currentRegion()).thenReturn(Optional.empty());
        when(terraform.outputs(any(), any(), any())).thenReturn(Map.of());
        when(platform.listAppSecrets(any())).thenReturn(List.of());
        console.answer("y", "n8n-eks-cluster");

        TeardownResult result = executor.execute(session);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stages()).extracting(TeardownStageResult::status).containsOnly(TeardownStatus.ALREADY_ABSENT);
        verifyNoInteractions(helm);
        verify(terraform, never()).destroy(any(), any(), any());
    }

    @Test
    void testDecliningSecretCleanupKeepsEntries() {
        deployedEnvironment();
        when(platform.listAppSecrets(any())).thenReturn(List.of("n8n/encryption-key", "n8n/basic-auth"));
        console.answer("y", "n8n-eks-cluster", "n");

        TeardownResult result = executor.execute(session);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stages().get(3).status()).isEqualTo(TeardownStatus.SKIPPED);
        verify(platform, never()).deleteSecret(any(), anyString());
    }

    @Test
    void testWrongClusterNameAborts() {
        when(states.check("us-east-1")).thenReturn(RegionCheck.CURRENT);
        console.answer("y", "other-cluster");

        TeardownResult result = executor.execute(session);

        assertThat(result.aborted()).isTrue();
        assertThat(result.isSuccess()).isFalse();
        verifyNoInteractions(terraform, helm, kubectl);
    }

    @Test
    void testRegionConflictIsPrecondition() {
        when(states.check("us-east-1")).thenReturn(RegionCheck.CONFLICT);
        when(states.currentRegion()).thenReturn(Optional.of("eu-west-1"));

        assertThatThrownBy(() -> executor.execute(session))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("eu-west-1");
        assertThat(console.questions()).isEmpty();
    }

    @Test
    void testDestroyFailureStopsBeforeSecrets() {
        deployedEnvironment();
        doThrow(new ExternalToolException("terraform destroy", 1, "Error: deleting EKS cluster"))
                .when(terraform).destroy(any(), any(), any());
        console.answer("y", "n8n-eks-cluster");

        TeardownResult result = executor.execute(session);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failedStage().orElseThrow().stage()).isEqualTo("Infrastructure destroy");
        assertThat(result.stages()).hasSize(3);
        verify(states, never()).clearMarker();
        verify(platform, never()).listAppSecrets(any());
    }
}
