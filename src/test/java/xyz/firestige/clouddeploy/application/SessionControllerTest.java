package xyz.firestige.clouddeploy.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.application.backup.BackupManager;
import xyz.firestige.clouddeploy.application.collect.CollectionResult;
import xyz.firestige.clouddeploy.application.collect.InteractiveCollector;
import xyz.firestige.clouddeploy.application.dependency.DependencyChecker;
import xyz.firestige.clouddeploy.application.dependency.DependencyReport;
import xyz.firestige.clouddeploy.application.dependency.ToolCheckResult;
import xyz.firestige.clouddeploy.application.execution.PhaseExecutor;
import xyz.firestige.clouddeploy.application.execution.phases.DeploymentPhaseFactory;
import xyz.firestige.clouddeploy.application.store.ConfigStore;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.application.teardown.TeardownExecutor;
import xyz.firestige.clouddeploy.application.teardown.TeardownResult;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.phase.CompositePhase;
import xyz.firestige.clouddeploy.domain.phase.PhaseStep;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DnsNotConfirmedException;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.infrastructure.catalog.CloudProviderCatalogLoader;
import xyz.firestige.clouddeploy.infrastructure.catalog.ToolDefinition;
import xyz.firestige.clouddeploy.infrastructure.console.InterruptHandler;
import xyz.firestige.clouddeploy.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.clouddeploy.support.RecordingEventPublisher;
import xyz.firestige.clouddeploy.support.ScriptedConsole;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SessionControllerTest {

    @TempDir
    Path workDir;

    private final ScriptedConsole console = new ScriptedConsole();
    private final CancellationToken token = new CancellationToken();
    private final DependencyChecker dependencyChecker = mock(DependencyChecker.class);
    private final InteractiveCollector collector = mock(InteractiveCollector.class);
    private final DeploymentPhaseFactory phaseFactory = mock(DeploymentPhaseFactory.class);
    private final TeardownExecutor teardownExecutor = mock(TeardownExecutor.class);
    private final RegionStateManager states = mock(RegionStateManager.class);
    private WorkspaceLayout layout;
    private ConfigStore configStore;
    private SessionController controller;

    @BeforeEach
    void setUp() {
        layout = new WorkspaceLayout(workDir);
        configStore = new ConfigStore(layout);
        CloudProviderCatalogLoader catalog = new CloudProviderCatalogLoader();
        catalog.loadCatalog();

        when(dependencyChecker.check(any(), any())).thenReturn(new DependencyReport(List.of()));
        when(states.check(any())).thenReturn(RegionCheck.CLEAR);
        when(states.list()).thenReturn(List.of());
        when(states.currentRegion()).thenReturn(Optional.empty());

        controller = new SessionController(console, token, dependencyChecker, catalog, collector, configStore, layout,
                new BackupManager(workDir.resolve(".setup-backups")), provider -> states, phaseFactory,
                new PhaseExecutor(new RecordingEventPublisher(), new NoopMetricsRegistry()), teardownExecutor,
                new NoopMetricsRegistry(), new InterruptHandler(token, Duration.ofSeconds(1)));
    }

    private static PhaseStep step(String name, Runnable action) {
        return new PhaseStep() {
            @Override
            public String getStepName() {
                return name;
            }

            @Override
            public void execute(DeploymentSession session) {
                action.run();
            }
        };
    }

    private Runnable writeTfvars(String content) {
        return () -> {
            try {
                Files.createDirectories(layout.tfvars(CloudProvider.AWS).getParent());
                Files.writeString(layout.tfvars(CloudProvider.AWS), content);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    private void collectorReturns(DeploymentConfig config) {
        when(collector.collect(any(), any())).thenReturn(new CollectionResult.Completed(config));
    }

    private String history() throws IOException {
        return Files.readString(layout.historyLog());
    }

    @Test
    void testSuccessfulDeploySavesConfigAndHistory() throws IOException {
        collectorReturns(TestConfigs.aws());
        when(phaseFactory.buildPhases()).thenReturn(List.of(
                new CompositePhase("Infrastructure", List.of(step("tfvars", writeTfvars("region = \"us-east-1\"\n"))))));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_OK);
        assertThat(configStore.load()).isPresent();
        assertThat(history()).contains("Outcome: SUCCEEDED").doesNotContain(TestConfigs.ENCRYPTION_KEY);
        assertThat(Files.readString(layout.tfvars(CloudProvider.AWS))).contains("us-east-1");
    }

    @Test
    void testHardFailureRestoresFiles() throws IOException {
        Files.createDirectories(layout.tfvars(CloudProvider.AWS).getParent());
        Files.writeString(layout.tfvars(CloudProvider.AWS), "original\n");
        collectorReturns(TestConfigs.aws());
        when(phaseFactory.buildPhases()).thenReturn(List.of(
                new CompositePhase("Infrastructure", List.of(step("tfvars", writeTfvars("changed\n")))),
                new CompositePhase("Application", List.of(step("release", () -> {
                    throw new IllegalStateException("helm exploded");
                })))));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_FAILED);
        assertThat(Files.readString(layout.tfvars(CloudProvider.AWS))).isEqualTo("original\n");
        assertThat(layout.currentConfig()).doesNotExist();
        assertThat(layout.historyLog()).doesNotExist();
        assertThat(console.errors()).anySatisfy(e -> assertThat(e).contains("Application").contains("helm exploded"));
    }

    @Test
    void testSoftFailureKeepsFilesAndExitsPartial() throws IOException {
        collectorReturns(TestConfigs.awsWithEverything());
        when(phaseFactory.buildPhases()).thenReturn(List.of(
                new CompositePhase("Infrastructure", List.of(step("tfvars", writeTfvars("new\n")))),
                new CompositePhase("TLS", List.of(step("dns", () -> {
                    throw new DnsNotConfirmedException("n8n.example.com");
                })))));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_PARTIAL);
        assertThat(Files.readString(layout.tfvars(CloudProvider.AWS))).isEqualTo("new\n");
        assertThat(history()).contains("Outcome: PARTIAL");
    }

    @Test
    void testInterruptRestoresFilesAndExits130() {
        collectorReturns(TestConfigs.aws());
        when(phaseFactory.buildPhases()).thenReturn(List.of(
                new CompositePhase("Infrastructure", List.of(
                        step("tfvars", writeTfvars("partial\n")),
                        step("apply", () -> token.cancel("Interrupted by user"))))));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_INTERRUPTED);
        assertThat(layout.tfvars(CloudProvider.AWS)).doesNotExist();
        assertThat(layout.currentConfig()).doesNotExist();
    }

    @Test
    void testAbortedCollectionChangesNothing() {
        when(collector.collect(any(), any())).thenReturn(new CollectionResult.Aborted("Configuration cancelled by user"));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_FAILED);
        assertThat(layout.currentConfig()).doesNotExist();
        verify(phaseFactory, never()).buildPhases();
    }

    @Test
    void testMissingToolsStopBeforeAnyQuestion() {
        ToolDefinition terraform = new ToolDefinition();
        terraform.setName("terraform");
        terraform.setInstallUrl("https://developer.hashicorp.com/terraform/install");
        when(dependencyChecker.check(any(), any()))
                .thenReturn(new DependencyReport(List.of(new ToolCheckResult(terraform, false, null, false))));

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_PRECONDITION);
        assertThat(console.questions()).isEmpty();
        assertThat(console.output()).anySatisfy(line -> assertThat(line).contains("hashicorp.com"));
        verifyNoInteractions(collector);
    }

    @Test
    void testRedeployWithoutSavedConfigIsPrecondition() {
        int exit = controller.run(DeployMode.SKIP_INFRASTRUCTURE, null);

        assertThat(exit).isEqualTo(SessionController.EXIT_PRECONDITION);
        assertThat(console.errors()).anySatisfy(e -> assertThat(e).contains(WorkspaceLayout.CURRENT_CONFIG));
        verifyNoInteractions(dependencyChecker);
    }

    @Test
    void testSavedConfigForAnotherCloudIsRejected() {
        configStore.save(TestConfigs.aws());

        int exit = controller.run(DeployMode.UPDATE_TLS, CloudProvider.GCP);

        assertThat(exit).isEqualTo(SessionController.EXIT_PRECONDITION);
        verifyNoInteractions(collector);
    }

    @Test
    void testSkipTerraformRefusesStateOfAnotherRegion() {
        configStore.save(TestConfigs.aws());
        when(states.check("us-east-1")).thenReturn(RegionCheck.CONFLICT);
        when(states.currentRegion()).thenReturn(Optional.of("eu-west-1"));

        int exit = controller.run(DeployMode.SKIP_INFRASTRUCTURE, null);

        assertThat(exit).isEqualTo(SessionController.EXIT_PRECONDITION);
        assertThat(console.errors()).anySatisfy(e -> assertThat(e).contains("eu-west-1"));
        verifyNoInteractions(collector);
        verify(phaseFactory, never()).buildPhases();
    }

    @Test
    void testDeclinedRegionSwitchIsPrecondition() {
        collectorReturns(TestConfigs.aws());
        when(states.check("us-east-1")).thenReturn(RegionCheck.CONFLICT);
        when(states.currentRegion()).thenReturn(Optional.of("eu-west-1"));
        console.answer("n");

        int exit = controller.run(DeployMode.DEPLOY, CloudProvider.AWS);

        assertThat(exit).isEqualTo(SessionController.EXIT_PRECONDITION);
        verify(states, never()).snapshotAndClear();
        assertThat(layout.currentConfig()).doesNotExist();
    }

    @Test
    void testTeardownRecordsHistory() throws IOException {
        configStore.save(TestConfigs.aws());
        when(teardownExecutor.execute(any())).thenReturn(new TeardownResult(false, List.of()));

        int exit = controller.run(DeployMode.TEARDOWN, null);

        assertThat(exit).isEqualTo(SessionController.EXIT_OK);
        assertThat(history()).contains("Mode: TEARDOWN").contains("Outcome: SUCCEEDED");
    }
}
