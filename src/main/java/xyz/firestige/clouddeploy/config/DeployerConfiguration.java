package xyz.firestige.clouddeploy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.clouddeploy.application.SessionController;
import xyz.firestige.clouddeploy.application.backup.BackupManager;
import xyz.firestige.clouddeploy.application.collect.CertificateValidator;
import xyz.firestige.clouddeploy.application.collect.InteractiveCollector;
import xyz.firestige.clouddeploy.application.dependency.DependencyChecker;
import xyz.firestige.clouddeploy.application.execution.PhaseExecutor;
import xyz.firestige.clouddeploy.application.execution.phases.DeploymentPhaseFactory;
import xyz.firestige.clouddeploy.application.store.ConfigStore;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.application.teardown.TeardownExecutor;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfigValidator;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;
import xyz.firestige.clouddeploy.facade.DeployerCommandRunner;
import xyz.firestige.clouddeploy.infrastructure.catalog.CloudProviderCatalogLoader;
import xyz.firestige.clouddeploy.infrastructure.cloud.AwsPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.AzurePlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.cloud.GcpPlatform;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.console.InterruptHandler;
import xyz.firestige.clouddeploy.infrastructure.console.TerminalConsole;
import xyz.firestige.clouddeploy.infrastructure.event.DomainEventPublisher;
import xyz.firestige.clouddeploy.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.clouddeploy.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.clouddeploy.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;
import xyz.firestige.clouddeploy.infrastructure.process.SystemProcessRunner;
import xyz.firestige.clouddeploy.infrastructure.state.FileRegionStateManager;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 部署工具的 Bean 装配
 */
@Configuration
@EnableConfigurationProperties(DeployerProperties.class)
public class DeployerConfiguration {

    private static final Duration INTERRUPT_CLEANUP_WAIT = Duration.ofSeconds(30);

    // ========== 基础设施 Bean ==========

    @Bean
    public Validator validator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new SystemProcessRunner();
    }

    @Bean
    public Console console(CancellationToken cancellationToken) {
        return new TerminalConsole(cancellationToken);
    }

    @Bean
    public InterruptHandler interruptHandler(CancellationToken cancellationToken) {
        return new InterruptHandler(cancellationToken, INTERRUPT_CLEANUP_WAIT);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsRegistry metricsRegistry(MeterRegistry meterRegistry) {
        return new MicrometerMetricsRegistry(meterRegistry);
    }

    @Bean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    public CloudProviderCatalogLoader cloudProviderCatalogLoader() {
        return new CloudProviderCatalogLoader();
    }

    // ========== 外部工具 ==========

    @Bean
    public TerraformClient terraformClient(ProcessRunner processRunner, ObjectMapper objectMapper,
                                           DeployerProperties properties) {
        return new TerraformClient(processRunner, properties.getTimeouts().getInfrastructure(), objectMapper);
    }

    @Bean
    public HelmClient helmClient(ProcessRunner processRunner, DeployerProperties properties) {
        return new HelmClient(processRunner, properties.getTimeouts().getHelm());
    }

    @Bean
    public KubectlClient kubectlClient(ProcessRunner processRunner, ObjectMapper objectMapper,
                                       DeployerProperties properties) {
        return new KubectlClient(processRunner, properties.getTimeouts().getKubectl(), objectMapper);
    }

    @Bean
    public CloudPlatformRegistry cloudPlatformRegistry(ProcessRunner processRunner,
                                                       ObjectMapper objectMapper,
                                                       CloudProviderCatalogLoader catalog,
                                                       DeployerProperties properties) {
        Duration identity = properties.getTimeouts().getIdentity();
        Duration command = properties.getTimeouts().getKubectl();
        String resourceGroup = catalog.defaultsFor(CloudProvider.AZURE).getResourceGroup();
        return new CloudPlatformRegistry(List.of(
                new AwsPlatform(processRunner, objectMapper, identity, command),
                new AzurePlatform(processRunner, objectMapper, identity, command, resourceGroup),
                new GcpPlatform(processRunner, objectMapper, identity, command)));
    }

    // ========== 工作区与持久化 ==========

    @Bean
    public WorkspaceLayout workspaceLayout(DeployerProperties properties) {
        return new WorkspaceLayout(Path.of(properties.getWorkDir()));
    }

    @Bean
    public RegionStateManagerFactory regionStateManagerFactory(WorkspaceLayout layout, ObjectMapper objectMapper) {
        return provider -> new FileRegionStateManager(layout.terraformDir(provider), objectMapper);
    }

    @Bean
    public ConfigStore configStore(WorkspaceLayout layout) {
        return new ConfigStore(layout);
    }

    @Bean
    public BackupManager backupManager(WorkspaceLayout layout) {
        return new BackupManager(layout.root().resolve(".setup-backups"));
    }

    // ========== 应用服务 ==========

    @Bean
    public DependencyChecker dependencyChecker(ProcessRunner processRunner, DeployerProperties properties) {
        return new DependencyChecker(processRunner, properties.getTimeouts().getVersion());
    }

    @Bean
    public CertificateValidator certificateValidator(ProcessRunner processRunner) {
        return new CertificateValidator(processRunner);
    }

    @Bean
    public DeploymentConfigValidator deploymentConfigValidator(Validator validator) {
        return new DeploymentConfigValidator(validator);
    }

    @Bean
    public InteractiveCollector interactiveCollector(Console console,
                                                     CloudPlatformRegistry platforms,
                                                     CloudProviderCatalogLoader catalog,
                                                     DeploymentConfigValidator configValidator,
                                                     CertificateValidator certificateValidator) {
        return new InteractiveCollector(console, platforms, catalog, configValidator, certificateValidator);
    }

    @Bean
    public DeploymentPhaseFactory deploymentPhaseFactory(CloudPlatformRegistry platforms,
                                                         TerraformClient terraform,
                                                         HelmClient helm,
                                                         KubectlClient kubectl,
                                                         WorkspaceLayout layout,
                                                         RegionStateManagerFactory regionStates,
                                                         Console console,
                                                         CertificateValidator certificateValidator,
                                                         DeployerProperties properties,
                                                         ObjectMapper objectMapper) {
        return new DeploymentPhaseFactory(platforms, terraform, helm, kubectl, layout, regionStates, console,
                certificateValidator, properties, objectMapper);
    }

    @Bean
    public PhaseExecutor phaseExecutor(DomainEventPublisher eventPublisher, MetricsRegistry metricsRegistry) {
        return new PhaseExecutor(eventPublisher, metricsRegistry);
    }

    @Bean
    public TeardownExecutor teardownExecutor(CloudPlatformRegistry platforms,
                                             TerraformClient terraform,
                                             HelmClient helm,
                                             KubectlClient kubectl,
                                             WorkspaceLayout layout,
                                             RegionStateManagerFactory regionStates,
                                             Console console,
                                             DeployerProperties properties) {
        return new TeardownExecutor(platforms, terraform, helm, kubectl, layout, regionStates, console, properties);
    }

    @Bean
    public SessionController sessionController(Console console,
                                               CancellationToken cancellationToken,
                                               DependencyChecker dependencyChecker,
                                               CloudProviderCatalogLoader catalog,
                                               InteractiveCollector collector,
                                               ConfigStore configStore,
                                               WorkspaceLayout layout,
                                               BackupManager backupManager,
                                               RegionStateManagerFactory regionStates,
                                               DeploymentPhaseFactory phaseFactory,
                                               PhaseExecutor phaseExecutor,
                                               TeardownExecutor teardownExecutor,
                                               MetricsRegistry metricsRegistry,
                                               InterruptHandler interruptHandler) {
        return new SessionController(console, cancellationToken, dependencyChecker, catalog, collector,
                configStore, layout, backupManager, regionStates, phaseFactory, phaseExecutor,
                teardownExecutor, metricsRegistry, interruptHandler);
    }

    @Bean
    public DeployerCommandRunner deployerCommandRunner(SessionController sessionController,
                                                       InterruptHandler interruptHandler) {
        return new DeployerCommandRunner(sessionController, interruptHandler);
    }
}
