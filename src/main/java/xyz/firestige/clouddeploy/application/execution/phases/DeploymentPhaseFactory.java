package xyz.firestige.clouddeploy.application.execution.phases;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.collect.CertificateValidator;
import xyz.firestige.clouddeploy.application.execution.ApplicationRelease;
import xyz.firestige.clouddeploy.application.execution.ReadinessPoller;
import xyz.firestige.clouddeploy.application.execution.steps.ApplicationReleaseStep;
import xyz.firestige.clouddeploy.application.execution.steps.AutomaticTlsStep;
import xyz.firestige.clouddeploy.application.execution.steps.BasicAuthStep;
import xyz.firestige.clouddeploy.application.execution.steps.ByoTlsStep;
import xyz.firestige.clouddeploy.application.execution.steps.CaptureOutputsStep;
import xyz.firestige.clouddeploy.application.execution.steps.ConfigureKubectlStep;
import xyz.firestige.clouddeploy.application.execution.steps.DatabaseCredentialsSecretStep;
import xyz.firestige.clouddeploy.application.execution.steps.DiscoverEndpointStep;
import xyz.firestige.clouddeploy.application.execution.steps.EncryptionKeySecretStep;
import xyz.firestige.clouddeploy.application.execution.steps.EnsureNamespaceStep;
import xyz.firestige.clouddeploy.application.execution.steps.IngressControllerStep;
import xyz.firestige.clouddeploy.application.execution.steps.TerraformApplyStep;
import xyz.firestige.clouddeploy.application.execution.steps.WorkloadReadinessStep;
import xyz.firestige.clouddeploy.application.execution.steps.WriteTerraformVarsStep;
import xyz.firestige.clouddeploy.application.execution.steps.WriteValuesOverrideStep;
import xyz.firestige.clouddeploy.application.store.HelmValuesWriter;
import xyz.firestige.clouddeploy.application.store.TerraformVarsWriter;
import xyz.firestige.clouddeploy.application.store.WorkspaceLayout;
import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.phase.DeploymentPhase;
import xyz.firestige.clouddeploy.domain.state.RegionStateManagerFactory;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;
import xyz.firestige.clouddeploy.infrastructure.tool.TerraformClient;

import java.util.List;

/**
 * 按固定顺序构建 4 个 Phase：
 * Infrastructure → Application → Endpoint Discovery → TLS &amp; Auth Upgrade
 */
public class DeploymentPhaseFactory {

    private static final Logger log = LoggerFactory.getLogger(DeploymentPhaseFactory.class);

    private final CloudPlatformRegistry platforms;
    private final TerraformClient terraform;
    private final HelmClient helm;
    private final KubectlClient kubectl;
    private final WorkspaceLayout layout;
    private final RegionStateManagerFactory regionStates;
    private final Console console;
    private final CertificateValidator certificateValidator;
    private final DeployerProperties properties;
    private final ObjectMapper objectMapper;

    public DeploymentPhaseFactory(CloudPlatformRegistry platforms,
                                  TerraformClient terraform,
                                  HelmClient helm,
                                  KubectlClient kubectl,
                                  WorkspaceLayout layout,
                                  RegionStateManagerFactory regionStates,
                                  Console console,
                                  CertificateValidator certificateValidator,
                                  DeployerProperties properties,
                                  ObjectMapper objectMapper) {
        this.platforms = platforms;
        this.terraform = terraform;
        this.helm = helm;
        this.kubectl = kubectl;
        this.layout = layout;
        this.regionStates = regionStates;
        this.console = console;
        this.certificateValidator = certificateValidator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public List<DeploymentPhase> buildPhases() {
        ReadinessPoller poller = new ReadinessPoller(properties.getPolling().getInterval());
        ApplicationRelease release = new ApplicationRelease(helm, layout, properties);
        CaptureOutputsStep captureOutputs = new CaptureOutputsStep(terraform, platforms, layout);
        ConfigureKubectlStep configureKubectl = new ConfigureKubectlStep(platforms, kubectl);

        DeploymentPhase infrastructure = new InfrastructurePhase(List.of(
                new WriteTerraformVarsStep(platforms, layout, new TerraformVarsWriter()),
                new TerraformApplyStep(terraform, platforms, layout, regionStates, console),
                captureOutputs
        ), regionStates);

        DeploymentPhase application = new ApplicationPhase(List.of(
                captureOutputs,
                new WriteValuesOverrideStep(layout, new HelmValuesWriter()),
                configureKubectl,
                new EnsureNamespaceStep(kubectl),
                new EncryptionKeySecretStep(platforms, kubectl),
                new DatabaseCredentialsSecretStep(platforms, kubectl, objectMapper),
                new IngressControllerStep(helm, properties),
                new ApplicationReleaseStep(release),
                new WorkloadReadinessStep(kubectl, poller, release.name(), properties.getPolling().getReadiness())
        ), regionStates);

        DeploymentPhase endpoint = new EndpointDiscoveryPhase(List.of(
                captureOutputs,
                configureKubectl,
                new DiscoverEndpointStep(kubectl, poller, console,
                        properties.getReleases().getIngressNamespace(), properties.getPolling().getEndpoint())
        ), regionStates);

        DeploymentPhase tlsAuth = new TlsAuthUpgradePhase(List.of(
                new ByoTlsStep(certificateValidator, kubectl, release),
                new AutomaticTlsStep(helm, kubectl, poller, release, console, properties),
                new BasicAuthStep(platforms, kubectl, release, console)
        ));

        List<DeploymentPhase> phases = List.of(infrastructure, application, endpoint, tlsAuth);
        log.debug("构建 {} 个 Phase", phases.size());
        return phases;
    }
}
