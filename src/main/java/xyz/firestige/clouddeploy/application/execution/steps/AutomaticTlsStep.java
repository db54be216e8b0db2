package xyz.firestige.clouddeploy.application.execution.steps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ApplicationRelease;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.application.execution.ReadinessPoller;
import xyz.firestige.clouddeploy.application.execution.ReleaseValuesMapper;
import xyz.firestige.clouddeploy.config.DeployerProperties;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DnsNotConfirmedException;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmClient;
import xyz.firestige.clouddeploy.infrastructure.tool.HelmUpgradeCommand;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 自动 TLS：DNS 确认 → cert-manager → ClusterIssuer → release 升级。
 * DNS 未确认时不触碰集群。
 */
public class AutomaticTlsStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(AutomaticTlsStep.class);
    static final String WEBHOOK_DEPLOYMENT = "cert-manager-webhook";

    private final HelmClient helm;
    private final KubectlClient kubectl;
    private final ReadinessPoller poller;
    private final ApplicationRelease release;
    private final Console console;
    private final DeployerProperties properties;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public AutomaticTlsStep(HelmClient helm, KubectlClient kubectl, ReadinessPoller poller, ApplicationRelease release,
                            Console console, DeployerProperties properties) {
        super("automatic-tls");
        this.helm = helm;
        this.kubectl = kubectl;
        this.poller = poller;
        this.release = release;
        this.console = console;
        this.properties = properties;
    }

    @Override
    public void execute(DeploymentSession session) throws JsonProcessingException {
        DeploymentConfig config = session.getConfig();
        if (!(config.getTls() instanceof TlsConfig.TlsAutomatic automatic)) {
            return;
        }
        confirmDns(session);

        DeployerProperties.Releases releases = properties.getReleases();
        helm.addRepo("jetstack", releases.getCertManagerRepo(), session.getCancellationToken());
        HelmUpgradeCommand command = HelmUpgradeCommand.release(releases.getCertManager(), "jetstack/cert-manager")
                .namespace(releases.getCertManagerNamespace())
                .createNamespace()
                .extraArgs("--set", "installCRDs=true")
                .waitFor(properties.getTimeouts().getHelm())
                .build();
        helm.upgradeInstall(command, session.getCancellationToken());
        poller.awaitTrue("deployment/" + WEBHOOK_DEPLOYMENT, properties.getPolling().getReadiness(),
                session.getCancellationToken(),
                () -> kubectl.availableReplicas(WEBHOOK_DEPLOYMENT, releases.getCertManagerNamespace(),
                        session.getCancellationToken()) >= 1);

        kubectl.applyManifest(clusterIssuer(automatic), session.getCancellationToken());
        log.info("[AutomaticTlsStep] ClusterIssuer applied: {}", automatic.issuerName());
        release.upgrade(session, ReleaseValuesMapper.tlsValues(config));
        console.info("Certificate for " + config.getHost() + " will be issued by " + automatic.issuerName()
                + "; check with: kubectl get certificate -n " + config.getNamespace());
    }

    private void confirmDns(DeploymentSession session) {
        String host = session.getConfig().getHost();
        String endpoint = session.getEndpoint().orElse("<LoadBalancer endpoint>");
        console.println("");
        console.info("Let's Encrypt validates " + host + " over HTTP, so DNS must already point at the cluster:");
        console.println("  " + host + "  ->  " + endpoint);
        if (!console.confirm("Does DNS for " + host + " resolve to " + endpoint + " now?", false)) {
            log.warn("[AutomaticTlsStep] DNS not confirmed for {}", host);
            throw new DnsNotConfirmedException(host);
        }
    }

    String clusterIssuer(TlsConfig.TlsAutomatic automatic) throws JsonProcessingException {
        Map<String, Object> solver = Map.of("http01", Map.of("ingress", Map.of("class", ClusterResources.INGRESS_CLASS)));
        Map<String, Object> acme = new LinkedHashMap<>();
        acme.put("server", automatic.acmeServer());
        acme.put("email", automatic.email());
        acme.put("privateKeySecretRef", Map.of("name", automatic.issuerName()));
        acme.put("solvers", List.of(solver));

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("apiVersion", "cert-manager.io/v1");
        manifest.put("kind", "ClusterIssuer");
        manifest.put("metadata", Map.of("name", automatic.issuerName()));
        manifest.put("spec", Map.of("acme", acme));
        return yaml.writeValueAsString(manifest);
    }
}
