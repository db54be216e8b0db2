package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.collect.CertificateValidator;
import xyz.firestige.clouddeploy.application.execution.ApplicationRelease;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.application.execution.ReleaseValuesMapper;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.shared.validation.ValidationResult;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 自带证书：重新校验 → TLS Secret → release 升级
 */
public class ByoTlsStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(ByoTlsStep.class);

    private final CertificateValidator certificateValidator;
    private final KubectlClient kubectl;
    private final ApplicationRelease release;

    public ByoTlsStep(CertificateValidator certificateValidator, KubectlClient kubectl, ApplicationRelease release) {
        super("byo-tls");
        this.certificateValidator = certificateValidator;
        this.kubectl = kubectl;
        this.release = release;
    }

    @Override
    public void execute(DeploymentSession session) throws IOException {
        DeploymentConfig config = session.getConfig();
        if (!(config.getTls() instanceof TlsConfig.TlsByo byo)) {
            return;
        }
        Path cert = Path.of(byo.certificatePath());
        Path key = Path.of(byo.privateKeyPath());
        ValidationResult check = certificateValidator.validate(cert, key, session.getCancellationToken());
        if (!check.isValid()) {
            throw new DeployerException(ErrorType.PRECONDITION_ERROR, "Certificate check failed: " + check.firstError())
                    .withHint("Provide a matching, unexpired PEM certificate and key, then run with --update-tls");
        }
        Map<String, String> data = new LinkedHashMap<>();
        data.put("tls.crt", Files.readString(cert, StandardCharsets.US_ASCII));
        data.put("tls.key", Files.readString(key, StandardCharsets.US_ASCII));
        kubectl.applySecret(config.getNamespace(), ClusterResources.TLS_SECRET, KubectlClient.SECRET_TYPE_TLS,
                data, session.getCancellationToken());
        release.upgrade(session, ReleaseValuesMapper.tlsValues(config));
        log.info("[ByoTlsStep] TLS enabled with supplied certificate");
    }
}
