package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.util.Map;
import java.util.Optional;

/**
 * 加密密钥：配置中的密钥优先，写入云密钥存储（已有不同值时更新），再以集群 Secret 提供给应用。
 * 配置中没有密钥时（复用上次配置）从密钥存储读回。集群与密钥存储始终持有同一个值。
 */
public class EncryptionKeySecretStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(EncryptionKeySecretStep.class);
    static final String SECRET_KEY = "N8N_ENCRYPTION_KEY";

    private final CloudPlatformRegistry platforms;
    private final KubectlClient kubectl;

    public EncryptionKeySecretStep(CloudPlatformRegistry platforms, KubectlClient kubectl) {
        super("encryption-key-secret");
        this.platforms = platforms;
        this.kubectl = kubectl;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        CloudPlatform platform = platforms.get(config.getCloudProvider());
        String secretName = platform.encryptionKeySecretName();

        String key = config.getEncryptionKey();
        if (key != null && !key.isBlank()) {
            Optional<String> stored = platform.readSecret(session, secretName);
            if (stored.isPresent() && stored.get().equals(key)) {
                log.info("[EncryptionKeySecretStep] secret store entry unchanged: {}", secretName);
            } else {
                if (stored.isPresent()) {
                    log.warn("[EncryptionKeySecretStep] secret store entry holds a different key, updating: {}",
                            secretName);
                }
                platform.putSecret(session, secretName, key, "n8n encryption key");
            }
        } else {
            key = platform.readSecret(session, secretName)
                    .orElseThrow(() -> new PreconditionException("No encryption key available",
                            "Enter the key used by the existing deployment or store it as '" + secretName + "'"));
            log.info("[EncryptionKeySecretStep] encryption key read from secret store");
        }
        kubectl.applySecret(config.getNamespace(), ClusterResources.ENCRYPTION_KEY_SECRET,
                KubectlClient.SECRET_TYPE_OPAQUE, Map.of(SECRET_KEY, key), session.getCancellationToken());
    }
}
