package xyz.firestige.clouddeploy.application.execution.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 托管数据库凭据：infra 引擎创建的密钥条目 → 集群 Secret。
 * 条目内容可以是纯口令，也可以是带 password 字段的 JSON。
 */
public class DatabaseCredentialsSecretStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCredentialsSecretStep.class);
    static final String USERNAME_KEY = "username";
    static final String PASSWORD_KEY = "password";

    private final CloudPlatformRegistry platforms;
    private final KubectlClient kubectl;
    private final ObjectMapper json;

    public DatabaseCredentialsSecretStep(CloudPlatformRegistry platforms, KubectlClient kubectl, ObjectMapper json) {
        super("database-credentials-secret");
        this.platforms = platforms;
        this.kubectl = kubectl;
        this.json = json;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        if (!(config.getDatabase() instanceof DatabaseConfig.ManagedDatabase)) {
            log.info("[DatabaseCredentialsSecretStep] local database, nothing to do");
            return;
        }
        CloudPlatform platform = platforms.get(config.getCloudProvider());
        String secretId = session.infraOutput("database_password_secret").orElseThrow();
        String raw = platform.readSecret(session, secretId)
                .orElseThrow(() -> new DeployerException(ErrorType.EXTERNAL_TOOL_ERROR,
                        "Database credentials not found in secret store: " + secretId));

        Map<String, String> data = new LinkedHashMap<>();
        data.put(USERNAME_KEY, session.infraOutput("database_username").orElseThrow());
        data.put(PASSWORD_KEY, extractPassword(raw));
        kubectl.applySecret(config.getNamespace(), ClusterResources.DB_CREDENTIALS_SECRET,
                KubectlClient.SECRET_TYPE_OPAQUE, data, session.getCancellationToken());
    }

    String extractPassword(String raw) {
        String trimmed = raw.strip();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = json.readTree(trimmed);
                if (node.hasNonNull(PASSWORD_KEY)) {
                    return node.get(PASSWORD_KEY).asText();
                }
            } catch (IOException e) {
                log.debug("[DatabaseCredentialsSecretStep] secret is not JSON, using raw value");
            }
        }
        return trimmed;
    }
}
