package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import xyz.firestige.clouddeploy.application.collect.SecretGenerator;
import xyz.firestige.clouddeploy.application.execution.ApplicationRelease;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.application.execution.ReleaseValuesMapper;
import xyz.firestige.clouddeploy.domain.config.BasicAuthConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.util.Map;

/**
 * 基础认证：随机口令 → bcrypt htpasswd Secret → 密钥存储 → release 升级 → 凭据只显示一次
 */
public class BasicAuthStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(BasicAuthStep.class);
    static final String HTPASSWD_KEY = "auth";
    static final int PASSWORD_LENGTH = 16;

    private final CloudPlatformRegistry platforms;
    private final KubectlClient kubectl;
    private final ApplicationRelease release;
    private final Console console;
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(BCryptPasswordEncoder.BCryptVersion.$2Y);

    public BasicAuthStep(CloudPlatformRegistry platforms, KubectlClient kubectl, ApplicationRelease release,
                         Console console) {
        super("basic-auth");
        this.platforms = platforms;
        this.kubectl = kubectl;
        this.release = release;
        this.console = console;
    }

    @Override
    public void execute(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        BasicAuthConfig auth = config.getBasicAuth();
        if (!auth.enabled()) {
            return;
        }
        String password = SecretGenerator.password(PASSWORD_LENGTH);
        kubectl.applySecret(config.getNamespace(), ClusterResources.BASIC_AUTH_SECRET, KubectlClient.SECRET_TYPE_OPAQUE,
                Map.of(HTPASSWD_KEY, htpasswdLine(auth.username(), password)), session.getCancellationToken());

        CloudPlatform platform = platforms.get(config.getCloudProvider());
        platform.putSecret(session, platform.basicAuthSecretName(), auth.username() + ":" + password,
                "n8n basic auth credentials");
        release.upgrade(session, ReleaseValuesMapper.basicAuthValues());
        log.info("[BasicAuthStep] basic auth enabled for user {}", auth.username());

        console.println("");
        console.success("Basic authentication enabled. These credentials are shown only once:");
        console.println("  Username: " + auth.username());
        console.println("  Password: " + password);
        console.info("A copy is kept in the secret store as '" + platform.basicAuthSecretName() + "'");
    }

    String htpasswdLine(String username, String password) {
        return username + ":" + encoder.encode(password);
    }
}
