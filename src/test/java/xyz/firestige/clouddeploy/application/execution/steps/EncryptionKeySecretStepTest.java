package xyz.firestige.clouddeploy.application.execution.steps;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.infrastructure.cloud.AwsPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;
import xyz.firestige.clouddeploy.support.FakeProcessRunner;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionKeySecretStepTest {

    private static final String STORED_KEY = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
    private static final String NOT_FOUND = "An error occurred (ResourceNotFoundException) when calling the "
            + "GetSecretValue operation: Secrets Manager can't find the specified secret.";

    private final FakeProcessRunner runner = new FakeProcessRunner();
    private EncryptionKeySecretStep step;
    private DeploymentSession session;

    @BeforeEach
    void setUp() {
        ObjectMapper json = new ObjectMapper();
        AwsPlatform aws = new AwsPlatform(runner, json, Duration.ofSeconds(5), Duration.ofSeconds(5));
        step = new EncryptionKeySecretStep(new CloudPlatformRegistry(List.of(aws)),
                new KubectlClient(runner, Duration.ofSeconds(5), json));
        session = new DeploymentSession(DeployMode.DEPLOY, new CancellationToken());
        session.setConfig(TestConfigs.aws());
    }

    private static String encoded(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private String clusterManifest() {
        return runner.calls().stream()
                .filter(c -> c.display().startsWith("kubectl apply"))
                .map(CommandSpec::getStdin)
                .findFirst()
                .orElseThrow();
    }

    private List<CommandSpec> storeWrites() {
        return runner.calls().stream()
                .filter(c -> c.display().contains("put-secret-value") || c.display().contains("create-secret"))
                .toList();
    }

    @Test
    void testEnteredKeyReplacesDifferentStoredKey() {
        runner.on("aws secretsmanager get-secret-value", 0, STORED_KEY + "\n");
        runner.on("aws secretsmanager describe-secret", 0, "{\"Name\":\"n8n/encryption-key\"}");

        step.execute(session);

        assertThat(storeWrites()).singleElement().satisfies(write -> {
            assertThat(write.display()).contains("put-secret-value");
            assertThat(write.getStdin()).isEqualTo(TestConfigs.ENCRYPTION_KEY);
        });
        assertThat(clusterManifest()).contains(encoded(TestConfigs.ENCRYPTION_KEY));
    }

    @Test
    void testMatchingStoredKeyIsNotRewritten() {
        runner.on("aws secretsmanager get-secret-value", 0, TestConfigs.ENCRYPTION_KEY + "\n");

        step.execute(session);

        assertThat(storeWrites()).isEmpty();
        assertThat(clusterManifest()).contains(encoded(TestConfigs.ENCRYPTION_KEY));
    }

    @Test
    void testFirstRunCreatesStoreEntry() {
        runner.onFailure("aws secretsmanager get-secret-value", 254, NOT_FOUND);
        runner.onFailure("aws secretsmanager describe-secret", 254, NOT_FOUND);

        step.execute(session);

        assertThat(storeWrites()).singleElement()
                .satisfies(write -> assertThat(write.display()).contains("create-secret"));
    }

    @Test
    void testMissingKeyIsRecoveredFromStore() {
        session.getConfig().setEncryptionKey(null);
        runner.on("aws secretsmanager get-secret-value", 0, STORED_KEY + "\n");

        step.execute(session);

        assertThat(storeWrites()).isEmpty();
        assertThat(clusterManifest()).contains(encoded(STORED_KEY));
    }

    @Test
    void testMissingKeyWithEmptyStoreIsPrecondition() {
        session.getConfig().setEncryptionKey(null);
        runner.onFailure("aws secretsmanager get-secret-value", 254, NOT_FOUND);

        assertThatThrownBy(() -> step.execute(session)).isInstanceOf(PreconditionException.class);
        assertThat(runner.ran("kubectl")).isFalse();
    }
}
