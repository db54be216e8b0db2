package xyz.firestige.clouddeploy.application.collect;

import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfigValidator;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.infrastructure.catalog.CloudProviderCatalogLoader;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.support.FakeProcessRunner;
import xyz.firestige.clouddeploy.support.ScriptedConsole;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InteractiveCollectorTest {

    private final ScriptedConsole console = new ScriptedConsole();
    private final CloudPlatform aws = mock(CloudPlatform.class);
    private final DeploymentSession session = new DeploymentSession(DeployMode.DEPLOY, new CancellationToken());
    private InteractiveCollector collector;

    @BeforeEach
    void setUp() {
        when(aws.provider()).thenReturn(CloudProvider.AWS);
        when(aws.listProfiles(any())).thenReturn(List.of("default", "prod"));
        when(aws.verifyIdentity(anyString(), anyString(), any())).thenReturn("arn:aws:iam::123456789012:user/ops");

        CloudProviderCatalogLoader catalog = new CloudProviderCatalogLoader();
        catalog.loadCatalog();
        collector = new InteractiveCollector(console,
                new CloudPlatformRegistry(List.of(aws)),
                catalog,
                new DeploymentConfigValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new CertificateValidator(new FakeProcessRunner()));
    }

    /**
     * 从 profile 到 TLS/basic auth 的默认回答
     */
    private void answerClusterDefaults() {
        console.answer(
                "",                 // profile -> default
                "",                 // region -> us-east-1
                "",                 // cluster name
                "",                 // node type
                "", "", "",         // node counts 1 / 2 / 5
                "",                 // namespace
                "",                 // persistence size
                "n8n.example.com",  // host
                "",                 // timezone
                "");                // database -> SQLite
    }

    @Test
    void rejectsShortEncryptionKeyAndReprompts() {
        answerClusterDefaults();
        console.answer(
                "",                 // TLS disabled
                "n",                // basic auth
                "n",                // do not generate key
                "abc123",           // rejected
                TestConfigs.ENCRYPTION_KEY,
                "");                // proceed

        CollectionResult result = collector.collect(CloudProvider.AWS, session);

        assertThat(result).isInstanceOf(CollectionResult.Completed.class);
        DeploymentConfig config = ((CollectionResult.Completed) result).config();
        assertThat(config.getEncryptionKey()).isEqualTo(TestConfigs.ENCRYPTION_KEY);
        assertThat(console.errors()).anySatisfy(e -> assertThat(e).contains("64"));
        assertThat(console.remainingAnswers()).isZero();
    }

    @Test
    void defaultsComeFromTheCatalog() {
        answerClusterDefaults();
        console.answer("", "n", "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getProfile()).isEqualTo("default");
        assertThat(config.getRegion()).isEqualTo("us-east-1");
        assertThat(config.getClusterName()).isEqualTo("n8n-eks-cluster");
        assertThat(config.getNodeType()).isEqualTo("t3.medium");
        assertThat(config.getNodeMinCount()).isEqualTo(1);
        assertThat(config.getNodeDesiredCount()).isEqualTo(2);
        assertThat(config.getNodeMaxCount()).isEqualTo(5);
        assertThat(config.getTimezone()).isEqualTo("America/Bahia");
        assertThat(config.getDatabase()).isInstanceOf(DatabaseConfig.LocalDatabase.class);
        assertThat(config.getTls().isEnabled()).isFalse();
        assertThat(config.getEncryptionKey()).matches("[0-9a-f]{64}");
    }

    @Test
    void unknownProfileIsRejected() {
        console.answer("staging");
        answerClusterDefaults();
        console.answer("", "n", "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getProfile()).isEqualTo("default");
        assertThat(console.errors()).anySatisfy(e -> assertThat(e).contains("staging").contains("default, prod"));
    }

    @Test
    void nodeCountsMustBeOrdered() {
        console.answer("", "", "", "",
                "3",                // min
                "2",                // desired below min, rejected
                "4",                // desired
                "3",                // max below desired, rejected
                "6",                // max
                "", "", "n8n.example.com", "", "",
                "", "n", "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getNodeMinCount()).isEqualTo(3);
        assertThat(config.getNodeDesiredCount()).isEqualTo(4);
        assertThat(config.getNodeMaxCount()).isEqualTo(6);
        assertThat(console.errors()).hasSize(2);
    }

    @Test
    void automaticTlsNeedsValidEmail() {
        answerClusterDefaults();
        console.answer(
                "3",                // automatic TLS
                "not-an-email",
                "ops@example.com",
                "2",                // staging
                "y", "",            // basic auth, default username
                "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getTls()).isEqualTo(new TlsConfig.TlsAutomatic("ops@example.com", TlsConfig.TlsAutomatic.STAGING));
        assertThat(config.getBasicAuth().enabled()).isTrue();
        assertThat(config.getBasicAuth().username()).isEqualTo("admin");
    }

    @Test
    void managedDatabaseUsesCatalogDefaults() {
        console.answer("", "", "", "", "", "", "", "", "", "n8n.example.com", "",
                "2",                // managed database
                "",                 // instance class
                "10",               // storage below minimum, rejected
                "",                 // storage default
                "y",                // high availability
                "", "n", "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getDatabase()).isEqualTo(new DatabaseConfig.ManagedDatabase("db.t3.micro", 20, true));
    }

    @Test
    void decliningTheSummaryAborts() {
        answerClusterDefaults();
        console.answer("", "n", "", "n");

        CollectionResult result = collector.collect(CloudProvider.AWS, session);

        assertThat(result).isInstanceOf(CollectionResult.Aborted.class);
    }

    @Test
    void failedIdentityCheckStopsCollection() {
        when(aws.verifyIdentity(anyString(), anyString(), any()))
                .thenThrow(new PreconditionException("AWS credentials are not valid", "Run aws configure"));
        console.answer("", "");

        assertThatThrownBy(() -> collector.collect(CloudProvider.AWS, session))
                .isInstanceOf(PreconditionException.class);
        assertThat(console.remainingAnswers()).isZero();
    }

    @Test
    void noDiscoveredProfilesAllowsFreeText() {
        when(aws.listProfiles(any())).thenReturn(List.of());
        console.answer("", "ci-profile");
        console.answer("", "", "", "", "", "", "", "", "n8n.example.com", "", "");
        console.answer("", "n", "", "");

        DeploymentConfig config = ((CollectionResult.Completed) collector.collect(CloudProvider.AWS, session)).config();

        assertThat(config.getProfile()).isEqualTo("ci-profile");
    }
}
