package xyz.firestige.clouddeploy.application.collect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.config.BasicAuthConfig;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfigValidator;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.validation.InputRules;
import xyz.firestige.clouddeploy.domain.shared.validation.InputValidator;
import xyz.firestige.clouddeploy.domain.shared.validation.ValidationResult;
import xyz.firestige.clouddeploy.infrastructure.catalog.CloudProviderCatalogLoader;
import xyz.firestige.clouddeploy.infrastructure.catalog.ProviderDefinition;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatform;
import xyz.firestige.clouddeploy.infrastructure.cloud.CloudPlatformRegistry;
import xyz.firestige.clouddeploy.infrastructure.console.Console;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 交互式收集配置记录。
 * 每个回答立即校验，失败则重新提问；最终展示汇总并要求确认。整个过程不写任何文件。
 */
public class InteractiveCollector {

    private static final Logger log = LoggerFactory.getLogger(InteractiveCollector.class);
    static final String DEFAULT_TIMEZONE = "America/Bahia";

    private final Console console;
    private final CloudPlatformRegistry platforms;
    private final CloudProviderCatalogLoader catalog;
    private final DeploymentConfigValidator configValidator;
    private final CertificateValidator certificateValidator;

    public InteractiveCollector(Console console,
                                CloudPlatformRegistry platforms,
                                CloudProviderCatalogLoader catalog,
                                DeploymentConfigValidator configValidator,
                                CertificateValidator certificateValidator) {
        this.console = console;
        this.platforms = platforms;
        this.catalog = catalog;
        this.configValidator = configValidator;
        this.certificateValidator = certificateValidator;
    }

    /**
     * 完整部署的配置收集
     *
     * @param cloud 已选定的云厂商
     */
    public CollectionResult collect(CloudProvider cloud, DeploymentSession session) {
        console.header("n8n Deployment Configuration");
        DeploymentConfig config = new DeploymentConfig();
        config.setCloudProvider(Objects.requireNonNull(cloud, "cloud"));
        CloudPlatform platform = platforms.get(cloud);
        ProviderDefinition definition = catalog.provider(cloud);
        ProviderDefinition.Defaults defaults = definition.getDefaults();

        console.header(cloud.getDisplayName() + " Configuration");
        config.setProfile(askProfile(cloud, platform.listProfiles(session)));
        List<String> regions = definition.getRegions();
        console.info("Available regions: " + String.join(", ", regions));
        config.setRegion(ask(regionLabel(cloud), definition.getDefaultRegion(), InputRules.oneOf(regions, "region")));

        console.info("Verifying credentials...");
        String identity = platform.verifyIdentity(config.getProfile(), config.getRegion(), session);
        console.success("Credentials verified: " + identity);

        console.header("Cluster");
        config.setClusterName(ask("Cluster name", defaults.getClusterName(), InputRules.dnsLabel()));
        if (definition.getNodeTypes() != null && !definition.getNodeTypes().isEmpty()) {
            console.info("Suggested node types: " + String.join(", ", definition.getNodeTypes()));
        }
        config.setNodeType(ask("Node type", defaults.getNodeType(), InputRules.required()));
        int min = Integer.parseInt(ask("Minimum nodes", "1", InputRules.integerBetween(1, 100)));
        int desired = Integer.parseInt(ask("Desired nodes", String.valueOf(Math.max(2, min)),
                InputRules.integerBetween(min, 100)));
        int max = Integer.parseInt(ask("Maximum nodes", String.valueOf(Math.max(5, desired)),
                InputRules.integerBetween(desired, 100)));
        config.setNodeMinCount(min);
        config.setNodeDesiredCount(desired);
        config.setNodeMaxCount(max);

        console.header("n8n");
        config.setNamespace(ask("Kubernetes namespace", "n8n", InputRules.dnsLabel()));
        config.setPersistenceSize(ask("Persistent volume size", "10Gi", InputRules.quantity()));
        config.setHost(ask("n8n host (FQDN for the ingress)", null, InputRules.required().and(InputRules.fqdn())));
        config.setTimezone(ask("Timezone", DEFAULT_TIMEZONE, InputRules.timezone()));
        config.setDatabase(askDatabase(cloud, defaults));

        collectTlsAndAuth(config, session);
        askEncryptionKey(config);
        return confirm(config, true);
    }

    /**
     * --update-tls：沿用已保存的记录，只重新回答 TLS 与基础认证
     */
    public CollectionResult collectTlsUpdate(DeploymentConfig saved, DeploymentSession session) {
        console.header("TLS & Authentication Update");
        DeploymentConfig config = saved.copy();
        console.info("Current TLS mode: " + config.tlsModeName() + ", basic auth: "
                + (config.getBasicAuth().enabled() ? "enabled" : "disabled"));
        verifyIdentity(config, session);
        collectTlsAndAuth(config, session);
        if (!config.requestsTlsOrAuth()) {
            console.warn("Neither TLS nor basic auth selected, nothing to update");
            return new CollectionResult.Aborted("Nothing to update");
        }
        return confirm(config, false);
    }

    /**
     * --skip-terraform：沿用已保存的记录；加密密钥可重新输入，否则从密钥存储读取
     */
    public CollectionResult reuse(DeploymentConfig saved, DeploymentSession session) {
        DeploymentConfig config = saved.copy();
        verifyIdentity(config, session);
        if (console.confirm("Re-enter the n8n encryption key? (No = read it from the secret store)", false)) {
            config.setEncryptionKey(askSecretKey());
        }
        return confirm(config, false);
    }

    private void verifyIdentity(DeploymentConfig config, DeploymentSession session) {
        String identity = platforms.get(config.getCloudProvider())
                .verifyIdentity(config.getProfile(), config.getRegion(), session);
        console.success("Credentials verified: " + identity);
    }

    public CloudProvider chooseProvider() {
        List<CloudProvider> providers = Arrays.asList(CloudProvider.values());
        int index = console.choose("Which cloud provider?",
                providers.stream().map(CloudProvider::getDisplayName).toList(), 0);
        return providers.get(index);
    }

    private String askProfile(CloudProvider cloud, List<String> discovered) {
        String label = profileLabel(cloud);
        if (discovered.isEmpty()) {
            console.warn("No " + label + " discovered via the " + cloud.getCliExecutable() + " CLI");
            return ask(label, null, InputRules.required());
        }
        console.info("Available: " + String.join(", ", discovered));
        return ask(label, discovered.get(0), InputRules.oneOf(discovered, label));
    }

    private DatabaseConfig askDatabase(CloudProvider cloud, ProviderDefinition.Defaults defaults) {
        int choice = console.choose("Database backend", List.of(
                "SQLite on a persistent volume (simple, single replica)",
                "Managed PostgreSQL (" + managedDatabaseName(cloud) + ")"), 0);
        if (choice == 0) {
            return DatabaseConfig.local();
        }
        String instanceClass = ask("Database instance class", defaults.getDatabaseInstanceClass(), InputRules.required());
        int storage = Integer.parseInt(ask("Database storage (GB)",
                String.valueOf(defaults.getDatabaseStorageGb()), InputRules.integerBetween(20, 16384)));
        boolean ha = console.confirm("Enable high availability for the database?", false);
        return new DatabaseConfig.ManagedDatabase(instanceClass, storage, ha);
    }

    private void collectTlsAndAuth(DeploymentConfig config, DeploymentSession session) {
        int mode = console.choose("TLS", List.of(
                "Disabled (HTTP only)",
                "Bring your own certificate (PEM files)",
                "Automatic (Let's Encrypt via cert-manager)"), 0);
        switch (mode) {
            case 1 -> config.setTls(askCertificate(session));
            case 2 -> {
                String email = ask("Let's Encrypt contact email", null, InputRules.email());
                int env = console.choose("Let's Encrypt environment", List.of(
                        "production (trusted certificates)", "staging (testing, untrusted)"), 0);
                config.setTls(new TlsConfig.TlsAutomatic(email,
                        env == 0 ? TlsConfig.TlsAutomatic.PRODUCTION : TlsConfig.TlsAutomatic.STAGING));
            }
            default -> config.setTls(TlsConfig.disabled());
        }
        if (config.getTls().isEnabled() && !InputRules.isFqdn(config.getHost())) {
            config.setHost(ask("TLS needs a fully-qualified host name", null, InputRules.fqdn()));
        }
        if (console.confirm("Enable basic authentication in front of n8n?", false)) {
            config.setBasicAuth(BasicAuthConfig.enabledFor(
                    ask("Basic auth username", BasicAuthConfig.DEFAULT_USERNAME, InputRules.dnsLabel())));
        } else {
            config.setBasicAuth(BasicAuthConfig.disabled());
        }
    }

    private TlsConfig askCertificate(DeploymentSession session) {
        InputValidator readable = value -> Files.isReadable(Path.of(value))
                ? ValidationResult.success()
                : ValidationResult.failure("File not found or not readable: " + value);
        while (true) {
            String cert = ask("Certificate file (PEM)", null, InputRules.required().and(readable));
            String key = ask("Private key file (PEM)", null, InputRules.required().and(readable));
            ValidationResult check = certificateValidator.validate(Path.of(cert), Path.of(key),
                    session.getCancellationToken());
            if (check.isValid()) {
                console.success("Certificate and key verified");
                return new TlsConfig.TlsByo(Path.of(cert).toAbsolutePath().toString(),
                        Path.of(key).toAbsolutePath().toString());
            }
            console.error(check.firstError());
        }
    }

    private void askEncryptionKey(DeploymentConfig config) {
        if (console.confirm("Generate a new n8n encryption key?", true)) {
            config.setEncryptionKey(SecretGenerator.encryptionKey());
            console.success("Generated new encryption key");
        } else {
            config.setEncryptionKey(askSecretKey());
        }
    }

    private String askSecretKey() {
        InputValidator rule = InputRules.encryptionKey();
        while (true) {
            String key = console.promptSecret("Existing n8n encryption key (64 hex characters)");
            ValidationResult result = rule.validate(key);
            if (result.isValid()) {
                return key;
            }
            console.error(result.firstError());
        }
    }

    private CollectionResult confirm(DeploymentConfig config, boolean requireKey) {
        console.header("Configuration Summary");
        for (Map.Entry<String, Object> e : config.toDisplayMap().entrySet()) {
            console.println(String.format("  %-28s %s", e.getKey(), e.getValue()));
        }
        console.println(String.format("  %-28s %s", "encryption_key",
                config.getEncryptionKey() != null ? "******** (hidden)" : "(from secret store)"));

        ValidationResult result = requireKey
                ? configValidator.validateComplete(config)
                : configValidator.validate(config);
        if (!result.isValid()) {
            result.getErrors().forEach(console::error);
            log.warn("配置记录不完整: {}", result.getErrors());
            return new CollectionResult.Aborted("Configuration is incomplete");
        }
        if (!console.confirm("Proceed with this configuration?", true)) {
            return new CollectionResult.Aborted("Configuration cancelled by user");
        }
        return new CollectionResult.Completed(config);
    }

    private String ask(String question, String defaultValue, InputValidator rule) {
        while (true) {
            String answer = console.prompt(question, defaultValue);
            ValidationResult result = rule.validate(answer);
            if (result.isValid()) {
                return answer;
            }
            console.error(result.firstError());
        }
    }

    private static String profileLabel(CloudProvider cloud) {
        return switch (cloud) {
            case AWS -> "AWS profile";
            case AZURE -> "Azure subscription ID";
            case GCP -> "GCP project ID";
        };
    }

    private static String regionLabel(CloudProvider cloud) {
        return cloud == CloudProvider.AZURE ? "Azure location" : cloud == CloudProvider.AWS ? "AWS region" : "GCP region";
    }

    private static String managedDatabaseName(CloudProvider cloud) {
        return switch (cloud) {
            case AWS -> "Amazon RDS";
            case AZURE -> "Azure Database for PostgreSQL Flexible Server";
            case GCP -> "Cloud SQL";
        };
    }
}
