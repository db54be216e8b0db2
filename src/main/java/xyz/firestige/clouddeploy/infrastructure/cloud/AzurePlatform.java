package xyz.firestige.clouddeploy.infrastructure.cloud;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Azure：AKS + PostgreSQL Flexible Server + Key Vault。
 * Key Vault 名称来自 infra 输出 key_vault_name，没有该输出时密钥相关操作跳过。
 */
public class AzurePlatform extends AbstractCloudPlatform {

    private static final Logger log = LoggerFactory.getLogger(AzurePlatform.class);
    private static final String STDIN = "/dev/stdin";

    private final String resourceGroup;

    public AzurePlatform(ProcessRunner runner, ObjectMapper json, Duration identityTimeout, Duration commandTimeout,
                         String resourceGroup) {
        super(runner, json, identityTimeout, commandTimeout);
        this.resourceGroup = resourceGroup;
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.AZURE;
    }

    @Override
    public List<String> listProfiles(DeploymentSession session) {
        ProcessResult result = cli(session, Map.of(), identityTimeout, null,
                "account", "list", "--query", "[].id", "-o", "tsv");
        return result.isSuccess() ? lines(result.stdout()) : List.of();
    }

    @Override
    public String verifyIdentity(String subscription, String region, DeploymentSession session) {
        ProcessResult set = cli(session, Map.of(), identityTimeout, null, "account", "set", "--subscription", subscription);
        if (set.cancelled()) {
            set.orThrow();
        }
        ProcessResult show = set.isSuccess()
                ? cli(session, Map.of(), identityTimeout, null, "account", "show", "-o", "json")
                : set;
        if (show.cancelled()) {
            show.orThrow();
        }
        if (!show.isSuccess()) {
            throw new PreconditionException("Azure authentication failed for subscription '" + subscription + "': "
                    + (show.timedOut() ? "timed out" : show.stderr().strip()),
                    "Run 'az login' and check 'az account list'");
        }
        try {
            JsonNode account = json.readTree(show.stdout());
            return "Subscription: " + account.path("name").asText(subscription)
                    + ", User: " + account.path("user").path("name").asText("unknown");
        } catch (IOException e) {
            return "authenticated";
        }
    }

    @Override
    public Map<String, String> toolEnvironment(DeploymentConfig config) {
        return Map.of("ARM_SUBSCRIPTION_ID", config.getProfile());
    }

    @Override
    public Map<String, Object> terraformVariables(DeploymentConfig config) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("azure_subscription_id", config.getProfile());
        vars.put("azure_location", config.getRegion());
        vars.put("resource_group_name", resourceGroup);
        vars.put("cluster_name", config.getClusterName());
        vars.put("node_vm_size", config.getNodeType());
        vars.put("node_count", config.getNodeDesiredCount());
        vars.put("node_min_count", config.getNodeMinCount());
        vars.put("node_max_count", config.getNodeMaxCount());
        vars.put("enable_auto_scaling", config.getNodeMaxCount() > config.getNodeMinCount());
        vars.put("n8n_host", config.getHost());
        vars.put("n8n_namespace", config.getNamespace());
        vars.put("n8n_persistence_size", config.getPersistenceSize());
        vars.put("timezone", config.getTimezone());
        vars.put("database_type", config.getDatabase().terraformType());
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase db) {
            vars.put("postgres_sku", db.instanceClass());
            vars.put("postgres_storage_gb", db.storageGb());
            vars.put("postgres_high_availability", db.highAvailability());
        }
        vars.put("enable_nginx_ingress", true);
        vars.put("enable_basic_auth", config.getBasicAuth().enabled());
        vars.put("enable_cert_manager", config.getTls() instanceof TlsConfig.TlsAutomatic);
        return vars;
    }

    @Override
    public List<String> requiredOutputs(DeploymentConfig config) {
        List<String> outputs = new ArrayList<>(List.of("cluster_name", "resource_group_name"));
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase) {
            outputs.addAll(List.of("database_host", "database_name", "database_username", "database_password_secret"));
        }
        return outputs;
    }

    @Override
    public void configureKubectl(DeploymentSession session) {
        String cluster = requireOutput(session, "cluster_name");
        String group = requireOutput(session, "resource_group_name");
        cli(session, toolEnvironment(session.getConfig()), "aks", "get-credentials",
                "--resource-group", group, "--name", cluster, "--overwrite-existing",
                "--subscription", session.getConfig().getProfile()).orThrow();
        log.info("kubeconfig 已指向 AKS 集群: {}/{}", group, cluster);
    }

    @Override
    public String encryptionKeySecretName() {
        return "n8n-encryption-key";
    }

    @Override
    public String basicAuthSecretName() {
        return "n8n-basic-auth";
    }

    @Override
    public boolean secretExists(DeploymentSession session, String name) {
        Optional<String> vault = vault(session);
        if (vault.isEmpty()) {
            return false;
        }
        return succeededOrAbsent(cli(session, env(session), "keyvault", "secret", "show",
                "--vault-name", vault.get(), "--name", name, "--query", "id", "-o", "tsv"));
    }

    @Override
    public void putSecret(DeploymentSession session, String name, String value, String description) {
        Optional<String> vault = vault(session);
        if (vault.isEmpty()) {
            log.warn("infra 输出中没有 key_vault_name，跳过写入 Key Vault: {}", name);
            return;
        }
        cli(session, env(session), commandTimeout, value, "keyvault", "secret", "set",
                "--vault-name", vault.get(), "--name", name, "--file", STDIN,
                "--description", description, "--tags", APP_LABEL_KEY + "=" + APP_LABEL_VALUE,
                "--output", "none").orThrow();
        log.info("已写入 Key Vault {}: {}", vault.get(), name);
    }

    @Override
    public Optional<String> readSecret(DeploymentSession session, String name) {
        Optional<String> vault = vault(session);
        if (vault.isEmpty()) {
            return Optional.empty();
        }
        ProcessResult result = cli(session, env(session), "keyvault", "secret", "show",
                "--vault-name", vault.get(), "--name", name, "--query", "value", "-o", "tsv");
        if (!succeededOrAbsent(result)) {
            return Optional.empty();
        }
        String value = result.stdout().strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public List<String> listAppSecrets(DeploymentSession session) {
        Optional<String> vault = vault(session);
        if (vault.isEmpty()) {
            return List.of();
        }
        ProcessResult result = cli(session, env(session), "keyvault", "secret", "list",
                "--vault-name", vault.get(),
                "--query", "[?tags." + APP_LABEL_KEY + "=='" + APP_LABEL_VALUE + "'].name", "-o", "json");
        if (!succeededOrAbsent(result)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try {
            json.readTree(result.stdout()).forEach(n -> names.add(n.asText()));
        } catch (IOException e) {
            log.warn("无法解析 Key Vault secret 列表: {}", e.getMessage());
        }
        return names;
    }

    @Override
    public boolean deleteSecret(DeploymentSession session, String name) {
        Optional<String> vault = vault(session);
        if (vault.isEmpty()) {
            return false;
        }
        return succeededOrAbsent(cli(session, env(session), "keyvault", "secret", "delete",
                "--vault-name", vault.get(), "--name", name));
    }

    /**
     * Flexible Server 没有删除保护开关，terraform destroy 直接处理
     */
    @Override
    public boolean clearDatabaseDeletionProtection(DeploymentSession session) {
        log.debug("Azure PostgreSQL Flexible Server 无删除保护设置");
        return false;
    }

    private Optional<String> vault(DeploymentSession session) {
        return session.infraOutput("key_vault_name");
    }

    private Map<String, String> env(DeploymentSession session) {
        return toolEnvironment(session.getConfig());
    }
}
