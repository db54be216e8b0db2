package xyz.firestige.clouddeploy.infrastructure.cloud;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
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
 * AWS：EKS + RDS + Secrets Manager
 */
public class AwsPlatform extends AbstractCloudPlatform {

    private static final Logger log = LoggerFactory.getLogger(AwsPlatform.class);
    private static final String STDIN = "file:///dev/stdin";

    public AwsPlatform(ProcessRunner runner, ObjectMapper json, Duration identityTimeout, Duration commandTimeout) {
        super(runner, json, identityTimeout, commandTimeout);
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.AWS;
    }

    @Override
    public List<String> listProfiles(DeploymentSession session) {
        ProcessResult result = cli(session, Map.of(), identityTimeout, null, "configure", "list-profiles");
        return result.isSuccess() ? lines(result.stdout()) : List.of();
    }

    @Override
    public String verifyIdentity(String profile, String region, DeploymentSession session) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AWS_PROFILE", profile);
        env.put("AWS_DEFAULT_REGION", region);
        ProcessResult result = cli(session, env, identityTimeout, null, "sts", "get-caller-identity", "--output", "json");
        if (result.cancelled()) {
            result.orThrow();
        }
        if (!result.isSuccess()) {
            throw new PreconditionException("AWS authentication failed for profile '" + profile + "': "
                    + (result.timedOut() ? "timed out" : result.stderr().strip()),
                    "Run 'aws configure --profile " + profile + "' or 'aws sso login --profile " + profile + "'");
        }
        try {
            JsonNode identity = json.readTree(result.stdout());
            return "Account: " + identity.path("Account").asText("unknown")
                    + ", User: " + identity.path("Arn").asText("unknown");
        } catch (IOException e) {
            return "authenticated";
        }
    }

    @Override
    public Map<String, String> toolEnvironment(DeploymentConfig config) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AWS_PROFILE", config.getProfile());
        env.put("AWS_DEFAULT_REGION", config.getRegion());
        env.put("AWS_REGION", config.getRegion());
        return env;
    }

    @Override
    public Map<String, Object> terraformVariables(DeploymentConfig config) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("aws_profile", config.getProfile());
        vars.put("region", config.getRegion());
        vars.put("cluster_name", config.getClusterName());
        vars.put("node_instance_types", List.of(config.getNodeType()));
        vars.put("node_desired_size", config.getNodeDesiredCount());
        vars.put("node_min_size", config.getNodeMinCount());
        vars.put("node_max_size", config.getNodeMaxCount());
        vars.put("n8n_host", config.getHost());
        vars.put("n8n_namespace", config.getNamespace());
        vars.put("n8n_persistence_size", config.getPersistenceSize());
        vars.put("timezone", config.getTimezone());
        vars.put("database_type", config.getDatabase().terraformType());
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase db) {
            vars.put("rds_instance_class", db.instanceClass());
            vars.put("rds_allocated_storage", db.storageGb());
            vars.put("rds_multi_az", db.highAvailability());
        }
        vars.put("enable_nginx_ingress", true);
        vars.put("enable_basic_auth", config.getBasicAuth().enabled());
        return vars;
    }

    @Override
    public List<String> requiredOutputs(DeploymentConfig config) {
        List<String> outputs = new ArrayList<>(List.of("cluster_name"));
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase) {
            outputs.addAll(List.of("database_host", "database_name", "database_username", "database_password_secret"));
        }
        return outputs;
    }

    @Override
    public void configureKubectl(DeploymentSession session) {
        DeploymentConfig config = session.getConfig();
        String cluster = requireOutput(session, "cluster_name");
        cli(session, toolEnvironment(config), "eks", "update-kubeconfig",
                "--name", cluster, "--region", config.getRegion(), "--profile", config.getProfile()).orThrow();
        log.info("kubeconfig 已指向 EKS 集群: {}", cluster);
    }

    @Override
    public String encryptionKeySecretName() {
        return "n8n/encryption-key";
    }

    @Override
    public String basicAuthSecretName() {
        return "n8n/basic-auth";
    }

    @Override
    public boolean secretExists(DeploymentSession session, String name) {
        return succeededOrAbsent(cli(session, env(session), "secretsmanager", "describe-secret", "--secret-id", name));
    }

    @Override
    public void putSecret(DeploymentSession session, String name, String value, String description) {
        if (secretExists(session, name)) {
            cli(session, env(session), commandTimeout, value,
                    "secretsmanager", "put-secret-value", "--secret-id", name, "--secret-string", STDIN).orThrow();
        } else {
            cli(session, env(session), commandTimeout, value,
                    "secretsmanager", "create-secret", "--name", name, "--description", description,
                    "--tags", "Key=" + APP_LABEL_KEY + ",Value=" + APP_LABEL_VALUE,
                    "--secret-string", STDIN).orThrow();
        }
        log.info("已写入 Secrets Manager: {}", name);
    }

    @Override
    public Optional<String> readSecret(DeploymentSession session, String name) {
        ProcessResult result = cli(session, env(session), "secretsmanager", "get-secret-value",
                "--secret-id", name, "--query", "SecretString", "--output", "text");
        if (!succeededOrAbsent(result)) {
            return Optional.empty();
        }
        String value = result.stdout().strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public List<String> listAppSecrets(DeploymentSession session) {
        ProcessResult result = cli(session, env(session), "secretsmanager", "list-secrets",
                "--filters", "Key=tag-key,Values=" + APP_LABEL_KEY, "Key=tag-value,Values=" + APP_LABEL_VALUE,
                "--query", "SecretList[].Name", "--output", "json").orThrow();
        List<String> names = new ArrayList<>();
        try {
            json.readTree(result.stdout()).forEach(n -> names.add(n.asText()));
        } catch (IOException e) {
            log.warn("无法解析 secret 列表: {}", e.getMessage());
        }
        return names;
    }

    @Override
    public boolean deleteSecret(DeploymentSession session, String name) {
        return succeededOrAbsent(cli(session, env(session), "secretsmanager", "delete-secret",
                "--secret-id", name, "--force-delete-without-recovery"));
    }

    @Override
    public boolean clearDatabaseDeletionProtection(DeploymentSession session) {
        Optional<String> instance = session.infraOutput("database_instance_identifier");
        if (instance.isEmpty()) {
            return false;
        }
        ProcessResult describe = cli(session, env(session), "rds", "describe-db-instances",
                "--db-instance-identifier", instance.get(),
                "--query", "DBInstances[0].DeletionProtection", "--output", "text");
        if (!succeededOrAbsent(describe) || !"true".equalsIgnoreCase(describe.stdout().strip())) {
            return false;
        }
        log.info("关闭 RDS 删除保护: {}", instance.get());
        cli(session, env(session), "rds", "modify-db-instance", "--db-instance-identifier", instance.get(),
                "--no-deletion-protection", "--apply-immediately").orThrow();
        return true;
    }

    private Map<String, String> env(DeploymentSession session) {
        return toolEnvironment(session.getConfig());
    }
}
