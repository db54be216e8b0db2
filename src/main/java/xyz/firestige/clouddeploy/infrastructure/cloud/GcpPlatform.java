package xyz.firestige.clouddeploy.infrastructure.cloud;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GCP：GKE + Cloud SQL + Secret Manager
 */
public class GcpPlatform extends AbstractCloudPlatform {

    private static final Logger log = LoggerFactory.getLogger(GcpPlatform.class);

    public GcpPlatform(ProcessRunner runner, ObjectMapper json, Duration identityTimeout, Duration commandTimeout) {
        super(runner, json, identityTimeout, commandTimeout);
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.GCP;
    }

    @Override
    public List<String> listProfiles(DeploymentSession session) {
        ProcessResult result = cli(session, Map.of(), identityTimeout, null,
                "projects", "list", "--format=value(projectId)");
        return result.isSuccess() ? lines(result.stdout()) : List.of();
    }

    @Override
    public String verifyIdentity(String project, String region, DeploymentSession session) {
        ProcessResult auth = cli(session, Map.of(), identityTimeout, null,
                "auth", "list", "--filter=status:ACTIVE", "--format=value(account)");
        if (auth.cancelled()) {
            auth.orThrow();
        }
        List<String> accounts = auth.isSuccess() ? lines(auth.stdout()) : List.of();
        if (accounts.isEmpty()) {
            throw new PreconditionException("No active gcloud account",
                    "Run 'gcloud auth login' and 'gcloud auth application-default login'");
        }
        ProcessResult describe = cli(session, Map.of(), identityTimeout, null,
                "projects", "describe", project, "--format=value(projectId)");
        if (describe.cancelled()) {
            describe.orThrow();
        }
        if (!describe.isSuccess()) {
            throw new PreconditionException("Cannot access GCP project '" + project + "': "
                    + (describe.timedOut() ? "timed out" : describe.stderr().strip()),
                    "Check 'gcloud projects list' and the account's IAM roles");
        }
        return "Project: " + project + ", Account: " + accounts.get(0);
    }

    @Override
    public Map<String, String> toolEnvironment(DeploymentConfig config) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("CLOUDSDK_CORE_PROJECT", config.getProfile());
        env.put("GOOGLE_PROJECT", config.getProfile());
        return env;
    }

    @Override
    public Map<String, Object> terraformVariables(DeploymentConfig config) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("gcp_project_id", config.getProfile());
        vars.put("gcp_region", config.getRegion());
        vars.put("gcp_zone", config.getRegion() + "-a");
        vars.put("cluster_name", config.getClusterName());
        vars.put("node_machine_type", config.getNodeType());
        vars.put("node_count", config.getNodeDesiredCount());
        vars.put("node_min_count", config.getNodeMinCount());
        vars.put("node_max_count", config.getNodeMaxCount());
        vars.put("n8n_host", config.getHost());
        vars.put("n8n_namespace", config.getNamespace());
        vars.put("n8n_persistence_size", config.getPersistenceSize());
        vars.put("timezone", config.getTimezone());
        vars.put("database_type", config.getDatabase().terraformType());
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase db) {
            vars.put("cloudsql_tier", db.instanceClass());
            vars.put("cloudsql_disk_size", db.storageGb());
            vars.put("cloudsql_high_availability", db.highAvailability());
        }
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
        cli(session, toolEnvironment(config), "container", "clusters", "get-credentials", cluster,
                "--region", config.getRegion(), "--project", config.getProfile()).orThrow();
        log.info("kubeconfig 已指向 GKE 集群: {}", cluster);
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
        return succeededOrAbsent(cli(session, env(session), "secrets", "describe", name, "--format=value(name)"));
    }

    @Override
    public void putSecret(DeploymentSession session, String name, String value, String description) {
        if (secretExists(session, name)) {
            cli(session, env(session), commandTimeout, value,
                    "secrets", "versions", "add", name, "--data-file=-").orThrow();
        } else {
            cli(session, env(session), commandTimeout, value,
                    "secrets", "create", name, "--data-file=-", "--replication-policy=automatic",
                    "--labels=" + APP_LABEL_KEY + "=" + APP_LABEL_VALUE).orThrow();
        }
        log.info("已写入 Secret Manager: {} ({})", name, description);
    }

    @Override
    public Optional<String> readSecret(DeploymentSession session, String name) {
        ProcessResult result = cli(session, env(session), "secrets", "versions", "access", "latest", "--secret=" + name);
        if (!succeededOrAbsent(result)) {
            return Optional.empty();
        }
        String value = result.stdout().strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public List<String> listAppSecrets(DeploymentSession session) {
        ProcessResult result = cli(session, env(session), "secrets", "list",
                "--filter=labels." + APP_LABEL_KEY + "=" + APP_LABEL_VALUE, "--format=value(name)").orThrow();
        return lines(result.stdout()).stream()
                .map(n -> n.substring(n.lastIndexOf('/') + 1))
                .toList();
    }

    @Override
    public boolean deleteSecret(DeploymentSession session, String name) {
        return succeededOrAbsent(cli(session, env(session), "secrets", "delete", name, "--quiet"));
    }

    @Override
    public boolean clearDatabaseDeletionProtection(DeploymentSession session) {
        Optional<String> instance = session.infraOutput("database_instance_name");
        if (instance.isEmpty()) {
            return false;
        }
        ProcessResult describe = cli(session, env(session), "sql", "instances", "describe", instance.get(),
                "--format=value(settings.deletionProtectionEnabled)");
        if (!succeededOrAbsent(describe) || !"true".equalsIgnoreCase(describe.stdout().strip())) {
            return false;
        }
        log.info("关闭 Cloud SQL 删除保护: {}", instance.get());
        cli(session, env(session), "sql", "instances", "patch", instance.get(),
                "--no-deletion-protection", "--quiet").orThrow();
        return true;
    }

    private Map<String, String> env(DeploymentSession session) {
        return toolEnvironment(session.getConfig());
    }
}
