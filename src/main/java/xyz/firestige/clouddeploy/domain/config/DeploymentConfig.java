package xyz.firestige.clouddeploy.domain.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 部署配置记录（Configuration Record）
 * <p>
 * 由交互收集器一次性构建（或从上次运行的 .setup-current.json 加载），
 * Phase 执行期间只读。加密密钥不参与 JSON 序列化，也不出现在 toString 中。
 */
public class DeploymentConfig {

    public static final String ENCRYPTION_KEY_PATTERN = "^[0-9a-fA-F]{64}$";

    @NotNull
    private CloudProvider cloudProvider;

    /**
     * AWS profile / Azure subscription / GCP project
     */
    @NotBlank
    private String profile;

    @NotBlank
    private String region;

    @NotBlank
    @Pattern(regexp = "^[a-z0-9]([-a-z0-9]*[a-z0-9])?$", message = "must be lowercase alphanumerics and dashes")
    @Size(max = 40)
    private String clusterName;

    @NotBlank
    private String nodeType;

    @Min(1)
    @Max(100)
    private int nodeMinCount = 1;

    @Min(1)
    @Max(100)
    private int nodeDesiredCount = 2;

    @Min(1)
    @Max(100)
    private int nodeMaxCount = 5;

    @NotBlank
    @Pattern(regexp = "^[a-z0-9]([-a-z0-9]*[a-z0-9])?$", message = "must be a DNS-1123 label")
    @Size(max = 63)
    private String namespace = "n8n";

    @NotBlank
    @Pattern(regexp = "^[1-9][0-9]*(Mi|Gi|Ti)$", message = "must be a quantity such as 10Gi")
    private String persistenceSize = "10Gi";

    @NotBlank
    private String host;

    @NotBlank
    private String timezone = "America/Bahia";

    @Pattern(regexp = ENCRYPTION_KEY_PATTERN, message = "must be exactly 64 hexadecimal characters")
    private String encryptionKey;

    @NotNull
    @Valid
    private DatabaseConfig database = DatabaseConfig.local();

    @NotNull
    @Valid
    private TlsConfig tls = TlsConfig.disabled();

    @NotNull
    @Valid
    private BasicAuthConfig basicAuth = BasicAuthConfig.disabled();

    public DeploymentConfig() {
    }

    /**
     * 浅拷贝（嵌套的 record 本身不可变）
     */
    public DeploymentConfig copy() {
        DeploymentConfig c = new DeploymentConfig();
        c.cloudProvider = cloudProvider;
        c.profile = profile;
        c.region = region;
        c.clusterName = clusterName;
        c.nodeType = nodeType;
        c.nodeMinCount = nodeMinCount;
        c.nodeDesiredCount = nodeDesiredCount;
        c.nodeMaxCount = nodeMaxCount;
        c.namespace = namespace;
        c.persistenceSize = persistenceSize;
        c.host = host;
        c.timezone = timezone;
        c.encryptionKey = encryptionKey;
        c.database = database;
        c.tls = tls;
        c.basicAuth = basicAuth;
        return c;
    }

    /**
     * 用于汇总展示和历史记录的非敏感字段视图（有序）
     */
    public Map<String, Object> toDisplayMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("cloud_provider", cloudProvider != null ? cloudProvider.getId() : null);
        m.put("profile", profile);
        m.put("region", region);
        m.put("cluster_name", clusterName);
        m.put("node_type", nodeType);
        m.put("node_min_count", nodeMinCount);
        m.put("node_desired_count", nodeDesiredCount);
        m.put("node_max_count", nodeMaxCount);
        m.put("namespace", namespace);
        m.put("persistence_size", persistenceSize);
        m.put("host", host);
        m.put("timezone", timezone);
        m.put("database_type", database.terraformType());
        if (database instanceof DatabaseConfig.ManagedDatabase managed) {
            m.put("database_instance_class", managed.instanceClass());
            m.put("database_storage_gb", managed.storageGb());
            m.put("database_high_availability", managed.highAvailability());
        }
        m.put("tls_mode", tlsModeName());
        if (tls instanceof TlsConfig.TlsByo byo) {
            m.put("tls_certificate_path", byo.certificatePath());
            m.put("tls_private_key_path", byo.privateKeyPath());
        } else if (tls instanceof TlsConfig.TlsAutomatic automatic) {
            m.put("letsencrypt_email", automatic.email());
            m.put("letsencrypt_environment", automatic.environment());
        }
        m.put("basic_auth_enabled", basicAuth.enabled());
        if (basicAuth.enabled()) {
            m.put("basic_auth_username", basicAuth.username());
        }
        return m;
    }

    @JsonIgnore
    public String tlsModeName() {
        if (tls instanceof TlsConfig.TlsByo) {
            return "byo";
        }
        if (tls instanceof TlsConfig.TlsAutomatic) {
            return "automatic";
        }
        return "disabled";
    }

    @JsonIgnore
    public boolean requestsTlsOrAuth() {
        return tls.isEnabled() || basicAuth.enabled();
    }

    // Getters and Setters

    public CloudProvider getCloudProvider() {
        return cloudProvider;
    }

    public void setCloudProvider(CloudProvider cloudProvider) {
        this.cloudProvider = cloudProvider;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getClusterName() {
        return clusterName;
    }

    public void setClusterName(String clusterName) {
        this.clusterName = clusterName;
    }

    public String getNodeType() {
        return nodeType;
    }

    public void setNodeType(String nodeType) {
        this.nodeType = nodeType;
    }

    public int getNodeMinCount() {
        return nodeMinCount;
    }

    public void setNodeMinCount(int nodeMinCount) {
        this.nodeMinCount = nodeMinCount;
    }

    public int getNodeDesiredCount() {
        return nodeDesiredCount;
    }

    public void setNodeDesiredCount(int nodeDesiredCount) {
        this.nodeDesiredCount = nodeDesiredCount;
    }

    public int getNodeMaxCount() {
        return nodeMaxCount;
    }

    public void setNodeMaxCount(int nodeMaxCount) {
        this.nodeMaxCount = nodeMaxCount;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getPersistenceSize() {
        return persistenceSize;
    }

    public void setPersistenceSize(String persistenceSize) {
        this.persistenceSize = persistenceSize;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    @JsonIgnore
    public String getEncryptionKey() {
        return encryptionKey;
    }

    @JsonIgnore
    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database;
    }

    public TlsConfig getTls() {
        return tls;
    }

    public void setTls(TlsConfig tls) {
        this.tls = tls;
    }

    public BasicAuthConfig getBasicAuth() {
        return basicAuth;
    }

    public void setBasicAuth(BasicAuthConfig basicAuth) {
        this.basicAuth = basicAuth;
    }

    @Override
    public String toString() {
        return "DeploymentConfig" + toDisplayMap();
    }
}
