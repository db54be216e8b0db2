package xyz.firestige.clouddeploy.application.execution;

import xyz.firestige.clouddeploy.domain.config.DatabaseConfig;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.config.TlsConfig;
import xyz.firestige.clouddeploy.infrastructure.helm.HelmValue;
import xyz.firestige.clouddeploy.infrastructure.helm.HelmValues;

import java.util.Map;

/**
 * 配置记录 → chart 取值
 */
public final class ReleaseValuesMapper {

    private ReleaseValuesMapper() {
    }

    /**
     * 首次安装：TLS 关闭，数据库按配置接入
     */
    public static HelmValues installValues(DeploymentConfig config, Map<String, String> outputs) {
        HelmValues values = HelmValues.create()
                .put(HelmValue.INGRESS_ENABLED, true)
                .put(HelmValue.INGRESS_CLASS, ClusterResources.INGRESS_CLASS)
                .put(HelmValue.INGRESS_HOST, config.getHost())
                .put(HelmValue.TLS_ENABLED, false)
                .put(HelmValue.N8N_HOST, config.getHost())
                .put(HelmValue.N8N_PROTOCOL, "http")
                .put(HelmValue.WEBHOOK_URL, "http://" + config.getHost() + "/")
                .put(HelmValue.GENERIC_TIMEZONE, config.getTimezone())
                .put(HelmValue.TZ, config.getTimezone())
                .put(HelmValue.PERSISTENCE_ENABLED, true)
                .put(HelmValue.PERSISTENCE_SIZE, config.getPersistenceSize())
                .put(HelmValue.DATABASE_TYPE, config.getDatabase().terraformType())
                .put(HelmValue.ENCRYPTION_KEY_EXISTING_SECRET, ClusterResources.ENCRYPTION_KEY_SECRET);
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase) {
            values.put(HelmValue.DATABASE_HOST, outputs.get("database_host"))
                    .put(HelmValue.DATABASE_PORT, ClusterResources.POSTGRES_PORT)
                    .put(HelmValue.DATABASE_NAME, outputs.get("database_name"))
                    .put(HelmValue.DATABASE_EXISTING_SECRET, ClusterResources.DB_CREDENTIALS_SECRET);
        }
        return values;
    }

    public static HelmValues tlsValues(DeploymentConfig config) {
        HelmValues values = HelmValues.create()
                .put(HelmValue.TLS_ENABLED, true)
                .put(HelmValue.TLS_SECRET_NAME, ClusterResources.TLS_SECRET)
                .put(HelmValue.SSL_REDIRECT, "true")
                .put(HelmValue.N8N_PROTOCOL, "https")
                .put(HelmValue.WEBHOOK_URL, "https://" + config.getHost() + "/");
        if (config.getTls() instanceof TlsConfig.TlsAutomatic automatic) {
            values.put(HelmValue.CLUSTER_ISSUER, automatic.issuerName());
        }
        return values;
    }

    public static HelmValues basicAuthValues() {
        return HelmValues.create()
                .put(HelmValue.AUTH_TYPE, "basic")
                .put(HelmValue.AUTH_SECRET, ClusterResources.BASIC_AUTH_SECRET)
                .put(HelmValue.AUTH_REALM, ClusterResources.AUTH_REALM);
    }
}
