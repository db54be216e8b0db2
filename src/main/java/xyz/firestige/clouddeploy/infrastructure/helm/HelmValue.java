package xyz.firestige.clouddeploy.infrastructure.helm;

import java.util.List;

/**
 * 应用 chart 支持的取值表：逻辑选项 → values 路径 + 值类型。
 * 路径按段保存，含点号的注解键作为单个段。
 */
public enum HelmValue {

    INGRESS_ENABLED(Boolean.class, "ingress", "enabled"),
    INGRESS_CLASS(String.class, "ingress", "className"),
    INGRESS_HOST(String.class, "ingress", "host"),
    TLS_ENABLED(Boolean.class, "ingress", "tls", "enabled"),
    TLS_SECRET_NAME(String.class, "ingress", "tls", "secretName"),
    CLUSTER_ISSUER(String.class, "ingress", "annotations", "cert-manager.io/cluster-issuer"),
    SSL_REDIRECT(String.class, "ingress", "annotations", "nginx.ingress.kubernetes.io/ssl-redirect"),
    AUTH_TYPE(String.class, "ingress", "annotations", "nginx.ingress.kubernetes.io/auth-type"),
    AUTH_SECRET(String.class, "ingress", "annotations", "nginx.ingress.kubernetes.io/auth-secret"),
    AUTH_REALM(String.class, "ingress", "annotations", "nginx.ingress.kubernetes.io/auth-realm"),

    N8N_HOST(String.class, "env", "N8N_HOST"),
    N8N_PROTOCOL(String.class, "env", "N8N_PROTOCOL"),
    WEBHOOK_URL(String.class, "env", "WEBHOOK_URL"),
    GENERIC_TIMEZONE(String.class, "env", "GENERIC_TIMEZONE"),
    TZ(String.class, "env", "TZ"),

    PERSISTENCE_ENABLED(Boolean.class, "persistence", "enabled"),
    PERSISTENCE_SIZE(String.class, "persistence", "size"),

    DATABASE_TYPE(String.class, "database", "type"),
    DATABASE_HOST(String.class, "database", "host"),
    DATABASE_PORT(Integer.class, "database", "port"),
    DATABASE_NAME(String.class, "database", "name"),
    DATABASE_EXISTING_SECRET(String.class, "database", "existingSecret"),

    ENCRYPTION_KEY_EXISTING_SECRET(String.class, "encryptionKey", "existingSecret");

    private final Class<?> type;
    private final List<String> path;

    HelmValue(Class<?> type, String... path) {
        this.type = type;
        this.path = List.of(path);
    }

    public Class<?> getType() {
        return type;
    }

    public List<String> getPath() {
        return path;
    }

    /**
     * --set 形式的键：段内的点号和逗号需要转义
     */
    public String setKey() {
        StringBuilder sb = new StringBuilder();
        for (String segment : path) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment.replace(".", "\\.").replace(",", "\\,"));
        }
        return sb.toString();
    }
}
