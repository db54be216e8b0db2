package xyz.firestige.clouddeploy.application.execution;

/**
 * 集群内由本工具创建或依赖的资源名
 */
public final class ClusterResources {

    public static final String ENCRYPTION_KEY_SECRET = "n8n-encryption-key";
    public static final String DB_CREDENTIALS_SECRET = "n8n-db-credentials";
    public static final String TLS_SECRET = "n8n-tls";
    public static final String BASIC_AUTH_SECRET = "n8n-basic-auth";
    public static final String INGRESS_CONTROLLER_SERVICE = "ingress-nginx-controller";
    public static final String INGRESS_CLASS = "nginx";
    public static final String AUTH_REALM = "Authentication Required";
    public static final int POSTGRES_PORT = 5432;

    private ClusterResources() {
    }
}
