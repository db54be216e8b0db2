package xyz.firestige.clouddeploy.domain.config;

/**
 * Ingress 基础认证开关
 */
public record BasicAuthConfig(boolean enabled, String username) {

    public static final String DEFAULT_USERNAME = "admin";

    public static BasicAuthConfig disabled() {
        return new BasicAuthConfig(false, DEFAULT_USERNAME);
    }

    public static BasicAuthConfig enabledFor(String username) {
        return new BasicAuthConfig(true, username);
    }
}
