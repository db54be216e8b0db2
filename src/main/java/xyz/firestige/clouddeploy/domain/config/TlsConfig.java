package xyz.firestige.clouddeploy.domain.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * TLS 模式：关闭 / 自带证书 / 自动签发（ACME）
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TlsConfig.TlsDisabled.class, name = "disabled"),
        @JsonSubTypes.Type(value = TlsConfig.TlsByo.class, name = "byo"),
        @JsonSubTypes.Type(value = TlsConfig.TlsAutomatic.class, name = "automatic")
})
public sealed interface TlsConfig permits TlsConfig.TlsDisabled, TlsConfig.TlsByo, TlsConfig.TlsAutomatic {

    @JsonIgnore
    default boolean isEnabled() {
        return true;
    }

    static TlsConfig disabled() {
        return new TlsDisabled();
    }

    record TlsDisabled() implements TlsConfig {
        @JsonIgnore
        @Override
        public boolean isEnabled() {
            return false;
        }
    }

    record TlsByo(String certificatePath, String privateKeyPath) implements TlsConfig {
    }

    /**
     * @param email       ACME 账户邮箱
     * @param environment production 或 staging
     */
    record TlsAutomatic(String email, String environment) implements TlsConfig {

        public static final String PRODUCTION = "production";
        public static final String STAGING = "staging";

        public String issuerName() {
            return "letsencrypt-" + environment;
        }

        public String acmeServer() {
            return STAGING.equals(environment)
                    ? "https://acme-staging-v02.api.letsencrypt.org/directory"
                    : "https://acme-v02.api.letsencrypt.org/directory";
        }
    }
}
