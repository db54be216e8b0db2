package xyz.firestige.clouddeploy.domain.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import xyz.firestige.clouddeploy.domain.shared.validation.InputRules;
import xyz.firestige.clouddeploy.domain.shared.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 配置记录完整性校验：字段级约束（Bean Validation）+ 跨字段一致性。
 * 收集器只有在这里通过之后才会交出记录；从磁盘加载的记录同样要过一遍。
 */
public class DeploymentConfigValidator {

    private final Validator validator;

    public DeploymentConfigValidator(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult validate(DeploymentConfig config) {
        List<String> errors = new ArrayList<>();
        validator.validate(config).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(DeploymentConfigValidator::describe)
                .forEach(errors::add);

        if (config.getNodeMinCount() > config.getNodeDesiredCount()
                || config.getNodeDesiredCount() > config.getNodeMaxCount()) {
            errors.add("node counts must satisfy min <= desired <= max");
        }
        if (config.getTimezone() != null && !InputRules.timezone().validate(config.getTimezone()).isValid()) {
            errors.add("timezone: '" + config.getTimezone() + "' is not a valid IANA zone");
        }
        TlsConfig tls = config.getTls();
        if (tls != null && tls.isEnabled() && !InputRules.isFqdn(config.getHost())) {
            errors.add("host: TLS requires a fully-qualified domain name, got '" + config.getHost() + "'");
        }
        if (tls instanceof TlsConfig.TlsByo byo) {
            if (isBlank(byo.certificatePath()) || isBlank(byo.privateKeyPath())) {
                errors.add("tls: bring-your-own mode requires certificate and private key paths");
            }
        } else if (tls instanceof TlsConfig.TlsAutomatic automatic) {
            if (!InputRules.email().validate(automatic.email()).isValid()) {
                errors.add("tls: automatic mode requires a valid contact email");
            }
            if (!TlsConfig.TlsAutomatic.PRODUCTION.equals(automatic.environment())
                    && !TlsConfig.TlsAutomatic.STAGING.equals(automatic.environment())) {
                errors.add("tls: environment must be production or staging");
            }
        }
        if (config.getDatabase() instanceof DatabaseConfig.ManagedDatabase managed) {
            if (isBlank(managed.instanceClass())) {
                errors.add("database: managed database requires an instance class");
            }
            if (managed.storageGb() < 20) {
                errors.add("database: storage must be at least 20 GB");
            }
        }
        BasicAuthConfig auth = config.getBasicAuth();
        if (auth != null && auth.enabled() && isBlank(auth.username())) {
            errors.add("basicAuth: username is required when basic auth is enabled");
        }
        return ValidationResult.failure(errors);
    }

    /**
     * 完整记录：在 {@link #validate} 基础上还要求加密密钥存在
     */
    public ValidationResult validateComplete(DeploymentConfig config) {
        ValidationResult result = validate(config);
        if (config.getEncryptionKey() == null) {
            result = result.merge(ValidationResult.failure("encryptionKey: is required"));
        }
        return result;
    }

    private static String describe(ConstraintViolation<DeploymentConfig> v) {
        return v.getPropertyPath() + ": " + v.getMessage();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
