package xyz.firestige.clouddeploy.domain.shared.validation;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collection;
import java.util.regex.Pattern;

/**
 * 交互输入的校验规则集合。每条规则返回 {@link ValidationResult}，调用方失败时重新提示。
 */
public final class InputRules {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");
    private static final Pattern FQDN_LABEL = Pattern.compile("^[A-Za-z0-9]([-A-Za-z0-9]{0,61}[A-Za-z0-9])?$");
    private static final Pattern TLD = Pattern.compile("^[A-Za-z][-A-Za-z0-9]*[A-Za-z0-9]$");
    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern QUANTITY = Pattern.compile("^[1-9][0-9]*(Mi|Gi|Ti)$");

    private InputRules() {
    }

    public static InputValidator required() {
        return value -> value == null || value.isBlank()
                ? ValidationResult.failure("This field is required")
                : ValidationResult.success();
    }

    /**
     * 加密密钥必须恰好 64 位十六进制字符
     */
    public static InputValidator encryptionKey() {
        return value -> {
            if (value == null || value.isEmpty()) {
                return ValidationResult.failure("Encryption key is required");
            }
            if (value.length() != 64) {
                return ValidationResult.failure("Encryption key must be exactly 64 hexadecimal characters (got " + value.length() + ")");
            }
            return HEX_64.matcher(value).matches()
                    ? ValidationResult.success()
                    : ValidationResult.failure("Encryption key must contain only hexadecimal characters [0-9a-f]");
        };
    }

    public static InputValidator fqdn() {
        return value -> isFqdn(value)
                ? ValidationResult.success()
                : ValidationResult.failure("'" + value + "' is not a valid fully-qualified domain name (e.g. n8n.example.com)");
    }

    public static boolean isFqdn(String value) {
        if (value == null || value.length() > 253 || value.endsWith(".") || value.startsWith(".")) {
            return false;
        }
        String[] labels = value.split("\\.");
        if (labels.length < 2) {
            return false;
        }
        for (String label : labels) {
            if (!FQDN_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return TLD.matcher(labels[labels.length - 1]).matches();
    }

    public static InputValidator email() {
        return value -> value != null && EMAIL.matcher(value).matches()
                ? ValidationResult.success()
                : ValidationResult.failure("'" + value + "' is not a valid email address");
    }

    public static InputValidator timezone() {
        return value -> {
            try {
                ZoneId.of(value);
                return ValidationResult.success();
            } catch (DateTimeException | NullPointerException e) {
                return ValidationResult.failure("'" + value + "' is not a valid IANA timezone (e.g. Europe/London)");
            }
        };
    }

    public static InputValidator dnsLabel() {
        return value -> value != null && value.length() <= 63 && DNS_LABEL.matcher(value).matches()
                ? ValidationResult.success()
                : ValidationResult.failure("Must be lowercase letters, digits and '-' (max 63 chars)");
    }

    public static InputValidator quantity() {
        return value -> value != null && QUANTITY.matcher(value).matches()
                ? ValidationResult.success()
                : ValidationResult.failure("Must be a size such as 10Gi");
    }

    public static InputValidator integerBetween(int min, int max) {
        return value -> {
            try {
                int n = Integer.parseInt(value.trim());
                return n >= min && n <= max
                        ? ValidationResult.success()
                        : ValidationResult.failure("Must be a number between " + min + " and " + max);
            } catch (NumberFormatException | NullPointerException e) {
                return ValidationResult.failure("Must be a number between " + min + " and " + max);
            }
        };
    }

    public static InputValidator atLeast(int min) {
        return integerBetween(min, Integer.MAX_VALUE);
    }

    /**
     * 值必须属于已发现的候选集合
     */
    public static InputValidator oneOf(Collection<String> allowed, String what) {
        return value -> allowed.contains(value)
                ? ValidationResult.success()
                : ValidationResult.failure("Unknown " + what + " '" + value + "'. Available: " + String.join(", ", allowed));
    }
}
