package xyz.firestige.clouddeploy.domain.shared.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InputRulesTest {

    private static final String VALID_KEY = "0123456789abcdef0123456789ABCDEF0123456789abcdef0123456789abcdef";

    @Test
    void encryptionKeyRequiresExactly64HexCharacters() {
        assertThat(InputRules.encryptionKey().validate(VALID_KEY).isValid()).isTrue();

        ValidationResult tooShort = InputRules.encryptionKey().validate("abc123");
        assertThat(tooShort.isValid()).isFalse();
        assertThat(tooShort.firstError()).contains("64");

        String notHex = "z" + VALID_KEY.substring(1);
        assertThat(InputRules.encryptionKey().validate(notHex).isValid()).isFalse();
        assertThat(InputRules.encryptionKey().validate("").isValid()).isFalse();
    }

    @Test
    void fqdnRejectsSingleLabelsAndBadCharacters() {
        assertThat(InputRules.isFqdn("n8n.example.com")).isTrue();
        assertThat(InputRules.isFqdn("automation.eu-west.example.co.uk")).isTrue();

        assertThat(InputRules.isFqdn("localhost")).isFalse();
        assertThat(InputRules.isFqdn("n8n_host.example.com")).isFalse();
        assertThat(InputRules.isFqdn("n8n.example.")).isFalse();
        assertThat(InputRules.isFqdn("-bad.example.com")).isFalse();
        assertThat(InputRules.isFqdn("n8n.example.123")).isFalse();
        assertThat(InputRules.isFqdn(null)).isFalse();
    }

    @Test
    void emailFollowsBasicGrammar() {
        assertThat(InputRules.email().validate("ops@example.com").isValid()).isTrue();
        assertThat(InputRules.email().validate("ops@example").isValid()).isFalse();
        assertThat(InputRules.email().validate("not an email").isValid()).isFalse();
    }

    @Test
    void timezoneMustBeIanaZone() {
        assertThat(InputRules.timezone().validate("America/Bahia").isValid()).isTrue();
        assertThat(InputRules.timezone().validate("Mars/Olympus").isValid()).isFalse();
        assertThat(InputRules.timezone().validate(null).isValid()).isFalse();
    }

    @Test
    void dnsLabelAndQuantity() {
        assertThat(InputRules.dnsLabel().validate("n8n-prod").isValid()).isTrue();
        assertThat(InputRules.dnsLabel().validate("N8N").isValid()).isFalse();
        assertThat(InputRules.dnsLabel().validate("ends-").isValid()).isFalse();

        assertThat(InputRules.quantity().validate("10Gi").isValid()).isTrue();
        assertThat(InputRules.quantity().validate("10GB").isValid()).isFalse();
        assertThat(InputRules.quantity().validate("0Gi").isValid()).isFalse();
    }

    @Test
    void integerBetweenIsInclusive() {
        InputValidator rule = InputRules.integerBetween(2, 5);
        assertThat(rule.validate("2").isValid()).isTrue();
        assertThat(rule.validate("5").isValid()).isTrue();
        assertThat(rule.validate("1").isValid()).isFalse();
        assertThat(rule.validate("six").isValid()).isFalse();
    }

    @Test
    void oneOfListsAvailableValuesOnFailure() {
        ValidationResult result = InputRules.oneOf(List.of("default", "prod"), "profile").validate("staging");
        assertThat(result.isValid()).isFalse();
        assertThat(result.firstError()).contains("staging").contains("default, prod");
    }

    @Test
    void andStopsAtFirstFailure() {
        ValidationResult result = InputRules.required().and(InputRules.fqdn()).validate("");
        assertThat(result.getErrors()).containsExactly("This field is required");
    }
}
