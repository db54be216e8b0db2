package xyz.firestige.clouddeploy.application.dependency;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VersionComparatorTest {

    @Test
    void comparesNumericallyNotLexically() {
        assertThat(VersionComparator.atLeast("1.10.2", "1.6.0")).isTrue();
        assertThat(VersionComparator.atLeast("1.5.7", "1.6.0")).isFalse();
        assertThat(VersionComparator.atLeast("3.0.0", "3.0.0")).isTrue();
    }

    @Test
    void missingSegmentsCountAsZero() {
        assertThat(VersionComparator.INSTANCE.compare("2.50", "2.50.0")).isZero();
        assertThat(VersionComparator.atLeast("400", "400.0.0")).isTrue();
    }

    @Test
    void ignoresNonNumericSuffix() {
        assertThat(VersionComparator.atLeast("1.1.1w", "1.1.1")).isTrue();
    }
}
