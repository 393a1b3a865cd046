package io.citysense.metrics.aqi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityScaleTest {

    @Test
    void testSixBinBoundaries() {
        SeverityScale scale = SeverityScale.SIX_BIN;

        assertThat(scale.classify(0)).isEqualTo(AqiCategory.GOOD);
        assertThat(scale.classify(50)).isEqualTo(AqiCategory.GOOD);
        assertThat(scale.classify(51)).isEqualTo(AqiCategory.MODERATE);
        assertThat(scale.classify(100)).isEqualTo(AqiCategory.MODERATE);
        assertThat(scale.classify(150)).isEqualTo(AqiCategory.UNHEALTHY_SENSITIVE);
        assertThat(scale.classify(200)).isEqualTo(AqiCategory.UNHEALTHY);
        assertThat(scale.classify(201)).isEqualTo(AqiCategory.VERY_UNHEALTHY);
        assertThat(scale.classify(300)).isEqualTo(AqiCategory.VERY_UNHEALTHY);
        assertThat(scale.classify(301)).isEqualTo(AqiCategory.HAZARDOUS);
    }

    @Test
    void testFiveBinHasNoHazardous() {
        SeverityScale scale = SeverityScale.FIVE_BIN;

        assertThat(scale.classify(200)).isEqualTo(AqiCategory.UNHEALTHY);
        assertThat(scale.classify(250)).isEqualTo(AqiCategory.VERY_UNHEALTHY);
        assertThat(scale.classify(400)).isEqualTo(AqiCategory.VERY_UNHEALTHY);
        assertThat(SeverityScale.SIX_BIN.classify(400)).isEqualTo(AqiCategory.HAZARDOUS);
    }

    @Test
    void testLabels() {
        assertThat(AqiCategory.UNHEALTHY_SENSITIVE.getLabel()).isEqualTo("unhealthy_sensitive");
        assertThat(AqiCalculator.status(75).getLabel()).isEqualTo("moderate");
    }

    @Test
    void testSeverityOrdering() {
        assertThat(AqiCategory.HAZARDOUS.isMoreSevereThan(AqiCategory.VERY_UNHEALTHY)).isTrue();
        assertThat(AqiCategory.GOOD.isMoreSevereThan(AqiCategory.MODERATE)).isFalse();
    }

    @Test
    void testFromName() {
        assertThat(SeverityScale.fromName("five_bin")).isEqualTo(SeverityScale.FIVE_BIN);
        assertThat(SeverityScale.fromName(" SIX_BIN ")).isEqualTo(SeverityScale.SIX_BIN);
        assertThatThrownBy(() -> SeverityScale.fromName("seven_bin"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seven_bin");
    }
}
