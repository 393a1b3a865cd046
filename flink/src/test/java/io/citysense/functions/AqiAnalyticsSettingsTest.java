package io.citysense.functions;

import io.citysense.metrics.aqi.SeverityScale;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AqiAnalyticsSettingsTest {

    @Test
    void testDefaults() {
        AqiAnalyticsSettings settings = AqiAnalyticsSettings.defaults();

        assertThat(settings.getAlertThreshold()).isEqualTo(150);
        assertThat(settings.getCriticalThreshold()).isEqualTo(200);
        assertThat(settings.getHistorySize()).isEqualTo(48);
        assertThat(settings.getForecastMinSamples()).isEqualTo(10);
        assertThat(settings.getForecastHorizonHours()).isEqualTo(24.0);
        assertThat(settings.getForecastEveryNReadings()).isEqualTo(12);
        assertThat(settings.getStateTtlMinutes()).isEqualTo(1440L);
        assertThat(settings.getSeverityScale()).isEqualTo(SeverityScale.SIX_BIN);
    }

    @Test
    void testOverrides() {
        AqiAnalyticsSettings settings = AqiAnalyticsSettings.defaults()
                .alertThreshold(100)
                .severityScale(SeverityScale.FIVE_BIN);

        assertThat(settings.getAlertThreshold()).isEqualTo(100);
        assertThat(settings.getSeverityScale()).isEqualTo(SeverityScale.FIVE_BIN);
    }
}
