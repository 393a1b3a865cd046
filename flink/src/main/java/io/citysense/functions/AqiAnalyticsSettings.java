package io.citysense.functions;

import io.citysense.metrics.aqi.SeverityScale;
import io.citysense.utils.ConfigLoader;

import java.io.Serializable;

/**
 * Tuning of the per-station AQI analytics. Shipped with the operator, so it must stay serializable.
 */
public class AqiAnalyticsSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int alertThreshold = 150;
    private int criticalThreshold = 200;
    private int historySize = 48;
    private int forecastMinSamples = 10;
    private double forecastHorizonHours = 24.0;
    private int forecastEveryNReadings = 12;
    private long stateTtlMinutes = 1440;
    private SeverityScale severityScale = SeverityScale.SIX_BIN;

    public static AqiAnalyticsSettings defaults() {
        return new AqiAnalyticsSettings();
    }

    public static AqiAnalyticsSettings fromEnvironment() {
        return new AqiAnalyticsSettings()
                .alertThreshold(ConfigLoader.aqiAlertThreshold())
                .criticalThreshold(ConfigLoader.aqiCriticalThreshold())
                .historySize(ConfigLoader.aqiHistorySize())
                .forecastMinSamples(ConfigLoader.forecastMinSamples())
                .forecastHorizonHours(ConfigLoader.forecastHorizonHours())
                .forecastEveryNReadings(ConfigLoader.forecastEveryNReadings())
                .stateTtlMinutes(ConfigLoader.stateTtlMinutes())
                .severityScale(ConfigLoader.aqiSeverityScale());
    }

    public AqiAnalyticsSettings alertThreshold(int value) { this.alertThreshold = value; return this; }
    public AqiAnalyticsSettings criticalThreshold(int value) { this.criticalThreshold = value; return this; }
    public AqiAnalyticsSettings historySize(int value) { this.historySize = value; return this; }
    public AqiAnalyticsSettings forecastMinSamples(int value) { this.forecastMinSamples = value; return this; }
    public AqiAnalyticsSettings forecastHorizonHours(double value) { this.forecastHorizonHours = value; return this; }
    public AqiAnalyticsSettings forecastEveryNReadings(int value) { this.forecastEveryNReadings = value; return this; }
    public AqiAnalyticsSettings stateTtlMinutes(long value) { this.stateTtlMinutes = value; return this; }
    public AqiAnalyticsSettings severityScale(SeverityScale value) { this.severityScale = value; return this; }

    public int getAlertThreshold() { return alertThreshold; }
    public int getCriticalThreshold() { return criticalThreshold; }
    public int getHistorySize() { return historySize; }
    public int getForecastMinSamples() { return forecastMinSamples; }
    public double getForecastHorizonHours() { return forecastHorizonHours; }
    public int getForecastEveryNReadings() { return forecastEveryNReadings; }
    public long getStateTtlMinutes() { return stateTtlMinutes; }
    public SeverityScale getSeverityScale() { return severityScale; }
}
