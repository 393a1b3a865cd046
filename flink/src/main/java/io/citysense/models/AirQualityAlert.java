package io.citysense.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Optional;

/**
 * Poor air quality alert, published on airquality.alert and stored in the alerts table.
 */
public class AirQualityAlert {

    public static final String SERVICE_TYPE = "air_quality";
    public static final String ALERT_TYPE = "poor_air_quality";
    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_CRITICAL = "critical";

    @JsonProperty("service_type")
    private String serviceType = SERVICE_TYPE;

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("alert_type")
    private String alertType = ALERT_TYPE;

    @JsonProperty("aqi")
    private int aqi;

    @JsonProperty("severity")
    private String severity;

    @JsonProperty("message")
    private String message;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("event_time_ms")
    private long eventTimeMs;

    public AirQualityAlert() {}

    public AirQualityAlert(String stationId, int aqi, String severity, long eventTimeMs) {
        this.stationId = stationId;
        this.aqi = aqi;
        this.severity = severity;
        this.eventTimeMs = eventTimeMs;
        this.timestamp = Instant.ofEpochMilli(eventTimeMs).toString();
        this.message = String.format("Poor air quality detected (AQI: %d) at station %s", aqi, stationId);
    }

    /**
     * Alert for a reading whose AQI exceeds {@code alertThreshold}; critical above
     * {@code criticalThreshold}, warning otherwise.
     */
    public static Optional<AirQualityAlert> evaluate(EnrichedReading reading,
                                                     int alertThreshold,
                                                     int criticalThreshold) {
        if (reading.getAqi() <= alertThreshold) {
            return Optional.empty();
        }
        String severity = reading.getAqi() > criticalThreshold ? SEVERITY_CRITICAL : SEVERITY_WARNING;
        return Optional.of(new AirQualityAlert(
                reading.getStationId(), reading.getAqi(), severity, reading.getEventTimeMs()));
    }

    // Getters
    public String getServiceType() { return serviceType; }
    public String getStationId() { return stationId; }
    public String getAlertType() { return alertType; }
    public int getAqi() { return aqi; }
    public String getSeverity() { return severity; }
    public String getMessage() { return message; }
    public String getTimestamp() { return timestamp; }
    public long getEventTimeMs() { return eventTimeMs; }

    @Override
    public String toString() {
        return String.format("AirQualityAlert{station='%s', aqi=%d, severity=%s}", stationId, aqi, severity);
    }
}
