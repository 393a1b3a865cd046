package io.citysense.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.citysense.metrics.aqi.PollutantReading;

/**
 * Raw station measurement consumed from airquality.raw.
 * Every measurement is optional; a null field was not measured.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AirQualityReading {

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("event_time_ms")
    private long eventTimeMs;

    @JsonProperty("pm25")
    private Double pm25;

    @JsonProperty("pm10")
    private Double pm10;

    @JsonProperty("co2")
    private Double co2;

    @JsonProperty("co")
    private Double co;

    @JsonProperty("no2")
    private Double no2;

    @JsonProperty("o3")
    private Double o3;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("humidity")
    private Double humidity;

    public AirQualityReading() {}

    /**
     * A reading is usable when it names its station, carries an event time and has no negative
     * pollutant concentration.
     */
    @JsonIgnore
    public boolean isValid() {
        return stationId != null && !stationId.isEmpty()
                && eventTimeMs > 0
                && nonNegative(pm25) && nonNegative(pm10)
                && nonNegative(co) && nonNegative(no2) && nonNegative(o3);
    }

    /**
     * Pollutant view used for AQI calculation. Only call on valid readings.
     */
    public PollutantReading toPollutantReading() {
        return PollutantReading.builder()
                .pm25(pm25)
                .pm10(pm10)
                .co(co)
                .no2(no2)
                .o3(o3)
                .build();
    }

    private static boolean nonNegative(Double value) {
        return value == null || (!value.isNaN() && value >= 0);
    }

    // Getters
    public String getStationId() { return stationId; }
    public long getEventTimeMs() { return eventTimeMs; }
    public Double getPm25() { return pm25; }
    public Double getPm10() { return pm10; }
    public Double getCo2() { return co2; }
    public Double getCo() { return co; }
    public Double getNo2() { return no2; }
    public Double getO3() { return o3; }
    public Double getTemperature() { return temperature; }
    public Double getHumidity() { return humidity; }

    // Setters
    public void setStationId(String stationId) { this.stationId = stationId; }
    public void setEventTimeMs(long eventTimeMs) { this.eventTimeMs = eventTimeMs; }
    public void setPm25(Double pm25) { this.pm25 = pm25; }
    public void setPm10(Double pm10) { this.pm10 = pm10; }
    public void setCo2(Double co2) { this.co2 = co2; }
    public void setCo(Double co) { this.co = co; }
    public void setNo2(Double no2) { this.no2 = no2; }
    public void setO3(Double o3) { this.o3 = o3; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }
    public void setHumidity(Double humidity) { this.humidity = humidity; }

    @Override
    public String toString() {
        return String.format("AirQualityReading{station='%s', t=%d, pm25=%s, pm10=%s}",
                stationId, eventTimeMs, pm25, pm10);
    }
}
