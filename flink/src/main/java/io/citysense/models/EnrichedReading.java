package io.citysense.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Reading with its computed AQI and status, published on airquality.reading.
 */
public class EnrichedReading {

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("event_time_ms")
    private long eventTimeMs;

    @JsonProperty("pm25")
    private Double pm25;

    @JsonProperty("pm10")
    private Double pm10;

    @JsonProperty("co2")
    private Double co2;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("humidity")
    private Double humidity;

    // Computed
    @JsonProperty("aqi")
    private int aqi;

    @JsonProperty("status")
    private String status;

    @JsonProperty("aqi_trend")
    private double aqiTrend;

    @JsonProperty("processing_time")
    private long processingTime;

    public EnrichedReading() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final EnrichedReading reading = new EnrichedReading();

        public Builder fromReading(AirQualityReading raw) {
            reading.stationId = raw.getStationId();
            reading.eventTimeMs = raw.getEventTimeMs();
            reading.timestamp = Instant.ofEpochMilli(raw.getEventTimeMs()).toString();
            reading.pm25 = raw.getPm25();
            reading.pm10 = raw.getPm10();
            reading.co2 = raw.getCo2();
            reading.temperature = raw.getTemperature();
            reading.humidity = raw.getHumidity();
            return this;
        }

        public Builder aqi(int aqi) { reading.aqi = aqi; return this; }
        public Builder status(String status) { reading.status = status; return this; }
        public Builder aqiTrend(double trend) { reading.aqiTrend = trend; return this; }
        public Builder processingTime(long time) { reading.processingTime = time; return this; }

        public EnrichedReading build() { return reading; }
    }

    // --- Getters ---
    public String getStationId() { return stationId; }
    public String getTimestamp() { return timestamp; }
    public long getEventTimeMs() { return eventTimeMs; }
    public Double getPm25() { return pm25; }
    public Double getPm10() { return pm10; }
    public Double getCo2() { return co2; }
    public Double getTemperature() { return temperature; }
    public Double getHumidity() { return humidity; }
    public int getAqi() { return aqi; }
    public String getStatus() { return status; }
    public double getAqiTrend() { return aqiTrend; }
    public long getProcessingTime() { return processingTime; }

    @Override
    public String toString() {
        return String.format("EnrichedReading{station='%s', aqi=%d, status=%s}", stationId, aqi, status);
    }
}
