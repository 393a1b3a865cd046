package io.citysense.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Hourly per-station air quality aggregate, published on airquality.hourly.
 * Field names follow the trends endpoint: avg_pm25, avg_pm10, avg_aqi, max_aqi, status.
 */
public class HourlyAqiAggregate {

    private static final DateTimeFormatter LOG_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00:00").withZone(ZoneOffset.UTC);

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("window_start")
    private long windowStart;      // earliest event time in the window (epoch ms)

    @JsonProperty("window_end")
    private long windowEnd;        // latest event time in the window (epoch ms)

    @JsonProperty("avg_pm25")
    private double avgPm25;

    @JsonProperty("avg_pm10")
    private double avgPm10;

    @JsonProperty("avg_aqi")
    private int avgAqi;

    @JsonProperty("max_aqi")
    private int maxAqi;

    @JsonProperty("status")
    private String status;

    @JsonProperty("readings_count")
    private int readingsCount;

    public HourlyAqiAggregate() {}

    public HourlyAqiAggregate(String stationId, long windowStart, long windowEnd,
                              double avgPm25, double avgPm10, int avgAqi, int maxAqi,
                              String status, int readingsCount) {
        this.stationId = stationId;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.avgPm25 = avgPm25;
        this.avgPm10 = avgPm10;
        this.avgAqi = avgAqi;
        this.maxAqi = maxAqi;
        this.status = status;
        this.readingsCount = readingsCount;
    }

    // Getters
    public String getStationId() { return stationId; }
    public long getWindowStart() { return windowStart; }
    public long getWindowEnd() { return windowEnd; }
    public double getAvgPm25() { return avgPm25; }
    public double getAvgPm10() { return avgPm10; }
    public int getAvgAqi() { return avgAqi; }
    public int getMaxAqi() { return maxAqi; }
    public String getStatus() { return status; }
    public int getReadingsCount() { return readingsCount; }

    @Override
    public String toString() {
        String timeStr = LOG_FORMAT.format(Instant.ofEpochMilli(windowStart));
        return String.format(
            "HourlyAqiAggregate{station=%s, time=%s, avgAqi=%d, maxAqi=%d, count=%d}",
            stationId, timeStr, avgAqi, maxAqi, readingsCount
        );
    }
}
