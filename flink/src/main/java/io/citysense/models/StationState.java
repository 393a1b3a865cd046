package io.citysense.models;

import io.citysense.metrics.forecast.Observation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * Per-station state maintained in Flink: a bounded AQI history and forecast cadence.
 */
public class StationState implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final int DEFAULT_HISTORY_SIZE = 48;

    // Ring buffer of (event time, AQI), oldest first
    private LinkedList<Long> eventTimes;
    private LinkedList<Integer> aqiHistory;
    private int historySize;

    private long lastEventTimeMs;
    private int lastAqi;
    private int readingsSinceForecast;

    public StationState() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public StationState(int historySize) {
        this.eventTimes = new LinkedList<>();
        this.aqiHistory = new LinkedList<>();
        this.historySize = historySize;
    }

    /**
     * Append a reading's AQI to the history.
     */
    public void update(long eventTimeMs, int aqi) {
        eventTimes.addLast(eventTimeMs);
        aqiHistory.addLast(aqi);
        while (aqiHistory.size() > historySize) {
            eventTimes.removeFirst();
            aqiHistory.removeFirst();
        }

        this.lastEventTimeMs = eventTimeMs;
        this.lastAqi = aqi;
        this.readingsSinceForecast++;
    }

    /**
     * Calculate average AQI from history.
     */
    public double getAverageAqi() {
        if (aqiHistory.isEmpty()) {
            return 0.0;
        }
        return aqiHistory.stream()
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
    }

    /**
     * Current AQI relative to the history average.
     */
    public double getAqiTrend(int currentAqi) {
        return currentAqi - getAverageAqi();
    }

    /**
     * A forecast is due once the history is long enough and {@code everyNReadings} readings
     * arrived since the last one.
     */
    public boolean isForecastDue(int minSamples, int everyNReadings) {
        return aqiHistory.size() >= minSamples && readingsSinceForecast >= everyNReadings;
    }

    public void markForecast() {
        this.readingsSinceForecast = 0;
    }

    public List<Observation> toObservations() {
        List<Observation> observations = new ArrayList<>(aqiHistory.size());
        Iterator<Long> times = eventTimes.iterator();
        Iterator<Integer> values = aqiHistory.iterator();
        while (times.hasNext() && values.hasNext()) {
            observations.add(Observation.ofEpochMilli(times.next(), values.next()));
        }
        return observations;
    }

    /**
     * Check if this is the first event for this station.
     */
    public boolean isFirstEvent() {
        return lastEventTimeMs == 0;
    }

    // Getters
    public int getHistoryLength() { return aqiHistory.size(); }
    public long getLastEventTimeMs() { return lastEventTimeMs; }
    public int getLastAqi() { return lastAqi; }
    public int getReadingsSinceForecast() { return readingsSinceForecast; }
}
