package io.citysense.metrics.forecast;

import java.time.Instant;
import java.util.Objects;

/**
 * Timestamped numeric reading from a sensor history.
 */
public final class Observation {

    private final Instant timestamp;
    private final double value;

    public Observation(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
    }

    public static Observation ofEpochMilli(long epochMs, double value) {
        return new Observation(Instant.ofEpochMilli(epochMs), value);
    }

    public Instant getTimestamp() { return timestamp; }
    public double getValue() { return value; }

    @Override
    public String toString() {
        return "Observation{" + timestamp + ", " + value + "}";
    }
}
