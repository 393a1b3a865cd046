package io.citysense.metrics.forecast;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Conversion of timestamped observations into regression samples.
 */
public final class TimeSeries {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private TimeSeries() {}

    /**
     * Samples ordered by time, with elapsed hours measured from the earliest observation.
     */
    public static List<TimeSeriesSample> toSamples(List<Observation> observations) {
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(Observation::getTimestamp));

        List<TimeSeriesSample> samples = new ArrayList<>(sorted.size());
        if (sorted.isEmpty()) {
            return samples;
        }

        Instant origin = sorted.get(0).getTimestamp();
        for (Observation observation : sorted) {
            samples.add(new TimeSeriesSample(
                    elapsedHours(origin, observation.getTimestamp()),
                    observation.getValue()));
        }
        return samples;
    }

    /**
     * Earliest timestamp of a history; the origin of its elapsed-hours axis.
     */
    public static Instant origin(List<Observation> observations) {
        return observations.stream()
                .map(Observation::getTimestamp)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new IllegalArgumentException("Empty observation history"));
    }

    public static double elapsedHours(Instant origin, Instant instant) {
        return Duration.between(origin, instant).toMillis() / MILLIS_PER_HOUR;
    }
}
