package io.citysense.metrics.forecast;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeSeriesTest {

    private static final Instant T0 = Instant.parse("2024-03-05T00:00:00Z");

    @Test
    void testSamplesSortedFromEarliest() {
        List<Observation> history = Arrays.asList(
                new Observation(T0.plusSeconds(7200), 30.0),
                new Observation(T0, 10.0),
                new Observation(T0.plusSeconds(1800), 20.0));

        List<TimeSeriesSample> samples = TimeSeries.toSamples(history);

        assertThat(samples).extracting(TimeSeriesSample::getElapsedHours).containsExactly(0.0, 0.5, 2.0);
        assertThat(samples).extracting(TimeSeriesSample::getValue).containsExactly(10.0, 20.0, 30.0);
        assertThat(TimeSeries.origin(history)).isEqualTo(T0);
    }

    @Test
    void testEmptyHistory() {
        assertThat(TimeSeries.toSamples(Collections.emptyList())).isEmpty();
        assertThatThrownBy(() -> TimeSeries.origin(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testElapsedHours() {
        assertThat(TimeSeries.elapsedHours(T0, T0.plusSeconds(90 * 60))).isEqualTo(1.5);
        assertThat(Observation.ofEpochMilli(T0.toEpochMilli(), 1.0).getTimestamp()).isEqualTo(T0);
    }
}
