package io.citysense.models;

import io.citysense.metrics.forecast.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StationStateTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final long HOUR_MS = 3_600_000L;

    private StationState state;

    @BeforeEach
    void setUp() {
        state = new StationState(5);
    }

    @Test
    void testInitialState() {
        assertThat(state.isFirstEvent()).isTrue();
        assertThat(state.getHistoryLength()).isZero();
        assertThat(state.getAverageAqi()).isEqualTo(0.0);
    }

    @Test
    void testUpdate() {
        state.update(T0, 42);

        assertThat(state.isFirstEvent()).isFalse();
        assertThat(state.getLastEventTimeMs()).isEqualTo(T0);
        assertThat(state.getLastAqi()).isEqualTo(42);
        assertThat(state.getHistoryLength()).isEqualTo(1);
    }

    @Test
    void testAverageAndTrend() {
        state.update(T0, 40);
        state.update(T0 + HOUR_MS, 50);
        state.update(T0 + 2 * HOUR_MS, 60);

        assertThat(state.getAverageAqi()).isCloseTo(50.0, within(0.01));
        assertThat(state.getAqiTrend(80)).isCloseTo(30.0, within(0.01));
        assertThat(state.getAqiTrend(45)).isCloseTo(-5.0, within(0.01));
    }

    @Test
    void testHistoryLimit() {
        for (int i = 0; i < 10; i++) {
            state.update(T0 + i * HOUR_MS, i * 10);
        }

        // Only the last 5 readings kept: 50, 60, 70, 80, 90
        assertThat(state.getHistoryLength()).isEqualTo(5);
        assertThat(state.getAverageAqi()).isCloseTo(70.0, within(0.01));
        assertThat(state.toObservations().get(0).getTimestamp().toEpochMilli()).isEqualTo(T0 + 5 * HOUR_MS);
    }

    @Test
    void testForecastCadence() {
        for (int i = 0; i < 3; i++) {
            state.update(T0 + i * HOUR_MS, 50);
        }
        assertThat(state.isForecastDue(4, 2)).isFalse();

        state.update(T0 + 3 * HOUR_MS, 50);
        assertThat(state.isForecastDue(4, 2)).isTrue();

        state.markForecast();
        assertThat(state.getReadingsSinceForecast()).isZero();
        assertThat(state.isForecastDue(4, 2)).isFalse();

        state.update(T0 + 4 * HOUR_MS, 50);
        state.update(T0 + 5 * HOUR_MS, 50);
        assertThat(state.isForecastDue(4, 2)).isTrue();
    }

    @Test
    void testObservationsFollowTrimmedHistory() {
        for (int i = 0; i < 8; i++) {
            state.update(T0 + i * HOUR_MS, i);
        }

        List<Observation> observations = state.toObservations();

        assertThat(observations).hasSize(5);
        assertThat(observations).extracting(Observation::getValue).containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
        assertThat(observations).extracting(o -> o.getTimestamp().toEpochMilli())
                .containsExactly(T0 + 3 * HOUR_MS, T0 + 4 * HOUR_MS, T0 + 5 * HOUR_MS,
                        T0 + 6 * HOUR_MS, T0 + 7 * HOUR_MS);
    }

    @Test
    void testObservationsOldestFirst() {
        state.update(T0, 10);
        state.update(T0 + HOUR_MS, 20);

        List<Observation> observations = state.toObservations();

        assertThat(observations).extracting(Observation::getValue).containsExactly(10.0, 20.0);
        assertThat(observations.get(1).getTimestamp().toEpochMilli()).isEqualTo(T0 + HOUR_MS);
    }
}
