package io.citysense.functions;

import io.citysense.models.AirQualityReading;
import io.citysense.models.EnrichedReading;
import io.citysense.models.HourlyAqiAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AqiAggregateFunctionTest {

    private static final long T0 = 1_700_000_000_000L;

    private AqiAggregateFunction function;

    @BeforeEach
    void setUp() {
        function = new AqiAggregateFunction();
    }

    @Test
    void testEmptyWindow() {
        assertThat(function.getResult(function.createAccumulator())).isNull();
    }

    @Test
    void testAggregate() {
        AqiAggregateFunction.AqiAccumulator acc = function.createAccumulator();
        acc = function.add(reading(T0, 10.0, 20.0, 40), acc);
        acc = function.add(reading(T0 + 60_000, 20.0, null, 70), acc);
        acc = function.add(reading(T0 + 120_000, null, 31.0, 101), acc);

        HourlyAqiAggregate result = function.getResult(acc);

        assertThat(result.getStationId()).isEqualTo("S-1");
        assertThat(result.getReadingsCount()).isEqualTo(3);
        assertThat(result.getAvgAqi()).isEqualTo(70);
        assertThat(result.getMaxAqi()).isEqualTo(101);
        assertThat(result.getStatus()).isEqualTo("moderate");
        assertThat(result.getAvgPm25()).isEqualTo(15.0);
        assertThat(result.getAvgPm10()).isEqualTo(25.5);
        assertThat(result.getWindowStart()).isEqualTo(T0);
        assertThat(result.getWindowEnd()).isEqualTo(T0 + 120_000);
    }

    @Test
    void testMissingPollutantAveragesToZero() {
        AqiAggregateFunction.AqiAccumulator acc = function.add(reading(T0, 10.0, null, 41),
                function.createAccumulator());

        assertThat(function.getResult(acc).getAvgPm10()).isEqualTo(0.0);
    }

    @Test
    void testMerge() {
        AqiAggregateFunction.AqiAccumulator a = function.add(reading(T0, 10.0, null, 40),
                function.createAccumulator());
        AqiAggregateFunction.AqiAccumulator b = function.add(reading(T0 + 1000, 30.0, null, 160),
                function.createAccumulator());

        HourlyAqiAggregate result = function.getResult(function.merge(a, b));

        assertThat(result.getReadingsCount()).isEqualTo(2);
        assertThat(result.getAvgAqi()).isEqualTo(100);
        assertThat(result.getMaxAqi()).isEqualTo(160);
        assertThat(result.getAvgPm25()).isEqualTo(20.0);
    }

    private static EnrichedReading reading(long eventTimeMs, Double pm25, Double pm10, int aqi) {
        AirQualityReading raw = new AirQualityReading();
        raw.setStationId("S-1");
        raw.setEventTimeMs(eventTimeMs);
        raw.setPm25(pm25);
        raw.setPm10(pm10);
        return EnrichedReading.builder().fromReading(raw).aqi(aqi).build();
    }
}
