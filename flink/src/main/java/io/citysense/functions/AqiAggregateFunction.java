package io.citysense.functions;

import io.citysense.metrics.aqi.AqiCalculator;
import io.citysense.models.EnrichedReading;
import io.citysense.models.HourlyAqiAggregate;
import org.apache.flink.api.common.functions.AggregateFunction;

import java.io.Serializable;

/**
 * Aggregate function for hourly per-station air quality.
 * Computes mean PM2.5 / PM10 over the readings that measured them, and mean / max AQI.
 */
public class AqiAggregateFunction
    implements AggregateFunction<EnrichedReading, AqiAggregateFunction.AqiAccumulator, HourlyAqiAggregate> {

    @Override
    public AqiAccumulator createAccumulator() {
        return new AqiAccumulator();
    }

    @Override
    public AqiAccumulator add(EnrichedReading reading, AqiAccumulator acc) {
        if (reading == null) {
            return acc;
        }

        acc.stationId = reading.getStationId();
        acc.count++;
        acc.aqiSum += reading.getAqi();
        acc.maxAqi = Math.max(acc.maxAqi, reading.getAqi());

        if (reading.getPm25() != null) {
            acc.pm25Sum += reading.getPm25();
            acc.pm25Count++;
        }
        if (reading.getPm10() != null) {
            acc.pm10Sum += reading.getPm10();
            acc.pm10Count++;
        }

        long ts = reading.getEventTimeMs();
        acc.windowStart = Math.min(acc.windowStart, ts);
        acc.windowEnd = Math.max(acc.windowEnd, ts);

        return acc;
    }

    @Override
    public HourlyAqiAggregate getResult(AqiAccumulator acc) {
        if (acc.count == 0) {
            return null;
        }

        int avgAqi = (int) (acc.aqiSum / acc.count);

        return new HourlyAqiAggregate(
            acc.stationId,
            acc.windowStart,
            acc.windowEnd,
            mean(acc.pm25Sum, acc.pm25Count),
            mean(acc.pm10Sum, acc.pm10Count),
            avgAqi,
            acc.maxAqi,
            AqiCalculator.status(avgAqi).getLabel(),
            acc.count
        );
    }

    @Override
    public AqiAccumulator merge(AqiAccumulator a, AqiAccumulator b) {
        if (a.stationId == null) {
            a.stationId = b.stationId;
        }
        a.count += b.count;
        a.aqiSum += b.aqiSum;
        a.maxAqi = Math.max(a.maxAqi, b.maxAqi);
        a.pm25Sum += b.pm25Sum;
        a.pm25Count += b.pm25Count;
        a.pm10Sum += b.pm10Sum;
        a.pm10Count += b.pm10Count;
        a.windowStart = Math.min(a.windowStart, b.windowStart);
        a.windowEnd = Math.max(a.windowEnd, b.windowEnd);
        return a;
    }

    private static double mean(double sum, int count) {
        if (count == 0) {
            return 0.0;
        }
        return Math.round(sum / count * 100.0) / 100.0;
    }

    /**
     * Nested Accumulator class.
     * Needs to be static and public for Flink Serialization.
     */
    public static class AqiAccumulator implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stationId;
        public int count = 0;
        public double aqiSum = 0.0;
        public int maxAqi = Integer.MIN_VALUE;
        public double pm25Sum = 0.0;
        public int pm25Count = 0;
        public double pm10Sum = 0.0;
        public int pm10Count = 0;
        public long windowStart = Long.MAX_VALUE;
        public long windowEnd = Long.MIN_VALUE;
    }
}
