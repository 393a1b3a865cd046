package io.citysense.functions;

import io.citysense.metrics.InvalidInputException;
import io.citysense.metrics.aqi.AqiCalculator;
import io.citysense.metrics.forecast.Forecast;
import io.citysense.metrics.forecast.TimeSeries;
import io.citysense.metrics.forecast.TrendForecaster;
import io.citysense.metrics.prediction.PredictionType;
import io.citysense.models.AirQualityAlert;
import io.citysense.models.AirQualityReading;
import io.citysense.models.EnrichedReading;
import io.citysense.models.Prediction;
import io.citysense.models.StationState;
import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Stateful processor for air quality readings, keyed by station.
 *
 * For each station:
 * - Computes AQI and status for every reading
 * - Emits poor air quality alerts (side output)
 * - Maintains a bounded AQI history and periodically forecasts it (side output)
 * - Emits enriched readings
 */
public class AqiEnrichmentFunction
        extends KeyedProcessFunction<String, AirQualityReading, EnrichedReading> {

    private static final Logger LOG = LoggerFactory.getLogger(AqiEnrichmentFunction.class);

    public static final OutputTag<AirQualityAlert> ALERT_TAG =
            new OutputTag<AirQualityAlert>("aqi-alerts") {};

    public static final OutputTag<Prediction> PREDICTION_TAG =
            new OutputTag<Prediction>("aqi-predictions") {};

    private final AqiAnalyticsSettings settings;

    private transient ValueState<StationState> stationState;
    private transient TrendForecaster forecaster;

    public AqiEnrichmentFunction() {
        this(AqiAnalyticsSettings.fromEnvironment());
    }

    public AqiEnrichmentFunction(AqiAnalyticsSettings settings) {
        this.settings = settings;
    }

    @Override
    public void open(Configuration parameters) {
        // Stations that stop reporting are dropped after the TTL
        StateTtlConfig ttlConfig = StateTtlConfig.newBuilder(
                        Time.minutes(settings.getStateTtlMinutes()))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();

        ValueStateDescriptor<StationState> descriptor =
                new ValueStateDescriptor<>("station-state", StationState.class);
        descriptor.enableTimeToLive(ttlConfig);

        stationState = getRuntimeContext().getState(descriptor);
        forecaster = new TrendForecaster();
    }

    @Override
    public void processElement(
            AirQualityReading reading,
            Context ctx,
            Collector<EnrichedReading> out) throws Exception {

        StationState state = stationState.value();
        if (state == null) {
            state = new StationState(settings.getHistorySize());
        }

        EnrichedReading enriched = enrich(reading, state);
        state.update(enriched.getEventTimeMs(), enriched.getAqi());

        AirQualityAlert.evaluate(enriched, settings.getAlertThreshold(), settings.getCriticalThreshold())
                .ifPresent(alert -> {
                    ctx.output(ALERT_TAG, alert);
                    LOG.debug("Air quality alert: {}", alert);
                });

        forecast(reading.getStationId(), state)
                .ifPresent(prediction -> ctx.output(PREDICTION_TAG, prediction));

        stationState.update(state);
        out.collect(enriched);
    }

    /**
     * Compute AQI, status and trend for a reading. The trend is taken against the history
     * before this reading is added.
     */
    EnrichedReading enrich(AirQualityReading reading, StationState state) {
        int aqi = AqiCalculator.calculate(reading.toPollutantReading());
        double trend = state.isFirstEvent() ? 0.0 : state.getAqiTrend(aqi);

        return EnrichedReading.builder()
                .fromReading(reading)
                .aqi(aqi)
                .status(AqiCalculator.status(aqi).getLabel())
                .aqiTrend(trend)
                .processingTime(System.currentTimeMillis())
                .build();
    }

    /**
     * Forecast the station's AQI past its latest reading, if one is due.
     */
    Optional<Prediction> forecast(String stationId, StationState state) {
        if (!state.isForecastDue(settings.getForecastMinSamples(), settings.getForecastEveryNReadings())) {
            return Optional.empty();
        }
        state.markForecast();

        try {
            Forecast forecast = forecaster().forecastAhead(
                    TimeSeries.toSamples(state.toObservations()),
                    settings.getForecastHorizonHours());

            int predictedAqi = (int) forecast.getPredictedValue();
            PredictionType type = PredictionType.AIR_QUALITY;
            return Optional.of(Prediction.builder()
                    .serviceType(type.getServiceType())
                    .entityId(stationId)
                    .predictionType(type.getTypeName())
                    .predictedValue(forecast.getPredictedValue())
                    .confidenceScore(forecast.getConfidenceScore())
                    .qualityLevel(settings.getSeverityScale().classify(predictedAqi).getLabel())
                    .timestamp(Instant.ofEpochMilli(state.getLastEventTimeMs()))
                    .build());
        } catch (InvalidInputException e) {
            LOG.debug("Skipped AQI forecast for station {}: {}", stationId, e.getMessage());
            return Optional.empty();
        }
    }

    private TrendForecaster forecaster() {
        if (forecaster == null) {
            forecaster = new TrendForecaster();
        }
        return forecaster;
    }
}
