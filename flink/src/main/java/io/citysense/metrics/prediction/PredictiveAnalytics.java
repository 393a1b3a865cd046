package io.citysense.metrics.prediction;

import io.citysense.metrics.aqi.SeverityScale;
import io.citysense.metrics.forecast.Forecast;
import io.citysense.metrics.forecast.MultipleLinearRegression;
import io.citysense.metrics.forecast.Observation;
import io.citysense.metrics.forecast.RegressionStrategy;
import io.citysense.metrics.forecast.TimeSeries;
import io.citysense.metrics.forecast.TrendForecaster;
import io.citysense.models.Prediction;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-domain prediction recipes over entity histories.
 *
 * <ul>
 *   <li>energy consumption and AQI: linear trend over elapsed hours, 24 h past "now"</li>
 *   <li>transport demand: linear model over (hour, day of week) evaluated at the current slot</li>
 *   <li>water leak risk: injected model over (flow rate, pressure) evaluated at the newest reading</li>
 * </ul>
 * Histories shorter than the type's minimum are rejected before any fitting.
 */
public class PredictiveAnalytics {

    public static final String ENERGY_UNIT = "kWh";

    private final Clock clock;
    private final SeverityScale severityScale;
    private final TrendForecaster trendForecaster;
    private final Supplier<? extends RegressionStrategy> demandModelFactory;
    private final Supplier<? extends RegressionStrategy> leakModelFactory;

    public PredictiveAnalytics() {
        this(Clock.systemUTC(), SeverityScale.SIX_BIN);
    }

    public PredictiveAnalytics(Clock clock, SeverityScale severityScale) {
        this(clock, severityScale, new TrendForecaster(),
                MultipleLinearRegression::new, MultipleLinearRegression::new);
    }

    public PredictiveAnalytics(Clock clock,
                               SeverityScale severityScale,
                               TrendForecaster trendForecaster,
                               Supplier<? extends RegressionStrategy> demandModelFactory,
                               Supplier<? extends RegressionStrategy> leakModelFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.severityScale = Objects.requireNonNull(severityScale, "severityScale");
        this.trendForecaster = Objects.requireNonNull(trendForecaster, "trendForecaster");
        this.demandModelFactory = Objects.requireNonNull(demandModelFactory, "demandModelFactory");
        this.leakModelFactory = Objects.requireNonNull(leakModelFactory, "leakModelFactory");
    }

    public Prediction predictEnergyConsumption(String meterId, List<Observation> consumption) {
        PredictionType type = PredictionType.ENERGY_CONSUMPTION;
        Instant now = clock.instant();
        Forecast forecast = trendAheadOfNow(type, consumption, now);

        return base(type, meterId, now, forecast.getPredictedValue(), forecast.getConfidenceScore())
                .unit(ENERGY_UNIT)
                .build();
    }

    public Prediction predictAirQuality(String stationId, List<Observation> aqiHistory) {
        PredictionType type = PredictionType.AIR_QUALITY;
        Instant now = clock.instant();
        Forecast forecast = trendAheadOfNow(type, aqiHistory, now);

        // Truncation toward zero, as the level is looked up on the integer AQI scale
        int predictedAqi = (int) forecast.getPredictedValue();
        return base(type, stationId, now, forecast.getPredictedValue(), forecast.getConfidenceScore())
                .qualityLevel(severityScale.classify(predictedAqi).getLabel())
                .build();
    }

    public Prediction predictTransportDemand(String vehicleId, List<DemandObservation> history) {
        PredictionType type = PredictionType.TRANSPORT_DEMAND;
        type.requireSamples(history.size());

        double[][] x = new double[history.size()][];
        double[] y = new double[history.size()];
        for (int i = 0; i < history.size(); i++) {
            DemandObservation observation = history.get(i);
            x[i] = new double[]{observation.getHour(), observation.getDayOfWeek()};
            y[i] = observation.getAveragePassengers();
        }

        RegressionStrategy model = demandModelFactory.get();
        model.fit(x, y);

        Instant now = clock.instant();
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        int dayOfWeek = utc.getDayOfWeek().getValue() % 7;
        double predicted = model.predict(new double[]{utc.getHour(), dayOfWeek});
        double confidence = model.score(x, y);

        return base(type, vehicleId, now, predicted, confidence)
                .demandLevel(DemandLevel.fromPassengers(predicted).getLabel())
                .build();
    }

    /**
     * @param newestFirst sensor history ordered from the most recent reading backwards
     */
    public Prediction predictLeakRisk(String sensorId, List<WaterObservation> newestFirst) {
        PredictionType type = PredictionType.LEAK_PROBABILITY;
        type.requireSamples(newestFirst.size());

        double[][] x = new double[newestFirst.size()][];
        double[] y = new double[newestFirst.size()];
        for (int i = 0; i < newestFirst.size(); i++) {
            x[i] = newestFirst.get(i).features();
            y[i] = newestFirst.get(i).label();
        }

        RegressionStrategy model = leakModelFactory.get();
        model.fit(x, y);

        double probability = model.predict(x[0]);
        double confidence = model.score(x, y);

        return base(type, sensorId, clock.instant(), probability, confidence)
                .riskLevel(LeakRiskLevel.fromProbability(probability).getLabel())
                .build();
    }

    private Forecast trendAheadOfNow(PredictionType type, List<Observation> history, Instant now) {
        type.requireSamples(history.size());
        double target = TimeSeries.elapsedHours(TimeSeries.origin(history), now)
                + TrendForecaster.DEFAULT_HORIZON_HOURS;
        return trendForecaster.forecast(TimeSeries.toSamples(history), target);
    }

    private static Prediction.Builder base(PredictionType type, String entityId, Instant now,
                                           double predicted, double confidence) {
        return Prediction.builder()
                .serviceType(type.getServiceType())
                .entityId(entityId)
                .predictionType(type.getTypeName())
                .predictedValue(predicted)
                .confidenceScore(confidence)
                .timestamp(now);
    }
}
