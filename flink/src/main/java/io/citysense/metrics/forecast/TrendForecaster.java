package io.citysense.metrics.forecast;

import io.citysense.metrics.InvalidInputException;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fits a regression of value against elapsed hours and extrapolates it.
 *
 * <p>A new model is obtained from the factory for every call, so one forecaster can serve
 * concurrent callers. Minimum history lengths are the caller's business; the forecaster only
 * needs enough distinct points for the model to fit.
 */
public class TrendForecaster {

    public static final double DEFAULT_HORIZON_HOURS = 24.0;

    private final Supplier<? extends RegressionStrategy> modelFactory;

    public TrendForecaster() {
        this(LinearTrendRegression::new);
    }

    public TrendForecaster(Supplier<? extends RegressionStrategy> modelFactory) {
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory");
    }

    /**
     * Forecast the value at {@code targetElapsedHours} on the samples' time axis.
     */
    public Forecast forecast(List<TimeSeriesSample> samples, double targetElapsedHours) {
        if (samples.size() < 2) {
            throw new InvalidInputException("At least 2 samples are required, got " + samples.size());
        }
        if (!Double.isFinite(targetElapsedHours)) {
            throw new InvalidInputException("Forecast target must be finite: " + targetElapsedHours);
        }

        double[][] x = new double[samples.size()][];
        double[] y = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            TimeSeriesSample sample = samples.get(i);
            x[i] = new double[]{sample.getElapsedHours()};
            y[i] = sample.getValue();
        }

        RegressionStrategy model = modelFactory.get();
        model.fit(x, y);

        double predicted = model.predict(new double[]{targetElapsedHours});
        double confidence = model.score(x, y);

        return new Forecast(predicted, confidence, targetElapsedHours, samples.size());
    }

    /**
     * Forecast {@code horizonHours} past the latest sample.
     */
    public Forecast forecastAhead(List<TimeSeriesSample> samples, double horizonHours) {
        return forecast(samples, latestElapsedHours(samples) + horizonHours);
    }

    public Forecast forecastAhead(List<TimeSeriesSample> samples) {
        return forecastAhead(samples, DEFAULT_HORIZON_HOURS);
    }

    private static double latestElapsedHours(List<TimeSeriesSample> samples) {
        if (samples.isEmpty()) {
            throw new InvalidInputException("At least 2 samples are required, got 0");
        }
        double latest = Double.NEGATIVE_INFINITY;
        for (TimeSeriesSample sample : samples) {
            latest = Math.max(latest, sample.getElapsedHours());
        }
        return latest;
    }
}
