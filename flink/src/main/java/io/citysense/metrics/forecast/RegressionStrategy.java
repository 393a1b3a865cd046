package io.citysense.metrics.forecast;

/**
 * Pluggable regression model.
 *
 * <p>Instances are stateful: {@link #predict} and {@link #score} are only valid after a
 * successful {@link #fit}. Callers that need a fresh model per request take a factory rather
 * than a shared instance.
 */
public interface RegressionStrategy {

    /**
     * Train on {@code features[i]} → {@code labels[i]}.
     *
     * @throws io.citysense.metrics.InvalidInputException if the data cannot be fitted
     */
    void fit(double[][] features, double[] labels);

    double predict(double[] features);

    /**
     * Coefficient of determination of this model's predictions against {@code labels}.
     */
    double score(double[][] features, double[] labels);
}
