package io.citysense.metrics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point forecast with its in-sample R² confidence.
 *
 * <p>The confidence is computed on the training samples, so it overstates how well the model
 * extrapolates. It can be negative for a fit worse than the mean.
 */
public final class Forecast {

    @JsonProperty("predicted_value")
    private final double predictedValue;

    @JsonProperty("confidence_score")
    private final double confidenceScore;

    @JsonProperty("target_elapsed_hours")
    private final double targetElapsedHours;

    @JsonProperty("sample_count")
    private final int sampleCount;

    public Forecast(double predictedValue, double confidenceScore, double targetElapsedHours, int sampleCount) {
        this.predictedValue = predictedValue;
        this.confidenceScore = confidenceScore;
        this.targetElapsedHours = targetElapsedHours;
        this.sampleCount = sampleCount;
    }

    public double getPredictedValue() { return predictedValue; }
    public double getConfidenceScore() { return confidenceScore; }
    public double getTargetElapsedHours() { return targetElapsedHours; }
    public int getSampleCount() { return sampleCount; }

    @Override
    public String toString() {
        return String.format("Forecast{value=%.3f, r2=%.3f, at=%.2fh, n=%d}",
                predictedValue, confidenceScore, targetElapsedHours, sampleCount);
    }
}
