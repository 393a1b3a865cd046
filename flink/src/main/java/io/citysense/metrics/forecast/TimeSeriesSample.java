package io.citysense.metrics.forecast;

/**
 * Regression input point: hours elapsed since the first observation of a series, and its value.
 */
public final class TimeSeriesSample {

    private final double elapsedHours;
    private final double value;

    public TimeSeriesSample(double elapsedHours, double value) {
        this.elapsedHours = elapsedHours;
        this.value = value;
    }

    public double getElapsedHours() { return elapsedHours; }
    public double getValue() { return value; }

    @Override
    public String toString() {
        return String.format("TimeSeriesSample{h=%.3f, value=%.3f}", elapsedHours, value);
    }
}
