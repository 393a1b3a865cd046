package io.citysense.metrics.prediction;

/**
 * Water sensor reading used as leak-risk training data. Missing flow or pressure counts as 0.
 */
public final class WaterObservation {

    private final Double flowRate;
    private final Double pressure;
    private final boolean leakDetected;

    public WaterObservation(Double flowRate, Double pressure, boolean leakDetected) {
        this.flowRate = flowRate;
        this.pressure = pressure;
        this.leakDetected = leakDetected;
    }

    public Double getFlowRate() { return flowRate; }
    public Double getPressure() { return pressure; }
    public boolean isLeakDetected() { return leakDetected; }

    double[] features() {
        return new double[]{
                flowRate != null ? flowRate : 0.0,
                pressure != null ? pressure : 0.0
        };
    }

    double label() {
        return leakDetected ? 1.0 : 0.0;
    }
}
