package io.citysense.metrics.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Water leak risk buckets for a predicted leak probability.
 */
public enum LeakRiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private static final double HIGH_ABOVE = 0.7;
    private static final double MEDIUM_ABOVE = 0.3;

    private final String label;

    LeakRiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static LeakRiskLevel fromProbability(double probability) {
        if (probability > HIGH_ABOVE) return HIGH;
        if (probability > MEDIUM_ABOVE) return MEDIUM;
        return LOW;
    }
}
