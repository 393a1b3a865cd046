package io.citysense.metrics.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Passenger demand buckets for a predicted average passenger count.
 */
public enum DemandLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private static final double HIGH_ABOVE = 30.0;
    private static final double MEDIUM_ABOVE = 15.0;

    private final String label;

    DemandLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static DemandLevel fromPassengers(double predictedPassengers) {
        if (predictedPassengers > HIGH_ABOVE) return HIGH;
        if (predictedPassengers > MEDIUM_ABOVE) return MEDIUM;
        return LOW;
    }
}
