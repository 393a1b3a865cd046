package io.citysense.metrics.aqi;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Air-quality status categories, ordered from least to most severe.
 */
public enum AqiCategory {
    GOOD("good"),
    MODERATE("moderate"),
    UNHEALTHY_SENSITIVE("unhealthy_sensitive"),
    UNHEALTHY("unhealthy"),
    VERY_UNHEALTHY("very_unhealthy"),
    HAZARDOUS("hazardous");

    private final String label;

    AqiCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isMoreSevereThan(AqiCategory other) {
        return compareTo(other) > 0;
    }
}
