package io.citysense.metrics.aqi;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pollutants reported by air-quality stations.
 */
public enum Pollutant {
    PM25("pm25"),
    PM10("pm10"),
    CO("co"),
    NO2("no2"),
    O3("o3");

    private final String fieldName;

    Pollutant(String fieldName) {
        this.fieldName = fieldName;
    }

    @JsonValue
    public String getFieldName() {
        return fieldName;
    }
}
