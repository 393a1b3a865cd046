package io.citysense.metrics.aqi;

import io.citysense.metrics.InvalidInputException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of pollutant concentrations from a single measurement.
 * A pollutant without a value was not measured.
 */
public final class PollutantReading {

    private static final PollutantReading EMPTY = new PollutantReading(new EnumMap<>(Pollutant.class));

    private final Map<Pollutant, Double> concentrations;

    private PollutantReading(EnumMap<Pollutant, Double> concentrations) {
        this.concentrations = Collections.unmodifiableMap(concentrations);
    }

    public static PollutantReading empty() {
        return EMPTY;
    }

    /**
     * Reading with only the particulate matter values set; either may be null.
     */
    public static PollutantReading of(Double pm25, Double pm10) {
        return builder().pm25(pm25).pm10(pm10).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return concentration, or null when the pollutant was not measured
     */
    public Double get(Pollutant pollutant) {
        return concentrations.get(pollutant);
    }

    public boolean isMeasured(Pollutant pollutant) {
        return concentrations.containsKey(pollutant);
    }

    public Map<Pollutant, Double> asMap() {
        return concentrations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PollutantReading)) return false;
        return concentrations.equals(((PollutantReading) o).concentrations);
    }

    @Override
    public int hashCode() {
        return concentrations.hashCode();
    }

    @Override
    public String toString() {
        return "PollutantReading" + concentrations;
    }

    public static class Builder {
        private final EnumMap<Pollutant, Double> values = new EnumMap<>(Pollutant.class);

        public Builder pm25(Double value) { return set(Pollutant.PM25, value); }
        public Builder pm10(Double value) { return set(Pollutant.PM10, value); }
        public Builder co(Double value) { return set(Pollutant.CO, value); }
        public Builder no2(Double value) { return set(Pollutant.NO2, value); }
        public Builder o3(Double value) { return set(Pollutant.O3, value); }

        public Builder set(Pollutant pollutant, Double value) {
            if (value == null) {
                values.remove(pollutant);
                return this;
            }
            if (value.isNaN() || value < 0) {
                throw new InvalidInputException(
                        "Concentration for " + pollutant.getFieldName() + " must be a non-negative number: " + value);
            }
            values.put(pollutant, value);
            return this;
        }

        public PollutantReading build() {
            return values.isEmpty() ? EMPTY : new PollutantReading(new EnumMap<>(values));
        }
    }
}
