package io.citysense.metrics.prediction;

import io.citysense.metrics.InvalidInputException;

/**
 * Prediction kinds produced by the analytics layer, with the history each one needs.
 */
public enum PredictionType {
    ENERGY_CONSUMPTION("energy", "consumption_24h", 10),
    AIR_QUALITY("air_quality", "aqi_24h", 10),
    TRANSPORT_DEMAND("transport", "passenger_demand", 10),
    LEAK_PROBABILITY("water", "leak_probability", 20);

    private final String serviceType;
    private final String typeName;
    private final int minimumSamples;

    PredictionType(String serviceType, String typeName, int minimumSamples) {
        this.serviceType = serviceType;
        this.typeName = typeName;
        this.minimumSamples = minimumSamples;
    }

    public String getServiceType() { return serviceType; }
    public String getTypeName() { return typeName; }
    public int getMinimumSamples() { return minimumSamples; }

    public void requireSamples(int available) {
        if (available < minimumSamples) {
            throw new InvalidInputException(String.format(
                    "Insufficient historical data for prediction: %s needs %d samples, got %d",
                    typeName, minimumSamples, available));
        }
    }
}
