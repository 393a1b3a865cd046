package io.citysense.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Prediction record published on ml.prediction and stored in the predictions table.
 * Exactly one of unit / quality_level / demand_level / risk_level is set, depending on the type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Prediction {

    @JsonProperty("service_type")
    private String serviceType;

    @JsonProperty("entity_id")
    private String entityId;

    @JsonProperty("prediction_type")
    private String predictionType;

    @JsonProperty("predicted_value")
    private double predictedValue;

    @JsonProperty("confidence_score")
    private double confidenceScore;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("timestamp_ms")
    private long timestampMs;

    @JsonProperty("unit")
    private String unit;

    @JsonProperty("quality_level")
    private String qualityLevel;

    @JsonProperty("demand_level")
    private String demandLevel;

    @JsonProperty("risk_level")
    private String riskLevel;

    public Prediction() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Prediction prediction = new Prediction();

        public Builder serviceType(String serviceType) { prediction.serviceType = serviceType; return this; }
        public Builder entityId(String entityId) { prediction.entityId = entityId; return this; }
        public Builder predictionType(String type) { prediction.predictionType = type; return this; }
        public Builder predictedValue(double value) { prediction.predictedValue = value; return this; }
        public Builder confidenceScore(double score) { prediction.confidenceScore = score; return this; }
        public Builder unit(String unit) { prediction.unit = unit; return this; }
        public Builder qualityLevel(String level) { prediction.qualityLevel = level; return this; }
        public Builder demandLevel(String level) { prediction.demandLevel = level; return this; }
        public Builder riskLevel(String level) { prediction.riskLevel = level; return this; }

        public Builder timestamp(Instant instant) {
            prediction.timestamp = instant.toString();
            prediction.timestampMs = instant.toEpochMilli();
            return this;
        }

        public Prediction build() { return prediction; }
    }

    // --- Getters ---
    public String getServiceType() { return serviceType; }
    public String getEntityId() { return entityId; }
    public String getPredictionType() { return predictionType; }
    public double getPredictedValue() { return predictedValue; }
    public double getConfidenceScore() { return confidenceScore; }
    public String getTimestamp() { return timestamp; }
    public long getTimestampMs() { return timestampMs; }
    public String getUnit() { return unit; }
    public String getQualityLevel() { return qualityLevel; }
    public String getDemandLevel() { return demandLevel; }
    public String getRiskLevel() { return riskLevel; }

    @Override
    public String toString() {
        return String.format("Prediction{%s/%s entity=%s value=%.3f r2=%.3f}",
                serviceType, predictionType, entityId, predictedValue, confidenceScore);
    }
}
