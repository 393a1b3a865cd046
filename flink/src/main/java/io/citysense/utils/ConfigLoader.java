package io.citysense.utils;

import io.citysense.metrics.aqi.SeverityScale;

import java.util.Optional;

/**
 * Configuration loader from environment variables.
 * No hardcoded secrets; fails fast on missing required keys.
 */
public final class ConfigLoader {

    private ConfigLoader() {}

    // --- Kafka Settings ---
    public static String kafkaBootstrapServers() {
        return getRequired("KAFKA_BOOTSTRAP_SERVERS");
    }

    public static String kafkaGroupId() {
        return getOrDefault("KAFKA_GROUP_ID", "citysense-flink");
    }

    public static String kafkaInputTopic() {
        return getOrDefault("KAFKA_INPUT_TOPIC", "airquality.raw");
    }

    public static String kafkaReadingTopic() {
        return getOrDefault("KAFKA_READING_TOPIC", "airquality.reading");
    }

    public static String kafkaAlertTopic() {
        return getOrDefault("KAFKA_ALERT_TOPIC", "airquality.alert");
    }

    public static String kafkaHourlyTopic() {
        return getOrDefault("KAFKA_HOURLY_TOPIC", "airquality.hourly");
    }

    public static String kafkaPredictionTopic() {
        return getOrDefault("KAFKA_PREDICTION_TOPIC", "ml.prediction");
    }

    // --- Redis Settings ---
    public static String redisHost() {
        return getOrDefault("REDIS_HOST", "redis");
    }

    public static int redisPort() {
        return Integer.parseInt(getOrDefault("REDIS_PORT", "6379"));
    }

    public static String redisPassword() {
        return getRequired("REDIS_PASSWORD");
    }

    public static String redisKeyPrefix() {
        return getOrDefault("REDIS_KEY_PREFIX", "current:station:");
    }

    // --- PostgreSQL Settings ---
    public static String postgresHost() {
        return getOrDefault("POSTGRES_HOST", "postgres");
    }

    public static int postgresPort() {
        return Integer.parseInt(getOrDefault("POSTGRES_PORT", "5432"));
    }

    public static String postgresDatabase() {
        return getOrDefault("POSTGRES_DB", "iot_platform");
    }

    public static String postgresUser() {
        return getRequired("POSTGRES_USER");
    }

    public static String postgresPassword() {
        return getRequired("POSTGRES_PASSWORD");
    }

    public static String postgresJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", postgresHost(), postgresPort(), postgresDatabase());
    }

    // --- Flink & Processing Settings ---
    public static long checkpointIntervalMs() {
        return Long.parseLong(getOrDefault("FLINK_CHECKPOINT_INTERVAL_MS", "60000"));
    }

    public static int parallelism() {
        return Integer.parseInt(getOrDefault("FLINK_PARALLELISM", "2"));
    }

    public static long stateTtlMinutes() {
        return Long.parseLong(getOrDefault("STATE_TTL_MINUTES", "1440"));
    }

    // --- Air Quality Analytics ---
    public static int aqiAlertThreshold() {
        return Integer.parseInt(getOrDefault("AQI_ALERT_THRESHOLD", "150"));
    }

    public static int aqiCriticalThreshold() {
        return Integer.parseInt(getOrDefault("AQI_CRITICAL_THRESHOLD", "200"));
    }

    public static int aqiHistorySize() {
        return Integer.parseInt(getOrDefault("AQI_HISTORY_SIZE", "48"));
    }

    public static SeverityScale aqiSeverityScale() {
        return SeverityScale.fromName(getOrDefault("AQI_SEVERITY_SCALE", "six_bin"));
    }

    public static int forecastMinSamples() {
        return Integer.parseInt(getOrDefault("FORECAST_MIN_SAMPLES", "10"));
    }

    public static double forecastHorizonHours() {
        return Double.parseDouble(getOrDefault("FORECAST_HORIZON_HOURS", "24"));
    }

    public static int forecastEveryNReadings() {
        return Integer.parseInt(getOrDefault("FORECAST_EVERY_N_READINGS", "12"));
    }

    // --- Helper Methods ---
    private static String getRequired(String key) {
        return Optional.ofNullable(System.getenv(key))
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new IllegalStateException(
                        "FATAL: Required environment variable not set or empty: " + key));
    }

    private static String getOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }
}
