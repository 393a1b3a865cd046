package io.citysense.sinks;

import io.citysense.models.AirQualityAlert;
import io.citysense.models.Prediction;
import org.apache.flink.connector.jdbc.JdbcConnectionOptions;
import org.apache.flink.connector.jdbc.JdbcExecutionOptions;
import org.apache.flink.connector.jdbc.JdbcSink;
import org.apache.flink.streaming.api.functions.sink.SinkFunction;

/**
 * JDBC sinks writing alerts and predictions into the platform's shared PostgreSQL tables.
 */
public class PostgresSink {

    static final String INSERT_ALERT_SQL = "INSERT INTO alerts (" +
        "service_type, entity_id, alert_type, severity, message, timestamp" +
        ") VALUES (" +
        "?, ?, ?, ?, ?, to_timestamp(?/1000.0))";

    static final String INSERT_PREDICTION_SQL = "INSERT INTO predictions (" +
        "service_type, entity_id, prediction_type, " +
        "predicted_value, confidence_score, timestamp" +
        ") VALUES (" +
        "?, ?, ?, " +
        "?, ?, to_timestamp(?/1000.0))";

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public PostgresSink(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    /**
     * Create a sink for AirQualityAlert records.
     */
    public SinkFunction<AirQualityAlert> createAlertSink() {
        return JdbcSink.sink(
            INSERT_ALERT_SQL,
            (statement, alert) -> {
                statement.setString(1, alert.getServiceType());
                statement.setString(2, alert.getStationId());
                statement.setString(3, alert.getAlertType());
                statement.setString(4, alert.getSeverity());
                statement.setString(5, alert.getMessage());
                statement.setLong(6, alert.getEventTimeMs());
            },
            JdbcExecutionOptions.builder()
                .withBatchSize(50)
                .withBatchIntervalMs(1000)
                .withMaxRetries(3)
                .build(),
            connectionOptions()
        );
    }

    /**
     * Create a sink for Prediction records.
     */
    public SinkFunction<Prediction> createPredictionSink() {
        return JdbcSink.sink(
            INSERT_PREDICTION_SQL,
            (statement, prediction) -> {
                statement.setString(1, prediction.getServiceType());
                statement.setString(2, prediction.getEntityId());
                statement.setString(3, prediction.getPredictionType());
                statement.setDouble(4, prediction.getPredictedValue());
                statement.setDouble(5, prediction.getConfidenceScore());
                statement.setLong(6, prediction.getTimestampMs());
            },
            JdbcExecutionOptions.builder()
                .withBatchSize(100)
                .withBatchIntervalMs(1000)
                .withMaxRetries(3)
                .build(),
            connectionOptions()
        );
    }

    private JdbcConnectionOptions connectionOptions() {
        return new JdbcConnectionOptions.JdbcConnectionOptionsBuilder()
            .withUrl(jdbcUrl)
            .withDriverName("org.postgresql.Driver")
            .withUsername(username)
            .withPassword(password)
            .build();
    }
}
