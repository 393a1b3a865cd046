package io.citysense;

import io.citysense.functions.AqiAggregateFunction;
import io.citysense.functions.AqiAnalyticsSettings;
import io.citysense.functions.AqiEnrichmentFunction;
import io.citysense.models.AirQualityAlert;
import io.citysense.models.AirQualityReading;
import io.citysense.models.EnrichedReading;
import io.citysense.models.HourlyAqiAggregate;
import io.citysense.models.Prediction;
import io.citysense.serialization.AirQualityReadingDeserializer;
import io.citysense.serialization.JsonSerializer;
import io.citysense.sinks.PostgresSink;
import io.citysense.sinks.RedisSink;
import io.citysense.utils.ConfigLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CitySense air quality analytics job.
 * Enriches station readings with AQI, raises alerts, forecasts AQI per station and
 * aggregates hourly trends.
 */
public class CitySenseFlinkApp {

    private static final Logger LOG = LoggerFactory.getLogger(CitySenseFlinkApp.class);

    private static final int WINDOW_SIZE_HOURS = 1;
    private static final int ALLOWED_LATENESS_MINUTES = 5;

    public static void main(String[] args) throws Exception {
        LOG.info("Starting CitySense air quality analytics");

        // 1. Environment Configuration
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(ConfigLoader.parallelism());

        env.enableCheckpointing(ConfigLoader.checkpointIntervalMs());
        env.getCheckpointConfig().setCheckpointingMode(CheckpointingMode.EXACTLY_ONCE);
        env.getCheckpointConfig().setMinPauseBetweenCheckpoints(5000);

        String bootstrapServers = ConfigLoader.kafkaBootstrapServers();

        // 2. Kafka Source Setup
        KafkaSource<AirQualityReading> source = KafkaSource.<AirQualityReading>builder()
                .setBootstrapServers(bootstrapServers)
                .setTopics(ConfigLoader.kafkaInputTopic())
                .setGroupId(ConfigLoader.kafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new AirQualityReadingDeserializer())
                .build();

        WatermarkStrategy<AirQualityReading> watermarkStrategy = WatermarkStrategy
                .<AirQualityReading>forBoundedOutOfOrderness(Duration.ofMinutes(ALLOWED_LATENESS_MINUTES))
                .withTimestampAssigner((reading, timestamp) -> reading.getEventTimeMs())
                .withIdleness(Duration.ofMinutes(1));

        // 3. Processing Pipeline
        DataStream<AirQualityReading> readings = env
                .fromSource(source, watermarkStrategy, "kafka-source")
                .filter(reading -> reading != null && reading.isValid())
                .name("filter-invalid-readings");

        SingleOutputStreamOperator<EnrichedReading> enriched = readings
                .keyBy(AirQualityReading::getStationId)
                .process(new AqiEnrichmentFunction(AqiAnalyticsSettings.fromEnvironment()))
                .name("aqi-enrichment");

        DataStream<AirQualityAlert> alerts = enriched.getSideOutput(AqiEnrichmentFunction.ALERT_TAG);
        DataStream<Prediction> predictions = enriched.getSideOutput(AqiEnrichmentFunction.PREDICTION_TAG);

        DataStream<HourlyAqiAggregate> hourly = enriched
                .keyBy(EnrichedReading::getStationId)
                .window(TumblingEventTimeWindows.of(Time.hours(WINDOW_SIZE_HOURS)))
                .aggregate(new AqiAggregateFunction())
                .filter(aggregate -> aggregate != null)
                .name("hourly-aqi-aggregation");

        // 4. Sinks
        enriched.sinkTo(kafkaSink(bootstrapServers, ConfigLoader.kafkaReadingTopic(), new JsonSerializer<EnrichedReading>()))
                .name("kafka-sink-readings");
        alerts.sinkTo(kafkaSink(bootstrapServers, ConfigLoader.kafkaAlertTopic(), new JsonSerializer<AirQualityAlert>()))
                .name("kafka-sink-alerts");
        predictions.sinkTo(kafkaSink(bootstrapServers, ConfigLoader.kafkaPredictionTopic(), new JsonSerializer<Prediction>()))
                .name("kafka-sink-predictions");
        hourly.sinkTo(kafkaSink(bootstrapServers, ConfigLoader.kafkaHourlyTopic(), new JsonSerializer<HourlyAqiAggregate>()))
                .name("kafka-sink-hourly");

        PostgresSink postgres = new PostgresSink(
                ConfigLoader.postgresJdbcUrl(),
                ConfigLoader.postgresUser(),
                ConfigLoader.postgresPassword());

        alerts.addSink(postgres.createAlertSink()).name("postgres-sink-alerts");
        predictions.addSink(postgres.createPredictionSink()).name("postgres-sink-predictions");

        enriched.addSink(new RedisSink()).name("redis-current-conditions");

        LOG.info("CitySense topology submitted to JobManager.");
        env.execute("CitySense Air Quality Analytics");
    }

    private static <T> KafkaSink<T> kafkaSink(String bootstrapServers, String topic, JsonSerializer<T> serializer) {
        return KafkaSink.<T>builder()
                .setBootstrapServers(bootstrapServers)
                .setRecordSerializer(KafkaRecordSerializationSchema.<T>builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(serializer)
                        .build())
                .build();
    }
}
