package io.citysense.sinks;

import io.citysense.models.EnrichedReading;
import io.citysense.utils.ConfigLoader;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.sink.RichSinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sink keeping the latest conditions of every station in Redis.
 * A station that has not reported within the TTL disappears from the current view.
 */
public class RedisSink extends RichSinkFunction<EnrichedReading> {

    private static final Logger LOG = LoggerFactory.getLogger(RedisSink.class);
    private static final int CURRENT_CONDITIONS_TTL_SECONDS = 3600;

    private transient JedisPool jedisPool;
    private transient String keyPrefix;

    @Override
    public void open(Configuration parameters) {
        String host = ConfigLoader.redisHost();
        int port = ConfigLoader.redisPort();
        String password = ConfigLoader.redisPassword();
        keyPrefix = ConfigLoader.redisKeyPrefix();

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(20);
        poolConfig.setMaxWait(Duration.ofSeconds(5));

        jedisPool = new JedisPool(poolConfig, host, port, 2000, password);
        LOG.info("Redis sink initialized for host {}:{}", host, port);
    }

    @Override
    public void invoke(EnrichedReading reading, Context context) {
        String key = keyPrefix + reading.getStationId();

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.hset(key, toFields(reading));
            jedis.expire(key, CURRENT_CONDITIONS_TTL_SECONDS);
        } catch (Exception e) {
            LOG.error("Redis Sink Error [key={}]: {}", key, e.getMessage());
        }
    }

    /**
     * Hash fields for a station's current conditions; unmeasured values are omitted.
     */
    static Map<String, String> toFields(EnrichedReading reading) {
        Map<String, String> fields = new HashMap<>();
        fields.put("station_id", reading.getStationId());
        fields.put("last_update", reading.getTimestamp());
        fields.put("aqi", String.valueOf(reading.getAqi()));
        fields.put("status", reading.getStatus());
        fields.put("aqi_trend", String.format(Locale.ROOT, "%.4f", reading.getAqiTrend()));
        putIfPresent(fields, "pm25", reading.getPm25());
        putIfPresent(fields, "pm10", reading.getPm10());
        putIfPresent(fields, "co2", reading.getCo2());
        putIfPresent(fields, "temperature", reading.getTemperature());
        putIfPresent(fields, "humidity", reading.getHumidity());
        return fields;
    }

    private static void putIfPresent(Map<String, String> fields, String name, Double value) {
        if (value != null) {
            fields.put(name, String.valueOf(value));
        }
    }

    @Override
    public void close() {
        if (jedisPool != null) {
            jedisPool.close();
            LOG.info("Redis connection pool closed.");
        }
    }
}
