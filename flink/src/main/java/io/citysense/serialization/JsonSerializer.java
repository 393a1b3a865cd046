package io.citysense.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * JSON value schema for the output topics (readings, alerts, hourly aggregates, predictions).
 *
 * <p>Output records are our own POJOs, so a serialization failure is a bug and fails the job
 * instead of publishing an empty value.
 */
public class JsonSerializer<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public void open(InitializationContext context) {
        mapper = ObjectMappers.create();
    }

    @Override
    public byte[] serialize(T element) {
        if (mapper == null) {
            mapper = ObjectMappers.create();
        }
        try {
            return mapper.writeValueAsBytes(element);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + element.getClass().getSimpleName(), e);
        }
    }
}
