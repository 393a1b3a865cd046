package io.citysense.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.citysense.models.AirQualityReading;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON deserializer for raw station readings.
 * Malformed records are logged and dropped (null), never rethrown.
 */
public class AirQualityReadingDeserializer implements DeserializationSchema<AirQualityReading> {

    private static final Logger LOG = LoggerFactory.getLogger(AirQualityReadingDeserializer.class);
    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public void open(InitializationContext context) {
        mapper = ObjectMappers.create();
    }

    @Override
    public AirQualityReading deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }

        if (mapper == null) {
            mapper = ObjectMappers.create();
        }

        try {
            return mapper.readValue(message, AirQualityReading.class);
        } catch (Exception e) {
            LOG.warn("Dropped malformed air quality reading. Error: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(AirQualityReading nextElement) {
        return false;
    }

    @Override
    public TypeInformation<AirQualityReading> getProducedType() {
        return TypeInformation.of(AirQualityReading.class);
    }
}
