package forcelink.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import forcelink.domain.exceptions.DeserializationFailed;
import forcelink.domain.exceptions.SerializationFailed;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.Map;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    @Inject
    private Instance<SimpleModule> modules;

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object object) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(SerializationFailed::new);
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.readValue(json, clazz))
                .onFailure(ex -> logger.warning("Failed to deserialize object of type " + clazz.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(DeserializationFailed::new);
    }

    @Override
    public <U, V> Map<U, V> deserializeMap(final String json, final Class<U> key, final Class<V> value) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.<Map<U, V>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructMapType(Map.class, key, value)))
                .onFailure(ex -> logger.warning("Failed to deserialize map of type " + key.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(DeserializationFailed::new);
    }

    private ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        if (modules != null) {
            objectMapper.registerModules(modules);
        }
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return objectMapper;
    }
}
