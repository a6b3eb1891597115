package io.classtimer.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.classtimer.exception.StorageErrorCode;
import io.classtimer.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed JSON storage over a string {@link StorageBackend}.
 * Values are serialized with Jackson; entries written with an expiry are wrapped as
 * {@code {"value": ..., "expiry": <epoch millis>}}.
 *
 * <pre>
 * JsonStorage storage = JsonStorage.builder()
 *     .backend(new MemoryBackend())
 *     .build();
 *
 * storage.setItem("app-config", Map.of("theme", "dark"));
 * Map&lt;?, ?&gt; config = storage.getItem("app-config", Map.class).orElseThrow();
 * </pre>
 */
public final class JsonStorage implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonStorage.class);

    private static final String VALUE_FIELD = "value";
    private static final String EXPIRY_FIELD = "expiry";

    private final StorageBackend backend;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private JsonStorage(Builder builder) {
        this.backend = builder.backend != null ? builder.backend : new MemoryBackend();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper();
    }

    /**
     * Creates a new builder for JsonStorage.
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Gets a value by key.
     *
     * @param key the key
     * @param type the class to deserialize to
     * @param <T> the type
     * @return the value, or empty if the key is not stored
     * @throws StorageException with PARSE_ERROR if the stored text cannot be read as the type
     */
    public <T> Optional<T> getItem(String key, Class<T> type) {
        Optional<String> json = backend.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException e) {
            throw new StorageException(StorageErrorCode.PARSE_ERROR, key,
                "Failed to parse stored value for key \"" + key + "\": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Gets a value by key, or a default when the key is not stored.
     *
     * @param key the key
     * @param type the class to deserialize to
     * @param defaultValue returned when the key is missing
     * @param <T> the type
     * @return the value or the default
     * @throws StorageException with PARSE_ERROR if the stored text cannot be read as the type
     */
    public <T> T getItem(String key, Class<T> type, T defaultValue) {
        return getItem(key, type).orElse(defaultValue);
    }

    /**
     * Gets a value that must exist.
     *
     * @param key the key
     * @param type the class to deserialize to
     * @param <T> the type
     * @return the value
     * @throws StorageException with NOT_FOUND if the key is not stored
     */
    public <T> T requireItem(String key, Class<T> type) {
        return getItem(key, type).orElseThrow(() ->
            new StorageException(StorageErrorCode.NOT_FOUND, key, "No value stored for key \"" + key + "\""));
    }

    /**
     * Stores a value as JSON.
     *
     * @param key the key
     * @param value the value, must be serializable by Jackson
     * @throws StorageException with SERIALIZATION_ERROR if the value cannot be serialized
     * @throws io.classtimer.exception.QuotaExceededException if the backend is full
     */
    public void setItem(String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException(StorageErrorCode.SERIALIZATION_ERROR, key,
                "Value for key \"" + key + "\" is not JSON serializable: " + e.getOriginalMessage(), e);
        }
        backend.set(key, json);
    }

    public void removeItem(String key) {
        backend.delete(key);
    }

    /**
     * Removes every stored value.
     */
    public void clear() {
        backend.clear();
    }

    public boolean hasItem(String key) {
        return backend.exists(key);
    }

    public List<String> getAllKeys() {
        return backend.keys();
    }

    /**
     * Gets the approximate storage size: the length of every key plus its stored text.
     *
     * @return the total size
     */
    public long getStorageSize() {
        long total = 0;
        for (String key : backend.keys()) {
            Optional<String> value = backend.get(key);
            if (value.isPresent() && !value.get().isEmpty()) {
                total += key.length() + value.get().length();
            }
        }
        return total;
    }

    /**
     * Stores a value that expires after the given time.
     *
     * @param key the key
     * @param value the value
     * @param expiresIn time until expiry
     */
    public void setItemWithExpiry(String key, Object value, Duration expiresIn) {
        if (expiresIn == null || expiresIn.isNegative()) {
            throw new IllegalArgumentException("Expiry must be a non-negative duration");
        }
        Map<String, Object> wrapper = new LinkedHashMap<>();
        wrapper.put(VALUE_FIELD, value);
        wrapper.put(EXPIRY_FIELD, clock.millis() + expiresIn.toMillis());
        setItem(key, wrapper);
    }

    /**
     * Gets a value stored with {@link #setItemWithExpiry}. Expired entries are removed.
     * Unreadable entries yield the default.
     *
     * @param key the key
     * @param type the class to deserialize the value to
     * @param defaultValue returned when missing, expired or unreadable
     * @param <T> the type
     * @return the value or the default
     */
    public <T> T getItemWithExpiry(String key, Class<T> type, T defaultValue) {
        Optional<String> json = backend.get(key);
        if (json.isEmpty()) {
            return defaultValue;
        }

        try {
            JsonNode node = objectMapper.readTree(json.get());
            if (node == null || !node.isObject() || !node.has(EXPIRY_FIELD)) {
                log.warn("Stored value for key \"{}\" has no expiry, returning default", key);
                return defaultValue;
            }

            if (clock.millis() > node.get(EXPIRY_FIELD).asLong()) {
                backend.delete(key);
                log.debug("Value for key \"{}\" expired and was removed", key);
                return defaultValue;
            }

            JsonNode value = node.get(VALUE_FIELD);
            if (value == null || value.isNull()) {
                return defaultValue;
            }
            return objectMapper.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to read value for key \"{}\", returning default: {}", key, e.getOriginalMessage());
            return defaultValue;
        }
    }

    /**
     * Exports every entry. Values that are not valid JSON are exported as raw strings.
     *
     * @return a map of key to parsed value, in key order
     */
    public Map<String, Object> exportAll() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : backend.keys()) {
            Optional<String> value = backend.get(key);
            if (value.isEmpty() || value.get().isEmpty()) {
                continue;
            }
            try {
                result.put(key, objectMapper.readValue(value.get(), Object.class));
            } catch (JsonProcessingException e) {
                result.put(key, value.get());
            }
        }
        return result;
    }

    /**
     * Imports entries, optionally clearing existing data first.
     *
     * @param data the entries to store
     * @param replace true to clear all stored values before importing
     */
    public void importAll(Map<String, ?> data, boolean replace) {
        if (replace) {
            clear();
        }
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            setItem(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Exports every entry as a single JSON document.
     *
     * @return the JSON text
     */
    public String exportJson() {
        ObjectNode root = objectMapper.valueToTree(exportAll());
        return root.toString();
    }

    public StorageBackend getBackend() {
        return backend;
    }

    @Override
    public void close() {
        backend.close();
    }

    /**
     * Builder for JsonStorage.
     */
    public static class Builder {
        private StorageBackend backend;
        private ObjectMapper objectMapper;
        private Clock clock;

        public Builder backend(StorageBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder backend(String uri) {
            if (uri.equals("memory") || uri.equals("memory://")) {
                this.backend = new MemoryBackend();
            } else {
                throw new IllegalArgumentException("Unsupported backend URI: " + uri);
            }
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JsonStorage build() {
            return new JsonStorage(this);
        }
    }
}
