package io.classtimer.store;

import java.util.List;
import java.util.Optional;

/**
 * Interface for string key-value stores backing {@link JsonStorage}.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Stores a value with the specified key, replacing any previous value.
     *
     * @param key the key
     * @param value the value
     * @throws io.classtimer.exception.QuotaExceededException if the backend is full
     */
    void set(String key, String value);

    /**
     * Gets a value by key.
     *
     * @param key the key
     * @return the value, or empty if not found
     */
    Optional<String> get(String key);

    /**
     * Deletes a value by key.
     *
     * @param key the key
     * @return true if the key existed and was deleted
     */
    boolean delete(String key);

    /**
     * Checks if a key exists.
     *
     * @param key the key
     * @return true if the key exists
     */
    boolean exists(String key);

    /**
     * Gets all keys, in insertion order where the backend keeps one.
     *
     * @return the keys
     */
    List<String> keys();

    /**
     * Removes every entry.
     */
    void clear();

    /**
     * Gets the name of this backend type.
     *
     * @return the backend name
     */
    String getBackendName();

    /**
     * Closes the backend and releases resources.
     */
    @Override
    void close();
}
