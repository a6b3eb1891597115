package io.classtimer.store;

import io.classtimer.exception.QuotaExceededException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory storage backend that keeps insertion order.
 * An optional quota caps the total size of keys plus values, in characters.
 */
public final class MemoryBackend implements StorageBackend {

    /**
     * Quota value meaning no limit.
     */
    public static final long UNLIMITED = -1;

    private final Map<String, String> data;
    private final long quota;

    public MemoryBackend() {
        this(UNLIMITED);
    }

    /**
     * Creates a backend that refuses writes beyond the given size.
     *
     * @param quota the maximum total size, or {@link #UNLIMITED}
     */
    public MemoryBackend(long quota) {
        if (quota < 0 && quota != UNLIMITED) {
            throw new IllegalArgumentException("Quota cannot be negative: " + quota);
        }
        this.data = Collections.synchronizedMap(new LinkedHashMap<>());
        this.quota = quota;
    }

    @Override
    public void set(String key, String value) {
        synchronized (data) {
            if (quota != UNLIMITED) {
                String previous = data.get(key);
                long current = size() - (previous != null ? key.length() + previous.length() : 0);
                if (current + key.length() + value.length() > quota) {
                    throw new QuotaExceededException(key, quota);
                }
            }
            data.put(key, value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public boolean delete(String key) {
        return data.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return data.containsKey(key);
    }

    @Override
    public List<String> keys() {
        synchronized (data) {
            return new ArrayList<>(data.keySet());
        }
    }

    @Override
    public void clear() {
        data.clear();
    }

    @Override
    public String getBackendName() {
        return "memory";
    }

    @Override
    public void close() {
        data.clear();
    }

    /**
     * Gets the number of entries.
     *
     * @return the entry count
     */
    public int count() {
        return data.size();
    }

    /**
     * Gets the total size of keys plus values.
     *
     * @return the size in characters
     */
    public long size() {
        synchronized (data) {
            long total = 0;
            for (Map.Entry<String, String> entry : data.entrySet()) {
                total += entry.getKey().length() + entry.getValue().length();
            }
            return total;
        }
    }

    public long getQuota() {
        return quota;
    }
}
