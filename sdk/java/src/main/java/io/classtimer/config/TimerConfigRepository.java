package io.classtimer.config;

import io.classtimer.exception.StorageException;
import io.classtimer.store.JsonStorage;
import io.classtimer.timer.DurationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Loads and saves the {@link TimerConfig} under a single storage key.
 */
public final class TimerConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(TimerConfigRepository.class);

    /**
     * Storage key holding the timer configuration.
     */
    public static final String STORAGE_KEY = "classroom-timer-storage";

    /**
     * Version written with every saved configuration.
     */
    public static final int VERSION = 1;

    private final JsonStorage storage;

    public TimerConfigRepository(JsonStorage storage) {
        this.storage = storage;
    }

    /**
     * Loads the stored configuration. Missing, unreadable or newer-version
     * entries yield {@link TimerConfig#defaults()}.
     *
     * @return the configuration
     */
    public TimerConfig load() {
        Optional<StoredConfig> stored;
        try {
            stored = storage.getItem(STORAGE_KEY, StoredConfig.class);
        } catch (StorageException e) {
            log.warn("Ignoring unreadable timer configuration: {}", e.getMessage());
            return TimerConfig.defaults();
        }

        if (stored.isEmpty() || stored.get().config() == null) {
            return TimerConfig.defaults();
        }
        if (stored.get().version() > VERSION) {
            log.warn("Ignoring timer configuration with unsupported version {}", stored.get().version());
            return TimerConfig.defaults();
        }
        return stored.get().config();
    }

    /**
     * Saves the configuration, replacing the stored one.
     *
     * @param config the configuration
     */
    public void save(TimerConfig config) {
        storage.setItem(STORAGE_KEY, new StoredConfig(config, VERSION));
        log.debug("Timer configuration saved: {}", config);
    }

    /**
     * Applies a partial update to the stored configuration and saves the result.
     *
     * <pre>
     * repository.update(builder -&gt; builder.warningAt5Min(false));
     * </pre>
     *
     * @param update changes to apply
     * @return the saved configuration
     */
    public TimerConfig update(UnaryOperator<TimerConfig.Builder> update) {
        TimerConfig updated = update.apply(load().toBuilder()).build();
        save(updated);
        return updated;
    }

    /**
     * Records the duration used for the last timer, for quick restart.
     *
     * @param seconds the duration
     * @return the saved configuration
     * @throws io.classtimer.exception.InvalidDurationException if the duration is invalid
     */
    public TimerConfig rememberDuration(int seconds) {
        int duration = DurationParser.validateDuration(seconds).orElseThrow();
        return update(builder -> builder.lastUsedDuration(duration));
    }

    /**
     * Removes the stored configuration.
     */
    public void clear() {
        storage.removeItem(STORAGE_KEY);
    }

    /**
     * Stored form of the configuration.
     *
     * @param config the configuration
     * @param version the format version
     */
    public record StoredConfig(TimerConfig config, int version) {
    }
}
