package io.classtimer.config;

import io.classtimer.exception.InvalidDurationException;
import io.classtimer.store.JsonStorage;
import io.classtimer.store.MemoryBackend;
import io.classtimer.timer.WarningConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timer Config Repository Tests")
class TimerConfigRepositoryTest {

    private MemoryBackend backend;
    private JsonStorage storage;
    private TimerConfigRepository repository;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
        storage = JsonStorage.builder().backend(backend).build();
        repository = new TimerConfigRepository(storage);
    }

    @Test
    @DisplayName("Load returns defaults when nothing is stored")
    void testLoadDefaults() {
        TimerConfig config = repository.load();

        assertEquals(TimerConfig.defaults(), config);
        assertTrue(config.isWarningAt2Min());
        assertTrue(config.isWarningAt5Min());
        assertEquals(Optional.of(300), config.getLastUsedDuration());
        assertTrue(config.getCustomPresets().isEmpty());
        assertEquals(WarningConfig.all(), config.toWarningConfig());
    }

    @Test
    @DisplayName("Save then load returns the same configuration")
    void testSaveAndLoad() {
        TimerConfig config = TimerConfig.builder()
            .warningAt2Min(false)
            .warningAt5Min(true)
            .customPresets(List.of(90, 420))
            .lastUsedDuration(900)
            .build();

        repository.save(config);

        assertEquals(config, repository.load());
        assertTrue(backend.exists(TimerConfigRepository.STORAGE_KEY));
    }

    @Test
    @DisplayName("Stored JSON holds the configuration and a version")
    void testStoredFormat() {
        repository.save(TimerConfig.defaults());

        Map<?, ?> stored = storage.getItem(TimerConfigRepository.STORAGE_KEY, Map.class).orElseThrow();
        assertEquals(1, stored.get("version"));
        Map<?, ?> config = (Map<?, ?>) stored.get("config");
        assertEquals(true, config.get("warningAt2Min"));
        assertEquals(true, config.get("warningAt5Min"));
        assertEquals(300, config.get("lastUsedDuration"));
        assertEquals(List.of(), config.get("customPresets"));
    }

    @Test
    @DisplayName("Missing fields fall back to defaults")
    void testPartialJson() {
        backend.set(TimerConfigRepository.STORAGE_KEY, "{\"config\":{\"warningAt5Min\":false},\"version\":1}");

        TimerConfig config = repository.load();

        assertTrue(config.isWarningAt2Min());
        assertFalse(config.isWarningAt5Min());
        assertTrue(config.getLastUsedDuration().isEmpty());
    }

    @Test
    @DisplayName("Corrupt or newer entries load as defaults")
    void testCorruptEntry() {
        backend.set(TimerConfigRepository.STORAGE_KEY, "{broken");
        assertEquals(TimerConfig.defaults(), repository.load());

        backend.set(TimerConfigRepository.STORAGE_KEY, "{\"config\":{\"lastUsedDuration\":0},\"version\":1}");
        assertEquals(TimerConfig.defaults(), repository.load());

        backend.set(TimerConfigRepository.STORAGE_KEY, "{\"config\":{\"warningAt2Min\":false},\"version\":2}");
        assertEquals(TimerConfig.defaults(), repository.load());
    }

    @Test
    @DisplayName("Update merges a partial change")
    void testUpdate() {
        repository.save(TimerConfig.builder().customPresets(List.of(60)).lastUsedDuration(600).build());

        TimerConfig updated = repository.update(builder -> builder.warningAt5Min(false));

        assertFalse(updated.isWarningAt5Min());
        assertEquals(List.of(60), updated.getCustomPresets());
        assertEquals(Optional.of(600), updated.getLastUsedDuration());
        assertEquals(updated, repository.load());
    }

    @Test
    @DisplayName("rememberDuration records the last used duration")
    void testRememberDuration() {
        repository.rememberDuration(1800);
        assertEquals(Optional.of(1800), repository.load().getLastUsedDuration());

        assertThrows(InvalidDurationException.class, () -> repository.rememberDuration(0));
    }

    @Test
    @DisplayName("Invalid presets are rejected")
    void testInvalidPresets() {
        assertThrows(InvalidDurationException.class,
            () -> TimerConfig.builder().customPresets(List.of(60, 0)).build());
        assertThrows(InvalidDurationException.class,
            () -> TimerConfig.builder().lastUsedDuration(90000).build());
    }

    @Test
    @DisplayName("Clear removes the stored configuration")
    void testClear() {
        repository.save(TimerConfig.defaults());
        repository.clear();

        assertFalse(backend.exists(TimerConfigRepository.STORAGE_KEY));
    }

    @Test
    @DisplayName("Presets map to their durations")
    void testPresets() {
        assertEquals(300, TimerPreset.FIVE_MINUTES.getSeconds());
        assertEquals(30, TimerPreset.THIRTY_MINUTES.getMinutes());
        assertEquals(Optional.of(TimerPreset.FIFTEEN_MINUTES), TimerPreset.fromSeconds(900));
        assertTrue(TimerPreset.fromSeconds(120).isEmpty());
    }
}
