package io.classtimer.config;

import java.util.Optional;

/**
 * Quick-start timer durations.
 */
public enum TimerPreset {
    FIVE_MINUTES(300),
    TEN_MINUTES(600),
    FIFTEEN_MINUTES(900),
    THIRTY_MINUTES(1800);

    private final int seconds;

    TimerPreset(int seconds) {
        this.seconds = seconds;
    }

    public int getSeconds() {
        return seconds;
    }

    public int getMinutes() {
        return seconds / 60;
    }

    /**
     * Finds the preset with the given duration.
     *
     * @param seconds the duration in seconds
     * @return the preset, or empty if none matches
     */
    public static Optional<TimerPreset> fromSeconds(int seconds) {
        for (TimerPreset preset : values()) {
            if (preset.seconds == seconds) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
