package io.classtimer.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.classtimer.timer.DurationParser;
import io.classtimer.timer.WarningConfig;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * User preferences for the timer. This is the only timer data kept in storage;
 * the countdown itself is never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE)
public final class TimerConfig {

    /**
     * Duration used when nothing has been remembered yet.
     */
    public static final int DEFAULT_DURATION_SECONDS = 300;

    private final boolean warningAt2Min;
    private final boolean warningAt5Min;
    private final List<Integer> customPresets;
    private final Integer lastUsedDuration;

    private TimerConfig(Builder builder) {
        this.warningAt2Min = builder.warningAt2Min;
        this.warningAt5Min = builder.warningAt5Min;
        this.customPresets = builder.customPresets != null ? List.copyOf(builder.customPresets) : List.of();
        this.lastUsedDuration = builder.lastUsedDuration;
    }

    @JsonCreator
    static TimerConfig fromJson(
            @JsonProperty("warningAt2Min") Boolean warningAt2Min,
            @JsonProperty("warningAt5Min") Boolean warningAt5Min,
            @JsonProperty("customPresets") List<Integer> customPresets,
            @JsonProperty("lastUsedDuration") Integer lastUsedDuration) {
        Builder builder = new Builder();
        if (warningAt2Min != null) {
            builder.warningAt2Min(warningAt2Min);
        }
        if (warningAt5Min != null) {
            builder.warningAt5Min(warningAt5Min);
        }
        return builder
            .customPresets(customPresets)
            .lastUsedDuration(lastUsedDuration)
            .build();
    }

    /**
     * Gets the default configuration: both warnings on, last duration five minutes.
     *
     * @return the defaults
     */
    public static TimerConfig defaults() {
        return new Builder().lastUsedDuration(DEFAULT_DURATION_SECONDS).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isWarningAt2Min() {
        return warningAt2Min;
    }

    public boolean isWarningAt5Min() {
        return warningAt5Min;
    }

    public List<Integer> getCustomPresets() {
        return customPresets;
    }

    public Optional<Integer> getLastUsedDuration() {
        return Optional.ofNullable(lastUsedDuration);
    }

    public WarningConfig toWarningConfig() {
        return new WarningConfig(warningAt2Min, warningAt5Min);
    }

    /**
     * Creates a builder pre-filled with this configuration, for partial updates.
     *
     * @return a new Builder
     */
    public Builder toBuilder() {
        return new Builder()
            .warningAt2Min(warningAt2Min)
            .warningAt5Min(warningAt5Min)
            .customPresets(customPresets)
            .lastUsedDuration(lastUsedDuration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimerConfig that = (TimerConfig) o;
        return warningAt2Min == that.warningAt2Min
            && warningAt5Min == that.warningAt5Min
            && customPresets.equals(that.customPresets)
            && Objects.equals(lastUsedDuration, that.lastUsedDuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(warningAt2Min, warningAt5Min, customPresets, lastUsedDuration);
    }

    @Override
    public String toString() {
        return "TimerConfig{" +
            "warningAt2Min=" + warningAt2Min +
            ", warningAt5Min=" + warningAt5Min +
            ", customPresets=" + customPresets +
            ", lastUsedDuration=" + lastUsedDuration +
            '}';
    }

    /**
     * Builder for TimerConfig.
     */
    public static class Builder {
        private boolean warningAt2Min = true;
        private boolean warningAt5Min = true;
        private List<Integer> customPresets;
        private Integer lastUsedDuration;

        public Builder warningAt2Min(boolean warningAt2Min) {
            this.warningAt2Min = warningAt2Min;
            return this;
        }

        public Builder warningAt5Min(boolean warningAt5Min) {
            this.warningAt5Min = warningAt5Min;
            return this;
        }

        public Builder customPresets(List<Integer> customPresets) {
            this.customPresets = customPresets;
            return this;
        }

        public Builder lastUsedDuration(Integer lastUsedDuration) {
            this.lastUsedDuration = lastUsedDuration;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws io.classtimer.exception.InvalidDurationException if a preset or the
         *         last used duration is not a valid duration
         */
        public TimerConfig build() {
            if (customPresets != null) {
                for (Integer preset : customPresets) {
                    DurationParser.validateDuration(Objects.requireNonNull(preset, "preset")).orElseThrow();
                }
            }
            if (lastUsedDuration != null) {
                DurationParser.validateDuration(lastUsedDuration).orElseThrow();
            }
            return new TimerConfig(this);
        }
    }
}
