package io.classtimer.engine;

import io.classtimer.timer.ProgressCalculator;
import io.classtimer.timer.TimeFormatter;
import io.classtimer.timer.TimerStatus;
import io.classtimer.timer.TriggeredWarnings;
import io.classtimer.timer.WarningThresholds;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a countdown timer. Produced and consumed by {@link TimerEngine}.
 */
public final class TimerState {

    private static final TimerState INITIAL = new Builder().build();

    private final int remainingSeconds;
    private final int totalSeconds;
    private final TimerStatus status;
    private final List<Integer> warningThresholds;
    private final TriggeredWarnings triggeredWarnings;

    private TimerState(Builder builder) {
        this.remainingSeconds = builder.remainingSeconds;
        this.totalSeconds = builder.totalSeconds;
        this.status = builder.status;
        this.warningThresholds = List.copyOf(builder.warningThresholds);
        this.triggeredWarnings = builder.triggeredWarnings;
    }

    /**
     * Gets the state of a timer with no duration set.
     *
     * @return the initial state
     */
    public static TimerState initial() {
        return INITIAL;
    }

    public int getRemainingSeconds() {
        return remainingSeconds;
    }

    public int getTotalSeconds() {
        return totalSeconds;
    }

    public TimerStatus getStatus() {
        return status;
    }

    public List<Integer> getWarningThresholds() {
        return warningThresholds;
    }

    public TriggeredWarnings getTriggeredWarnings() {
        return triggeredWarnings;
    }

    public boolean isIdle() {
        return status == TimerStatus.IDLE;
    }

    public boolean isRunning() {
        return status == TimerStatus.RUNNING;
    }

    public boolean isPaused() {
        return status == TimerStatus.PAUSED;
    }

    public boolean isCompleted() {
        return status == TimerStatus.COMPLETED;
    }

    public String getFormattedTime() {
        return TimeFormatter.formatTime(remainingSeconds);
    }

    public double getProgress() {
        return ProgressCalculator.getProgress(remainingSeconds, totalSeconds);
    }

    public boolean isInWarningZone() {
        return WarningThresholds.isInWarningZone(remainingSeconds, warningThresholds);
    }

    public Builder toBuilder() {
        return new Builder()
            .remainingSeconds(remainingSeconds)
            .totalSeconds(totalSeconds)
            .status(status)
            .warningThresholds(warningThresholds)
            .triggeredWarnings(triggeredWarnings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimerState that = (TimerState) o;
        return remainingSeconds == that.remainingSeconds
            && totalSeconds == that.totalSeconds
            && status == that.status
            && warningThresholds.equals(that.warningThresholds)
            && triggeredWarnings.equals(that.triggeredWarnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(remainingSeconds, totalSeconds, status, warningThresholds, triggeredWarnings);
    }

    @Override
    public String toString() {
        return "TimerState{" +
            "remaining=" + remainingSeconds +
            ", total=" + totalSeconds +
            ", status=" + status +
            ", thresholds=" + warningThresholds +
            ", triggered=" + triggeredWarnings.asSet() +
            '}';
    }

    /**
     * Builder for TimerState.
     */
    public static class Builder {
        private int remainingSeconds;
        private int totalSeconds;
        private TimerStatus status = TimerStatus.IDLE;
        private List<Integer> warningThresholds = List.of();
        private TriggeredWarnings triggeredWarnings = TriggeredWarnings.empty();

        public Builder remainingSeconds(int remainingSeconds) {
            this.remainingSeconds = remainingSeconds;
            return this;
        }

        public Builder totalSeconds(int totalSeconds) {
            this.totalSeconds = totalSeconds;
            return this;
        }

        public Builder status(TimerStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder warningThresholds(List<Integer> warningThresholds) {
            this.warningThresholds = Objects.requireNonNull(warningThresholds, "warningThresholds");
            return this;
        }

        public Builder triggeredWarnings(TriggeredWarnings triggeredWarnings) {
            this.triggeredWarnings = Objects.requireNonNull(triggeredWarnings, "triggeredWarnings");
            return this;
        }

        public TimerState build() {
            if (remainingSeconds < 0 || totalSeconds < 0) {
                throw new IllegalArgumentException("Seconds cannot be negative");
            }
            return new TimerState(this);
        }
    }
}
