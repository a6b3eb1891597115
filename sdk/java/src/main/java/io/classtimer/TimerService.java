package io.classtimer;

import io.classtimer.timer.DurationParser;
import io.classtimer.timer.ProgressCalculator;
import io.classtimer.timer.TimeFormatter;
import io.classtimer.timer.TimerResult;
import io.classtimer.timer.TimerStatus;
import io.classtimer.timer.TriggeredWarnings;
import io.classtimer.timer.WarningConfig;
import io.classtimer.timer.WarningDecision;
import io.classtimer.timer.WarningThresholds;

import java.util.Collection;
import java.util.List;

/**
 * Entry point for the timer calculations: formatting, progress, warnings,
 * status transitions and duration parsing. Every method is a pure function;
 * the caller owns the remaining time, the status and the triggered warnings.
 *
 * <pre>
 * TimerResult&lt;Integer&gt; duration = TimerService.parseTimeString("10:00");
 * List&lt;Integer&gt; thresholds = TimerService.calculateWarningThresholds(duration.getValue(), WarningConfig.all());
 *
 * String display = TimerService.formatTime(remaining);
 * double progress = TimerService.getProgress(remaining, duration.getValue());
 * </pre>
 */
public final class TimerService {

    private TimerService() {
        // Utility class
    }

    public static TimerResult<Integer> validateDuration(long seconds) {
        return DurationParser.validateDuration(seconds);
    }

    public static TimerResult<Integer> validateDuration(double seconds) {
        return DurationParser.validateDuration(seconds);
    }

    public static TimerResult<Integer> parseTimeString(String text) {
        return DurationParser.parseTimeString(text);
    }

    public static String formatTime(int seconds) {
        return TimeFormatter.formatTime(seconds);
    }

    public static String getReadableTimeRemaining(int seconds) {
        return TimeFormatter.getReadableTimeRemaining(seconds);
    }

    public static double getProgress(int remainingSeconds, int totalSeconds) {
        return ProgressCalculator.getProgress(remainingSeconds, totalSeconds);
    }

    public static List<Integer> calculateWarningThresholds(int totalSeconds, WarningConfig config) {
        return WarningThresholds.calculateWarningThresholds(totalSeconds, config);
    }

    public static boolean isInWarningZone(int remainingSeconds, Collection<Integer> thresholds) {
        return WarningThresholds.isInWarningZone(remainingSeconds, thresholds);
    }

    public static boolean hasWarningBeenTriggered(int threshold, TriggeredWarnings triggeredWarnings) {
        return WarningThresholds.hasWarningBeenTriggered(threshold, triggeredWarnings);
    }

    /**
     * Decides which warnings fire at the given remaining time.
     *
     * @see WarningThresholds#evaluate(int, Collection, TriggeredWarnings)
     */
    public static WarningDecision evaluateWarnings(int remainingSeconds,
                                                   Collection<Integer> thresholds,
                                                   TriggeredWarnings triggeredWarnings) {
        return WarningThresholds.evaluate(remainingSeconds, thresholds, triggeredWarnings);
    }

    public static boolean isValidTransition(TimerStatus current, TimerStatus next) {
        return TimerStatus.isValidTransition(current, next);
    }

    public static boolean isValidTransition(String current, String next) {
        return TimerStatus.isValidTransition(current, next);
    }
}
