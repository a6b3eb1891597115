package io.classtimer.timer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Computes warning thresholds and decides when a warning fires.
 */
public final class WarningThresholds {

    /**
     * Two minutes remaining.
     */
    public static final int TWO_MINUTES = 120;

    /**
     * Five minutes remaining.
     */
    public static final int FIVE_MINUTES = 300;

    private WarningThresholds() {
        // Utility class
    }

    /**
     * Gets the thresholds that apply to a duration. A threshold applies only
     * when the duration is strictly longer than it.
     *
     * @param totalSeconds the timer duration
     * @param config which warnings are enabled
     * @return the thresholds in ascending order
     */
    public static List<Integer> calculateWarningThresholds(int totalSeconds, WarningConfig config) {
        List<Integer> thresholds = new ArrayList<>(2);

        if (config.warningAt2Min() && totalSeconds > TWO_MINUTES) {
            thresholds.add(TWO_MINUTES);
        }
        if (config.warningAt5Min() && totalSeconds > FIVE_MINUTES) {
            thresholds.add(FIVE_MINUTES);
        }

        return List.copyOf(thresholds);
    }

    /**
     * Checks whether the remaining time is at or below any threshold.
     *
     * @param remainingSeconds seconds remaining
     * @param thresholds the thresholds to check against
     * @return true if in any warning zone
     */
    public static boolean isInWarningZone(int remainingSeconds, Collection<Integer> thresholds) {
        for (int threshold : thresholds) {
            if (remainingSeconds <= threshold) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a threshold was already fired during the current run.
     *
     * @param threshold the threshold
     * @param triggeredWarnings the thresholds fired so far
     * @return true if already fired
     */
    public static boolean hasWarningBeenTriggered(int threshold, TriggeredWarnings triggeredWarnings) {
        return triggeredWarnings.contains(threshold);
    }

    /**
     * Decides which warnings fire at the given remaining time. A threshold fires
     * once, on the tick where the remaining time equals it.
     *
     * @param remainingSeconds seconds remaining after the tick
     * @param thresholds the thresholds in effect
     * @param triggeredWarnings the thresholds fired so far; not modified
     * @return the fired thresholds and the updated triggered set
     */
    public static WarningDecision evaluate(int remainingSeconds,
                                           Collection<Integer> thresholds,
                                           TriggeredWarnings triggeredWarnings) {
        List<Integer> fired = new ArrayList<>();
        TriggeredWarnings next = triggeredWarnings;

        for (int threshold : thresholds) {
            if (remainingSeconds == threshold && !hasWarningBeenTriggered(threshold, next)) {
                fired.add(threshold);
                next = next.with(threshold);
            }
        }

        return new WarningDecision(fired, next);
    }
}
