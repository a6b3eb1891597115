package io.classtimer.timer;

/**
 * Computes countdown completion as a percentage.
 */
public final class ProgressCalculator {

    private ProgressCalculator() {
        // Utility class
    }

    /**
     * Gets the elapsed share of the total duration, from 0 to 100.
     * A zero total reports no progress. Inputs are not clamped, so a remaining
     * time above the total yields a negative percentage.
     *
     * @param remainingSeconds seconds remaining
     * @param totalSeconds total duration in seconds
     * @return the progress percentage
     */
    public static double getProgress(int remainingSeconds, int totalSeconds) {
        if (totalSeconds == 0) {
            return 0;
        }
        return ((double) (totalSeconds - remainingSeconds) / totalSeconds) * 100;
    }
}
