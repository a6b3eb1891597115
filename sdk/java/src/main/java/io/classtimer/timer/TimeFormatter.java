package io.classtimer.timer;

/**
 * Formats remaining seconds for display.
 */
public final class TimeFormatter {

    private TimeFormatter() {
        // Utility class
    }

    /**
     * Formats seconds as {@code MM:SS}. Minutes are never carried into hours,
     * so 3661 seconds formats as "61:01".
     *
     * @param seconds the seconds to format, not negative
     * @return the formatted string (e.g., "05:30")
     */
    public static String formatTime(int seconds) {
        requireNonNegative(seconds);
        int minutes = seconds / 60;
        int secs = seconds % 60;
        return String.format("%02d:%02d", minutes, secs);
    }

    /**
     * Formats seconds as a phrase, e.g. "2 minutes 30 seconds", "1 minute" or "45 seconds".
     *
     * @param seconds the seconds to describe, not negative
     * @return the readable string
     */
    public static String getReadableTimeRemaining(int seconds) {
        requireNonNegative(seconds);
        int minutes = seconds / 60;
        int secs = seconds % 60;

        if (minutes == 0) {
            return plural(secs, "second");
        }
        if (secs == 0) {
            return plural(minutes, "minute");
        }
        return plural(minutes, "minute") + " " + plural(secs, "second");
    }

    private static String plural(int count, String unit) {
        return count + " " + unit + (count != 1 ? "s" : "");
    }

    private static void requireNonNegative(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Seconds cannot be negative: " + seconds);
        }
    }
}
