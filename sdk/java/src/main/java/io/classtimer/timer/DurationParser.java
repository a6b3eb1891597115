package io.classtimer.timer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates timer durations and parses {@code MM:SS} strings into seconds.
 * Supports formats like "05:30", "0:45" and "120:00".
 */
public final class DurationParser {

    /**
     * Longest allowed duration in seconds (24 hours).
     */
    public static final int MAX_DURATION_SECONDS = 24 * 60 * 60;

    /**
     * Largest value {@link #parseTimeString(String)} can produce: 999 minutes 99 seconds.
     */
    public static final int MAX_PARSEABLE_SECONDS = 999 * 60 + 99;

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,3}):(\\d{2})$");

    private DurationParser() {
        // Utility class
    }

    /**
     * Validates a timer duration.
     *
     * @param seconds the duration in seconds
     * @return the duration as an int, or an INVALID_DURATION failure
     */
    public static TimerResult<Integer> validateDuration(long seconds) {
        if (seconds <= 0) {
            return TimerResult.failure(TimerErrorKind.INVALID_DURATION,
                "Timer duration must be a positive integer");
        }
        if (seconds > MAX_DURATION_SECONDS) {
            return TimerResult.failure(TimerErrorKind.INVALID_DURATION,
                "Timer duration cannot exceed 24 hours");
        }
        return TimerResult.success((int) seconds);
    }

    /**
     * Validates a timer duration given as a floating point number.
     * Fractional, NaN and infinite values are rejected.
     *
     * @param seconds the duration in seconds
     * @return the duration as an int, or an INVALID_DURATION failure
     */
    public static TimerResult<Integer> validateDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds != Math.rint(seconds)) {
            return TimerResult.failure(TimerErrorKind.INVALID_DURATION,
                "Timer duration must be a positive integer");
        }
        if (seconds > MAX_DURATION_SECONDS) {
            return TimerResult.failure(TimerErrorKind.INVALID_DURATION,
                "Timer duration cannot exceed 24 hours");
        }
        return validateDuration((long) seconds);
    }

    /**
     * Parses a time string into seconds and validates the result.
     *
     * @param text the time string (e.g., "05:30", "120:00")
     * @return the total seconds, or an INVALID_FORMAT / INVALID_DURATION failure
     */
    public static TimerResult<Integer> parseTimeString(String text) {
        if (text == null) {
            return TimerResult.failure(TimerErrorKind.INVALID_FORMAT,
                "Invalid time format. Use MM:SS or MMM:SS", null);
        }

        Matcher matcher = TIME_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return TimerResult.failure(TimerErrorKind.INVALID_FORMAT,
                "Invalid time format: " + text + ". Use MM:SS or MMM:SS", text);
        }

        int minutes = Integer.parseInt(matcher.group(1));
        int seconds = Integer.parseInt(matcher.group(2));

        return validateDuration(minutes * 60L + seconds);
    }

    /**
     * Parses a time string, throwing on failure.
     *
     * @param text the time string
     * @return the total seconds
     * @throws io.classtimer.exception.InvalidFormatException if the format is invalid
     * @throws io.classtimer.exception.InvalidDurationException if the duration is out of range
     */
    public static int parse(String text) {
        return parseTimeString(text).orElseThrow();
    }

    /**
     * Checks whether some {@code MMM:SS} string parses to the given duration.
     * Values from 60000 to 60039 are reachable only as {@code "999:60"} to {@code "999:99"}.
     *
     * @param seconds the duration in seconds
     * @return true if the duration is within the parser's range
     */
    public static boolean isParseable(int seconds) {
        return seconds >= 0 && seconds <= MAX_PARSEABLE_SECONDS;
    }

    /**
     * Checks whether {@link TimeFormatter#formatTime(int)} output for the duration parses back.
     *
     * @param seconds the duration in seconds
     * @return true if the formatted minute field fits in three digits
     */
    public static boolean isFormattedParseable(int seconds) {
        return seconds >= 0 && seconds / 60 <= 999;
    }
}
