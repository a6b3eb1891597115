package io.classtimer.timer;

/**
 * Which warning thresholds are enabled.
 *
 * @param warningAt2Min warn when two minutes remain
 * @param warningAt5Min warn when five minutes remain
 */
public record WarningConfig(boolean warningAt2Min, boolean warningAt5Min) {

    public static WarningConfig all() {
        return new WarningConfig(true, true);
    }

    public static WarningConfig none() {
        return new WarningConfig(false, false);
    }
}
