package io.classtimer.timer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Status of a countdown timer, with the transitions allowed between them.
 */
public enum TimerStatus {
    /**
     * Not active, ready to be started.
     */
    IDLE("idle"),

    /**
     * Counting down.
     */
    RUNNING("running"),

    /**
     * Paused, can be resumed.
     */
    PAUSED("paused"),

    /**
     * Reached 00:00. Not absorbing: the timer can be reset or restarted.
     */
    COMPLETED("completed");

    private final String value;

    TimerStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Gets the statuses reachable from this one in a single step.
     *
     * @return the allowed next statuses
     */
    public Set<TimerStatus> allowedTransitions() {
        return switch (this) {
            case IDLE -> EnumSet.of(RUNNING, IDLE);
            case RUNNING -> EnumSet.of(PAUSED, IDLE);
            case PAUSED -> EnumSet.of(RUNNING, IDLE);
            case COMPLETED -> EnumSet.of(IDLE, RUNNING);
        };
    }

    /**
     * Checks whether this status may change to the given one.
     *
     * @param next the desired next status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(TimerStatus next) {
        return next != null && allowedTransitions().contains(next);
    }

    /**
     * Checks whether a status change is legal. A null current status is never legal.
     *
     * @param current the current status
     * @param next the desired next status
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(TimerStatus current, TimerStatus next) {
        return current != null && current.canTransitionTo(next);
    }

    /**
     * Checks a status change given by wire names. Unknown names are never legal.
     *
     * @param current the current status name (e.g., "idle")
     * @param next the desired next status name
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(String current, String next) {
        Optional<TimerStatus> from = lookup(current);
        Optional<TimerStatus> to = lookup(next);
        return from.isPresent() && to.isPresent() && isValidTransition(from.get(), to.get());
    }

    /**
     * Looks up a status by its wire name.
     *
     * @param value the wire name
     * @return the status, or empty if the name is unknown
     */
    public static Optional<TimerStatus> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TimerStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TimerStatus fromValue(String value) {
        return lookup(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown timer status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
