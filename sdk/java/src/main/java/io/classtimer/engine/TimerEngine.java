package io.classtimer.engine;

import io.classtimer.exception.InvalidTimerStateException;
import io.classtimer.timer.DurationParser;
import io.classtimer.timer.TimerStatus;
import io.classtimer.timer.TriggeredWarnings;
import io.classtimer.timer.WarningConfig;
import io.classtimer.timer.WarningDecision;
import io.classtimer.timer.WarningThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Timer actions as functions from one {@link TimerState} to the next.
 * Status changes requested by the caller are checked against
 * {@link TimerStatus#isValidTransition(TimerStatus, TimerStatus)}; completion is
 * reached only by ticking down to zero.
 * The engine holds no state and owns no clock: a driver calls {@link #tick(TimerState)}
 * once per second while the timer is running and keeps the returned state.
 *
 * <pre>
 * TimerState state = TimerEngine.setDuration(TimerState.initial(), 600, WarningConfig.all());
 * state = TimerEngine.start(state);
 * TickResult result = TimerEngine.tick(state);
 * if (result.hasWarning()) {
 *     // play the warning sound
 * }
 * state = result.state();
 * </pre>
 */
public final class TimerEngine {

    private static final Logger log = LoggerFactory.getLogger(TimerEngine.class);

    private TimerEngine() {
        // Utility class
    }

    /**
     * Sets a new duration. The timer becomes idle with the full duration remaining
     * and no warnings triggered.
     *
     * @param state the current state
     * @param seconds the duration in seconds
     * @param config which warnings are enabled
     * @return the new state
     * @throws io.classtimer.exception.InvalidDurationException if the duration is invalid
     * @throws InvalidTimerStateException if the timer cannot return to idle
     */
    public static TimerState setDuration(TimerState state, int seconds, WarningConfig config) {
        int duration = DurationParser.validateDuration(seconds).orElseThrow();
        requireTransition(state, TimerStatus.IDLE, "Cannot set duration");

        TimerState next = new TimerState.Builder()
            .remainingSeconds(duration)
            .totalSeconds(duration)
            .status(TimerStatus.IDLE)
            .warningThresholds(WarningThresholds.calculateWarningThresholds(duration, config))
            .triggeredWarnings(TriggeredWarnings.empty())
            .build();

        log.debug("Duration set to {}s ({}min)", duration, duration / 60);
        return next;
    }

    /**
     * Starts the countdown. From idle the remaining time must be positive;
     * from completed the run restarts with the full duration.
     *
     * @param state the current state
     * @return the running state
     * @throws InvalidTimerStateException if the timer cannot start
     */
    public static TimerState start(TimerState state) {
        TimerStatus status = state.getStatus();
        if (status != TimerStatus.IDLE && status != TimerStatus.COMPLETED) {
            throw new InvalidTimerStateException(status, "Timer can only start from idle or completed state");
        }
        requireTransition(state, TimerStatus.RUNNING, "Cannot start timer");

        int remaining = status == TimerStatus.COMPLETED ? state.getTotalSeconds() : state.getRemainingSeconds();
        if (remaining <= 0) {
            throw new InvalidTimerStateException(status, "Cannot start timer with 0 seconds remaining");
        }

        log.debug(status == TimerStatus.COMPLETED ? "Restarted" : "Started");
        return state.toBuilder()
            .remainingSeconds(remaining)
            .status(TimerStatus.RUNNING)
            .triggeredWarnings(TriggeredWarnings.empty())
            .build();
    }

    /**
     * Pauses a running timer.
     *
     * @param state the current state
     * @return the paused state
     * @throws InvalidTimerStateException if the timer is not running
     */
    public static TimerState pause(TimerState state) {
        if (state.getStatus() != TimerStatus.RUNNING) {
            throw new InvalidTimerStateException(state.getStatus(), "Timer can only pause from running state");
        }
        requireTransition(state, TimerStatus.PAUSED, "Cannot pause timer");

        log.debug("Paused at {}s", state.getRemainingSeconds());
        return state.toBuilder().status(TimerStatus.PAUSED).build();
    }

    /**
     * Resumes a paused timer. Warnings already triggered stay triggered.
     *
     * @param state the current state
     * @return the running state
     * @throws InvalidTimerStateException if the timer is not paused
     */
    public static TimerState resume(TimerState state) {
        if (state.getStatus() != TimerStatus.PAUSED) {
            throw new InvalidTimerStateException(state.getStatus(), "Timer can only resume from paused state");
        }
        requireTransition(state, TimerStatus.RUNNING, "Cannot resume timer");

        log.debug("Resumed at {}s", state.getRemainingSeconds());
        return state.toBuilder().status(TimerStatus.RUNNING).build();
    }

    /**
     * Stops the timer and rewinds it to the full duration, keeping the thresholds.
     *
     * @param state the current state
     * @return the idle state
     */
    public static TimerState stop(TimerState state) {
        requireTransition(state, TimerStatus.IDLE, "Cannot stop timer");

        log.debug("Stopped, reset to total duration {}s", state.getTotalSeconds());
        return state.toBuilder()
            .remainingSeconds(state.getTotalSeconds())
            .status(TimerStatus.IDLE)
            .triggeredWarnings(TriggeredWarnings.empty())
            .build();
    }

    /**
     * Clears the timer back to the initial state.
     *
     * @param state the current state
     * @return the initial state
     */
    public static TimerState reset(TimerState state) {
        requireTransition(state, TimerStatus.IDLE, "Cannot reset timer");

        log.debug("Reset to 0");
        return TimerState.initial();
    }

    /**
     * Advances the countdown by one second. Does nothing unless the timer is running.
     *
     * @param state the current state
     * @return the new state, the warnings reached on this tick and whether it completed
     */
    public static TickResult tick(TimerState state) {
        if (state.getStatus() != TimerStatus.RUNNING) {
            return TickResult.unchanged(state);
        }

        int remaining = state.getRemainingSeconds() - 1;

        if (remaining <= 0) {
            log.debug("Completed");
            TimerState completed = state.toBuilder()
                .remainingSeconds(0)
                .status(TimerStatus.COMPLETED)
                .build();
            return new TickResult(completed, List.of(), true);
        }

        WarningDecision decision = WarningThresholds.evaluate(
            remaining, state.getWarningThresholds(), state.getTriggeredWarnings());
        if (decision.shouldWarn()) {
            log.debug("Warning at {}s", decision.fired());
        }

        TimerState next = state.toBuilder()
            .remainingSeconds(remaining)
            .triggeredWarnings(decision.triggered())
            .build();
        return new TickResult(next, decision.fired(), false);
    }

    private static void requireTransition(TimerState state, TimerStatus next, String message) {
        if (!TimerStatus.isValidTransition(state.getStatus(), next)) {
            throw new InvalidTimerStateException(state.getStatus(),
                message + ": " + state.getStatus() + " -> " + next);
        }
    }
}
