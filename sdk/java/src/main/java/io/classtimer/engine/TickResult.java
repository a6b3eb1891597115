package io.classtimer.engine;

import java.util.List;

/**
 * Outcome of one tick.
 *
 * @param state the state after the tick
 * @param firedWarnings thresholds reached on this tick, ascending
 * @param completed true if this tick finished the countdown
 */
public record TickResult(TimerState state, List<Integer> firedWarnings, boolean completed) {

    public TickResult {
        firedWarnings = List.copyOf(firedWarnings);
    }

    static TickResult unchanged(TimerState state) {
        return new TickResult(state, List.of(), false);
    }

    public boolean hasWarning() {
        return !firedWarnings.isEmpty();
    }
}
