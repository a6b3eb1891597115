package io.classtimer.timer;

import java.util.List;

/**
 * Result of evaluating warnings for one tick.
 *
 * @param fired thresholds that fire on this tick, ascending
 * @param triggered the triggered set after this tick
 */
public record WarningDecision(List<Integer> fired, TriggeredWarnings triggered) {

    public WarningDecision {
        fired = List.copyOf(fired);
    }

    public boolean shouldWarn() {
        return !fired.isEmpty();
    }
}
