package io.classtimer.timer;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of warning thresholds already fired during the current run.
 * Adding a threshold returns a new instance.
 */
public final class TriggeredWarnings {

    private static final TriggeredWarnings EMPTY = new TriggeredWarnings(new TreeSet<>());

    private final Set<Integer> thresholds;

    private TriggeredWarnings(TreeSet<Integer> thresholds) {
        this.thresholds = Collections.unmodifiableSet(thresholds);
    }

    public static TriggeredWarnings empty() {
        return EMPTY;
    }

    public static TriggeredWarnings of(Integer... thresholds) {
        return of(Arrays.asList(thresholds));
    }

    public static TriggeredWarnings of(Collection<Integer> thresholds) {
        if (thresholds.isEmpty()) {
            return EMPTY;
        }
        return new TriggeredWarnings(new TreeSet<>(thresholds));
    }

    /**
     * Returns a set that also contains the given threshold.
     *
     * @param threshold the threshold to record
     * @return this set if already present, otherwise a new set
     */
    public TriggeredWarnings with(int threshold) {
        if (thresholds.contains(threshold)) {
            return this;
        }
        TreeSet<Integer> next = new TreeSet<>(thresholds);
        next.add(threshold);
        return new TriggeredWarnings(next);
    }

    public boolean contains(int threshold) {
        return thresholds.contains(threshold);
    }

    public boolean isEmpty() {
        return thresholds.isEmpty();
    }

    public int size() {
        return thresholds.size();
    }

    /**
     * Gets the thresholds in ascending order.
     *
     * @return an unmodifiable view
     */
    public Set<Integer> asSet() {
        return thresholds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return thresholds.equals(((TriggeredWarnings) o).thresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(thresholds);
    }

    @Override
    public String toString() {
        return "TriggeredWarnings" + thresholds;
    }
}
