package io.fmengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The compiled constraint set of one expanded tree, with an index from instance ordinal to the
 * constraints mentioning it (used for incremental checking during search).
 *
 * <p>Thread-safe and immutable.
 */
public final class CompiledConstraints implements Iterable<CompiledConstraint> {

    private static final CompiledConstraints EMPTY = new CompiledConstraints(List.of(), 0);

    private final List<CompiledConstraint> constraints;
    private final List<List<CompiledConstraint>> bySlot;

    public CompiledConstraints(List<CompiledConstraint> constraints, int instanceCount) {
        this.constraints = List.copyOf(constraints);
        List<List<CompiledConstraint>> index = new ArrayList<>(instanceCount);
        for (int i = 0; i < instanceCount; i++) {
            List<CompiledConstraint> mentioning = new ArrayList<>();
            for (CompiledConstraint constraint : this.constraints) {
                if (constraint.references(i)) {
                    mentioning.add(constraint);
                }
            }
            index.add(Collections.unmodifiableList(mentioning));
        }
        this.bySlot = Collections.unmodifiableList(index);
    }

    public static CompiledConstraints empty() {
        return EMPTY;
    }

    public List<CompiledConstraint> all() {
        return constraints;
    }

    /** Constraints whose formula references the given instance ordinal. */
    public List<CompiledConstraint> mentioning(int slot) {
        return slot < bySlot.size() ? bySlot.get(slot) : List.of();
    }

    public int size() {
        return constraints.size();
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public Iterator<CompiledConstraint> iterator() {
        return constraints.iterator();
    }
}
