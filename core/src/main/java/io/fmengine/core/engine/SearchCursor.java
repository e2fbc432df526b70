package io.fmengine.core.engine;

import io.fmengine.core.model.CompiledConstraint;
import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.FeatureInstance;
import io.fmengine.core.model.GroupKind;
import io.fmengine.core.model.InstanceGroup;
import io.fmengine.core.model.Truth;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first backtracking search over an {@link ExpandedTree}, driven by an explicit stack.
 *
 * <p>Instances are decided in pre-order. The decision at an instance assigns all of its children
 * at once: nothing for a leaf, all unselected below an unselected instance, otherwise one
 * group-consistent combination per group. After each tentative decision the structural rules of
 * the decided instances and the constraints that became fully bound are checked; a violation
 * moves on to the next alternative.
 *
 * <p>Not thread-safe: one cursor per search. Parallel search uses one cursor per branch, each with
 * its own copy of the assignment.
 */
final class SearchCursor {

    private final ExpandedTree tree;
    private final CompiledConstraints constraints;
    private final CancellationToken token;
    private final Boolean[] values;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private boolean completePending;
    private boolean cancelled;

    private SearchCursor(
            ExpandedTree tree,
            CompiledConstraints constraints,
            CancellationToken token,
            Boolean[] values,
            int position) {
        this.tree = tree;
        this.constraints = constraints;
        this.token = token;
        this.values = values;
        if (position == tree.size()) {
            completePending = true;
        } else {
            stack.push(new Frame(position, choices(tree, values, position)));
        }
    }

    /** A cursor over the whole search space. */
    static SearchCursor open(ExpandedTree tree, CompiledConstraints constraints, CancellationToken token) {
        Boolean[] values = rootAssignment(tree, constraints);
        if (values == null) {
            return exhausted(tree, constraints, token);
        }
        return new SearchCursor(tree, constraints, token, values, 0);
    }

    /**
     * Splits the search space at the first decision with more than one feasible alternative.
     * Each returned cursor covers one alternative; together they cover the whole space.
     */
    static List<SearchCursor> branches(
            ExpandedTree tree, CompiledConstraints constraints, CancellationToken token) {
        Boolean[] values = rootAssignment(tree, constraints);
        if (values == null) {
            return List.of();
        }
        int position = 0;
        while (position < tree.size()) {
            List<boolean[]> feasible = new ArrayList<>();
            for (boolean[] choice : choices(tree, values, position)) {
                Boolean[] copy = values.clone();
                if (apply(tree, constraints, copy, position, choice)) {
                    feasible.add(choice);
                }
            }
            if (feasible.size() == 1) {
                apply(tree, constraints, values, position, feasible.get(0));
                position++;
                continue;
            }
            List<SearchCursor> cursors = new ArrayList<>(feasible.size());
            for (boolean[] choice : feasible) {
                Boolean[] copy = values.clone();
                apply(tree, constraints, copy, position, choice);
                cursors.add(new SearchCursor(tree, constraints, token, copy, position + 1));
            }
            return cursors;
        }
        return List.of(new SearchCursor(tree, constraints, token, values, position));
    }

    /**
     * Advances to the next valid complete assignment.
     *
     * @return a fresh copy of the assignment, or {@code null} when the space is exhausted or the
     *     search was cancelled
     */
    Boolean[] next() {
        if (completePending) {
            completePending = false;
            return values.clone();
        }
        while (!stack.isEmpty()) {
            if (token.isCancelled()) {
                cancelled = true;
                stack.clear();
                return null;
            }
            Frame top = stack.peek();
            top.undo(tree, values);
            if (top.next >= top.choices.size()) {
                stack.pop();
                continue;
            }
            boolean[] choice = top.choices.get(top.next++);
            top.applied = true;
            if (!apply(tree, constraints, values, top.position, choice)) {
                continue;
            }
            int following = top.position + 1;
            if (following == tree.size()) {
                return values.clone();
            }
            stack.push(new Frame(following, choices(tree, values, following)));
        }
        return null;
    }

    /** Whether the search stopped because its token was cancelled. */
    boolean isCancelled() {
        return cancelled;
    }

    private static SearchCursor exhausted(
            ExpandedTree tree, CompiledConstraints constraints, CancellationToken token) {
        SearchCursor cursor = new SearchCursor(tree, constraints, token, new Boolean[tree.size()], 0);
        cursor.stack.clear();
        return cursor;
    }

    /** The assignment with only the root selected, or {@code null} if that already fails. */
    private static Boolean[] rootAssignment(ExpandedTree tree, CompiledConstraints constraints) {
        Boolean[] values = new Boolean[tree.size()];
        values[0] = Boolean.TRUE;
        FeatureInstance root = tree.root();
        if (!StructuralRules.check(tree, root, values, null) || !constraintsHold(constraints, values, 0)) {
            return null;
        }
        return values;
    }

    /**
     * Assigns the children of the instance at {@code position} and checks what became decidable.
     *
     * @return {@code false} if a structural rule or a fully bound constraint is violated
     */
    private static boolean apply(
            ExpandedTree tree, CompiledConstraints constraints, Boolean[] values, int position, boolean[] choice) {
        FeatureInstance instance = tree.instance(position);
        List<Integer> children = instance.children();
        for (int i = 0; i < choice.length; i++) {
            values[children.get(i)] = choice[i];
        }
        if (!StructuralRules.check(tree, instance, values, null)) {
            return false;
        }
        for (int child : children) {
            if (!StructuralRules.check(tree, tree.instance(child), values, null)
                    || !constraintsHold(constraints, values, child)) {
                return false;
            }
        }
        return true;
    }

    private static boolean constraintsHold(CompiledConstraints constraints, Boolean[] values, int slot) {
        for (CompiledConstraint constraint : constraints.mentioning(slot)) {
            if (constraint.isFullyBound(values) && constraint.evaluate(values) == Truth.FALSE) {
                return false;
            }
        }
        return true;
    }

    /** Group-consistent child assignments of the instance at {@code position}, in child order. */
    private static List<boolean[]> choices(ExpandedTree tree, Boolean[] values, int position) {
        FeatureInstance instance = tree.instance(position);
        int width = instance.children().size();
        if (!Boolean.TRUE.equals(values[position]) || width == 0) {
            return List.of(new boolean[width]);
        }
        List<boolean[]> partial = List.of(new boolean[width]);
        int offset = 0;
        for (InstanceGroup group : instance.groups()) {
            List<boolean[]> extended = new ArrayList<>();
            for (boolean[] prefix : partial) {
                for (boolean[] option : groupOptions(group)) {
                    boolean[] combined = prefix.clone();
                    System.arraycopy(option, 0, combined, offset, option.length);
                    extended.add(combined);
                }
            }
            partial = extended;
            offset += group.children().size();
        }
        return partial;
    }

    private static List<boolean[]> groupOptions(InstanceGroup group) {
        int size = group.children().size();
        List<boolean[]> options = new ArrayList<>();
        switch (group.kind()) {
            case MANDATORY -> {
                boolean[] all = new boolean[size];
                Arrays.fill(all, true);
                options.add(all);
            }
            case ALTERNATIVE -> {
                for (int i = 0; i < size; i++) {
                    boolean[] one = new boolean[size];
                    one[i] = true;
                    options.add(one);
                }
            }
            case OPTIONAL, OR -> {
                int first = group.kind() == GroupKind.OR ? 1 : 0;
                for (int mask = first; mask < (1 << size); mask++) {
                    boolean[] subset = new boolean[size];
                    for (int i = 0; i < size; i++) {
                        subset[i] = (mask & (1 << i)) != 0;
                    }
                    options.add(subset);
                }
            }
        }
        return options;
    }

    private static final class Frame {
        final int position;
        final List<boolean[]> choices;
        int next;
        boolean applied;

        Frame(int position, List<boolean[]> choices) {
            this.position = position;
            this.choices = choices;
        }

        /** Clears the children assigned by the previous alternative. */
        void undo(ExpandedTree tree, Boolean[] values) {
            if (applied) {
                for (int child : tree.instance(position).children()) {
                    values[child] = null;
                }
                applied = false;
            }
        }
    }
}
