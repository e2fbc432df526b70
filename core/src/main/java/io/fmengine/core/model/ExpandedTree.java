package io.fmengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The finite, cycle-free result of unrolling a {@link FeatureTree}: an arena of
 * {@link FeatureInstance}s in pre-order, an id index, and the expansion scopes.
 *
 * <p>Immutable and thread-safe; shared read-only by concurrent validation and enumeration.
 */
public final class ExpandedTree {

    private final String namespace;
    private final int maxDepth;
    private final List<FeatureInstance> instances;
    private final List<ExpansionScope> scopes;
    private final List<ConstraintLine> constraints;
    private final Map<String, Integer> byId;

    public ExpandedTree(
            String namespace,
            int maxDepth,
            List<FeatureInstance> instances,
            List<ExpansionScope> scopes,
            List<ConstraintLine> constraints) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.maxDepth = maxDepth;
        this.instances = List.copyOf(instances);
        this.scopes = List.copyOf(scopes);
        this.constraints = List.copyOf(constraints);
        if (this.instances.isEmpty()) {
            throw new IllegalArgumentException("expanded tree must contain at least the root instance");
        }
        Map<String, Integer> index = new HashMap<>();
        for (FeatureInstance instance : this.instances) {
            if (index.put(instance.id(), instance.ordinal()) != null) {
                throw new IllegalArgumentException("duplicate instance id: " + instance.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public String namespace() {
        return namespace;
    }

    /** The depth bound this tree was expanded with. */
    public int maxDepth() {
        return maxDepth;
    }

    public FeatureInstance root() {
        return instances.get(0);
    }

    public FeatureInstance instance(int ordinal) {
        return instances.get(ordinal);
    }

    /** All instances in pre-order (ordinal order). */
    public List<FeatureInstance> instances() {
        return instances;
    }

    public List<ExpansionScope> scopes() {
        return scopes;
    }

    public ExpansionScope scope(int index) {
        return scopes.get(index);
    }

    /** Constraint lines of the originating model. */
    public List<ConstraintLine> constraints() {
        return constraints;
    }

    public int size() {
        return instances.size();
    }

    public Optional<FeatureInstance> find(String id) {
        Integer ordinal = byId.get(id);
        return ordinal == null ? Optional.empty() : Optional.of(instances.get(ordinal));
    }

    /**
     * Looks up an instance by id.
     *
     * @throws IllegalArgumentException if no instance has that id
     */
    public FeatureInstance require(String id) {
        return find(id).orElseThrow(() ->
                new IllegalArgumentException("The feature instance '" + id + "' does not exist in the expanded tree"));
    }

    /** All instances declared under the given feature name, across every scope. */
    public List<FeatureInstance> instancesNamed(String name) {
        List<FeatureInstance> result = new ArrayList<>();
        for (FeatureInstance instance : instances) {
            if (instance.name().equals(name)) {
                result.add(instance);
            }
        }
        return result;
    }

    /** Length of the longest chain of recursive instantiations in the tree. */
    public int recursionDepth() {
        int max = 0;
        for (FeatureInstance instance : instances) {
            max = Math.max(max, instance.depth());
        }
        return max;
    }
}
