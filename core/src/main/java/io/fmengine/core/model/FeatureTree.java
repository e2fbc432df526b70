package io.fmengine.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The typed, pre-expansion feature tree of one model. Recursive references are kept as named
 * relations on their features; the tree itself is acyclic.
 *
 * <p>Immutable and thread-safe.
 */
public final class FeatureTree {

    private final String namespace;
    private final Feature root;
    private final List<ConstraintLine> constraints;
    private final Map<String, Feature> byName;

    public FeatureTree(String namespace, Feature root, List<ConstraintLine> constraints) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.constraints = List.copyOf(constraints);
        Map<String, Feature> index = new LinkedHashMap<>();
        collect(root, index);
        this.byName = Collections.unmodifiableMap(index);
    }

    private static void collect(Feature feature, Map<String, Feature> index) {
        index.put(feature.name(), feature);
        for (Feature child : feature.children()) {
            collect(child, index);
        }
    }

    public String namespace() {
        return namespace;
    }

    public Feature root() {
        return root;
    }

    /** Constraint lines carried over from the parsed document. */
    public List<ConstraintLine> constraints() {
        return constraints;
    }

    /** Looks up a declared feature by name. */
    public Optional<Feature> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /** Returns the declared features in pre-order. */
    public List<Feature> features() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }
}
