package io.fmengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Selection state of feature instances, keyed by instance id. A configuration is complete when it
 * carries a value for every instance of a tree, otherwise partial. Key order is kept for display
 * only and plays no part in equality.
 *
 * <p>Thread-safe and immutable.
 */
public final class Configuration {

    private static final Configuration EMPTY = new Configuration(Map.of());

    private final Map<String, Boolean> selection;

    private Configuration(Map<String, Boolean> selection) {
        this.selection = Collections.unmodifiableMap(new LinkedHashMap<>(selection));
    }

    public static Configuration empty() {
        return EMPTY;
    }

    /**
     * Creates a configuration from an id to selected map.
     *
     * @throws NullPointerException if a key or value is null
     */
    public static Configuration of(Map<String, Boolean> selection) {
        Objects.requireNonNull(selection, "selection must not be null");
        selection.forEach((id, selected) -> {
            Objects.requireNonNull(id, "instance id must not be null");
            Objects.requireNonNull(selected, "selection value must not be null for " + id);
        });
        return new Configuration(selection);
    }

    /** Builds a complete configuration from an ordinal-indexed assignment over {@code tree}. */
    public static Configuration fromAssignment(ExpandedTree tree, Boolean[] values) {
        Map<String, Boolean> selection = new LinkedHashMap<>();
        for (FeatureInstance instance : tree.instances()) {
            Boolean value = values[instance.ordinal()];
            if (value != null) {
                selection.put(instance.id(), value);
            }
        }
        return new Configuration(selection);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The value recorded for {@code id}, or empty if the configuration leaves it unbound. */
    public Optional<Boolean> valueOf(String id) {
        return Optional.ofNullable(selection.get(id));
    }

    public Truth truthOf(String id) {
        return Truth.of(selection.get(id));
    }

    /** {@code true} only if {@code id} is bound and selected. */
    public boolean isSelected(String id) {
        return Boolean.TRUE.equals(selection.get(id));
    }

    public boolean isBound(String id) {
        return selection.containsKey(id);
    }

    /** Ids of selected instances, in key order. */
    public List<String> selected() {
        List<String> ids = new ArrayList<>();
        selection.forEach((id, value) -> {
            if (value) {
                ids.add(id);
            }
        });
        return Collections.unmodifiableList(ids);
    }

    /** Ids of selected, concrete (non-abstract) instances of {@code tree}, in pre-order. */
    public List<String> selectedConcrete(ExpandedTree tree) {
        List<String> ids = new ArrayList<>();
        for (FeatureInstance instance : tree.instances()) {
            if (!instance.abstractFeature() && isSelected(instance.id())) {
                ids.add(instance.id());
            }
        }
        return Collections.unmodifiableList(ids);
    }

    /** Whether every instance of {@code tree} has a value. */
    public boolean isComplete(ExpandedTree tree) {
        for (FeatureInstance instance : tree.instances()) {
            if (!selection.containsKey(instance.id())) {
                return false;
            }
        }
        return true;
    }

    /** Ordinal-indexed view over {@code tree}; ids unknown to the tree are ignored. */
    public Boolean[] toAssignment(ExpandedTree tree) {
        Boolean[] values = new Boolean[tree.size()];
        for (FeatureInstance instance : tree.instances()) {
            values[instance.ordinal()] = selection.get(instance.id());
        }
        return values;
    }

    public Map<String, Boolean> asMap() {
        return selection;
    }

    public int size() {
        return selection.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration that)) return false;
        return selection.equals(that.selection);
    }

    @Override
    public int hashCode() {
        return selection.hashCode();
    }

    @Override
    public String toString() {
        return "Configuration" + selected();
    }

    /** Incremental builder; later calls for the same id override earlier ones. */
    public static final class Builder {

        private final Map<String, Boolean> selection = new LinkedHashMap<>();

        Builder() {}

        public Builder select(String... ids) {
            for (String id : ids) {
                selection.put(Objects.requireNonNull(id, "id must not be null"), Boolean.TRUE);
            }
            return this;
        }

        public Builder deselect(String... ids) {
            for (String id : ids) {
                selection.put(Objects.requireNonNull(id, "id must not be null"), Boolean.FALSE);
            }
            return this;
        }

        public Builder set(String id, boolean selected) {
            selection.put(Objects.requireNonNull(id, "id must not be null"), selected);
            return this;
        }

        /** Marks every instance of {@code tree} not yet mentioned as unselected. */
        public Builder deselectRemaining(ExpandedTree tree) {
            for (FeatureInstance instance : tree.instances()) {
                selection.putIfAbsent(instance.id(), Boolean.FALSE);
            }
            return this;
        }

        public Configuration build() {
            return new Configuration(selection);
        }
    }
}
