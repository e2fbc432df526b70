package io.fmengine.core.engine;

import io.fmengine.core.error.ExpansionException;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.ExpansionScope;
import io.fmengine.core.model.Feature;
import io.fmengine.core.model.FeatureGroup;
import io.fmengine.core.model.FeatureInstance;
import io.fmengine.core.model.FeatureTree;
import io.fmengine.core.model.InstanceGroup;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unrolls recursive feature references into a finite {@link ExpandedTree}.
 *
 * <p>A feature declared {@code {rec X}} receives a fresh clone of the groups of {@code X} as
 * declared in the feature tree, one recursion level deeper. A reference reached when the current
 * level already equals {@code maxDepth} becomes an absent leaf that can never be selected, which
 * bounds the expansion. Instance ids are the feature-name path from the root joined with
 * {@code /}, so every unrolled copy is distinguishable.
 *
 * <p>Thread-safe and stateless.
 */
public final class RecursionExpander {

    private static final Logger LOG = LoggerFactory.getLogger(RecursionExpander.class);

    /** Upper bound on arena size; guards against depth settings that explode the tree. */
    static final int MAX_INSTANCES = 1_000_000;

    static final String PATH_SEPARATOR = "/";

    /**
     * Expands the tree.
     *
     * @param tree     the built feature tree
     * @param maxDepth maximum number of nested recursive instantiations, {@code >= 0}
     * @throws ExpansionException if a reference does not name an ancestor, if {@code maxDepth} is
     *     negative, or if the result would exceed {@value #MAX_INSTANCES} instances
     */
    public ExpandedTree expand(FeatureTree tree, int maxDepth) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (maxDepth < 0) {
            throw new ExpansionException("maxDepth must not be negative, got: " + maxDepth, null);
        }
        checkReferences(tree.root(), new ArrayDeque<>());

        Run run = new Run(tree, maxDepth);
        run.emit(tree.root(), tree.root().name(), -1, "", 0, run.openScope(-1, tree.root().name(), 0));
        ExpandedTree expanded = run.finish();
        LOG.debug(
                "Expanded '{}' with maxDepth={}: {} instances, {} scopes, recursion depth {}",
                tree.namespace(),
                maxDepth,
                expanded.size(),
                expanded.scopes().size(),
                expanded.recursionDepth());
        return expanded;
    }

    private static void checkReferences(Feature feature, Deque<String> ancestors) {
        if (feature.isRecursiveReference() && !ancestors.contains(feature.recursiveReference())) {
            throw new ExpansionException(
                    "Feature '" + feature.name() + "' references '" + feature.recursiveReference()
                            + "', which is not one of its ancestors",
                    feature.recursiveReference());
        }
        ancestors.push(feature.name());
        for (Feature child : feature.children()) {
            checkReferences(child, ancestors);
        }
        ancestors.pop();
    }

    private static final class ScopeDraft {
        final int index;
        final int parent;
        final String templateName;
        final int rootOrdinal;
        final Map<String, Integer> members = new HashMap<>();

        ScopeDraft(int index, int parent, String templateName, int rootOrdinal) {
            this.index = index;
            this.parent = parent;
            this.templateName = templateName;
            this.rootOrdinal = rootOrdinal;
        }
    }

    private static final class Run {

        private final FeatureTree tree;
        private final int maxDepth;
        private final List<FeatureInstance> arena = new ArrayList<>();
        private final List<ScopeDraft> scopes = new ArrayList<>();

        Run(FeatureTree tree, int maxDepth) {
            this.tree = tree;
            this.maxDepth = maxDepth;
        }

        int openScope(int parent, String templateName, int rootOrdinal) {
            ScopeDraft scope = new ScopeDraft(scopes.size(), parent, templateName, rootOrdinal);
            scopes.add(scope);
            scope.members.put(templateName, rootOrdinal);
            return scope.index;
        }

        /**
         * Emits {@code feature} and its subtree in pre-order.
         *
         * @return the ordinal of the emitted instance
         */
        int emit(Feature feature, String name, int parent, String parentId, int depth, int scope) {
            int ordinal = reserve();
            String id = parentId.isEmpty() ? name : parentId + PATH_SEPARATOR + name;
            scopes.get(scope).members.put(name, ordinal);

            if (!feature.isRecursiveReference()) {
                List<InstanceGroup> groups = emitGroups(feature.groups(), ordinal, id, depth, scope);
                arena.set(
                        ordinal,
                        new FeatureInstance(
                                ordinal, id, name, feature.name(), depth, parent, scope,
                                feature.abstractFeature(), false, groups));
                return ordinal;
            }

            Feature template = tree.find(feature.recursiveReference()).orElseThrow();
            if (depth >= maxDepth) {
                arena.set(
                        ordinal,
                        new FeatureInstance(
                                ordinal, id, name, template.name(), depth, parent, scope,
                                feature.abstractFeature() || template.abstractFeature(), true, List.of()));
                return ordinal;
            }

            int inner = openScope(scope, template.name(), ordinal);
            List<InstanceGroup> groups = emitGroups(template.groups(), ordinal, id, depth + 1, inner);
            arena.set(
                    ordinal,
                    new FeatureInstance(
                            ordinal, id, name, template.name(), depth + 1, parent, scope,
                            feature.abstractFeature() || template.abstractFeature(), false, groups));
            return ordinal;
        }

        private List<InstanceGroup> emitGroups(
                List<FeatureGroup> declared, int parent, String parentId, int depth, int scope) {
            List<InstanceGroup> groups = new ArrayList<>(declared.size());
            for (FeatureGroup group : declared) {
                List<Integer> children = new ArrayList<>(group.children().size());
                for (Feature child : group.children()) {
                    children.add(emit(child, child.name(), parent, parentId, depth, scope));
                }
                groups.add(new InstanceGroup(group.kind(), children));
            }
            return groups;
        }

        private int reserve() {
            if (arena.size() >= MAX_INSTANCES) {
                throw new ExpansionException(
                        "Expansion with maxDepth=" + maxDepth + " exceeds " + MAX_INSTANCES + " instances", null);
            }
            arena.add(null);
            return arena.size() - 1;
        }

        ExpandedTree finish() {
            List<ExpansionScope> frozen = new ArrayList<>(scopes.size());
            for (ScopeDraft draft : scopes) {
                frozen.add(new ExpansionScope(
                        draft.index, draft.rootOrdinal, draft.templateName, draft.parent, draft.members));
            }
            return new ExpandedTree(tree.namespace(), maxDepth, arena, frozen, tree.constraints());
        }
    }
}
