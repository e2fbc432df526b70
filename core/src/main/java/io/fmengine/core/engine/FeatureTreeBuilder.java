package io.fmengine.core.engine;

import io.fmengine.core.error.ModelSemanticException;
import io.fmengine.core.model.Feature;
import io.fmengine.core.model.FeatureDeclaration;
import io.fmengine.core.model.FeatureGroup;
import io.fmengine.core.model.FeatureTree;
import io.fmengine.core.model.GroupDeclaration;
import io.fmengine.core.model.GroupKind;
import io.fmengine.core.model.ModelDocument;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a parsed {@link ModelDocument} into a typed {@link FeatureTree}.
 *
 * <p>Feature names are unique across the whole model, which is the single scope constraint atoms
 * are written against. Implicit groups (children written directly under a feature) are only
 * accepted with a single child, which becomes mandatory.
 *
 * <p>Thread-safe and stateless.
 */
public final class FeatureTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureTreeBuilder.class);

    /**
     * Builds the feature tree.
     *
     * @throws ModelSemanticException on a duplicate name, an empty group, an {@code alternative} or
     *     {@code or} group with fewer than two children, or an implicit group with several children
     */
    public FeatureTree build(ModelDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        Set<String> seen = new HashSet<>();
        Feature root = feature(document.root(), seen);
        FeatureTree tree = new FeatureTree(document.namespace(), root, document.constraints());
        LOG.debug("Built feature tree '{}': {} features", tree.namespace(), tree.size());
        return tree;
    }

    private Feature feature(FeatureDeclaration declaration, Set<String> seen) {
        if (!seen.add(declaration.name())) {
            throw new ModelSemanticException(
                    declaration.name(), "declared more than once (line " + declaration.line() + ")");
        }
        if (declaration.recursiveReference() != null && !declaration.groups().isEmpty()) {
            throw new ModelSemanticException(
                    declaration.name(),
                    "a recursive reference to '" + declaration.recursiveReference() + "' cannot declare its own children");
        }
        List<FeatureGroup> groups = new ArrayList<>();
        for (GroupDeclaration group : declaration.groups()) {
            groups.add(group(declaration.name(), group, seen));
        }
        return new Feature(declaration.name(), declaration.abstractFeature(), declaration.recursiveReference(), groups);
    }

    private FeatureGroup group(String owner, GroupDeclaration declaration, Set<String> seen) {
        int size = declaration.children().size();
        GroupKind kind;
        if (declaration.isImplicit()) {
            if (size != 1) {
                throw new ModelSemanticException(
                        owner, size + " children without a group keyword (line " + declaration.line() + ")");
            }
            kind = GroupKind.MANDATORY;
        } else {
            kind = declaration.kind();
            if (size == 0) {
                throw new ModelSemanticException(
                        owner, "'" + kind.keyword() + "' group has no children (line " + declaration.line() + ")");
            }
            if (size < kind.minimumChildren()) {
                throw new ModelSemanticException(
                        owner,
                        "'" + kind.keyword() + "' group needs at least " + kind.minimumChildren()
                                + " children, found " + size + " (line " + declaration.line() + ")");
            }
        }
        List<Feature> children = new ArrayList<>();
        for (FeatureDeclaration child : declaration.children()) {
            children.add(feature(child, seen));
        }
        return new FeatureGroup(kind, children);
    }
}
