package io.fmengine.core.engine;

import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.FeatureTree;
import java.util.Objects;

/**
 * A model that passed the whole load pipeline, ready for validation and enumeration.
 *
 * @param tree        the built feature tree, before expansion
 * @param expanded    the tree unrolled to the configured depth
 * @param constraints constraints compiled against {@code expanded}
 */
public record LoadedModel(FeatureTree tree, ExpandedTree expanded, CompiledConstraints constraints) {

    public LoadedModel {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(expanded, "expanded must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
    }

    public String namespace() {
        return tree.namespace();
    }
}
