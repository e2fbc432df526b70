package io.fmengine.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A region of the expanded tree instantiated from one template: the whole model for the root
 * scope, or the clone spliced in for one recursive reference. Constraint atoms resolve against
 * {@link #members()} first and then against enclosing scopes.
 *
 * @param index        position in {@link ExpandedTree#scopes()}
 * @param rootOrdinal  the instance the scope hangs from
 * @param templateName the template instantiated by this scope
 * @param parentScope  enclosing scope index, {@code -1} for the root scope
 * @param members      feature name to instance ordinal, for instances owned by this scope; the
 *                     template name maps to {@code rootOrdinal}
 */
public record ExpansionScope(
        int index, int rootOrdinal, String templateName, int parentScope, Map<String, Integer> members) {

    public ExpansionScope {
        Objects.requireNonNull(templateName, "templateName must not be null");
        members = Map.copyOf(members);
    }

    public boolean isRoot() {
        return parentScope < 0;
    }

    public Optional<Integer> member(String name) {
        return Optional.ofNullable(members.get(name));
    }
}
