package io.fmengine.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Cardinality rule relating a feature's children to the feature itself. Closed set: builder,
 * validator and enumerator each dispatch over it with an exhaustive {@code switch}.
 */
public enum GroupKind {
    /** Every child is selected iff the parent is selected. */
    MANDATORY("mandatory"),
    /** Each child may be selected independently when the parent is selected. */
    OPTIONAL("optional"),
    /** Exactly one child is selected when the parent is selected, none otherwise. */
    ALTERNATIVE("alternative"),
    /** At least one child is selected when the parent is selected, none otherwise. */
    OR("or");

    private final String keyword;

    GroupKind(String keyword) {
        this.keyword = keyword;
    }

    /** The keyword introducing this group in model text. */
    public String keyword() {
        return keyword;
    }

    /** Minimum number of children a declared group of this kind must have. */
    public int minimumChildren() {
        return this == ALTERNATIVE || this == OR ? 2 : 1;
    }

    /** Looks up a group kind by its model keyword (case-sensitive). */
    public static Optional<GroupKind> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(k -> k.keyword.equals(keyword)).findFirst();
    }
}
