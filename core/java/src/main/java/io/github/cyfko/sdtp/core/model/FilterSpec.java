package io.github.cyfko.sdtp.core.model;

import io.github.cyfko.sdtp.core.api.Op;

/**
 * An unvalidated filter tree, freshly built from one wire document.
 * <p>
 * The tree has exactly two node kinds, {@link FilterLeaf} and {@link FilterCombinator}. Nothing
 * in a {@code FilterSpec} has been checked against a schema yet: column names may be unknown and
 * literals are still raw JSON. {@link io.github.cyfko.sdtp.core.validation.FilterValidator} turns
 * it into a {@link io.github.cyfko.sdtp.core.validation.ValidatedFilter}.
 * </p>
 *
 * @since 1.0.0
 */
public interface FilterSpec {

    /**
     * @return the operator of this node
     */
    Op operator();

    /**
     * @return the number of nodes in this subtree, itself included
     */
    int size();
}
