package io.github.cyfko.querier.core.api;

/**
 * Comparison performed by a {@link QueryPredicate.Compare} node.
 *
 * @author Frank KOSSI
 */
public enum ComparisonOperator {
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE;

    /**
     * @return true for the ordering comparisons, which require a {@link Comparable} field type
     */
    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
