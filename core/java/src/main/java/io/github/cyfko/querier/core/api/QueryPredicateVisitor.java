package io.github.cyfko.querier.core.api;

/**
 * Visitor lowering a {@link QueryPredicate} tree into a source-specific representation
 * (a JPA {@code Predicate}, an in-memory {@code java.util.function.Predicate}, ...).
 *
 * @param <T> entity type
 * @param <R> result of the lowering
 * @author Frank KOSSI
 */
public interface QueryPredicateVisitor<T, R> {

    R visitAnd(QueryPredicate.And<T> and);

    R visitOr(QueryPredicate.Or<T> or);

    R visitCompare(QueryPredicate.Compare<T> compare);

    R visitNullCheck(QueryPredicate.NullCheck<T> nullCheck);

    R visitSubstring(QueryPredicate.Substring<T> substring);
}
