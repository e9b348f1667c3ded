package io.github.cyfko.querier.core.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiled, source-independent predicate over an entity type.
 * <p>
 * A predicate is a small tree of five node kinds. It is built fresh for each execution by the
 * {@link io.github.cyfko.querier.core.compile.PredicateCompiler} and handed to a
 * {@link io.github.cyfko.querier.core.spi.QuerySource}, which lowers it through a
 * {@link QueryPredicateVisitor}. Literals are already converted to the type of their field.
 * </p>
 *
 * <pre>{@code
 * QueryPredicate<Company> p = QueryPredicate.allOf(List.of(
 *     QueryPredicate.compare(ComparisonOperator.EQ, status, Status.ACTIVE),
 *     QueryPredicate.substring(SubstringKind.CONTAINS, name, "ac")));
 * }</pre>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryPredicate<T> {

    <R> R accept(QueryPredicateVisitor<T, R> visitor);

    /**
     * Conjunction of this predicate with another one.
     *
     * @param other the other operand
     * @return a conjunction node
     */
    default QueryPredicate<T> and(QueryPredicate<T> other) {
        return allOf(List.of(this, other));
    }

    /**
     * Combines operands with AND. A single operand is returned unchanged.
     */
    static <T> QueryPredicate<T> allOf(List<QueryPredicate<T>> operands) {
        return operands.size() == 1 ? operands.get(0) : new And<>(operands);
    }

    /**
     * Combines operands with OR. A single operand is returned unchanged.
     */
    static <T> QueryPredicate<T> anyOf(List<QueryPredicate<T>> operands) {
        return operands.size() == 1 ? operands.get(0) : new Or<>(operands);
    }

    static <T> QueryPredicate<T> compare(ComparisonOperator operator, FieldAccessor<T, ?> field, Object literal) {
        return new Compare<>(operator, field, literal);
    }

    static <T> QueryPredicate<T> isNull(FieldAccessor<T, ?> field) {
        return new NullCheck<>(field, false);
    }

    static <T> QueryPredicate<T> isNotNull(FieldAccessor<T, ?> field) {
        return new NullCheck<>(field, true);
    }

    static <T> QueryPredicate<T> substring(SubstringKind kind, FieldAccessor<T, ?> field, String literal) {
        return new Substring<>(kind, field, literal);
    }

    record And<T>(List<QueryPredicate<T>> operands) implements QueryPredicate<T> {
        public And {
            if (operands == null || operands.isEmpty()) {
                throw new IllegalArgumentException("AND requires at least one operand");
            }
            operands = List.copyOf(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(QueryPredicateVisitor<T, R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or<T>(List<QueryPredicate<T>> operands) implements QueryPredicate<T> {
        public Or {
            if (operands == null || operands.isEmpty()) {
                throw new IllegalArgumentException("OR requires at least one operand");
            }
            operands = List.copyOf(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(QueryPredicateVisitor<T, R> visitor) {
            return visitor.visitOr(this);
        }
    }

    /**
     * Comparison of a field with a non-null literal.
     */
    record Compare<T>(ComparisonOperator operator, FieldAccessor<T, ?> field, Object literal) implements QueryPredicate<T> {
        public Compare {
            Objects.requireNonNull(operator, "operator cannot be null");
            Objects.requireNonNull(field, "field cannot be null");
            Objects.requireNonNull(literal, "literal cannot be null; use NullCheck");
        }

        @Override
        public <R> R accept(QueryPredicateVisitor<T, R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    /**
     * Presence test. {@code negated == false} means "is null".
     */
    record NullCheck<T>(FieldAccessor<T, ?> field, boolean negated) implements QueryPredicate<T> {
        public NullCheck {
            Objects.requireNonNull(field, "field cannot be null");
        }

        @Override
        public <R> R accept(QueryPredicateVisitor<T, R> visitor) {
            return visitor.visitNullCheck(this);
        }
    }

    record Substring<T>(SubstringKind kind, FieldAccessor<T, ?> field, String literal) implements QueryPredicate<T> {
        public Substring {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(field, "field cannot be null");
            Objects.requireNonNull(literal, "literal cannot be null");
        }

        @Override
        public <R> R accept(QueryPredicateVisitor<T, R> visitor) {
            return visitor.visitSubstring(this);
        }
    }
}
