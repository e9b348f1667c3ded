package io.github.cyfko.querier.core.memory;

import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.QueryPredicateVisitor;

import java.util.List;
import java.util.function.Predicate;

/**
 * Lowers a {@link QueryPredicate} into a {@link Predicate} evaluated with the accessor getters.
 * <p>
 * Null semantics follow SQL: a comparison or substring test against a null attribute is false,
 * including {@code NE}. Only {@link QueryPredicate.NullCheck} matches null attributes.
 * Substring tests are case-sensitive; non-text attributes are matched through their Java string
 * form: enum constants through their name, everything else through {@code toString()}
 * ({@code 2024-01-01T12:00} for a {@code LocalDateTime}). Other sources render non-text values
 * the way their storage does.
 * </p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
public class InMemoryPredicateEvaluator<T> implements QueryPredicateVisitor<T, Predicate<T>> {

    @Override
    public Predicate<T> visitAnd(QueryPredicate.And<T> and) {
        List<Predicate<T>> operands = and.operands().stream().map(p -> p.accept(this)).toList();
        return entity -> operands.stream().allMatch(p -> p.test(entity));
    }

    @Override
    public Predicate<T> visitOr(QueryPredicate.Or<T> or) {
        List<Predicate<T>> operands = or.operands().stream().map(p -> p.accept(this)).toList();
        return entity -> operands.stream().anyMatch(p -> p.test(entity));
    }

    @Override
    public Predicate<T> visitCompare(QueryPredicate.Compare<T> compare) {
        Object literal = compare.literal();
        return entity -> {
            Object value = compare.field().get(entity);
            if (value == null) {
                return false;
            }
            return switch (compare.operator()) {
                case EQ -> valueEquals(value, literal);
                case NE -> !valueEquals(value, literal);
                case GT -> compareValues(value, literal) > 0;
                case GTE -> compareValues(value, literal) >= 0;
                case LT -> compareValues(value, literal) < 0;
                case LTE -> compareValues(value, literal) <= 0;
            };
        };
    }

    @Override
    public Predicate<T> visitNullCheck(QueryPredicate.NullCheck<T> nullCheck) {
        return entity -> (nullCheck.field().get(entity) == null) != nullCheck.negated();
    }

    @Override
    public Predicate<T> visitSubstring(QueryPredicate.Substring<T> substring) {
        return entity -> {
            Object value = substring.field().get(entity);
            return value != null && substring.kind().test(asText(value), substring.literal());
        };
    }

    static String asText(Object value) {
        return value instanceof Enum<?> e ? e.name() : String.valueOf(value);
    }

    private static boolean valueEquals(Object value, Object literal) {
        if (value instanceof Comparable<?> && value.getClass() == literal.getClass()) {
            return compareValues(value, literal) == 0;
        }
        return value.equals(literal);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object value, Object literal) {
        return ((Comparable) value).compareTo(literal);
    }
}
