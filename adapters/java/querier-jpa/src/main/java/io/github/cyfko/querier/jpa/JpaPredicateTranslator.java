package io.github.cyfko.querier.jpa;

import io.github.cyfko.querier.core.api.FieldAccessor;
import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.QueryPredicateVisitor;
import io.github.cyfko.querier.jpa.utils.PathResolverUtils;
import jakarta.persistence.criteria.*;
import jakarta.persistence.metamodel.Metamodel;

/**
 * Lowers a {@link QueryPredicate} into a JPA Criteria {@link Predicate}.
 *
 * <table border="1">
 *   <caption>Node mapping</caption>
 *   <tr><th>Node</th><th>Criteria</th></tr>
 *   <tr><td>And / Or</td><td>{@code cb.and} / {@code cb.or}</td></tr>
 *   <tr><td>Compare EQ / NE</td><td>{@code cb.equal} / {@code cb.notEqual}</td></tr>
 *   <tr><td>Compare GT, GTE, LT, LTE</td><td>{@code cb.greaterThan} ... on comparable paths</td></tr>
 *   <tr><td>NullCheck</td><td>{@code cb.isNull} / {@code cb.isNotNull}</td></tr>
 *   <tr><td>Substring</td><td>{@code cb.like} with {@code \} escape; non-text paths cast to String</td></tr>
 * </table>
 *
 * <p>Paths are resolved through {@link PathResolverUtils}, so a translator instance must not be
 * shared between queries.</p>
 *
 * <p>Substring tests on non-text attributes match the database's text rendering of the value,
 * not the Java one: H2 renders a timestamp as {@code 2024-01-01 12:00:00} where the in-memory
 * source sees {@code 2024-01-01T12:00}.</p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
public class JpaPredicateTranslator<T> implements QueryPredicateVisitor<T, Predicate> {

    static final char ESCAPE = '\\';

    private final From<?, T> root;
    private final CriteriaBuilder cb;
    private final Metamodel metamodel;

    public JpaPredicateTranslator(From<?, T> root, CriteriaBuilder cb, Metamodel metamodel) {
        this.root = root;
        this.cb = cb;
        this.metamodel = metamodel;
    }

    public Predicate translate(QueryPredicate<T> predicate) {
        return predicate.accept(this);
    }

    @Override
    public Predicate visitAnd(QueryPredicate.And<T> and) {
        return cb.and(and.operands().stream().map(this::translate).toArray(Predicate[]::new));
    }

    @Override
    public Predicate visitOr(QueryPredicate.Or<T> or) {
        return cb.or(or.operands().stream().map(this::translate).toArray(Predicate[]::new));
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Predicate visitCompare(QueryPredicate.Compare<T> compare) {
        Path<?> path = resolve(compare.field());
        Object literal = compare.literal();
        return switch (compare.operator()) {
            case EQ -> cb.equal(path, literal);
            case NE -> cb.notEqual(path, literal);
            case GT -> cb.greaterThan((Expression<Comparable>) path, (Comparable) literal);
            case GTE -> cb.greaterThanOrEqualTo((Expression<Comparable>) path, (Comparable) literal);
            case LT -> cb.lessThan((Expression<Comparable>) path, (Comparable) literal);
            case LTE -> cb.lessThanOrEqualTo((Expression<Comparable>) path, (Comparable) literal);
        };
    }

    @Override
    public Predicate visitNullCheck(QueryPredicate.NullCheck<T> nullCheck) {
        Path<?> path = resolve(nullCheck.field());
        return nullCheck.negated() ? cb.isNotNull(path) : cb.isNull(path);
    }

    @Override
    public Predicate visitSubstring(QueryPredicate.Substring<T> substring) {
        Expression<String> text = asText(resolve(substring.field()));
        String escaped = escapeLike(substring.literal());
        String pattern = switch (substring.kind()) {
            case CONTAINS -> "%" + escaped + "%";
            case STARTS_WITH -> escaped + "%";
            case ENDS_WITH -> "%" + escaped;
        };
        return cb.like(text, pattern, ESCAPE);
    }

    Path<?> resolve(FieldAccessor<T, ?> field) {
        return PathResolverUtils.resolvePath(root, field.path(), metamodel);
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> asText(Path<?> path) {
        if (path.getJavaType() == String.class) {
            return (Path<String>) path;
        }
        return path.as(String.class);
    }

    /**
     * Escapes LIKE wildcards so that the literal is matched verbatim.
     */
    static String escapeLike(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (char c : literal.toCharArray()) {
            if (c == ESCAPE || c == '%' || c == '_') {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
