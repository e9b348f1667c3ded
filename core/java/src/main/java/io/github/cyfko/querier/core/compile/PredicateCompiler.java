package io.github.cyfko.querier.core.compile;

import io.github.cyfko.querier.core.api.*;
import io.github.cyfko.querier.core.config.ParseFailurePolicy;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.exception.QuerierValidationException;
import io.github.cyfko.querier.core.model.QuerierConstants;
import io.github.cyfko.querier.core.utils.TypeConversionUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles client filters into a {@link QueryPredicate} over the fields of a {@link FieldRegistry}.
 *
 * <h2>Composition</h2>
 * <ol>
 *   <li>Fields absent from the filterable registry are skipped.</li>
 *   <li>Each operator of a field produces at most one clause; clauses of a field are ANDed.</li>
 *   <li>Field groups are ANDed together.</li>
 * </ol>
 *
 * <h2>Dropped clauses</h2>
 * <p>
 * Unknown operators, ordering operators on non-comparable fields and {@code null} literals for
 * operators other than {@code eq}/{@code neq} are dropped. Values that do not parse into the
 * field type follow the configured {@link ParseFailurePolicy}.
 * </p>
 *
 * <p>The compiler holds no mutable state and may be shared between threads.</p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PredicateCompiler<T> {

    private static final Logger logger = Logger.getLogger(PredicateCompiler.class.getName());

    private final FieldRegistry<T> registry;
    private final QuerierConfig config;

    public PredicateCompiler(FieldRegistry<T> registry, QuerierConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Compiles the filters of a request.
     *
     * @param filters field name to (operator to raw value)
     * @return the conjunction of all surviving clauses, or empty when none survives
     * @throws QuerierValidationException if a value does not parse and the policy is
     *                                    {@link ParseFailurePolicy#REJECT_REQUEST}
     */
    public Optional<QueryPredicate<T>> compile(Map<String, Map<String, String>> filters) {
        if (filters == null || filters.isEmpty()) {
            return Optional.empty();
        }

        List<QueryPredicate<T>> groups = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> entry : filters.entrySet()) {
            String field = entry.getKey();
            Optional<FieldAccessor<T, ?>> accessor = registry.findFilterable(field);
            if (accessor.isEmpty()) {
                logger.fine(() -> String.format("Ignoring filter on unregistered field '%s' for %s",
                        field, registry.getEntityType().getSimpleName()));
                continue;
            }

            List<QueryPredicate<T>> clauses = new ArrayList<>();
            for (Map.Entry<String, String> op : entry.getValue().entrySet()) {
                compileClause(field, accessor.get(), op.getKey(), op.getValue()).ifPresent(clauses::add);
            }
            if (!clauses.isEmpty()) {
                groups.add(QueryPredicate.allOf(clauses));
            }
        }

        return groups.isEmpty() ? Optional.empty() : Optional.of(QueryPredicate.allOf(groups));
    }

    /**
     * Compiles the free-text term into a {@code contains} clause on the registry free-text field.
     *
     * @param freeText the raw term
     * @return the clause, or empty when the term is blank or no free-text field is known
     */
    public Optional<QueryPredicate<T>> compileFreeText(String freeText) {
        if (freeText == null || freeText.isBlank()) {
            return Optional.empty();
        }
        return registry.getFreeTextField()
                .map(field -> QueryPredicate.substring(SubstringKind.CONTAINS, field, freeText.trim()));
    }

    private Optional<QueryPredicate<T>> compileClause(String field, FieldAccessor<T, ?> accessor, String operatorName, String raw) {
        Optional<FilterOperator> resolved = FilterOperator.fromString(operatorName);
        if (resolved.isEmpty()) {
            logger.fine(() -> String.format("Ignoring unknown operator '%s' on field '%s'", operatorName, field));
            return Optional.empty();
        }

        FilterOperator operator = resolved.get();
        boolean nullLiteral = raw == null || QuerierConstants.NULL_LITERAL.equalsIgnoreCase(raw.trim());

        return switch (operator) {
            case EQ -> nullLiteral
                    ? Optional.of(QueryPredicate.isNull(accessor))
                    : compare(field, operator, ComparisonOperator.EQ, accessor, raw);
            case NEQ -> nullLiteral
                    ? Optional.of(QueryPredicate.isNotNull(accessor))
                    : compare(field, operator, ComparisonOperator.NE, accessor, raw);
            case NOT_NULL -> Optional.of(QueryPredicate.isNotNull(accessor));
            case GT -> ordering(field, operator, ComparisonOperator.GT, accessor, raw, nullLiteral);
            case GTE -> ordering(field, operator, ComparisonOperator.GTE, accessor, raw, nullLiteral);
            case LT -> ordering(field, operator, ComparisonOperator.LT, accessor, raw, nullLiteral);
            case LTE -> ordering(field, operator, ComparisonOperator.LTE, accessor, raw, nullLiteral);
            case IN -> nullLiteral ? dropNull(field, operator) : in(field, accessor, raw);
            case CONTAINS -> substring(field, operator, SubstringKind.CONTAINS, accessor, raw, nullLiteral);
            case STARTS_WITH -> substring(field, operator, SubstringKind.STARTS_WITH, accessor, raw, nullLiteral);
            case ENDS_WITH -> substring(field, operator, SubstringKind.ENDS_WITH, accessor, raw, nullLiteral);
        };
    }

    private Optional<QueryPredicate<T>> compare(String field, FilterOperator operator, ComparisonOperator comparison,
                                                FieldAccessor<T, ?> accessor, String raw) {
        return convert(field, operator, accessor, raw)
                .map(literal -> QueryPredicate.compare(comparison, accessor, literal));
    }

    private Optional<QueryPredicate<T>> ordering(String field, FilterOperator operator, ComparisonOperator comparison,
                                                 FieldAccessor<T, ?> accessor, String raw, boolean nullLiteral) {
        if (nullLiteral) {
            return dropNull(field, operator);
        }
        if (!accessor.isComparable()) {
            logger.fine(() -> String.format("Ignoring '%s' on field '%s': type %s is not comparable",
                    operator.wireName(), field, accessor.type().getSimpleName()));
            return Optional.empty();
        }
        return compare(field, operator, comparison, accessor, raw);
    }

    private Optional<QueryPredicate<T>> in(String field, FieldAccessor<T, ?> accessor, String raw) {
        List<QueryPredicate<T>> alternatives = new ArrayList<>();
        for (String item : raw.split(QuerierConstants.LIST_SEPARATOR)) {
            String trimmed = item.trim();
            if (trimmed.isEmpty() || QuerierConstants.NULL_LITERAL.equalsIgnoreCase(trimmed)) {
                continue;
            }
            convert(field, FilterOperator.IN, accessor, trimmed)
                    .ifPresent(literal -> alternatives.add(QueryPredicate.compare(ComparisonOperator.EQ, accessor, literal)));
        }
        if (alternatives.isEmpty()) {
            logger.fine(() -> String.format("Ignoring 'in' on field '%s': no usable value in '%s'", field, raw));
            return Optional.empty();
        }
        return Optional.of(QueryPredicate.anyOf(alternatives));
    }

    private Optional<QueryPredicate<T>> substring(String field, FilterOperator operator, SubstringKind kind,
                                                  FieldAccessor<T, ?> accessor, String raw, boolean nullLiteral) {
        if (nullLiteral) {
            return dropNull(field, operator);
        }
        return Optional.of(QueryPredicate.substring(kind, accessor, raw));
    }

    private Optional<QueryPredicate<T>> dropNull(String field, FilterOperator operator) {
        logger.fine(() -> String.format("Ignoring '%s' on field '%s': null literal not supported", operator.wireName(), field));
        return Optional.empty();
    }

    private Optional<Object> convert(String field, FilterOperator operator, FieldAccessor<T, ?> accessor, String raw) {
        Optional<Object> value = TypeConversionUtils.tryConvert(accessor.type(), raw, config.getEnumMatchMode());
        if (value.isPresent()) {
            return value;
        }

        String message = String.format("Value '%s' of filter '%s' (%s) cannot be parsed as %s",
                raw, field, operator.wireName(), accessor.type().getSimpleName());
        if (config.getParseFailurePolicy() == ParseFailurePolicy.REJECT_REQUEST) {
            throw new QuerierValidationException(field, operator.wireName(), raw, message);
        }
        logger.fine(() -> "Ignoring clause: " + message);
        return Optional.empty();
    }
}
