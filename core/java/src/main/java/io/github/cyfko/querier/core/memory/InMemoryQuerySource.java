package io.github.cyfko.querier.core.memory;

import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.spi.CancellationToken;
import io.github.cyfko.querier.core.spi.QuerySource;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link QuerySource} over an in-memory list.
 * <p>
 * Predicates are evaluated through the accessor getters by {@link InMemoryPredicateEvaluator}.
 * Sorting is stable: entities comparing equal keep their list order, nulls come first when
 * ascending and last when descending. Without an executor, terminal operations run on the
 * calling thread and return completed futures.
 * </p>
 *
 * <pre>{@code
 * QuerySource<Company> source = InMemoryQuerySource.of(companies);
 * }</pre>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 */
public final class InMemoryQuerySource<T> implements QuerySource<T> {

    private final List<T> entities;
    private final List<QueryPredicate<T>> predicates;
    private final List<SortKey<T>> ordering;
    private final long skip;
    private final int take;
    private final Executor executor;

    private InMemoryQuerySource(List<T> entities, List<QueryPredicate<T>> predicates, List<SortKey<T>> ordering,
                                long skip, int take, Executor executor) {
        this.entities = entities;
        this.predicates = predicates;
        this.ordering = ordering;
        this.skip = skip;
        this.take = take;
        this.executor = executor;
    }

    public static <T> InMemoryQuerySource<T> of(Collection<? extends T> entities) {
        Objects.requireNonNull(entities, "entities cannot be null");
        return new InMemoryQuerySource<>(Collections.unmodifiableList(new ArrayList<>(entities)),
                List.of(), List.of(), 0, -1, null);
    }

    /**
     * Runs the terminal operations on the given executor.
     */
    public InMemoryQuerySource<T> withExecutor(Executor executor) {
        return new InMemoryQuerySource<>(entities, predicates, ordering, skip, take, executor);
    }

    @Override
    public InMemoryQuerySource<T> where(QueryPredicate<T> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return new InMemoryQuerySource<>(entities, append(predicates, predicate), ordering, skip, take, executor);
    }

    @Override
    public InMemoryQuerySource<T> orderBy(SortKey<T> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new InMemoryQuerySource<>(entities, predicates, List.of(key), skip, take, executor);
    }

    @Override
    public InMemoryQuerySource<T> thenBy(SortKey<T> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new InMemoryQuerySource<>(entities, predicates, append(ordering, key), skip, take, executor);
    }

    @Override
    public InMemoryQuerySource<T> skip(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip must be >= 0. Provided: " + count);
        }
        return new InMemoryQuerySource<>(entities, predicates, ordering, count, take, executor);
    }

    @Override
    public InMemoryQuerySource<T> take(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Take must be >= 0. Provided: " + count);
        }
        return new InMemoryQuerySource<>(entities, predicates, ordering, skip, count, executor);
    }

    @Override
    public CompletableFuture<Long> countAsync(CancellationToken token) {
        return read(() -> filtered().count(), token);
    }

    @Override
    public <R> CompletableFuture<List<R>> fetchAsync(Function<? super T, ? extends R> projection, CancellationToken token) {
        Objects.requireNonNull(projection, "projection cannot be null");
        return read(() -> {
            Stream<T> window = sorted().stream().skip(skip);
            if (take >= 0) {
                window = window.limit(take);
            }
            return window.<R>map(projection).collect(Collectors.toList());
        }, token);
    }

    private Stream<T> filtered() {
        InMemoryPredicateEvaluator<T> evaluator = new InMemoryPredicateEvaluator<>();
        Predicate<T> test = predicates.stream()
                .map(p -> p.accept(evaluator))
                .reduce(Predicate::and)
                .orElse(entity -> true);
        return entities.stream().filter(test);
    }

    private List<T> sorted() {
        List<T> result = filtered().collect(Collectors.toCollection(ArrayList::new));
        comparator().ifPresent(result::sort);
        return result;
    }

    private Optional<Comparator<T>> comparator() {
        Comparator<T> combined = null;
        for (SortKey<T> key : ordering) {
            Function<T, Object> extractor = entity -> key.field().get(entity);
            Comparator<Object> byValue = Comparator.nullsFirst(InMemoryQuerySource::compareAny);
            Comparator<T> ascending = Comparator.comparing(extractor, byValue);
            Comparator<T> next = key.descending() ? ascending.reversed() : ascending;
            combined = combined == null ? next : combined.thenComparing(next);
        }
        return Optional.ofNullable(combined);
    }

    private static int compareAny(Object left, Object right) {
        if (left instanceof Comparable<?> && left.getClass() == right.getClass()) {
            return InMemoryPredicateEvaluator.compareValues(left, right);
        }
        return InMemoryPredicateEvaluator.asText(left).compareTo(InMemoryPredicateEvaluator.asText(right));
    }

    private <V> CompletableFuture<V> read(Supplier<V> reader, CancellationToken token) {
        CancellationToken effective = token == null ? CancellationToken.NONE : token;
        if (executor == null) {
            try {
                effective.throwIfCancellationRequested();
                return CompletableFuture.completedFuture(reader.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(() -> {
            effective.throwIfCancellationRequested();
            return reader.get();
        }, executor);
    }

    private static <E> List<E> append(List<E> list, E element) {
        List<E> copy = new ArrayList<>(list);
        copy.add(element);
        return Collections.unmodifiableList(copy);
    }
}
