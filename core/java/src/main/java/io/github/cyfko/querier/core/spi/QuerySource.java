package io.github.cyfko.querier.core.spi;

import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.SortKey;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Composable, deferred query over a collection of entities.
 * <p>
 * Every composition method returns a new source and leaves the receiver untouched, so a source
 * can be shared and derived from freely. Nothing is read until {@link #countAsync} or
 * {@link #fetchAsync} is called.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #where} calls accumulate with AND semantics.</li>
 *   <li>{@link #orderBy} replaces any previous ordering; {@link #thenBy} appends a tie-break.</li>
 *   <li>{@link #countAsync} ignores ordering, skip and take.</li>
 *   <li>Both terminal operations check the cancellation token before reading and complete
 *       exceptionally with {@link java.util.concurrent.CancellationException} when it is set.</li>
 *   <li>Read failures complete the returned future exceptionally with the original exception.</li>
 * </ul>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QuerySource<T> {

    QuerySource<T> where(QueryPredicate<T> predicate);

    QuerySource<T> orderBy(SortKey<T> key);

    QuerySource<T> thenBy(SortKey<T> key);

    QuerySource<T> skip(long count);

    QuerySource<T> take(int count);

    /**
     * Counts the entities matching the accumulated predicates.
     *
     * @param token cancellation token checked before the read
     * @return future total count
     */
    CompletableFuture<Long> countAsync(CancellationToken token);

    /**
     * Projects and materializes the current window.
     *
     * @param projection mapping applied to every entity
     * @param token      cancellation token checked before the read
     * @param <R>        projected type
     * @return future list of projected items
     */
    <R> CompletableFuture<List<R>> fetchAsync(Function<? super T, ? extends R> projection, CancellationToken token);
}
