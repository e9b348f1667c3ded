package io.github.cyfko.querier.core;

import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.compile.IncludeResolver;
import io.github.cyfko.querier.core.compile.PredicateCompiler;
import io.github.cyfko.querier.core.compile.SortCompiler;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.core.spi.CancellationToken;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.core.spi.QuerySource;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Execution pipeline turning {@link QuerierParams} into a {@link PagedResult}.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>Include hints, filtered through the registry allow-list</li>
 *   <li>Filter predicate</li>
 *   <li>Free-text clause</li>
 *   <li>Count, before pagination</li>
 *   <li>Sort, or the registry default order when no sort is requested</li>
 *   <li>Paging clamp: {@code page >= 1}, {@code 1 <= pageSize <= maxPageSize}</li>
 *   <li>Skip/take, projection and materialization</li>
 * </ol>
 *
 * <p>
 * The engine holds no per-request state. The cancellation token is checked before counting and
 * before materializing. Failures, including {@link io.github.cyfko.querier.core.exception.QuerierValidationException},
 * are reported through the returned future.
 * </p>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QuerierEngine<T> {

    private static final Logger logger = Logger.getLogger(QuerierEngine.class.getName());

    private final FieldRegistry<T> registry;
    private final QuerierConfig config;
    private final PredicateCompiler<T> predicateCompiler;
    private final SortCompiler<T> sortCompiler;
    private final IncludeResolver<T> includeResolver;

    public QuerierEngine(FieldRegistry<T> registry, QuerierConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.predicateCompiler = new PredicateCompiler<>(registry, config);
        this.sortCompiler = new SortCompiler<>(registry);
        this.includeResolver = new IncludeResolver<>(registry);
    }

    /**
     * Runs one search.
     *
     * @param source         the source to query
     * @param params         the request parameters
     * @param projection     mapping applied to each materialized entity
     * @param includeApplier eager-load applier, may be null
     * @param token          cancellation token, may be null
     * @param <R>            projected type
     * @return future page of projected items
     */
    public <R> CompletableFuture<PagedResult<R>> executeAsync(QuerySource<T> source,
                                                              QuerierParams params,
                                                              Function<? super T, ? extends R> projection,
                                                              IncludeApplier<T> includeApplier,
                                                              CancellationToken token) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        Objects.requireNonNull(projection, "projection cannot be null");
        CancellationToken effectiveToken = token == null ? CancellationToken.NONE : token;
        long startTime = System.nanoTime();

        final QuerySource<T> filtered;
        final List<SortKey<T>> sortKeys;
        final int page;
        final int pageSize;
        try {
            QuerySource<T> query = includeResolver.apply(source, params.include(), includeApplier);

            Optional<QueryPredicate<T>> predicate = predicateCompiler.compile(params.filters());
            if (predicate.isPresent()) {
                query = query.where(predicate.get());
            }
            Optional<QueryPredicate<T>> freeText = predicateCompiler.compileFreeText(params.freeText());
            if (freeText.isPresent()) {
                query = query.where(freeText.get());
            }

            filtered = query;
            sortKeys = sortCompiler.compile(params.sort());
            page = clampPage(params.page());
            pageSize = clampPageSize(params.pageSize());

            effectiveToken.throwIfCancellationRequested();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        logger.fine(() -> String.format("Executing %s search: sort=%s, page=%d, pageSize=%d",
                registry.getEntityType().getSimpleName(), sortKeys, page, pageSize));

        return filtered.countAsync(effectiveToken).thenCompose(total -> {
            effectiveToken.throwIfCancellationRequested();

            QuerySource<T> window = applySort(filtered, sortKeys)
                    .skip(offset(page, pageSize))
                    .take(pageSize);

            return window.<R>fetchAsync(projection, effectiveToken).thenApply(items -> {
                long durationMs = (System.nanoTime() - startTime) / 1_000_000;
                logger.info(() -> String.format("%s search completed in %dms: %d total, page %d (%d items)",
                        registry.getEntityType().getSimpleName(), durationMs, total, page, items.size()));
                return new PagedResult<R>(items, total, page, pageSize);
            });
        });
    }

    int clampPage(int requested) {
        return Math.max(1, requested);
    }

    int clampPageSize(int requested) {
        return Math.min(Math.max(1, requested), config.getMaxPageSize());
    }

    /**
     * Number of entities preceding a page. Saturates at {@link Long#MAX_VALUE}.
     */
    static long offset(int page, int pageSize) {
        long pagesBefore = (long) page - 1;
        if (pagesBefore > 0 && pageSize > Long.MAX_VALUE / pagesBefore) {
            return Long.MAX_VALUE;
        }
        return pagesBefore * pageSize;
    }

    private QuerySource<T> applySort(QuerySource<T> source, List<SortKey<T>> keys) {
        QuerySource<T> sorted = source;
        for (int i = 0; i < keys.size(); i++) {
            sorted = i == 0 ? sorted.orderBy(keys.get(i)) : sorted.thenBy(keys.get(i));
        }
        return sorted;
    }
}
