package io.github.cyfko.querier.spring.service;

import io.github.cyfko.querier.core.QuerierBuilder;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.core.spi.QuerySource;
import io.github.cyfko.querier.spring.support.FieldRegistryCatalog;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Entry point for running searches from Spring components.
 * <p>
 * Each call creates a fresh {@link QuerierBuilder} configured with the registry declared for the
 * entity and the application-wide {@link QuerierConfig}, so the template itself is stateless and
 * can be shared.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @GetMapping("/companies")
 * public CompletableFuture<PagedResult<CompanyDto>> search(QuerierParams params) {
 *     return template.search(Company.class, JpaQuerySource.of(em, Company.class), params, CompanyDto::from);
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QuerierTemplate {

    private final FieldRegistryCatalog catalog;
    private final QuerierConfig config;

    public QuerierTemplate(FieldRegistryCatalog catalog, QuerierConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public <T, R> CompletableFuture<PagedResult<R>> search(Class<T> entityType,
                                                          QuerySource<T> source,
                                                          QuerierParams params,
                                                          Function<? super T, ? extends R> projection) {
        return builder(entityType, source, params).<R>withProjection(projection).executeAsync();
    }

    public <T, R> CompletableFuture<PagedResult<R>> search(Class<T> entityType,
                                                          QuerySource<T> source,
                                                          QuerierParams params,
                                                          Function<? super T, ? extends R> projection,
                                                          IncludeApplier<T> includeApplier) {
        return builder(entityType, source, params)
                .withIncludeApplier(includeApplier)
                .<R>withProjection(projection)
                .executeAsync();
    }

    private <T> QuerierBuilder<T, T> builder(Class<T> entityType, QuerySource<T> source, QuerierParams params) {
        return QuerierBuilder.<T>create()
                .withSource(source)
                .withQueryParams(params)
                .withFieldRegistry(catalog.get(entityType))
                .withConfig(config);
    }
}
