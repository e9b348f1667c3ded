package io.github.cyfko.querier.core;

import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.exception.QuerierStateException;
import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.core.spi.CancellationToken;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.core.spi.QuerySource;
import io.github.cyfko.querier.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Single-use fluent builder running one search through a {@link QuerierEngine}.
 * <p>
 * A builder collects the source, the request parameters and the field registry (required), plus
 * an optional projection, include applier, configuration and cancellation token. It executes
 * exactly once; any further configuration or execution raises {@link QuerierStateException}.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CompletableFuture<PagedResult<CompanyDto>> page = QuerierBuilder.<Company>create()
 *     .withSource(JpaQuerySource.of(em, Company.class))
 *     .withQueryParams(params)
 *     .withFieldRegistry(CompanyQueries.REGISTRY)
 *     .withProjection(CompanyDto::from)
 *     .withIncludeApplier(JpaIncludes.fetchJoins())
 *     .executeAsync();
 * }</pre>
 *
 * <p>Instances are not thread-safe and are meant to live for a single request.</p>
 *
 * @param <T> entity type
 * @param <R> projected type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QuerierBuilder<T, R> {

    private QuerySource<T> source;
    private QuerierParams params;
    private FieldRegistry<T> registry;
    private Function<? super T, ? extends R> projection;
    private IncludeApplier<T> includeApplier;
    private QuerierConfig config = QuerierConfig.defaults();
    private CancellationToken token = CancellationToken.NONE;
    private BuilderState state = BuilderState.UNCONFIGURED;

    @SuppressWarnings("unchecked")
    private QuerierBuilder() {
        this.projection = entity -> (R) entity;
    }

    /**
     * Creates a builder projecting entities to themselves.
     *
     * @param <T> entity type
     * @return a new, unconfigured builder
     */
    public static <T> QuerierBuilder<T, T> create() {
        return new QuerierBuilder<>();
    }

    public QuerierBuilder<T, R> withSource(QuerySource<T> source) {
        ensureConfigurable();
        this.source = Objects.requireNonNull(source, "source cannot be null");
        return refreshState();
    }

    public QuerierBuilder<T, R> withQueryParams(QuerierParams params) {
        ensureConfigurable();
        this.params = Objects.requireNonNull(params, "params cannot be null");
        return refreshState();
    }

    public QuerierBuilder<T, R> withFieldRegistry(FieldRegistry<T> registry) {
        ensureConfigurable();
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        return refreshState();
    }

    /**
     * Sets the projection applied to each materialized entity.
     *
     * @param projection mapping from entity to result item
     * @param <R2>       new projected type
     * @return this builder, retyped
     */
    @SuppressWarnings("unchecked")
    public <R2> QuerierBuilder<T, R2> withProjection(Function<? super T, ? extends R2> projection) {
        ensureConfigurable();
        QuerierBuilder<T, R2> retyped = (QuerierBuilder<T, R2>) this;
        retyped.projection = Objects.requireNonNull(projection, "projection cannot be null");
        return retyped;
    }

    public QuerierBuilder<T, R> withIncludeApplier(IncludeApplier<T> includeApplier) {
        ensureConfigurable();
        this.includeApplier = Objects.requireNonNull(includeApplier, "includeApplier cannot be null");
        return this;
    }

    public QuerierBuilder<T, R> withConfig(QuerierConfig config) {
        ensureConfigurable();
        this.config = Objects.requireNonNull(config, "config cannot be null");
        return this;
    }

    public QuerierBuilder<T, R> withCancellationToken(CancellationToken token) {
        ensureConfigurable();
        this.token = Objects.requireNonNull(token, "token cannot be null");
        return this;
    }

    public BuilderState getState() {
        return state;
    }

    /**
     * Runs the search. May be called once.
     *
     * @return future page of projected items
     * @throws QuerierStateException if the builder was already executed or misses a required piece
     */
    public CompletableFuture<PagedResult<R>> executeAsync() {
        ValidationResult transition = state.checkTransition(BuilderState.EXECUTED);
        if (!transition.isValid()) {
            if (state == BuilderState.UNCONFIGURED) {
                throw new QuerierStateException(transition.getErrorMessage() + ": missing " + String.join(", ", missingPieces()));
            }
            throw new QuerierStateException(transition.getErrorMessage());
        }
        state = BuilderState.EXECUTED;

        QuerierEngine<T> engine = new QuerierEngine<>(registry, config);
        return engine.executeAsync(source, params, projection, includeApplier, token);
    }

    private void ensureConfigurable() {
        ValidationResult transition = state.checkTransition(BuilderState.CONFIGURED);
        if (!transition.isValid()) {
            throw new QuerierStateException(transition.getErrorMessage());
        }
    }

    private QuerierBuilder<T, R> refreshState() {
        state = missingPieces().isEmpty() ? BuilderState.CONFIGURED : BuilderState.UNCONFIGURED;
        return this;
    }

    private List<String> missingPieces() {
        List<String> missing = new ArrayList<>();
        if (source == null) missing.add("source");
        if (params == null) missing.add("query params");
        if (registry == null) missing.add("field registry");
        return missing;
    }
}
