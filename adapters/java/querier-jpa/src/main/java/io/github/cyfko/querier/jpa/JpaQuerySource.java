package io.github.cyfko.querier.jpa;

import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.spi.CancellationToken;
import io.github.cyfko.querier.core.spi.QuerySource;
import io.github.cyfko.querier.jpa.utils.PathResolverUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceUnitUtil;
import jakarta.persistence.Tuple;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.*;
import jakarta.persistence.metamodel.EntityType;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link QuerySource} backed by the JPA Criteria API.
 * <p>
 * The source is an immutable description of the query: predicates, ordering, fetch joins,
 * offset and limit are accumulated and the Criteria queries are only built when
 * {@link #countAsync} or {@link #fetchAsync} is called.
 * </p>
 *
 * <h2>Query shape</h2>
 * <ul>
 *   <li>The count query applies the predicates only: no fetch joins, no ordering.</li>
 *   <li>Fetch joins are LEFT joins; the select becomes {@code distinct} as soon as a join or a
 *       fetch is present.</li>
 *   <li>When fetch joins meet an offset or a limit, the page of root identifiers is read first
 *       without fetches, then those entities are loaded with their fetches through
 *       {@code id IN (...)}, so paging always happens in SQL.</li>
 *   <li>Without any requested ordering, rows are ordered by the entity identifier so that
 *       pagination is deterministic.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>
 * By default the queries run on the calling thread and the returned futures are already
 * completed. With {@link #withExecutor(Executor)} they run on the executor; the
 * {@link EntityManager} must then be usable from that executor's threads.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * QuerySource<Company> source = JpaQuerySource.of(entityManager, Company.class);
 * PagedResult<Company> page = QuerierBuilder.<Company>create()
 *     .withSource(source)
 *     .withQueryParams(params)
 *     .withFieldRegistry(registry)
 *     .withIncludeApplier(JpaIncludes.fetchJoins())
 *     .executeAsync()
 *     .join();
 * }</pre>
 *
 * @param <T> entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaQuerySource<T> implements QuerySource<T> {

    private static final Logger logger = Logger.getLogger(JpaQuerySource.class.getName());

    private final EntityManager em;
    private final Class<T> entityClass;
    private final List<QueryPredicate<T>> predicates;
    private final List<SortKey<T>> ordering;
    private final List<String> fetches;
    private final long skip;
    private final int take;
    private final Executor executor;

    private JpaQuerySource(EntityManager em, Class<T> entityClass, List<QueryPredicate<T>> predicates,
                           List<SortKey<T>> ordering, List<String> fetches, long skip, int take, Executor executor) {
        this.em = em;
        this.entityClass = entityClass;
        this.predicates = predicates;
        this.ordering = ordering;
        this.fetches = fetches;
        this.skip = skip;
        this.take = take;
        this.executor = executor;
    }

    public static <T> JpaQuerySource<T> of(EntityManager em, Class<T> entityClass) {
        Objects.requireNonNull(em, "entityManager cannot be null");
        Objects.requireNonNull(entityClass, "entityClass cannot be null");
        return new JpaQuerySource<>(em, entityClass, List.of(), List.of(), List.of(), 0, -1, null);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public List<String> getFetches() {
        return fetches;
    }

    public JpaQuerySource<T> withExecutor(Executor executor) {
        return new JpaQuerySource<>(em, entityClass, predicates, ordering, fetches, skip, take, executor);
    }

    /**
     * Adds LEFT fetch joins for the given association paths.
     *
     * @param paths association paths in dot notation
     * @return a new source with the fetches added
     */
    public JpaQuerySource<T> withFetches(Collection<String> paths) {
        Set<String> merged = new LinkedHashSet<>(fetches);
        merged.addAll(paths);
        return new JpaQuerySource<>(em, entityClass, predicates, ordering, List.copyOf(merged), skip, take, executor);
    }

    @Override
    public JpaQuerySource<T> where(QueryPredicate<T> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return new JpaQuerySource<>(em, entityClass, append(predicates, predicate), ordering, fetches, skip, take, executor);
    }

    @Override
    public JpaQuerySource<T> orderBy(SortKey<T> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new JpaQuerySource<>(em, entityClass, predicates, List.of(key), fetches, skip, take, executor);
    }

    @Override
    public JpaQuerySource<T> thenBy(SortKey<T> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new JpaQuerySource<>(em, entityClass, predicates, append(ordering, key), fetches, skip, take, executor);
    }

    @Override
    public JpaQuerySource<T> skip(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip must be >= 0. Provided: " + count);
        }
        return new JpaQuerySource<>(em, entityClass, predicates, ordering, fetches, count, take, executor);
    }

    @Override
    public JpaQuerySource<T> take(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Take must be >= 0. Provided: " + count);
        }
        return new JpaQuerySource<>(em, entityClass, predicates, ordering, fetches, skip, count, executor);
    }

    @Override
    public CompletableFuture<Long> countAsync(CancellationToken token) {
        return read(this::count, token);
    }

    @Override
    public <R> CompletableFuture<List<R>> fetchAsync(Function<? super T, ? extends R> projection, CancellationToken token) {
        Objects.requireNonNull(projection, "projection cannot be null");
        return read(() -> fetch().stream().<R>map(projection).collect(Collectors.toList()), token);
    }

    private long count() {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<T> root = countQuery.from(entityClass);

        Predicate predicate = buildPredicate(root, cb);
        countQuery.select(root.getJoins().isEmpty() ? cb.count(root) : cb.countDistinct(root));
        if (predicate != null) {
            countQuery.where(predicate);
        }

        Long count = em.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query on %s completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, count));
        return count;
    }

    private List<T> fetch() {
        long startTime = System.nanoTime();

        boolean paged = skip > 0 || take >= 0;
        Optional<String> idName = identifierName();
        List<T> results;
        if (!fetches.isEmpty() && paged && idName.isPresent()) {
            results = fetchByIdentifiers(idName.get(), fetchPageIdentifiers(idName.get()));
        } else {
            results = fetchInOneQuery();
        }

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Fetch query on %s completed in %dms: %d rows (fetches=%s)",
                entityClass.getSimpleName(), durationMs, results.size(), fetches));
        return results;
    }

    private List<T> fetchInOneQuery() {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(entityClass);
        Root<T> root = query.from(entityClass);
        query.select(root);

        for (String path : fetches) {
            PathResolverUtils.fetchPath(root, path);
        }

        Predicate predicate = buildPredicate(root, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        query.orderBy(buildOrders(root, cb));

        if (!fetches.isEmpty() || !root.getJoins().isEmpty()) {
            query.distinct(true);
        }

        TypedQuery<T> typedQuery = em.createQuery(query);
        applyRange(typedQuery);
        return typedQuery.getResultList();
    }

    /**
     * Pages the root identifiers without any fetch join, so offset and limit reach the SQL.
     * Order expressions are selected along with the identifier to keep {@code distinct} valid.
     */
    private List<Object> fetchPageIdentifiers(String idName) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<T> root = query.from(entityClass);

        Predicate predicate = buildPredicate(root, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        List<Order> orders = buildOrders(root, cb);

        List<Selection<?>> selections = new ArrayList<>();
        selections.add(root.get(idName));
        for (Order order : orders) {
            selections.add(order.getExpression());
        }
        query.multiselect(selections);
        query.orderBy(orders);
        if (!root.getJoins().isEmpty()) {
            query.distinct(true);
        }

        TypedQuery<Tuple> typedQuery = em.createQuery(query);
        applyRange(typedQuery);
        return typedQuery.getResultList().stream().map(tuple -> tuple.get(0)).collect(Collectors.toList());
    }

    /**
     * Loads the given entities with their fetch joins and returns them in identifier order.
     */
    private List<T> fetchByIdentifiers(String idName, List<Object> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(entityClass);
        Root<T> root = query.from(entityClass);
        for (String path : fetches) {
            PathResolverUtils.fetchPath(root, path);
        }
        query.select(root).distinct(true).where(root.get(idName).in(ids));

        Map<Object, Integer> positions = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            positions.putIfAbsent(ids.get(i), i);
        }
        PersistenceUnitUtil unitUtil = em.getEntityManagerFactory().getPersistenceUnitUtil();
        return em.createQuery(query).getResultList().stream()
                .sorted(Comparator.comparingInt((T entity) ->
                        positions.getOrDefault(unitUtil.getIdentifier(entity), Integer.MAX_VALUE)))
                .collect(Collectors.toList());
    }

    private void applyRange(TypedQuery<?> typedQuery) {
        if (skip > 0) {
            typedQuery.setFirstResult((int) Math.min(skip, Integer.MAX_VALUE));
        }
        if (take >= 0) {
            typedQuery.setMaxResults(take);
        }
    }

    private Predicate buildPredicate(Root<T> root, CriteriaBuilder cb) {
        if (predicates.isEmpty()) {
            return null;
        }
        JpaPredicateTranslator<T> translator = new JpaPredicateTranslator<>(root, cb, em.getMetamodel());
        Predicate[] translated = predicates.stream().map(translator::translate).toArray(Predicate[]::new);
        return translated.length == 1 ? translated[0] : cb.and(translated);
    }

    private List<Order> buildOrders(Root<T> root, CriteriaBuilder cb) {
        List<Order> orders = new ArrayList<>();
        for (SortKey<T> key : ordering) {
            Path<?> path = PathResolverUtils.resolvePath(root, key.field().path(), em.getMetamodel());
            orders.add(key.descending() ? cb.desc(path) : cb.asc(path));
        }
        if (orders.isEmpty()) {
            identifierPath(root).ifPresent(id -> orders.add(cb.asc(id)));
        }
        return orders;
    }

    private Optional<Path<?>> identifierPath(Root<T> root) {
        Optional<String> idName = identifierName();
        if (idName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(root.get(idName.get()));
    }

    private Optional<String> identifierName() {
        EntityType<T> type = em.getMetamodel().entity(entityClass);
        if (!type.hasSingleIdAttribute()) {
            return Optional.empty();
        }
        return Optional.of(type.getId(type.getIdType().getJavaType()).getName());
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
