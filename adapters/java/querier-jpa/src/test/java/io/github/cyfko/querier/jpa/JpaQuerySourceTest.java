package io.github.cyfko.querier.jpa;

import io.github.cyfko.querier.core.QuerierBuilder;
import io.github.cyfko.querier.core.api.FieldAccessor;
import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.api.QueryPredicate;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.config.ParseFailurePolicy;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.exception.QuerierValidationException;
import io.github.cyfko.querier.core.memory.InMemoryQuerySource;
import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.core.spi.CancellationToken;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.jpa.entities.Company;
import io.github.cyfko.querier.jpa.entities.CompanyStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the query pipeline against H2 through the Criteria API.
 * Default ordering is createdAt descending: Acme 100% Labs, Umbrella, Hooli, Initech, Globex, Acme.
 */
@DisplayName("JPA query source")
class JpaQuerySourceTest {

    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 12, 0);

    private static EntityManagerFactory emf;
    private static FieldRegistry<Company> registry;

    private EntityManager em;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");

        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();
        em.persist(new Company("Acme", CompanyStatus.ACTIVE, new BigDecimal("1000.00"), 10,
                BASE_TIME, "Paris").addSetting("theme", "dark"));
        em.persist(new Company("Globex", CompanyStatus.INACTIVE, new BigDecimal("2500.50"), 250,
                BASE_TIME.plusDays(1), "Berlin"));
        em.persist(new Company("Initech", CompanyStatus.ACTIVE, new BigDecimal("500.00"), 50,
                BASE_TIME.plusDays(2), "Paris").addSetting("locale", "fr").addSetting("theme", "light"));
        em.persist(new Company("Hooli", null, new BigDecimal("9999.99"), 5000,
                BASE_TIME.plusDays(2).plusHours(1), null));
        em.persist(new Company("Umbrella", CompanyStatus.PENDING, null, 0,
                BASE_TIME.plusDays(3), "London"));
        em.persist(new Company("Acme 100% Labs", CompanyStatus.ACTIVE, new BigDecimal("750.25"), 12,
                BASE_TIME.plusDays(4), "Berlin"));
        em.getTransaction().commit();
        em.close();

        registry = FieldRegistry.builder(Company.class)
                .field("id", FieldAccessor.of("id", Long.class, Company::getId))
                .field("name", FieldAccessor.of("name", String.class, Company::getName))
                .field("status", FieldAccessor.of("status", CompanyStatus.class, Company::getStatus))
                .field("revenue", FieldAccessor.of("revenue", BigDecimal.class, Company::getRevenue))
                .field("employees", FieldAccessor.of("employees", Integer.class, Company::getEmployees))
                .field("createdAt", FieldAccessor.of("createdAt", LocalDateTime.class, Company::getCreatedAt))
                .filterable("city", FieldAccessor.of("address.city", String.class,
                        c -> c.getAddress() == null ? null : c.getAddress().getCity()))
                .filterable("settingKey", FieldAccessor.of("settings.key", String.class,
                        c -> c.getSettings().isEmpty() ? null : c.getSettings().get(0).getKey()))
                .include("settings")
                .freeTextField("name")
                .defaultSortField("createdAt")
                .build();
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void openEntityManager() {
        em = emf.createEntityManager();
    }

    @AfterEach
    void closeEntityManager() {
        em.close();
    }

    private QuerierBuilder<Company, String> names(QuerierParams params) {
        return QuerierBuilder.<Company>create()
                .withSource(JpaQuerySource.of(em, Company.class))
                .withQueryParams(params)
                .withFieldRegistry(registry)
                .withProjection(Company::getName);
    }

    private PagedResult<String> search(QuerierParams params) {
        return names(params).executeAsync().join();
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        void noFiltersShouldReturnEverythingNewestFirst() {
            PagedResult<String> result = search(QuerierParams.empty());
            assertEquals(6, result.totalCount());
            assertEquals(List.of("Acme 100% Labs", "Umbrella", "Hooli", "Initech", "Globex", "Acme"), result.items());
        }

        @Test
        void eqOnEnumShouldIgnoreCaseByDefault() {
            PagedResult<String> result = search(QuerierParams.builder().filter("status", "active").build());
            assertEquals(List.of("Acme 100% Labs", "Initech", "Acme"), result.items());
        }

        @Test
        void gtOnDecimalShouldCompareNumerically() {
            PagedResult<String> result = search(QuerierParams.builder().filter("revenue", "gt", "1000").build());
            assertEquals(List.of("Hooli", "Globex"), result.items());
        }

        @Test
        void lteOnDateShouldIncludeBoundary() {
            PagedResult<String> result = search(QuerierParams.builder()
                    .filter("createdAt", "lte", "2024-01-02T12:00:00").build());
            assertEquals(List.of("Globex", "Acme"), result.items());
        }

        @Test
        void nullLiteralShouldBecomeNullChecks() {
            assertEquals(List.of("Umbrella"),
                    search(QuerierParams.builder().filter("revenue", "null").build()).items());
            assertEquals(5,
                    search(QuerierParams.builder().filter("revenue", "neq", "NULL").build()).totalCount());
        }

        @Test
        void neqShouldExcludeNullValues() {
            PagedResult<String> result = search(QuerierParams.builder().filter("status", "neq", "ACTIVE").build());
            assertEquals(List.of("Umbrella", "Globex"), result.items());
        }

        @Test
        void inShouldMatchAnyListedValue() {
            PagedResult<String> result = search(QuerierParams.builder().filter("name", "in", "Acme, Hooli,Nope").build());
            assertEquals(List.of("Hooli", "Acme"), result.items());
        }

        @Test
        void substringOperatorsShouldBeCaseSensitive() {
            assertEquals(List.of("Acme 100% Labs", "Acme"),
                    search(QuerierParams.builder().filter("name", "startswith", "Acme").build()).items());
            assertEquals(0,
                    search(QuerierParams.builder().filter("name", "startswith", "acme").build()).totalCount());
            assertEquals(List.of("Acme 100% Labs"),
                    search(QuerierParams.builder().filter("name", "endswith", "Labs").build()).items());
        }

        @Test
        void likeWildcardsShouldBeMatchedLiterally() {
            assertEquals(List.of("Acme 100% Labs"),
                    search(QuerierParams.builder().filter("name", "contains", "%").build()).items());
            assertEquals(0,
                    search(QuerierParams.builder().filter("name", "contains", "_").build()).totalCount());
        }

        @Test
        void unregisteredFieldsAndOperatorsShouldBeIgnored() {
            PagedResult<String> result = search(QuerierParams.builder()
                    .filter("secret", "x")
                    .filter("name", "regex", "A.*")
                    .build());
            assertEquals(6, result.totalCount());
        }
    }

    @Nested
    @DisplayName("paths")
    class Paths {

        @Test
        void embeddedPathShouldResolve() {
            PagedResult<String> result = search(QuerierParams.builder().filter("city", "Paris").build());
            assertEquals(List.of("Initech", "Acme"), result.items());
        }

        @Test
        void collectionPathShouldJoinAndCountDistinctRoots() {
            PagedResult<String> result = search(QuerierParams.builder()
                    .filter("settingKey", "in", "theme,locale").build());
            assertEquals(2, result.totalCount());
            assertEquals(List.of("Initech", "Acme"), result.items());
        }
    }

    @Nested
    @DisplayName("sorting and paging")
    class SortingAndPaging {

        @Test
        void sortShouldHonourDirectionAndOrder() {
            assertEquals(List.of("Acme", "Acme 100% Labs", "Globex", "Hooli", "Initech", "Umbrella"),
                    search(QuerierParams.builder().sort("name").build()).items());
            assertEquals(List.of("Hooli", "Globex", "Acme", "Acme 100% Labs", "Initech"),
                    search(QuerierParams.builder().filter("revenue", "neq", "null").sort("-revenue").build()).items());
        }

        @Test
        void pageShouldSliceAfterCounting() {
            PagedResult<String> result = search(QuerierParams.builder().page(2).pageSize(2).build());
            assertEquals(6, result.totalCount());
            assertEquals(3, result.totalPages());
            assertEquals(List.of("Hooli", "Initech"), result.items());
        }

        @Test
        void pageBeyondEndShouldBeEmptyWithTotal() {
            PagedResult<String> result = search(QuerierParams.builder().page(9).pageSize(5).build());
            assertEquals(6, result.totalCount());
            assertTrue(result.items().isEmpty());
        }

        @Test
        void freeTextShouldMatchNameSubstring() {
            PagedResult<String> result = search(QuerierParams.builder().freeText(" Acme ").build());
            assertEquals(List.of("Acme 100% Labs", "Acme"), result.items());
        }
    }

    @Nested
    @DisplayName("includes")
    class Includes {

        @Test
        void allowedIncludeShouldFetchAssociation() {
            PagedResult<Company> result = QuerierBuilder.<Company>create()
                    .withSource(JpaQuerySource.of(em, Company.class))
                    .withQueryParams(QuerierParams.builder().include("SETTINGS,unknown").build())
                    .withFieldRegistry(registry)
                    .withIncludeApplier(JpaIncludes.fetchJoins())
                    .executeAsync()
                    .join();

            assertEquals(6, result.totalCount());
            assertEquals(6, result.items().size());
            for (Company company : result.items()) {
                assertTrue(emf.getPersistenceUnitUtil().isLoaded(company, "settings"), company.getName());
            }
            Company initech = result.items().stream().filter(c -> c.getName().equals("Initech")).findFirst().orElseThrow();
            assertEquals(2, initech.getSettings().size());
        }

        @Test
        void includeWithPagingShouldPageInDatabase() {
            PagedResult<Company> result = QuerierBuilder.<Company>create()
                    .withSource(JpaQuerySource.of(em, Company.class))
                    .withQueryParams(QuerierParams.builder().include("settings").page(2).pageSize(2).build())
                    .withFieldRegistry(registry)
                    .withIncludeApplier(JpaIncludes.fetchJoins())
                    .executeAsync()
                    .join();

            assertEquals(6, result.totalCount());
            assertEquals(List.of("Hooli", "Initech"), result.items().stream().map(Company::getName).toList());
            assertTrue(emf.getPersistenceUnitUtil().isLoaded(result.items().get(1), "settings"));
            assertEquals(2, result.items().get(1).getSettings().size());
        }

        @Test
        void includeWithPagingShouldKeepRequestedOrderAcrossJoins() {
            PagedResult<Company> result = QuerierBuilder.<Company>create()
                    .withSource(JpaQuerySource.of(em, Company.class))
                    .withQueryParams(QuerierParams.builder()
                            .filter("settingKey", "theme")
                            .include("settings")
                            .sort("name")
                            .pageSize(1)
                            .build())
                    .withFieldRegistry(registry)
                    .withIncludeApplier(JpaIncludes.fetchJoins())
                    .executeAsync()
                    .join();

            assertEquals(2, result.totalCount());
            assertEquals(1, result.items().size());
            assertEquals("Acme", result.items().get(0).getName());
            assertEquals(1, result.items().get(0).getSettings().size());
        }

        @Test
        void includeOnEmptyPageShouldSkipSecondQuery() {
            PagedResult<Company> result = QuerierBuilder.<Company>create()
                    .withSource(JpaQuerySource.of(em, Company.class))
                    .withQueryParams(QuerierParams.builder().include("settings").page(5).pageSize(5).build())
                    .withFieldRegistry(registry)
                    .withIncludeApplier(JpaIncludes.fetchJoins())
                    .executeAsync()
                    .join();

            assertEquals(6, result.totalCount());
            assertTrue(result.items().isEmpty());
        }

        @Test
        void withoutIncludeAssociationShouldStayLazy() {
            PagedResult<Company> result = QuerierBuilder.<Company>create()
                    .withSource(JpaQuerySource.of(em, Company.class))
                    .withQueryParams(QuerierParams.empty())
                    .withFieldRegistry(registry)
                    .withIncludeApplier(JpaIncludes.fetchJoins())
                    .executeAsync()
                    .join();

            for (Company company : result.items()) {
                assertFalse(emf.getPersistenceUnitUtil().isLoaded(company, "settings"), company.getName());
            }
        }

        @Test
        void fetchJoinsShouldRejectForeignSources() {
            IncludeApplier<Company> applier = JpaIncludes.fetchJoins();
            assertThrows(IllegalArgumentException.class,
                    () -> applier.apply(InMemoryQuerySource.of(List.of()), List.of("settings")));
        }
    }

    @Nested
    @DisplayName("source")
    class Source {

        @Test
        void countShouldIgnoreOffsetLimitAndOrdering() {
            JpaQuerySource<Company> source = JpaQuerySource.of(em, Company.class)
                    .withFetches(List.of("settings"))
                    .orderBy(SortKey.desc(registry.findSortable("name").orElseThrow()))
                    .skip(2)
                    .take(1);
            assertEquals(6L, source.countAsync(CancellationToken.NONE).join());
        }

        @Test
        void sourceShouldBeImmutable() {
            JpaQuerySource<Company> source = JpaQuerySource.of(em, Company.class);
            JpaQuerySource<Company> filtered =
                    source.where(QueryPredicate.isNull(registry.findFilterable("name").orElseThrow()));

            assertNotSame(source, filtered);
            assertEquals(6L, source.countAsync(CancellationToken.NONE).join());
            assertEquals(0L, filtered.countAsync(CancellationToken.NONE).join());
        }

        @Test
        void withoutOrderingRowsShouldComeInIdentifierOrder() {
            List<String> names = JpaQuerySource.of(em, Company.class)
                    .take(3)
                    .fetchAsync(Company::getName, CancellationToken.NONE)
                    .join();
            assertEquals(List.of("Acme", "Globex", "Initech"), names);
        }

        @Test
        void executorShouldRunTheRead() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                JpaQuerySource<Company> source = JpaQuerySource.of(em, Company.class).withExecutor(executor);
                assertEquals(6L, source.countAsync(CancellationToken.NONE).get());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void negativeSkipOrTakeShouldBeRejected() {
            JpaQuerySource<Company> source = JpaQuerySource.of(em, Company.class);
            assertThrows(IllegalArgumentException.class, () -> source.skip(-1));
            assertThrows(IllegalArgumentException.class, () -> source.take(-1));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void rejectPolicyShouldFailWithValidationException() {
            QuerierBuilder<Company, String> builder = names(QuerierParams.builder().filter("revenue", "gt", "lots").build())
                    .withConfig(QuerierConfig.builder().parseFailurePolicy(ParseFailurePolicy.REJECT_REQUEST).build());

            CompletionException ex = assertThrows(CompletionException.class, () -> builder.executeAsync().join());
            QuerierValidationException cause = assertInstanceOf(QuerierValidationException.class, ex.getCause());
            assertEquals("revenue", cause.getField());
            assertEquals("lots", cause.getRawValue());
        }

        @Test
        void cancelledTokenShouldStopBeforeReading() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            QuerierBuilder<Company, String> builder = names(QuerierParams.empty()).withCancellationToken(token);

            assertThrows(CancellationException.class, () -> builder.executeAsync().join());
        }
    }
}
