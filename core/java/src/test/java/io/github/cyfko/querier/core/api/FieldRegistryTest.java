package io.github.cyfko.querier.core.api;

import io.github.cyfko.querier.core.exception.FieldDefinitionException;
import io.github.cyfko.querier.core.testing.Company;
import io.github.cyfko.querier.core.testing.CompanyFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldRegistry")
class FieldRegistryTest {

    private static final FieldAccessor<Company, String> SECRET = FieldAccessor.of("secret", String.class, Company::getSecret);

    @Nested
    @DisplayName("lookups")
    class Lookups {

        private final FieldRegistry<Company> registry = CompanyFixtures.registry();

        @Test
        void shouldMatchNamesIgnoringCase() {
            assertSame(CompanyFixtures.NAME, registry.findFilterable("NAME").orElseThrow());
            assertSame(CompanyFixtures.CREATED_AT, registry.findSortable("createdat").orElseThrow());
        }

        @Test
        void shouldNotResolveUndeclaredNames() {
            assertTrue(registry.findFilterable("secret").isEmpty());
            assertTrue(registry.findSortable("secret").isEmpty());
            assertTrue(registry.findFilterable(null).isEmpty());
        }

        @Test
        void shouldReturnDeclaredIncludeSpelling() {
            assertEquals("Owner", registry.findInclude("owner").orElseThrow());
            assertEquals("settings", registry.findInclude(" SETTINGS ").orElseThrow());
            assertTrue(registry.findInclude("audit").isEmpty());
        }
    }

    @Nested
    @DisplayName("canonical fields")
    class CanonicalFields {

        @Test
        void shouldDiscoverNameAndCreatedAtByConvention() {
            FieldRegistry<Company> registry = CompanyFixtures.registry();
            assertSame(CompanyFixtures.NAME, registry.getFreeTextField().orElseThrow());
            assertSame(CompanyFixtures.CREATED_AT, registry.getDefaultSortField().orElseThrow());
        }

        @Test
        void shouldPreferTitleOverName() {
            FieldAccessor<Company, String> title = FieldAccessor.of("name", String.class, Company::getName);
            FieldRegistry<Company> registry = FieldRegistry.builder(Company.class)
                    .filterable("name", CompanyFixtures.NAME)
                    .filterable("title", title)
                    .build();
            assertSame(title, registry.getFreeTextField().orElseThrow());
        }

        @Test
        void shouldUseFilterableCreatedAtWhenNotSortable() {
            FieldRegistry<Company> registry = FieldRegistry.builder(Company.class)
                    .filterable("createdAt", CompanyFixtures.CREATED_AT)
                    .build();
            assertSame(CompanyFixtures.CREATED_AT, registry.getDefaultSortField().orElseThrow());
        }

        @Test
        void shouldHonourExplicitDeclarations() {
            FieldRegistry<Company> registry = FieldRegistry.builder(Company.class)
                    .field("name", CompanyFixtures.NAME)
                    .filterable("secret", SECRET)
                    .sortable("revenue", CompanyFixtures.REVENUE)
                    .freeTextField("secret")
                    .defaultSortField("revenue")
                    .build();
            assertSame(SECRET, registry.getFreeTextField().orElseThrow());
            assertSame(CompanyFixtures.REVENUE, registry.getDefaultSortField().orElseThrow());
        }

        @Test
        void shouldBeAbsentWithoutConventionalFields() {
            FieldRegistry<Company> registry = FieldRegistry.builder(Company.class)
                    .filterable("status", CompanyFixtures.STATUS)
                    .build();
            assertTrue(registry.getFreeTextField().isEmpty());
            assertTrue(registry.getDefaultSortField().isEmpty());
        }
    }

    @Nested
    @DisplayName("declaration errors")
    class DeclarationErrors {

        @Test
        void shouldRejectDuplicateNamesIgnoringCase() {
            FieldRegistry.Builder<Company> builder = FieldRegistry.builder(Company.class)
                    .filterable("name", CompanyFixtures.NAME);
            assertThrows(FieldDefinitionException.class, () -> builder.filterable("Name", CompanyFixtures.NAME));
        }

        @Test
        void shouldRejectBlankNames() {
            assertThrows(FieldDefinitionException.class,
                    () -> FieldRegistry.builder(Company.class).sortable(" ", CompanyFixtures.NAME));
            assertThrows(FieldDefinitionException.class,
                    () -> FieldRegistry.builder(Company.class).include("settings", ""));
        }

        @Test
        void shouldRejectMissingAccessor() {
            assertThrows(FieldDefinitionException.class,
                    () -> FieldRegistry.builder(Company.class).filterable("name", null));
        }

        @Test
        void shouldRejectCanonicalFieldPointingNowhere() {
            FieldRegistry.Builder<Company> freeText = FieldRegistry.builder(Company.class)
                    .sortable("name", CompanyFixtures.NAME)
                    .freeTextField("name");
            assertThrows(FieldDefinitionException.class, freeText::build);

            FieldRegistry.Builder<Company> defaultSort = FieldRegistry.builder(Company.class)
                    .defaultSortField("updatedAt");
            assertThrows(FieldDefinitionException.class, defaultSort::build);
        }
    }

    @Test
    void accessorShouldBoxPrimitiveTypes() {
        assertEquals(Integer.class, CompanyFixtures.EMPLOYEES.type());
        assertTrue(CompanyFixtures.EMPLOYEES.isComparable());
        assertEquals(LocalDateTime.class, CompanyFixtures.CREATED_AT.type());
        assertNull(CompanyFixtures.NAME.get(null));
    }
}
