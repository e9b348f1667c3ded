package io.github.cyfko.querier.core.compile;

import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.api.SortKey;
import io.github.cyfko.querier.core.testing.Company;
import io.github.cyfko.querier.core.testing.CompanyFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SortCompilerTest {

    private final SortCompiler<Company> compiler = new SortCompiler<>(CompanyFixtures.registry());

    @Test
    void shouldKeepEncounterOrderAndDirections() {
        List<SortKey<Company>> keys = compiler.compile(" -createdAt , name");
        assertEquals(List.of(SortKey.desc(CompanyFixtures.CREATED_AT), SortKey.asc(CompanyFixtures.NAME)), keys);
    }

    @Test
    void shouldSkipUnknownAndEmptyKeys() {
        List<SortKey<Company>> keys = compiler.compile("secret,,-,REVENUE");
        assertEquals(List.of(SortKey.asc(CompanyFixtures.REVENUE)), keys);
    }

    @Test
    void blankSortShouldFallBackToDefaultFieldDescending() {
        assertEquals(List.of(SortKey.desc(CompanyFixtures.CREATED_AT)), compiler.compile(null));
        assertEquals(List.of(SortKey.desc(CompanyFixtures.CREATED_AT)), compiler.compile("  "));
    }

    @Test
    void sortWithOnlyUnknownKeysShouldNotFallBack() {
        assertTrue(compiler.compile("secret").isEmpty());
    }

    @Test
    void registryWithoutDefaultFieldShouldKeepNaturalOrder() {
        SortCompiler<Company> plain = new SortCompiler<>(FieldRegistry.builder(Company.class)
                .sortable("name", CompanyFixtures.NAME)
                .build());
        assertTrue(plain.compile("").isEmpty());
    }
}
