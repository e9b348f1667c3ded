package io.github.cyfko.querier.spring.service;

import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.memory.InMemoryQuerySource;
import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.core.spi.IncludeApplier;
import io.github.cyfko.querier.spring.support.FieldRegistryCatalog;
import io.github.cyfko.querier.spring.testing.Book;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class QuerierTemplateTest {

    private final QuerierTemplate template = new QuerierTemplate(
            new FieldRegistryCatalog(List.of(Book.registry())),
            QuerierConfig.builder().maxPageSize(2).build());

    @Test
    void searchShouldUseCatalogRegistryAndConfig() {
        PagedResult<String> result = template.search(Book.class,
                InMemoryQuerySource.of(Book.shelf()),
                QuerierParams.builder().filter("year", "gt", "1960").sort("year").pageSize(50).build(),
                Book::title).join();

        assertEquals(3, result.totalCount());
        assertEquals(2, result.pageSize());
        assertEquals(List.of("Dune", "Neuromancer"), result.items());
    }

    @Test
    void eachSearchShouldStartFromAFreshBuilder() {
        InMemoryQuerySource<Book> source = InMemoryQuerySource.of(Book.shelf());
        QuerierParams params = QuerierParams.builder().sort("-id").build();

        assertEquals(List.of(4L, 3L), template.search(Book.class, source, params, Book::id).join().items());
        assertEquals(List.of(4L, 3L), template.search(Book.class, source, params, Book::id).join().items());
    }

    @Test
    @SuppressWarnings("unchecked")
    void includeApplierShouldReceiveAllowedIncludes() {
        IncludeApplier<Book> applier = mock(IncludeApplier.class);
        when(applier.apply(any(), anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        template.search(Book.class, InMemoryQuerySource.of(Book.shelf()),
                QuerierParams.builder().include("reviews").build(), Book::title, applier).join();

        // no include is declared for books
        verify(applier, never()).apply(any(), anyList());
    }

    @Test
    void unknownEntityShouldFailFast() {
        assertThrows(IllegalArgumentException.class, () -> template.search(String.class,
                InMemoryQuerySource.of(List.of("x")), QuerierParams.empty(), s -> s));
    }
}
