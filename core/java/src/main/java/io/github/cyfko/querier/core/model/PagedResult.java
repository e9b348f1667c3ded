package io.github.cyfko.querier.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable page of results together with the total number of matching entities.
 *
 * <p>{@code totalCount} is computed before pagination; {@code page} and {@code pageSize} are the
 * effective (clamped) values that produced {@code items}.</p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * PagedResult<Company> result = builder.executeAsync().join();
 * PagedResult<CompanyDto> response = result.map(CompanyDto::from);
 * }</pre>
 *
 * @param items      the items of the current page
 * @param totalCount number of entities matching the query, across all pages
 * @param page       1-based page number
 * @param pageSize   effective page size
 * @param <R>        item type
 * @author Frank KOSSI
 */
public record PagedResult<R>(
        List<R> items,
        long totalCount,
        int page,
        int pageSize
) {

    public PagedResult {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be >= 1. Provided: " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be >= 1. Provided: " + pageSize);
        }
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total count must be >= 0. Provided: " + totalCount);
        }
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public long totalPages() {
        return (totalCount + pageSize - 1) / pageSize;
    }

    public boolean hasNext() {
        return page < totalPages();
    }

    public boolean hasPrevious() {
        return page > 1;
    }

    /**
     * Transforms the items, preserving the paging metadata.
     *
     * @param mapper the mapping function
     * @param <U>    target item type
     * @return a new result with mapped items
     */
    public <U> PagedResult<U> map(Function<? super R, ? extends U> mapper) {
        List<U> mapped = items.stream().map(mapper).collect(Collectors.toList());
        return new PagedResult<>(mapped, totalCount, page, pageSize);
    }
}
