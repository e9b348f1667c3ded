package io.github.cyfko.querier.spring.pagination;

import io.github.cyfko.querier.core.model.PagedResult;
import org.springframework.data.domain.Page;

/**
 * Pagination metadata for REST responses.
 * <p>
 * Pages are 0-based here, following Spring Data; {@link PagedResult} pages are 1-based and are
 * shifted on conversion.
 * </p>
 *
 * @param currentPage   the current 0-based page index
 * @param totalPages    the total number of pages available
 * @param pageSize      the size of each page
 * @param totalElements the total number of elements across all pages
 * @param hasNext       if there is a next page available
 * @param hasPrevious   if there is a previous page
 * @author Frank KOSSI
 */
public record PaginationInfo(
        int currentPage,
        int totalPages,
        int pageSize,
        long totalElements,
        boolean hasNext,
        boolean hasPrevious
) {
    public PaginationInfo(int currentPage, int pageSize, long totalElements) {
        this(currentPage,
                (int) Math.ceil((double) totalElements / pageSize),
                pageSize,
                totalElements,
                currentPage < ((int) Math.ceil((double) totalElements / pageSize)) - 1,
                currentPage > 0);
    }

    public static PaginationInfo from(Page<?> page) {
        return new PaginationInfo(page.getNumber(), page.getSize(), page.getTotalElements());
    }

    public static PaginationInfo from(PagedResult<?> result) {
        return new PaginationInfo(result.page() - 1, result.pageSize(), result.totalCount());
    }
}
