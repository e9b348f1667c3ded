package io.github.cyfko.querier.spring.pagination;

import io.github.cyfko.querier.core.model.PagedResult;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A page of data with its {@link PaginationInfo}, shaped for REST responses.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * return template.search(Company.class, source, params, CompanyDto::from)
 *         .thenApply(PaginatedData::from);
 * }</pre>
 *
 * @param <T> the type of data contained in the page
 * @author Frank KOSSI
 */
public record PaginatedData<T>(
        List<T> data,
        PaginationInfo pagination
) {
    public PaginatedData(List<T> data, PaginationInfo pagination) {
        this.data = Collections.unmodifiableList(new ArrayList<>(data));
        this.pagination = pagination;
    }

    public PaginatedData(Page<T> page) {
        this(page.getContent(), PaginationInfo.from(page));
    }

    public static <T> PaginatedData<T> from(PagedResult<T> result) {
        return new PaginatedData<>(result.items(), PaginationInfo.from(result));
    }

    public <R> PaginatedData<R> map(Function<T, R> mapper) {
        return new PaginatedData<>(data.stream().map(mapper).collect(Collectors.toList()), pagination);
    }

    /**
     * Converts a search result into a Spring Data {@link Page}, for callers that already work
     * with repositories.
     *
     * @param result search result
     * @param <T>    item type
     * @return a page with the same content and a 0-based page number
     */
    public static <T> Page<T> toPage(PagedResult<T> result) {
        return new PageImpl<>(result.items(), PageRequest.of(result.page() - 1, result.pageSize()), result.totalCount());
    }
}
