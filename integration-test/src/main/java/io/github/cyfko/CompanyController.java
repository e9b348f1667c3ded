package io.github.cyfko;

import io.github.cyfko.querier.core.model.PagedResult;
import io.github.cyfko.querier.core.model.QuerierParams;
import io.github.cyfko.querier.jpa.JpaIncludes;
import io.github.cyfko.querier.jpa.JpaQuerySource;
import io.github.cyfko.querier.spring.pagination.PaginatedData;
import io.github.cyfko.querier.spring.service.QuerierTemplate;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Company search endpoint backed by {@link QuerierTemplate}.
 *
 * @author Frank KOSSI
 */
@RestController
@RequestMapping("/api/v1/companies")
public class CompanyController {

    private final QuerierTemplate querierTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    public CompanyController(QuerierTemplate querierTemplate) {
        this.querierTemplate = querierTemplate;
    }

    @GetMapping
    public CompletableFuture<PagedResult<CompanyDto>> search(QuerierParams params) {
        return querierTemplate.search(Company.class, JpaQuerySource.of(entityManager, Company.class),
                params, CompanyDto::from, JpaIncludes.fetchJoins());
    }

    @GetMapping("/paginated")
    public CompletableFuture<PaginatedData<CompanyDto>> searchPaginated(QuerierParams params) {
        return search(params).thenApply(PaginatedData::from);
    }
}
