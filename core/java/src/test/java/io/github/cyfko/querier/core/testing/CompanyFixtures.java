package io.github.cyfko.querier.core.testing;

import io.github.cyfko.querier.core.api.FieldAccessor;
import io.github.cyfko.querier.core.api.FieldRegistry;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry and datasets shared by the core tests.
 */
public final class CompanyFixtures {

    public static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 12, 0);

    public static final FieldAccessor<Company, Long> ID = FieldAccessor.of("id", Long.class, Company::getId);
    public static final FieldAccessor<Company, String> NAME = FieldAccessor.of("name", String.class, Company::getName);
    public static final FieldAccessor<Company, Company.Status> STATUS = FieldAccessor.of("status", Company.Status.class, Company::getStatus);
    public static final FieldAccessor<Company, BigDecimal> REVENUE = FieldAccessor.of("revenue", BigDecimal.class, Company::getRevenue);
    public static final FieldAccessor<Company, Integer> EMPLOYEES = FieldAccessor.of("employees", int.class, Company::getEmployees);
    public static final FieldAccessor<Company, LocalDateTime> CREATED_AT = FieldAccessor.of("createdAt", LocalDateTime.class, Company::getCreatedAt);

    private CompanyFixtures() {
    }

    public static FieldRegistry<Company> registry() {
        return FieldRegistry.builder(Company.class)
                .field("id", ID)
                .field("name", NAME)
                .field("status", STATUS)
                .field("revenue", REVENUE)
                .field("employees", EMPLOYEES)
                .field("createdAt", CREATED_AT)
                .include("settings", "Owner")
                .build();
    }

    public static Company company(long id, String name, Company.Status status, String revenue, int employees, int dayOffset) {
        return new Company(id, name, status, revenue == null ? null : new BigDecimal(revenue), employees,
                BASE_TIME.plusDays(dayOffset));
    }

    /**
     * Six companies with distinct creation days except ids 3 and 4, which share day 2.
     */
    public static List<Company> small() {
        return List.of(
                company(1, "Acme", Company.Status.ACTIVE, "1000.00", 10, 0),
                company(2, "Globex", Company.Status.INACTIVE, "2500.50", 250, 1),
                company(3, "Initech", Company.Status.ACTIVE, "500", 50, 2),
                company(4, "Hooli", null, "9999.99", 5000, 2),
                company(5, "Umbrella", Company.Status.PENDING, null, 0, 3),
                company(6, "Acme Labs", Company.Status.ACTIVE, "750.25", 12, 4)
        );
    }

    /**
     * Twenty-five companies, twelve of which have "foo" in their name.
     */
    public static List<Company> twentyFive() {
        List<Company> companies = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            String name = i <= 12 ? "foo-company-" + i : "bar-company-" + i;
            companies.add(company(i, name, Company.Status.ACTIVE, String.valueOf(i * 100), i, i));
        }
        return companies;
    }
}
