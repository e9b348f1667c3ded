package io.github.cyfko.querier.integration;

import io.github.cyfko.Company;
import io.github.cyfko.CompanyRepository;
import io.github.cyfko.CompanyStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Six companies; newest first they read Acme Labs, Umbrella, Hooli, Initech, Globex, Acme.
 */
final class CompanyFixtures {

    static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 12, 0);

    private CompanyFixtures() {
    }

    static void reset(CompanyRepository repository) {
        repository.deleteAll();
        repository.saveAll(List.of(
                new Company("Acme", CompanyStatus.ACTIVE, new BigDecimal("1000.00"), BASE_TIME)
                        .withSetting("theme", "dark"),
                new Company("Globex", CompanyStatus.INACTIVE, new BigDecimal("2500.50"), BASE_TIME.plusDays(1)),
                new Company("Initech", CompanyStatus.ACTIVE, new BigDecimal("500.00"), BASE_TIME.plusDays(2))
                        .withSetting("locale", "fr")
                        .withSetting("theme", "light"),
                new Company("Hooli", null, new BigDecimal("9999.99"), BASE_TIME.plusDays(2).plusHours(1)),
                new Company("Umbrella", CompanyStatus.PENDING, null, BASE_TIME.plusDays(3)),
                new Company("Acme Labs", CompanyStatus.ACTIVE, new BigDecimal("750.25"), BASE_TIME.plusDays(4))));
    }
}
