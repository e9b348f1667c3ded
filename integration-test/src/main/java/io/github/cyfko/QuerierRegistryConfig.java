package io.github.cyfko;

import io.github.cyfko.querier.core.api.FieldAccessor;
import io.github.cyfko.querier.core.api.FieldRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Declares what the company endpoint lets clients filter, sort and include.
 * {@code apiKey} is deliberately absent.
 */
@Configuration
public class QuerierRegistryConfig {

    @Bean
    public FieldRegistry<Company> companyFieldRegistry() {
        return FieldRegistry.builder(Company.class)
                .field("id", FieldAccessor.of("id", Long.class, Company::getId))
                .field("name", FieldAccessor.of("name", String.class, Company::getName))
                .field("status", FieldAccessor.of("status", CompanyStatus.class, Company::getStatus))
                .field("revenue", FieldAccessor.of("revenue", BigDecimal.class, Company::getRevenue))
                .field("createdAt", FieldAccessor.of("createdAt", LocalDateTime.class, Company::getCreatedAt))
                .include("settings")
                .freeTextField("name")
                .defaultSortField("createdAt")
                .build();
    }
}
