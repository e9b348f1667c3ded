package io.github.cyfko;

import jakarta.persistence.Persistence;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Public view of a company. {@code settings} is only populated when the association was
 * fetched through {@code include=settings}.
 */
public record CompanyDto(
        Long id,
        String name,
        CompanyStatus status,
        BigDecimal revenue,
        LocalDateTime createdAt,
        Map<String, String> settings
) {
    public static CompanyDto from(Company company) {
        Map<String, String> settings = null;
        if (Persistence.getPersistenceUtil().isLoaded(company, "settings")) {
            settings = company.getSettings().stream()
                    .collect(Collectors.toMap(CompanySetting::getKey, CompanySetting::getValue));
        }
        return new CompanyDto(company.getId(), company.getName(), company.getStatus(),
                company.getRevenue(), company.getCreatedAt(), settings);
    }
}
