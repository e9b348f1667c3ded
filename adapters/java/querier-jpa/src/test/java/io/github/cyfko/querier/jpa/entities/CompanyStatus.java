package io.github.cyfko.querier.jpa.entities;

public enum CompanyStatus {
    ACTIVE,
    INACTIVE,
    PENDING
}
