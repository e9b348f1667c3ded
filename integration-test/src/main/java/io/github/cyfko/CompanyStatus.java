package io.github.cyfko;

public enum CompanyStatus {
    ACTIVE,
    INACTIVE,
    PENDING
}
