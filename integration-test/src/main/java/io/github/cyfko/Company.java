package io.github.cyfko;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "company")
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    @Enumerated(EnumType.STRING)
    private CompanyStatus status;

    private BigDecimal revenue;

    private LocalDateTime createdAt;

    /** Never exposed through the search endpoint. */
    private String apiKey;

    @OneToMany(mappedBy = "company", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<CompanySetting> settings = new ArrayList<>();

    protected Company() {
    }

    public Company(String name, CompanyStatus status, BigDecimal revenue, LocalDateTime createdAt) {
        this.name = name;
        this.status = status;
        this.revenue = revenue;
        this.createdAt = createdAt;
        this.apiKey = "key-" + name.toLowerCase();
    }

    public Company withSetting(String key, String value) {
        settings.add(new CompanySetting(this, key, value));
        return this;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CompanyStatus getStatus() {
        return status;
    }

    public BigDecimal getRevenue() {
        return revenue;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public String getApiKey() {
        return apiKey;
    }

    public List<CompanySetting> getSettings() {
        return settings;
    }
}
