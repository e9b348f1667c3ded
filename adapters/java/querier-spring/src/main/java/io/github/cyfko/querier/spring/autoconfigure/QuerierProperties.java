package io.github.cyfko.querier.spring.autoconfigure;

import io.github.cyfko.querier.core.config.EnumMatchMode;
import io.github.cyfko.querier.core.config.ParseFailurePolicy;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.core.model.QuerierConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings under the {@code querier} prefix.
 *
 * <pre>
 * querier.parse-failure-policy=REJECT_REQUEST
 * querier.enum-match-mode=CASE_SENSITIVE
 * querier.max-page-size=100
 * querier.default-page-size=25
 * </pre>
 *
 * @author Frank KOSSI
 */
@ConfigurationProperties(prefix = "querier")
public class QuerierProperties {

    private ParseFailurePolicy parseFailurePolicy = ParseFailurePolicy.IGNORE_CLAUSE;
    private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;
    private int maxPageSize = QuerierConfig.DEFAULT_MAX_PAGE_SIZE;
    private int defaultPageSize = QuerierConstants.DEFAULT_PAGE_SIZE;

    public ParseFailurePolicy getParseFailurePolicy() {
        return parseFailurePolicy;
    }

    public void setParseFailurePolicy(ParseFailurePolicy parseFailurePolicy) {
        this.parseFailurePolicy = parseFailurePolicy;
    }

    public EnumMatchMode getEnumMatchMode() {
        return enumMatchMode;
    }

    public void setEnumMatchMode(EnumMatchMode enumMatchMode) {
        this.enumMatchMode = enumMatchMode;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * @return the engine configuration described by these properties
     * @throws IllegalArgumentException if {@code max-page-size} is outside {@code [1, 500]}
     */
    public QuerierConfig toConfig() {
        return QuerierConfig.builder()
                .parseFailurePolicy(parseFailurePolicy)
                .enumMatchMode(enumMatchMode)
                .maxPageSize(maxPageSize)
                .build();
    }
}
