package io.github.cyfko.querier.core.config;

import java.util.Objects;

/**
 * Central configuration object aggregating the behavioural strategies of the query engine.
 * <p>
 * Instances are immutable and shared freely between concurrent executions. A builder is provided
 * to keep construction fluent; every knob has a default so {@code QuerierConfig.builder().build()}
 * is a valid configuration.
 * </p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@link ParseFailurePolicy#IGNORE_CLAUSE}: unparsable filter values drop their clause</li>
 *   <li>{@link EnumMatchMode#CASE_INSENSITIVE}: enum names match ignoring case</li>
 *   <li>{@code maxPageSize = 500}: upper bound applied when clamping the requested page size,
 *       configurable within {@code [1, 500]}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QuerierConfig {

    /** Largest page size the engine ever serves; configuration can only lower it. */
    public static final int DEFAULT_MAX_PAGE_SIZE = 500;

    private final ParseFailurePolicy parseFailurePolicy;
    private final EnumMatchMode enumMatchMode;
    private final int maxPageSize;

    private QuerierConfig(Builder builder) {
        this.parseFailurePolicy = builder.parseFailurePolicy;
        this.enumMatchMode = builder.enumMatchMode;
        this.maxPageSize = builder.maxPageSize;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Returns a configuration holding every default value.
     *
     * @return default configuration
     */
    public static QuerierConfig defaults() { return builder().build(); }

    public ParseFailurePolicy getParseFailurePolicy() { return parseFailurePolicy; }
    public EnumMatchMode getEnumMatchMode() { return enumMatchMode; }
    public int getMaxPageSize() { return maxPageSize; }

    @Override
    public String toString() {
        return "QuerierConfig{parseFailurePolicy=" + parseFailurePolicy
                + ", enumMatchMode=" + enumMatchMode
                + ", maxPageSize=" + maxPageSize + '}';
    }

    /**
     * Builder for {@link QuerierConfig}.
     */
    public static final class Builder {
        private ParseFailurePolicy parseFailurePolicy = ParseFailurePolicy.IGNORE_CLAUSE;
        private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;
        private int maxPageSize = DEFAULT_MAX_PAGE_SIZE;

        public Builder parseFailurePolicy(ParseFailurePolicy policy) {
            this.parseFailurePolicy = Objects.requireNonNull(policy, "parseFailurePolicy");
            return this;
        }

        public Builder enumMatchMode(EnumMatchMode mode) {
            this.enumMatchMode = Objects.requireNonNull(mode, "enumMatchMode");
            return this;
        }

        /**
         * @param maxPageSize page size ceiling, between 1 and {@link #DEFAULT_MAX_PAGE_SIZE}
         * @return this builder
         * @throws IllegalArgumentException if the value is outside {@code [1, 500]}
         */
        public Builder maxPageSize(int maxPageSize) {
            if (maxPageSize < 1 || maxPageSize > DEFAULT_MAX_PAGE_SIZE) {
                throw new IllegalArgumentException("Max page size must be between 1 and " + DEFAULT_MAX_PAGE_SIZE
                        + ". Provided: " + maxPageSize);
            }
            this.maxPageSize = maxPageSize;
            return this;
        }

        public QuerierConfig build() { return new QuerierConfig(this); }
    }
}
