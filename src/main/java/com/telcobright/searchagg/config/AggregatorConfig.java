package com.telcobright.searchagg.config;

import com.telcobright.searchagg.logging.Logger;
import com.telcobright.searchagg.logging.Slf4jLogger;

/**
 * Tuning knobs shared by every aggregation controller created with it.
 * Immutable; build with {@link #builder()}.
 */
public class AggregatorConfig {

    private static final int DEFAULT_LIST_CAPACITY = 100;
    private static final int DEFAULT_STATS_FRACTION_DIGITS = 3;
    private static final String DEFAULT_VALUES_SEPARATOR = ", ";

    private final int listCapacity;
    private final int statsFractionDigits;
    private final String valuesSeparator;
    private final Logger logger;

    private AggregatorConfig(Builder builder) {
        this.listCapacity = builder.listCapacity;
        this.statsFractionDigits = builder.statsFractionDigits;
        this.valuesSeparator = builder.valuesSeparator;
        this.logger = builder.logger != null
            ? builder.logger
            : new Slf4jLogger("com.telcobright.searchagg.QueryAggregation");
    }

    public static AggregatorConfig defaults() {
        return builder().build();
    }

    /**
     * Maximum number of raw values a List measure keeps across all merged segments.
     */
    public int getListCapacity() { return listCapacity; }

    /**
     * Fraction digits used when rendering floating point statistics for display.
     */
    public int getStatsFractionDigits() { return statsFractionDigits; }

    /**
     * Separator placed between entries when a Values result is rendered as one string.
     */
    public String getValuesSeparator() { return valuesSeparator; }

    public Logger getLogger() { return logger; }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("AggregatorConfig[listCapacity=%d, statsFractionDigits=%d]",
            listCapacity, statsFractionDigits);
    }

    public static class Builder {
        private int listCapacity = DEFAULT_LIST_CAPACITY;
        private int statsFractionDigits = DEFAULT_STATS_FRACTION_DIGITS;
        private String valuesSeparator = DEFAULT_VALUES_SEPARATOR;
        private Logger logger;

        public Builder withListCapacity(int listCapacity) {
            if (listCapacity <= 0) {
                throw new IllegalArgumentException("listCapacity must be positive");
            }
            this.listCapacity = listCapacity;
            return this;
        }

        public Builder withStatsFractionDigits(int statsFractionDigits) {
            if (statsFractionDigits < 0) {
                throw new IllegalArgumentException("statsFractionDigits must be non-negative");
            }
            this.statsFractionDigits = statsFractionDigits;
            return this;
        }

        public Builder withValuesSeparator(String valuesSeparator) {
            if (valuesSeparator == null) {
                throw new IllegalArgumentException("valuesSeparator cannot be null");
            }
            this.valuesSeparator = valuesSeparator;
            return this;
        }

        public Builder withLogger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public AggregatorConfig build() {
            return new AggregatorConfig(this);
        }
    }
}
