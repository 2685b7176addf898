package com.wildfire.resolution.orchestrator;

import java.time.Duration;

/**
 * Time budgets for the risk fallback chain.
 *
 * <pre>
 * OrchestratorOptions options = OrchestratorOptions.builder()
 *     .deadline(Duration.ofSeconds(5))
 *     .primaryBudget(Duration.ofSeconds(2))
 *     .build();
 * </pre>
 */
public class OrchestratorOptions {

    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(8);
    public static final Duration DEFAULT_PRIMARY_BUDGET = Duration.ofSeconds(3);
    public static final Duration DEFAULT_SECONDARY_BUDGET = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CACHE_BUDGET = Duration.ofSeconds(1);

    private final Duration deadline;
    private final Duration primaryBudget;
    private final Duration secondaryBudget;
    private final Duration cacheBudget;
    private final boolean writeThrough;

    private OrchestratorOptions(Builder builder) {
        this.deadline = requirePositive(builder.deadline, "deadline");
        this.primaryBudget = requirePositive(builder.primaryBudget, "primaryBudget");
        this.secondaryBudget = requirePositive(builder.secondaryBudget, "secondaryBudget");
        this.cacheBudget = requirePositive(builder.cacheBudget, "cacheBudget");
        this.writeThrough = builder.writeThrough;
    }

    public static OrchestratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getDeadline() {
        return deadline;
    }

    public Duration getPrimaryBudget() {
        return primaryBudget;
    }

    public Duration getSecondaryBudget() {
        return secondaryBudget;
    }

    public Duration getCacheBudget() {
        return cacheBudget;
    }

    /**
     * Whether live observations are stored in the geocache.
     */
    public boolean isWriteThrough() {
        return writeThrough;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    public static class Builder {
        private Duration deadline = DEFAULT_DEADLINE;
        private Duration primaryBudget = DEFAULT_PRIMARY_BUDGET;
        private Duration secondaryBudget = DEFAULT_SECONDARY_BUDGET;
        private Duration cacheBudget = DEFAULT_CACHE_BUDGET;
        private boolean writeThrough = true;

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder primaryBudget(Duration primaryBudget) {
            this.primaryBudget = primaryBudget;
            return this;
        }

        public Builder secondaryBudget(Duration secondaryBudget) {
            this.secondaryBudget = secondaryBudget;
            return this;
        }

        public Builder cacheBudget(Duration cacheBudget) {
            this.cacheBudget = cacheBudget;
            return this;
        }

        public Builder writeThrough(boolean writeThrough) {
            this.writeThrough = writeThrough;
            return this;
        }

        public OrchestratorOptions build() {
            return new OrchestratorOptions(this);
        }
    }
}
