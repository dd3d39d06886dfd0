package application;

import infrastructure.util.ValidationUtils;

/**
 * Immutable value object holding the execution settings of a {@link HashReverser}.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates each
 * parameter as it is set. None of these settings changes which strings are found;
 * they only control how level expansion is scheduled and what is reported.
 *
 * <p>The class is {@code final} with primitive/enum fields only, so sharing a
 * {@code ReverserConfiguration} across threads is safe.
 */
public final class ReverserConfiguration {

    /**
     * Scheduling of (node, symbol) expansions within a level.
     *
     * <p>Both strategies build the same tree. The default is {@link #PARALLEL}.
     */
    public enum ExpansionStrategy {
        /** ForkJoin fan-out over the level's work items (default). */
        PARALLEL,
        /** Single loop on the calling thread; for debugging and comparison. */
        SEQUENTIAL
    }

    private final ExpansionStrategy expansionStrategy;
    private final int parallelism;
    private final int leafTaskSize;
    private final boolean debugMode;

    private ReverserConfiguration(Builder builder) {
        this.expansionStrategy = builder.expansionStrategy;
        this.parallelism = builder.parallelism;
        this.leafTaskSize = builder.leafTaskSize;
        this.debugMode = builder.debugMode;
    }

    /**
     * Returns the configuration used by {@link HashReverser#HashReverser()}.
     *
     * @return default settings
     */
    public static ReverserConfiguration defaults() {
        return new Builder().build();
    }

    public ExpansionStrategy getExpansionStrategy() { return expansionStrategy; }
    public int getParallelism() { return parallelism; }
    public int getLeafTaskSize() { return leafTaskSize; }
    public boolean isDebugMode() { return debugMode; }

    /**
     * Fluent builder for {@link ReverserConfiguration}.
     *
     * <p>Defaults:
     * <ul>
     *   <li>{@code expansionStrategy} — {@link ExpansionStrategy#PARALLEL}</li>
     *   <li>{@code parallelism} — {@link EngineConfiguration#DEFAULT_PARALLELISM}</li>
     *   <li>{@code leafTaskSize} — {@link EngineConfiguration#LEAF_TASK_SIZE}</li>
     *   <li>{@code debugMode} — {@code false}</li>
     * </ul>
     */
    public static class Builder {
        private ExpansionStrategy expansionStrategy = ExpansionStrategy.PARALLEL;
        private int parallelism = EngineConfiguration.DEFAULT_PARALLELISM;
        private int leafTaskSize = EngineConfiguration.LEAF_TASK_SIZE;
        private boolean debugMode = false;

        public Builder setExpansionStrategy(ExpansionStrategy strategy) {
            if (strategy == null) throw new IllegalArgumentException("expansionStrategy cannot be null");
            this.expansionStrategy = strategy;
            return this;
        }

        /**
         * Sets the number of ForkJoin workers used by {@link ExpansionStrategy#PARALLEL}.
         *
         * @param parallelism positive worker count
         * @return this builder
         */
        public Builder setParallelism(int parallelism) {
            ValidationUtils.validatePositive(parallelism, "parallelism");
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Sets the maximum number of work items a single ForkJoin task expands.
         *
         * @param leafTaskSize positive work-item count
         * @return this builder
         */
        public Builder setLeafTaskSize(int leafTaskSize) {
            ValidationUtils.validatePositive(leafTaskSize, "leafTaskSize");
            this.leafTaskSize = leafTaskSize;
            return this;
        }

        public Builder setDebugMode(boolean debug) {
            this.debugMode = debug;
            return this;
        }

        public ReverserConfiguration build() {
            return new ReverserConfiguration(this);
        }
    }
}
