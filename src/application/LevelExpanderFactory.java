package application;

import domain.engine.LevelExpander;
import domain.engine.SequentialLevelExpander;
import infrastructure.parallel.ParallelLevelExpander;

import java.util.concurrent.ForkJoinPool;

/**
 * Factory for creating {@link LevelExpander} instances based on configuration.
 *
 * <p>Decouples {@link HashReverser} from the concrete expansion strategies.
 *
 * @see ReverserConfiguration.ExpansionStrategy
 */
public final class LevelExpanderFactory {

    /**
     * Creates a {@link LevelExpander} for the configured expansion strategy.
     *
     * @param config configuration with strategy selection and task granularity
     * @param pool   pool used by the parallel strategy
     * @param <S>    hash state type
     * @return the configured expander
     * @throws IllegalStateException if strategy is unknown
     */
    public static <S extends Comparable<? super S>> LevelExpander<S> createExpander(
            ReverserConfiguration config,
            ForkJoinPool pool) {
        switch (config.getExpansionStrategy()) {
            case PARALLEL:
                return new ParallelLevelExpander<>(pool, config.getLeafTaskSize());

            case SEQUENTIAL:
                return new SequentialLevelExpander<>();

            default:
                throw new IllegalStateException(
                    "Unknown expansion strategy: " + config.getExpansionStrategy() + ". " +
                    "This indicates a configuration validation bug.");
        }
    }

    private LevelExpanderFactory() {
        throw new AssertionError("Factory class — do not instantiate");
    }
}
