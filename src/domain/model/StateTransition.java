package domain.model;

/**
 * One step of a hash function's fold, expressed over a single symbol.
 *
 * <p>Used for both the reverse transition (the state one step further back in the
 * reverse walk) and the check step (the intermediate state fed to the acceptance test).
 * Implementations must be pure: the explorer may call them concurrently and in any order.
 *
 * @param <S> hash state type
 */
@FunctionalInterface
public interface StateTransition<S> {

    /**
     * Applies this step.
     *
     * @param symbol the symbol being undone
     * @param state  the current state of the reverse walk
     * @return the resulting state
     */
    S apply(String symbol, S state);
}
