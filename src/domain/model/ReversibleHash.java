package domain.model;

/**
 * Strategy object bundling the three callbacks needed to invert a fold hash.
 *
 * <p>{@link #checkStep} and {@link #reverseStep} are expected to agree on which steps
 * are valid; nothing verifies this. A pair that disagrees can make the search accept
 * a step the reverse function does not logically support.
 *
 * @param <S> hash state type
 * @see StateTransition
 */
public interface ReversibleHash<S> {

    /**
     * Computes the state before {@code symbol} was folded into {@code state}.
     *
     * @param symbol symbol to undo
     * @param state  state after the symbol was consumed
     * @return state before the symbol was consumed
     */
    S reverseStep(String symbol, S state);

    /**
     * Computes the intermediate state used only to validate the reverse step.
     *
     * @param symbol symbol to undo
     * @param state  state after the symbol was consumed
     * @return check state passed to {@link #acceptsCheckState}
     */
    S checkStep(String symbol, S state);

    /**
     * Decides whether a check state belongs to a valid reverse walk.
     *
     * @param checkState result of {@link #checkStep}
     * @return {@code true} if the step is admissible
     */
    boolean acceptsCheckState(S checkState);
}
