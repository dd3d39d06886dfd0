package domain.model;

import infrastructure.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable, validated input of one hash inversion.
 *
 * <p>All validation happens in the constructor, before any search work starts.
 * Every failure is reported as an {@link IllegalArgumentException}:
 * <ul>
 *   <li><b>symbols</b> — null, empty, or holding a {@code null} symbol</li>
 *   <li><b>callbacks</b> — any of the reverse, check or acceptance functions unset</li>
 *   <li><b>terminalState</b> — the type's default value (see
 *       {@link ValidationUtils#isDefaultValue(Object)}), which is indistinguishable from
 *       "no terminal state provided"</li>
 *   <li><b>maxStringLength</b> — zero or negative</li>
 *   <li><b>initialState</b> — null</li>
 * </ul>
 *
 * <p>The alphabet is copied, so later changes to the caller's list do not affect a
 * running search.
 *
 * @param <S> hash state type; its natural ordering drives the monotonicity pruning
 */
public final class InversionRequest<S extends Comparable<? super S>> {

    private final List<String> symbols;
    private final StateTransition<S> reverseFunction;
    private final StateTransition<S> checkFunction;
    private final Predicate<S> acceptanceFunction;
    private final S terminalState;
    private final S initialState;
    private final int maxStringLength;

    /**
     * Validates and captures the inputs of an inversion.
     *
     * @param symbols            ordered alphabet; duplicates allowed
     * @param reverseFunction    reverse transition {@code (symbol, state) -> previous state}
     * @param checkFunction      check step {@code (symbol, state) -> check state}
     * @param acceptanceFunction acceptance test over check states
     * @param terminalState      hash output; start of the reverse walk
     * @param initialState       hash seed; success condition of the reverse walk
     * @param maxStringLength    maximum number of symbols in a solution
     * @throws IllegalArgumentException if any input is invalid
     */
    public InversionRequest(List<String> symbols,
                            StateTransition<S> reverseFunction,
                            StateTransition<S> checkFunction,
                            Predicate<S> acceptanceFunction,
                            S terminalState,
                            S initialState,
                            int maxStringLength) {
        ValidationUtils.validateNotEmpty(symbols, "symbols");
        for (String symbol : symbols) {
            if (symbol == null) {
                throw new IllegalArgumentException("symbols cannot contain null");
            }
        }
        ValidationUtils.validateNotNull(reverseFunction, "reversedHashFunction");
        ValidationUtils.validateNotNull(checkFunction, "checkFunction");
        ValidationUtils.validateNotNull(acceptanceFunction, "acceptanceFunction");
        ValidationUtils.validateNotDefault(terminalState, "terminalState");
        ValidationUtils.validatePositive(maxStringLength, "maxStringLength");
        ValidationUtils.validateNotNull(initialState, "initialState");

        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        this.reverseFunction = reverseFunction;
        this.checkFunction = checkFunction;
        this.acceptanceFunction = acceptanceFunction;
        this.terminalState = terminalState;
        this.initialState = initialState;
        this.maxStringLength = maxStringLength;
    }

    /**
     * Builds a request from a strategy object.
     *
     * @param symbols         ordered alphabet
     * @param hash            callbacks of the hash being inverted
     * @param terminalState   hash output
     * @param initialState    hash seed
     * @param maxStringLength maximum number of symbols in a solution
     * @param <S>             hash state type
     * @return validated request
     * @throws IllegalArgumentException if any input is invalid
     */
    public static <S extends Comparable<? super S>> InversionRequest<S> of(List<String> symbols,
                                                                         ReversibleHash<S> hash,
                                                                         S terminalState,
                                                                         S initialState,
                                                                         int maxStringLength) {
        ValidationUtils.validateNotNull(hash, "hash");
        return new InversionRequest<>(symbols,
            hash::reverseStep,
            hash::checkStep,
            hash::acceptsCheckState,
            terminalState,
            initialState,
            maxStringLength);
    }

    public List<String> getSymbols() { return symbols; }
    public StateTransition<S> getReverseFunction() { return reverseFunction; }
    public StateTransition<S> getCheckFunction() { return checkFunction; }
    public Predicate<S> getAcceptanceFunction() { return acceptanceFunction; }
    public S getTerminalState() { return terminalState; }
    public S getInitialState() { return initialState; }
    public int getMaxStringLength() { return maxStringLength; }
}
