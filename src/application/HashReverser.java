package application;

import domain.engine.BreadthFirstExplorer;
import domain.engine.LevelExpander;
import domain.engine.PathReconstructor;
import domain.engine.SearchTree;
import domain.model.InversionRequest;
import domain.model.ReversibleHash;
import domain.model.StateTransition;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;

/**
 * Public entry point: inverts an iteratively defined hash function.
 *
 * <h3>Workflow</h3>
 * <ol>
 *   <li><b>VALIDATION</b> — inputs are captured in an {@link InversionRequest}, which fails
 *       fast with {@link IllegalArgumentException} before any search work.</li>
 *   <li><b>EXPLORATION</b> — {@link BreadthFirstExplorer} builds the bounded reverse-walk
 *       tree and collects solution leaves.</li>
 *   <li><b>RECONSTRUCTION</b> — {@link PathReconstructor} turns every leaf into the string
 *       the forward hash would have consumed.</li>
 * </ol>
 *
 * <p>Every accepting path yields one string; identical strings reached through
 * different paths (e.g. a repeated alphabet entry) are all returned. The order of the
 * result is deterministic for a given configuration but carries no meaning.
 *
 * <p>Exceptions thrown by the caller's callbacks are not caught and reach the caller
 * unchanged. Nothing is cached between calls.
 *
 * <p>Instances are thread-safe; concurrent calls share the ForkJoin pool.
 *
 * @see ReverserConfiguration
 */
public final class HashReverser {

    private final ReverserConfiguration config;
    private final ForkJoinPool executorPool;

    /**
     * Constructs a reverser with {@link ReverserConfiguration#defaults()}.
     */
    public HashReverser() {
        this(ReverserConfiguration.defaults());
    }

    /**
     * Constructs a reverser for the given configuration.
     *
     * <p>Creates a dedicated {@link ForkJoinPool} that is reused by every call.
     *
     * @param config execution settings
     */
    public HashReverser(ReverserConfiguration config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.config = config;
        this.executorPool = new ForkJoinPool(config.getParallelism());
    }

    /**
     * Reverses an iteratively generated hash function.
     *
     * @param symbols              symbols that may appear in an input (letters of the alphabet etc.)
     * @param reversedHashFunction the hash step implemented in reverse
     * @param checkFunction        the reverse step minus its last operation, used for validation
     * @param acceptanceFunction   decides whether a check state is a valid step
     * @param terminalState        the state obtained by hashing; must not be the type's default
     * @param initialState         the seed of the hash
     * @param maxStringLength      maximum number of symbols in a returned string; positive
     * @param <S>                  hash state type, ordered so that states move monotonically
     *                             toward {@code initialState} along every valid reverse walk
     * @return every string of at most {@code maxStringLength} symbols whose reverse walk
     *         ends in {@code initialState}; empty if there is none
     * @throws IllegalArgumentException if any input is invalid
     */
    public <S extends Comparable<? super S>> List<String> reverseHash(
            List<String> symbols,
            StateTransition<S> reversedHashFunction,
            StateTransition<S> checkFunction,
            Predicate<S> acceptanceFunction,
            S terminalState,
            S initialState,
            int maxStringLength) {
        return reverseHash(new InversionRequest<>(
            symbols,
            reversedHashFunction,
            checkFunction,
            acceptanceFunction,
            terminalState,
            initialState,
            maxStringLength));
    }

    /**
     * Reverses a hash supplied as a strategy object.
     *
     * @param symbols         alphabet
     * @param hash            reverse, check and acceptance callbacks
     * @param terminalState   the state obtained by hashing
     * @param initialState    the seed of the hash
     * @param maxStringLength maximum number of symbols in a returned string
     * @param <S>             hash state type
     * @return the solution strings
     * @throws IllegalArgumentException if any input is invalid
     * @see #reverseHash(List, StateTransition, StateTransition, Predicate, Comparable, Comparable, int)
     */
    public <S extends Comparable<? super S>> List<String> reverseHash(
            List<String> symbols,
            ReversibleHash<S> hash,
            S terminalState,
            S initialState,
            int maxStringLength) {
        return reverseHash(InversionRequest.of(symbols, hash, terminalState, initialState, maxStringLength));
    }

    /**
     * Reverses the hash described by a validated request.
     *
     * @param request inversion input
     * @param <S>     hash state type
     * @return the solution strings
     */
    public <S extends Comparable<? super S>> List<String> reverseHash(InversionRequest<S> request) {
        return PathReconstructor.reconstructAll(explore(request));
    }

    /**
     * Like {@link #reverseHash(InversionRequest)} but keeps the symbol boundaries, which
     * matters when symbols are longer than one character.
     *
     * @param request inversion input
     * @param <S>     hash state type
     * @return one token list per solution, first consumed symbol first
     */
    public <S extends Comparable<? super S>> List<List<String>> reverseHashTokens(InversionRequest<S> request) {
        SearchTree<S> tree = explore(request);
        List<List<String>> solutions = new ArrayList<>(tree.getLeaves().size());
        for (SearchTree.LeafRef leaf : tree.getLeaves()) {
            solutions.add(PathReconstructor.reconstructTokens(tree, leaf));
        }
        return solutions;
    }

    /**
     * Runs the exploration phase only.
     *
     * @param request inversion input
     * @param <S>     hash state type
     * @return the explored tree with its solution leaves
     */
    public <S extends Comparable<? super S>> SearchTree<S> explore(InversionRequest<S> request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");

        if (config.isDebugMode()) {
            System.err.printf("[Search] Reversing %s -> %s over %d symbols, max length %d (%s)%n",
                request.getTerminalState(), request.getInitialState(),
                request.getSymbols().size(), request.getMaxStringLength(),
                config.getExpansionStrategy());
        }

        long startTime = System.currentTimeMillis();
        LevelExpander<S> expander = LevelExpanderFactory.createExpander(config, executorPool);
        SearchTree<S> tree = new BreadthFirstExplorer<>(expander, config.isDebugMode()).explore(request);

        if (config.isDebugMode()) {
            System.err.printf("[TOTAL] Time: %d ms%n", System.currentTimeMillis() - startTime);
        }
        return tree;
    }

    public ReverserConfiguration getConfiguration() {
        return config;
    }
}
