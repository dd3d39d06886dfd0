package domain.engine;

/**
 * A node of the reverse-walk tree.
 *
 * <p>Each node records:
 * <ul>
 *   <li><b>symbol</b> — the symbol undone to reach this node ({@code null} for the root)</li>
 *   <li><b>state</b> — the hash state after undoing {@code symbol}</li>
 *   <li><b>parentIndex</b> — position of the parent in the preceding level
 *       ({@link #NO_PARENT} for the root)</li>
 *   <li><b>solution</b> — whether {@code state} equals the search's initial state</li>
 * </ul>
 *
 * <p>Parents are referenced by index into the previous {@link SearchLevel}, never by
 * object reference, so nodes hold no links that outlive the tree.
 *
 * <p>This class is immutable.
 *
 * @param <S> hash state type
 */
public final class SearchNode<S> {

    /** Parent index of the root node. */
    public static final int NO_PARENT = -1;

    /** Symbol undone to reach this node; {@code null} for the root. */
    public final String symbol;

    /** Hash state at this node. */
    public final S state;

    /** Index of the parent node in the preceding level. */
    public final int parentIndex;

    /** {@code true} if {@link #state} equals the initial state of the search. */
    public final boolean solution;

    /**
     * Constructs a non-root search node.
     *
     * @param symbol      symbol undone to reach this node
     * @param state       resulting hash state
     * @param parentIndex index of the parent in the preceding level
     * @param solution    whether {@code state} equals the initial state
     */
    public SearchNode(String symbol, S state, int parentIndex, boolean solution) {
        assert symbol != null : "non-root node needs a symbol";
        assert parentIndex >= 0 : "non-root node needs a parent";
        this.symbol = symbol;
        this.state = state;
        this.parentIndex = parentIndex;
        this.solution = solution;
    }

    private SearchNode(S state) {
        this.symbol = null;
        this.state = state;
        this.parentIndex = NO_PARENT;
        this.solution = false;
    }

    /**
     * Creates the root node holding the terminal state.
     *
     * @param terminalState hash output the reverse walk starts from
     * @param <S>           hash state type
     * @return root node
     */
    static <S> SearchNode<S> root(S terminalState) {
        return new SearchNode<>(terminalState);
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    @Override
    public String toString() {
        return isRoot() ? "root(" + state + ")" : symbol + "->" + state + (solution ? "*" : "");
    }
}
