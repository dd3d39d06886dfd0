package domain.engine;

import domain.model.InversionRequest;
import domain.model.StateTransition;

import java.util.List;
import java.util.function.Predicate;

/**
 * Expands one (node, symbol) work item of a level.
 *
 * <p>A level of {@code n} nodes over an alphabet of {@code m} symbols holds the
 * work items {@code [0, n * m)}; item {@code w} pairs node {@code w / m} with symbol
 * {@code w % m}. Work items are independent and read only immutable data, so any
 * partition of the range can be expanded concurrently.
 *
 * <p>A symbol is an admissible reverse step at a node when the check state
 * {@code c = check(symbol, node.state)} satisfies both {@code accepts(c)} and
 * {@code c >= initialState}. The child then holds {@code reverse(symbol, node.state)}.
 *
 * <p>Callback exceptions are not caught.
 *
 * @param <S> hash state type
 */
public final class ExpansionStep<S extends Comparable<? super S>> {

    private final List<String> symbols;
    private final StateTransition<S> reverseFunction;
    private final StateTransition<S> checkFunction;
    private final Predicate<S> acceptanceFunction;
    private final S initialState;

    public ExpansionStep(InversionRequest<S> request) {
        this.symbols = request.getSymbols();
        this.reverseFunction = request.getReverseFunction();
        this.checkFunction = request.getCheckFunction();
        this.acceptanceFunction = request.getAcceptanceFunction();
        this.initialState = request.getInitialState();
    }

    /**
     * Returns the number of work items in {@code level}.
     *
     * @param level level to expand
     * @return {@code level.size() * symbolCount}
     * @throws ArithmeticException if the level is too large to index
     */
    public int workItemCount(SearchLevel<S> level) {
        return Math.multiplyExact(level.size(), symbols.size());
    }

    /**
     * Expands the work items {@code [from, to)} of {@code level} into {@code out},
     * in work-item order.
     *
     * @param level level being expanded
     * @param from  inclusive first work item
     * @param to    exclusive last work item
     * @param out   receives the admitted children
     */
    public void expandRange(SearchLevel<S> level, int from, int to, List<SearchNode<S>> out) {
        int symbolCount = symbols.size();
        for (int w = from; w < to; w++) {
            int nodeIndex = w / symbolCount;
            SearchNode<S> child = expand(level.get(nodeIndex), nodeIndex, symbols.get(w % symbolCount));
            if (child != null) {
                out.add(child);
            }
        }
    }

    /**
     * Tries to undo {@code symbol} at {@code parent}.
     *
     * @param parent      node being expanded
     * @param parentIndex index of {@code parent} within its level
     * @param symbol      candidate symbol
     * @return the child node, or {@code null} if the step is not admissible
     */
    public SearchNode<S> expand(SearchNode<S> parent, int parentIndex, String symbol) {
        S checkState = checkFunction.apply(symbol, parent.state);
        if (!acceptanceFunction.test(checkState) || checkState.compareTo(initialState) < 0) {
            return null;
        }
        S childState = reverseFunction.apply(symbol, parent.state);
        return new SearchNode<>(symbol, childState, parentIndex, initialState.equals(childState));
    }
}
