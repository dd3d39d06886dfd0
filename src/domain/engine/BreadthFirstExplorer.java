package domain.engine;

import domain.model.InversionRequest;

import java.util.List;

/**
 * Breadth-first explorer: builds the reverse-walk tree level by level.
 *
 * <p>Level 0 holds the root (terminal state). Level {@code k} is expanded only while
 * the continuation test holds:
 * <ol>
 *   <li>level {@code k} is non-empty,</li>
 *   <li>every node of level {@code k} has {@code state >= initialState}, and</li>
 *   <li>{@code k < maxStringLength}.</li>
 * </ol>
 * Expanding a level applies {@link ExpansionStep} to every (node, symbol) pair through
 * the configured {@link LevelExpander}; children whose state equals the initial state are
 * recorded as solution leaves by {@link SearchTree}.
 *
 * <p><b>Monotonicity pruning:</b> rule 2 assumes states move monotonically toward the
 * initial state along every valid reverse walk. The caller's ordering must guarantee it;
 * the explorer cannot check. With a non-monotone ordering the search may stop early or
 * run to the depth cap, but it always terminates.
 *
 * <br><b>Memory:</b> O(total nodes); every level is kept for reconstruction.
 *
 * @param <S> hash state type
 */
public final class BreadthFirstExplorer<S extends Comparable<? super S>> {

    private final LevelExpander<S> expander;
    private final boolean debugMode;

    /**
     * Constructs an explorer.
     *
     * @param expander  level expansion strategy (sequential or parallel)
     * @param debugMode whether to print per-level statistics to stderr
     */
    public BreadthFirstExplorer(LevelExpander<S> expander, boolean debugMode) {
        this.expander = expander;
        this.debugMode = debugMode;
    }

    /**
     * Builds the reverse-walk tree for {@code request}.
     *
     * @param request validated inversion input
     * @return tree holding every materialized level and all solution leaves
     */
    public SearchTree<S> explore(InversionRequest<S> request) {
        ExpansionStep<S> step = new ExpansionStep<>(request);
        SearchTree<S> tree = new SearchTree<>(request.getTerminalState());
        S initialState = request.getInitialState();
        int maxDepth = request.getMaxStringLength();

        int depth = 0;
        while (shouldExpand(tree.getLevel(depth), initialState, maxDepth)) {
            long levelStart = System.currentTimeMillis();
            List<SearchNode<S>> children = expander.expand(tree.getLevel(depth), step);
            SearchLevel<S> next = tree.appendLevel(children);
            depth++;

            if (debugMode) {
                System.err.printf("[Level %d] Nodes: %d, solutions so far: %d, time: %d ms%n",
                    next.getDepth(), next.size(), tree.getLeaves().size(),
                    System.currentTimeMillis() - levelStart);
            }
        }

        assert tree.getLevelCount() <= maxDepth + 1 : "depth cap exceeded";
        if (debugMode) {
            System.err.printf("[Search] Stopped at depth %d (%s): %d nodes, %d solutions%n",
                depth, stopReason(tree.getLevel(depth), initialState, maxDepth),
                tree.getNodeCount(), tree.getLeaves().size());
        }
        return tree;
    }

    /**
     * Continuation test evaluated before expanding {@code level}.
     */
    private boolean shouldExpand(SearchLevel<S> level, S initialState, int maxDepth) {
        return !level.isEmpty()
            && allAtLeast(level, initialState)
            && level.getDepth() < maxDepth;
    }

    private boolean allAtLeast(SearchLevel<S> level, S initialState) {
        for (SearchNode<S> node : level.getNodes()) {
            if (node.state.compareTo(initialState) < 0) {
                return false;
            }
        }
        return true;
    }

    private String stopReason(SearchLevel<S> level, S initialState, int maxDepth) {
        if (level.isEmpty()) return "empty frontier";
        if (!allAtLeast(level, initialState)) return "frontier passed initial state";
        return "depth cap " + maxDepth;
    }
}
