package domain.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only tree built by {@link BreadthFirstExplorer}.
 *
 * <p>Stored as a list of {@link SearchLevel}s (level 0 holds only the root) plus the
 * positions of every solution leaf. Nodes reference their parent by index into the
 * preceding level, so a leaf's path is recovered by walking those indexes back to
 * depth 0 (see {@link PathReconstructor}).
 *
 * <p>Not thread-safe: only the explorer thread appends, and only between level expansions.
 *
 * @param <S> hash state type
 */
public final class SearchTree<S> {

    /**
     * Position of a solution leaf inside the tree.
     */
    public static final class LeafRef {
        /** Depth of the leaf; equals the length of its solution in symbols. */
        public final int depth;

        /** Index of the leaf within its level. */
        public final int index;

        LeafRef(int depth, int index) {
            this.depth = depth;
            this.index = index;
        }
    }

    private final List<SearchLevel<S>> levels = new ArrayList<>();
    private final List<LeafRef> leaves = new ArrayList<>();
    private long nodeCount;

    /**
     * Creates a tree whose level 0 holds only the root.
     *
     * @param terminalState hash output the reverse walk starts from
     */
    public SearchTree(S terminalState) {
        List<SearchNode<S>> rootLevel = new ArrayList<>(1);
        rootLevel.add(SearchNode.root(terminalState));
        levels.add(new SearchLevel<>(0, rootLevel));
        nodeCount = 1;
    }

    /**
     * Publishes the next level and records its solution leaves.
     *
     * @param nodes children of the current deepest level, in merge order
     * @return the published level
     */
    SearchLevel<S> appendLevel(List<SearchNode<S>> nodes) {
        int depth = levels.size();
        SearchLevel<S> level = new SearchLevel<>(depth, nodes);
        for (int i = 0; i < level.size(); i++) {
            SearchNode<S> node = level.get(i);
            assert node.parentIndex < getLevel(depth - 1).size() : "parent outside preceding level";
            if (node.solution) {
                leaves.add(new LeafRef(depth, i));
            }
        }
        levels.add(level);
        nodeCount += level.size();
        return level;
    }

    public SearchLevel<S> getLevel(int depth) {
        return levels.get(depth);
    }

    public SearchNode<S> getNode(int depth, int index) {
        return getLevel(depth).get(index);
    }

    public SearchNode<S> getRoot() {
        return getNode(0, 0);
    }

    /** Number of materialized levels, root level included. */
    public int getLevelCount() { return levels.size(); }

    public SearchLevel<S> getDeepestLevel() { return getLevel(levels.size() - 1); }

    public List<LeafRef> getLeaves() { return Collections.unmodifiableList(leaves); }

    public long getNodeCount() { return nodeCount; }
}
