package domain.engine;

import java.util.Collections;
import java.util.List;

/**
 * All nodes created at one depth of the reverse walk, in creation order.
 *
 * <p>A level is published once its expansion completes and is read-only afterwards;
 * the next level refers to its nodes by index.
 *
 * @param <S> hash state type
 */
public final class SearchLevel<S> {

    private final int depth;
    private final List<SearchNode<S>> nodes;

    SearchLevel(int depth, List<SearchNode<S>> nodes) {
        this.depth = depth;
        this.nodes = Collections.unmodifiableList(nodes);
    }

    public int getDepth() { return depth; }
    public List<SearchNode<S>> getNodes() { return nodes; }
    public int size() { return nodes.size(); }
    public boolean isEmpty() { return nodes.isEmpty(); }

    public SearchNode<S> get(int index) {
        return nodes.get(index);
    }
}
