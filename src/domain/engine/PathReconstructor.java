package domain.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns solution leaves back into input strings.
 *
 * <p>The reverse walk undoes the <em>last</em> symbol consumed by the forward hash first,
 * so the root's children carry the last symbol and a leaf carries the first one. Walking
 * parent indexes from the leaf up to the root therefore visits the symbols in forward
 * order; the root contributes nothing.
 *
 * <p>Pure and stateless.
 */
public final class PathReconstructor {

    private PathReconstructor() {
        // Static utility class — no instances
    }

    /**
     * Rebuilds the string of every solution leaf, in leaf order.
     *
     * @param tree explored tree
     * @param <S>  hash state type
     * @return one string per leaf; duplicates are kept
     */
    public static <S> List<String> reconstructAll(SearchTree<S> tree) {
        List<SearchTree.LeafRef> leaves = tree.getLeaves();
        List<String> solutions = new ArrayList<>(leaves.size());
        for (SearchTree.LeafRef leaf : leaves) {
            solutions.add(reconstruct(tree, leaf));
        }
        return solutions;
    }

    /**
     * Rebuilds the string spelled by the path from {@code leaf} to the root.
     *
     * @param tree explored tree
     * @param leaf position of the leaf
     * @param <S>  hash state type
     * @return concatenated symbols in forward-hash order
     */
    public static <S> String reconstruct(SearchTree<S> tree, SearchTree.LeafRef leaf) {
        return String.join("", reconstructTokens(tree, leaf));
    }

    /**
     * Returns the symbols of the path from {@code leaf} to the root, in forward order.
     *
     * @param tree explored tree
     * @param leaf position of the leaf
     * @param <S>  hash state type
     * @return symbol tokens, first consumed first
     */
    public static <S> List<String> reconstructTokens(SearchTree<S> tree, SearchTree.LeafRef leaf) {
        List<String> tokens = new ArrayList<>(leaf.depth);
        int index = leaf.index;
        for (int depth = leaf.depth; depth > 0; depth--) {
            SearchNode<S> node = tree.getNode(depth, index);
            tokens.add(node.symbol);
            index = node.parentIndex;
        }
        assert index == 0 : "path must end at the root";
        return tokens;
    }
}
