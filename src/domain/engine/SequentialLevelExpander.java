package domain.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands a level with a plain loop on the calling thread.
 *
 * @param <S> hash state type
 */
public final class SequentialLevelExpander<S extends Comparable<? super S>> implements LevelExpander<S> {

    @Override
    public List<SearchNode<S>> expand(SearchLevel<S> level, ExpansionStep<S> step) {
        List<SearchNode<S>> children = new ArrayList<>();
        step.expandRange(level, 0, step.workItemCount(level), children);
        return children;
    }
}
