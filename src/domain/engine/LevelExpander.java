package domain.engine;

import java.util.List;

/**
 * Strategy that turns one level of the reverse-walk tree into the next.
 *
 * <p>Implementations differ only in scheduling: they must return exactly the children
 * {@link ExpansionStep#expandRange} yields over the whole work range, in work-item
 * order, so every strategy builds the same tree.
 *
 * <h3>Implemented strategies</h3>
 * <ul>
 *   <li>{@link SequentialLevelExpander} — single loop on the calling thread</li>
 *   <li>{@code infrastructure.parallel.ParallelLevelExpander} — ForkJoin fan-out</li>
 * </ul>
 *
 * @param <S> hash state type
 */
public interface LevelExpander<S extends Comparable<? super S>> {

    /**
     * Expands every (node, symbol) pair of {@code level}.
     *
     * @param level level to expand; never empty
     * @param step  expansion rule of the running search
     * @return the children, ordered by work item
     */
    List<SearchNode<S>> expand(SearchLevel<S> level, ExpansionStep<S> step);
}
