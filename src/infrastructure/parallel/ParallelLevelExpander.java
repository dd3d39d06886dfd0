package infrastructure.parallel;

import domain.engine.ExpansionStep;
import domain.engine.LevelExpander;
import domain.engine.SearchLevel;
import domain.engine.SearchNode;

import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Expands a level by submitting a {@link LevelExpansionTask} to a {@link ForkJoinPool}.
 *
 * <p>The call blocks until the whole level is expanded; the level boundary is the only
 * synchronization point. The pool is owned by the caller and reused across levels.
 *
 * <h3>Exceptions</h3>
 * When a task fails on a worker thread, {@link ForkJoinPool#invoke} rethrows a fresh
 * copy of the failure rather than the instance that was thrown. The tasks of a level
 * record the first failure they see, and this expander rethrows that recorded instance,
 * so an exception or error raised by a hash callback reaches the caller exactly as thrown.
 */
public final class ParallelLevelExpander<S extends Comparable<? super S>> implements LevelExpander<S> {

    private final ForkJoinPool pool;
    private final int leafTaskSize;

    /**
     * Constructs a parallel expander.
     *
     * @param pool         pool running the expansion tasks
     * @param leafTaskSize maximum work items expanded by a single task
     */
    public ParallelLevelExpander(ForkJoinPool pool, int leafTaskSize) {
        this.pool = pool;
        this.leafTaskSize = leafTaskSize;
    }

    @Override
    public List<SearchNode<S>> expand(SearchLevel<S> level, ExpansionStep<S> step) {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        LevelExpansionTask<S> rootTask = new LevelExpansionTask<>(
            level, step, 0, step.workItemCount(level), leafTaskSize, failure);
        try {
            return pool.invoke(rootTask);
        } catch (RuntimeException | Error e) {
            Throwable original = failure.get();
            if (original instanceof RuntimeException) {
                throw (RuntimeException) original;
            }
            if (original instanceof Error) {
                throw (Error) original;
            }
            throw e;
        }
    }
}
