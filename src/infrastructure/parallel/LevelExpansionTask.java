package infrastructure.parallel;

import domain.engine.ExpansionStep;
import domain.engine.SearchLevel;
import domain.engine.SearchNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link RecursiveTask} that expands a range of (node, symbol) work items of one level.
 *
 * <p>The level's work range {@code [0, nodes * symbols)} is recursively bisected until a
 * task holds at most {@code leafTaskSize} items. Splitting the flattened range (rather
 * than the node list) spreads work across symbols as well, so a level with few nodes and
 * a large alphabet still fans out.
 *
 * <h3>Output buffers</h3>
 * Each leaf task writes into its own list; parents concatenate left then right. No list
 * is shared between threads, and the merged result keeps work-item order, which makes the
 * parallel tree identical to the sequential one.
 *
 * <h3>Failures</h3>
 * The first exception or error raised while expanding a range is recorded in the
 * failure slot shared by all tasks of the level, then rethrown. ForkJoin replaces a
 * failure with a copy when it crosses threads; the recorded instance is the one thrown.
 */
public final class LevelExpansionTask<S extends Comparable<? super S>> extends RecursiveTask<List<SearchNode<S>>> {

    private final SearchLevel<S> level;
    private final ExpansionStep<S> step;
    /** Inclusive first work item of this task. */
    private final int rangeStart;
    /** Exclusive last work item of this task. */
    private final int rangeEnd;
    private final int leafTaskSize;
    /** First failure of the level, shared by every task of the same level. */
    private final AtomicReference<Throwable> failure;

    /**
     * Constructs a root or child task for the given work-item range.
     *
     * @param level        level being expanded
     * @param step         expansion rule of the running search
     * @param rangeStart   inclusive first work item
     * @param rangeEnd     exclusive last work item
     * @param leafTaskSize range size at or below which the task expands directly
     * @param failure      receives the first exception or error raised by an expansion
     */
    public LevelExpansionTask(SearchLevel<S> level,
                              ExpansionStep<S> step,
                              int rangeStart, int rangeEnd,
                              int leafTaskSize,
                              AtomicReference<Throwable> failure) {
        this.level = level;
        this.step = step;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.leafTaskSize = leafTaskSize;
        this.failure = failure;
    }

    /**
     * Expands this task's range, splitting it first if it is too large.
     *
     * @implNote This method is called by the ForkJoin framework. Never call directly.
     */
    @Override
    protected List<SearchNode<S>> compute() {
        int rangeSize = rangeEnd - rangeStart;

        if (rangeSize <= leafTaskSize) {
            List<SearchNode<S>> children = new ArrayList<>();
            try {
                step.expandRange(level, rangeStart, rangeEnd, children);
            } catch (RuntimeException | Error e) {
                failure.compareAndSet(null, e);
                throw e;
            }
            return children;
        }

        int splitPoint = (rangeStart + rangeEnd) >>> 1;
        LevelExpansionTask<S> left = createSubtask(rangeStart, splitPoint);
        LevelExpansionTask<S> right = createSubtask(splitPoint, rangeEnd);
        invokeAll(left, right);

        List<SearchNode<S>> merged = left.join();
        merged.addAll(right.join());
        return merged;
    }

    private LevelExpansionTask<S> createSubtask(int start, int end) {
        return new LevelExpansionTask<>(level, step, start, end, leafTaskSize, failure);
    }
}
