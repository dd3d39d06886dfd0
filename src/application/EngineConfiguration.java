package application;

/**
 * Tuning constants for the hash reverser.
 *
 * <p>Centralizes the parameters that control ForkJoin parallelism and task granularity
 * during level expansion.
 *
 * <h3>Tuning guidelines</h3>
 * <ul>
 *   <li><b>LEAF_TASK_SIZE</b>: Larger values reduce task overhead but decrease
 *       work-stealing granularity. Cheap callbacks favour larger leaves.</li>
 * </ul>
 */
public final class EngineConfiguration {

    // =========================================================================
    // Parallelism Configuration
    // =========================================================================

    /**
     * Default ForkJoin parallelism level.
     *
     * <p>Set to the number of available processors. Level expansion is CPU-bound, so
     * more workers than cores only adds contention.
     */
    public static final int DEFAULT_PARALLELISM = Runtime.getRuntime().availableProcessors();

    // =========================================================================
    // Task Granularity Configuration
    // =========================================================================

    /**
     * Maximum (node, symbol) work items expanded by one leaf task.
     *
     * <p>Each work item runs the check, acceptance and (when admitted) reverse callbacks
     * once, so 64 items keeps per-task overhead small for arithmetic hashes while still
     * splitting mid-sized levels across all workers.
     */
    public static final int LEAF_TASK_SIZE = 64;

    // =========================================================================
    // Reporting Constants
    // =========================================================================

    /**
     * Milliseconds per second for time reporting.
     */
    public static final double MS_PER_SECOND = 1000.0;

    private EngineConfiguration() {
        throw new AssertionError("Utility class — do not instantiate");
    }
}
