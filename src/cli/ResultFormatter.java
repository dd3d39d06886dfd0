package cli;

import application.EngineConfiguration;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Formats and prints reversal results.
 *
 * <p>Candidates are listed with their rank and the forward hash recomputed for each one,
 * followed by a summary (terminal state, candidate count, execution time).
 *
 * <p>All floating-point values use {@link Locale#ROOT} so the output is identical regardless
 * of system locale.
 */
public final class ResultFormatter {

    private final PrintStream out;

    /**
     * Constructs a formatter writing to {@code out}.
     *
     * @param out destination stream
     */
    public ResultFormatter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints the candidates and the run summary.
     *
     * @param terminalState   hash value that was inverted
     * @param candidates      solution strings in result order
     * @param forwardHashes   forward hash of each candidate, same order as {@code candidates}
     * @param executionTimeMs wall-clock time of the search, in ms
     */
    public void printResults(long terminalState,
                             List<String> candidates,
                             List<Long> forwardHashes,
                             long executionTimeMs) {
        out.println("=================================================");
        out.printf("CANDIDATE INPUTS FOR HASH %d%n", terminalState);
        out.println("=================================================");

        if (candidates.isEmpty()) {
            out.println("No candidates found.");
        } else {
            out.printf("%-6s %-30s %-15s%n", "Rank", "Input", "Forward hash");
            out.println("-------------------------------------------------");

            for (int i = 0; i < candidates.size(); i++) {
                out.printf(Locale.ROOT, "%-6d %-30s %-15d%n",
                    i + 1, candidates.get(i), forwardHashes.get(i));
            }
        }

        out.println("=================================================");
        out.printf(Locale.ROOT, "Execution time: %.3f seconds%n", executionTimeMs / EngineConfiguration.MS_PER_SECOND);
        out.printf("Candidates found: %d%n", candidates.size());
        out.println("=================================================");
    }
}
