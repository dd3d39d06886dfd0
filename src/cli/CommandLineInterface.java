package cli;

import application.HashReverser;
import application.ReverserConfiguration;
import domain.hash.PolynomialFoldHash;
import domain.model.InversionRequest;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: inverts a {@link PolynomialFoldHash}.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java cli.CommandLineInterface &lt;terminal_state&gt; &lt;max_length&gt; [options]
 * </pre>
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>Results are printed to stdout via {@link ResultFormatter} (or to a file if --output is used)</li>
 *   <li>Debug output goes to stderr (if --debug is enabled)</li>
 *   <li>Exit code is 0 on success, non-zero on error</li>
 * </ul>
 *
 * @see ArgumentParser
 * @see HashReverser
 */
public final class CommandLineInterface {

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        try {
            execute(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Argument Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Parses arguments, runs the reversal and prints the result.
     *
     * @param args command-line arguments
     * @throws IOException if the output file cannot be written
     * @throws IllegalArgumentException if arguments are invalid
     */
    static void execute(String[] args) throws IOException {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);

        if (parser.isHelpRequested()) {
            parser.printHelp();
            return;
        }

        ReverserConfiguration config = parser.buildConfiguration();
        PolynomialFoldHash hash = parser.buildHash();
        long terminalState = parser.resolveTerminalState(hash);

        if (config.isDebugMode()) {
            System.err.printf("[CLI] Alphabet: %s, multiplier=%d, scale=%d, seed=%d%n",
                hash.getSymbolValues(), hash.getMultiplier(), hash.getScale(), hash.getSeed());
            System.err.printf("[CLI] Terminal state: %d, max length: %d%n",
                terminalState, parser.getMaxLength());
        }

        InversionRequest<Long> request = InversionRequest.of(
            hash.getSymbols(), hash, terminalState, hash.getSeed(), parser.getMaxLength());

        long startTime = System.currentTimeMillis();
        List<List<String>> solutions = new HashReverser(config).reverseHashTokens(request);
        long executionTime = System.currentTimeMillis() - startTime;

        List<String> candidates = new ArrayList<>(solutions.size());
        List<Long> forwardHashes = new ArrayList<>(solutions.size());
        for (List<String> tokens : solutions) {
            candidates.add(String.join("", tokens));
            forwardHashes.add(hash.hashTokens(tokens));
        }

        displayResults(parser, terminalState, candidates, forwardHashes, executionTime);
    }

    /**
     * Displays results on stdout or writes them to the {@code --output} file.
     */
    private static void displayResults(ArgumentParser parser,
                                       long terminalState,
                                       List<String> candidates,
                                       List<Long> forwardHashes,
                                       long executionTime) throws IOException {
        if (parser.getOutputFile() != null) {
            try (PrintStream fileOut = new PrintStream(new FileOutputStream(parser.getOutputFile()))) {
                new ResultFormatter(fileOut).printResults(terminalState, candidates, forwardHashes, executionTime);
            }
            System.err.println("[CLI] Results written to: " + parser.getOutputFile());
        } else {
            new ResultFormatter(System.out).printResults(terminalState, candidates, forwardHashes, executionTime);
        }
    }
}
