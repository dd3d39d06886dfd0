package cli;

import application.ReverserConfiguration;
import domain.hash.PolynomialFoldHash;
import infrastructure.util.ValidationUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses and validates all command-line arguments for the fold-hash reverser demo.
 *
 * <h3>Syntax</h3>
 * <pre>
 *   &lt;terminal_state&gt; &lt;max_length&gt;
 *       [--help | -h]
 *       [--debug]
 *       [--output &lt;file&gt; | -o &lt;file&gt;]
 *       [--no-parallel]
 *       [--parallelism &lt;n&gt;]
 *       [--alphabet a=1,b=2]
 *       [--multiplier &lt;n&gt;] [--scale &lt;n&gt;] [--seed &lt;n&gt;]
 *       [--input &lt;text&gt;]
 * </pre>
 *
 * <h3>Required positional arguments</h3>
 * <ol>
 *   <li>{@code terminal_state} — hash value to invert, or {@code -} together with {@code --input}</li>
 *   <li>{@code max_length}     — maximum number of symbols per candidate (positive integer)</li>
 * </ol>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java cli.CommandLineInterface 1205 3 --debug
 *   java cli.CommandLineInterface - 6 --input abba --alphabet a=1,b=2,c=4
 * </pre>
 *
 * @see ReverserConfiguration
 * @see PolynomialFoldHash
 */
public final class ArgumentParser {

    // =========================================================================
    // Error Messages
    // =========================================================================

    private static final String USAGE_MESSAGE =
        "Usage: <terminal_state|-> <max_length> [OPTIONS]\n" +
        "Options:\n" +
        "  --help, -h              Show this help message and exit\n" +
        "  --debug                 Enable debug output with per-level statistics\n" +
        "  --output, -o <file>     Write results to file instead of stdout\n" +
        "  --no-parallel           Expand levels sequentially\n" +
        "  --parallelism <n>       ForkJoin worker count (default: available processors)\n" +
        "  --alphabet <list>       Symbols and values, e.g. a=1,b=2 (default: a=1,b=2)\n" +
        "  --multiplier <n>        Accumulator multiplier (default: 3)\n" +
        "  --scale <n>             Post-step scale factor (default: 5)\n" +
        "  --seed <n>              Initial accumulator value (default: 0)\n" +
        "  --input <text>          Derive the terminal state by hashing <text> (terminal_state must be -)";

    private static final String MISSING_ARGS_ERROR =
        "Missing required arguments. " + USAGE_MESSAGE;

    private static final String INVALID_TERMINAL_FORMAT =
        "Invalid terminal_state: must be an integer or '-'";

    private static final String INVALID_LENGTH_FORMAT =
        "Invalid max_length: must be a positive integer";

    private static final String MISSING_VALUE_FORMAT =
        "%s requires a value";

    private static final String INVALID_NUMBER_FORMAT =
        "Invalid value for %s: %s";

    private static final String INVALID_ALPHABET_FORMAT =
        "Invalid alphabet entry: %s. Expected symbol=value";

    private static final String TERMINAL_SOURCE_ERROR =
        "Give either a terminal_state or '-' with --input, not both";

    private static final String UNKNOWN_ARG_FORMAT =
        "Unknown argument: %s. Use --help for usage information.";

    // =========================================================================
    // Parsed Fields
    // =========================================================================

    private Long terminalState;
    private int maxLength;
    private boolean helpRequested = false;
    private boolean debugMode = false;
    private String outputFile = null;
    private boolean noParallel = false;
    private Integer parallelism = null;
    private Map<String, Long> alphabet = PolynomialFoldHash.defaults().getSymbolValues();
    private long multiplier = 3L;
    private long scale = 5L;
    private long seed = 0L;
    private String inputText = null;

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parses command-line arguments.
     *
     * @param args command-line arguments from {@code main()}
     * @throws IllegalArgumentException if arguments are invalid or missing
     */
    public void parse(String[] args) {
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            helpRequested = true;
            return;
        }

        if (args.length < 2) {
            throw new IllegalArgumentException(MISSING_ARGS_ERROR);
        }

        terminalState = parseTerminalParameter(args[0]);
        maxLength = parseLengthParameter(args[1]);
        parseOptionalFlags(args);

        if ((terminalState == null) == (inputText == null)) {
            throw new IllegalArgumentException(TERMINAL_SOURCE_ERROR);
        }
    }

    /**
     * Builds a {@link ReverserConfiguration} from parsed arguments.
     *
     * @return immutable reverser configuration
     */
    public ReverserConfiguration buildConfiguration() {
        ReverserConfiguration.Builder builder = new ReverserConfiguration.Builder()
            .setDebugMode(debugMode);
        if (noParallel) {
            builder.setExpansionStrategy(ReverserConfiguration.ExpansionStrategy.SEQUENTIAL);
        }
        if (parallelism != null) {
            builder.setParallelism(parallelism);
        }
        return builder.build();
    }

    /**
     * Builds the demonstration hash described by the parsed arguments.
     *
     * @return fold hash
     * @throws IllegalArgumentException if the hash parameters are invalid
     */
    public PolynomialFoldHash buildHash() {
        return new PolynomialFoldHash(alphabet, multiplier, scale, seed);
    }

    /**
     * Returns the terminal state, hashing {@code --input} when it was given.
     *
     * @param hash hash built by {@link #buildHash()}
     * @return terminal state to invert
     */
    public long resolveTerminalState(PolynomialFoldHash hash) {
        return terminalState != null ? terminalState : hash.hash(inputText);
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public Long getTerminalState() { return terminalState; }
    public int getMaxLength() { return maxLength; }
    public boolean isHelpRequested() { return helpRequested; }
    public boolean isDebugMode() { return debugMode; }
    public String getOutputFile() { return outputFile; }
    public boolean isNoParallel() { return noParallel; }
    public Map<String, Long> getAlphabet() { return alphabet; }
    public long getMultiplier() { return multiplier; }
    public long getScale() { return scale; }
    public long getSeed() { return seed; }
    public String getInputText() { return inputText; }

    /**
     * Prints help message to stderr.
     */
    public void printHelp() {
        System.err.println("Fold-Hash Reverser: enumerate the inputs of (acc * m + value) * scale hashes");
        System.err.println();
        System.err.println(USAGE_MESSAGE);
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java cli.CommandLineInterface 1205 3 --debug");
    }

    // =========================================================================
    // Private Parsing Methods
    // =========================================================================

    private Long parseTerminalParameter(String arg) {
        if (arg.equals("-")) {
            return null;
        }
        try {
            return Long.parseLong(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(INVALID_TERMINAL_FORMAT);
        }
    }

    private int parseLengthParameter(String arg) {
        try {
            int parsedLength = Integer.parseInt(arg);
            ValidationUtils.validatePositive(parsedLength, "max_length");
            return parsedLength;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(INVALID_LENGTH_FORMAT);
        }
    }

    /**
     * Parses optional flags starting from index 2.
     *
     * <p>Parametrized flags call a helper that consumes the value and returns the index
     * of the last consumed argument; the loop's {@code i++} then moves past it.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if flags are invalid
     */
    private void parseOptionalFlags(String[] args) {
        for (int i = 2; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help":
                case "-h":
                    helpRequested = true;
                    break;

                case "--debug":
                    debugMode = true;
                    break;

                case "--output":
                case "-o":
                    outputFile = requireValue(args, i++);
                    break;

                case "--no-parallel":
                    noParallel = true;
                    break;

                case "--parallelism":
                    parallelism = parseIntFlag(args, i++);
                    break;

                case "--alphabet":
                    alphabet = parseAlphabet(requireValue(args, i++));
                    break;

                case "--multiplier":
                    multiplier = parseLongFlag(args, i++);
                    break;

                case "--scale":
                    scale = parseLongFlag(args, i++);
                    break;

                case "--seed":
                    seed = parseLongFlag(args, i++);
                    break;

                case "--input":
                    inputText = requireValue(args, i++);
                    break;

                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_ARG_FORMAT, arg));
            }
        }
    }

    /**
     * Returns the value following the flag at index {@code i}.
     */
    private String requireValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(String.format(MISSING_VALUE_FORMAT, args[i]));
        }
        return args[i + 1];
    }

    private int parseIntFlag(String[] args, int i) {
        String value = requireValue(args, i);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_NUMBER_FORMAT, args[i], value));
        }
    }

    private long parseLongFlag(String[] args, int i) {
        String value = requireValue(args, i);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_NUMBER_FORMAT, args[i], value));
        }
    }

    /**
     * Parses {@code a=1,b=2} into an ordered symbol-value map.
     */
    private Map<String, Long> parseAlphabet(String spec) {
        Map<String, Long> parsed = new LinkedHashMap<>();
        for (String entry : spec.split(",")) {
            int eq = entry.lastIndexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new IllegalArgumentException(String.format(INVALID_ALPHABET_FORMAT, entry));
            }
            try {
                parsed.put(entry.substring(0, eq), Long.parseLong(entry.substring(eq + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format(INVALID_ALPHABET_FORMAT, entry));
            }
        }
        return parsed;
    }
}
