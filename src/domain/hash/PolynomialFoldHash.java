package domain.hash;

import domain.model.ReversibleHash;
import infrastructure.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A toy fold hash together with its reverse.
 *
 * <pre>
 *   h(s) = fold(s, seed, (acc, sym) -&gt; (acc * multiplier + value(sym)) * scale)
 * </pre>
 *
 * <p>With the {@linkplain #defaults() default parameters} ({@code a = 1}, {@code b = 2},
 * multiplier 3, scale 5, seed 0), {@code h("aaa") = 1205}.
 *
 * <h3>Reverse step</h3>
 * Undoing {@code sym} from state {@code t}:
 * <ul>
 *   <li>check: {@code t / scale - value(sym)}, or {@code -1} when {@code t} is not a
 *       multiple of {@code scale}</li>
 *   <li>accept: {@code check % multiplier == 0} and {@code check / multiplier >= seed}</li>
 *   <li>reverse: {@code (t / scale - value(sym)) / multiplier}</li>
 * </ul>
 * Positive parameters make every forward step strictly increase the state, so the reverse
 * walk decreases monotonically toward the seed under {@code Long}'s natural order.
 *
 * <p>Arithmetic is plain {@code long}; inputs long enough to overflow are not supported.
 */
public final class PolynomialFoldHash implements ReversibleHash<Long> {

    private final Map<String, Long> symbolValues;
    private final long multiplier;
    private final long scale;
    private final long seed;

    /**
     * Constructs a fold hash.
     *
     * @param symbolValues alphabet with the value each symbol contributes, in alphabet order
     * @param multiplier   factor applied to the accumulator before adding a symbol value
     * @param scale        factor applied after adding a symbol value
     * @param seed         initial accumulator value
     * @throws IllegalArgumentException if the alphabet is empty or any factor or value is not positive,
     *                                  or the seed is negative
     */
    public PolynomialFoldHash(Map<String, Long> symbolValues, long multiplier, long scale, long seed) {
        ValidationUtils.validateNotNull(symbolValues, "symbolValues");
        ValidationUtils.validateNotEmpty(symbolValues.keySet(), "symbolValues");
        for (Map.Entry<String, Long> entry : symbolValues.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("symbols cannot be null or empty");
            }
            ValidationUtils.validateNotNull(entry.getValue(), "value of '" + entry.getKey() + "'");
            ValidationUtils.validatePositive(entry.getValue(), "value of '" + entry.getKey() + "'");
        }
        ValidationUtils.validatePositive(multiplier, "multiplier");
        ValidationUtils.validatePositive(scale, "scale");
        ValidationUtils.validateNonNegative(seed, "seed");

        this.symbolValues = Collections.unmodifiableMap(new LinkedHashMap<>(symbolValues));
        this.multiplier = multiplier;
        this.scale = scale;
        this.seed = seed;
    }

    /**
     * Returns the hash {@code (acc * 3 + (a = 1, b = 2)) * 5} seeded with 0.
     *
     * @return the default fold hash
     */
    public static PolynomialFoldHash defaults() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("a", 1L);
        values.put("b", 2L);
        return new PolynomialFoldHash(values, 3L, 5L, 0L);
    }

    // =========================================================================
    // Forward hash
    // =========================================================================

    /**
     * Hashes a sequence of symbols.
     *
     * @param tokens symbols in consumption order
     * @return the terminal state
     * @throws IllegalArgumentException if a token is not in the alphabet
     */
    public long hashTokens(List<String> tokens) {
        long acc = seed;
        for (String token : tokens) {
            acc = (acc * multiplier + valueOf(token)) * scale;
        }
        return acc;
    }

    /**
     * Hashes a string, splitting it into symbols by greedy longest match.
     *
     * @param input text made of alphabet symbols
     * @return the terminal state
     * @throws IllegalArgumentException if {@code input} cannot be split into symbols
     */
    public long hash(String input) {
        return hashTokens(tokenize(input));
    }

    /**
     * Splits {@code input} into alphabet symbols, always taking the longest match.
     *
     * @param input text made of alphabet symbols
     * @return symbols in order
     * @throws IllegalArgumentException if some position matches no symbol
     */
    public List<String> tokenize(String input) {
        ValidationUtils.validateNotNull(input, "input");
        List<String> tokens = new ArrayList<>();
        int pos = 0;
        while (pos < input.length()) {
            String match = null;
            for (String symbol : symbolValues.keySet()) {
                if (input.startsWith(symbol, pos) && (match == null || symbol.length() > match.length())) {
                    match = symbol;
                }
            }
            if (match == null) {
                throw new IllegalArgumentException(
                    "No symbol matches '" + input + "' at position " + pos);
            }
            tokens.add(match);
            pos += match.length();
        }
        return tokens;
    }

    // =========================================================================
    // Reverse step
    // =========================================================================

    @Override
    public Long reverseStep(String symbol, Long state) {
        return (state / scale - valueOf(symbol)) / multiplier;
    }

    @Override
    public Long checkStep(String symbol, Long state) {
        if (state % scale != 0) {
            return -1L;
        }
        return state / scale - valueOf(symbol);
    }

    @Override
    public boolean acceptsCheckState(Long checkState) {
        return checkState % multiplier == 0 && checkState / multiplier >= seed;
    }

    private long valueOf(String symbol) {
        Long value = symbolValues.get(symbol);
        if (value == null) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return value;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public List<String> getSymbols() { return new ArrayList<>(symbolValues.keySet()); }
    public Map<String, Long> getSymbolValues() { return symbolValues; }
    public long getMultiplier() { return multiplier; }
    public long getScale() { return scale; }
    public long getSeed() { return seed; }
}
