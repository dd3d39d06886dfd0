package cli;

import application.ReverserConfiguration;
import domain.hash.PolynomialFoldHash;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentParserTest {

    private static ArgumentParser parse(String... args) {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);
        return parser;
    }

    @Test
    void parsesPositionalArgumentsWithDefaults() {
        ArgumentParser parser = parse("1205", "3");

        assertEquals(1205L, parser.getTerminalState());
        assertEquals(3, parser.getMaxLength());
        assertFalse(parser.isDebugMode());
        assertFalse(parser.isNoParallel());
        assertNull(parser.getOutputFile());

        PolynomialFoldHash hash = parser.buildHash();
        assertEquals(1205L, hash.hash("aaa"));
        assertEquals(1205L, parser.resolveTerminalState(hash));
        assertEquals(ReverserConfiguration.ExpansionStrategy.PARALLEL,
            parser.buildConfiguration().getExpansionStrategy());
    }

    @Test
    void parsesOptionalFlags() {
        ArgumentParser parser = parse("-", "4",
            "--debug", "--no-parallel", "-o", "out.txt",
            "--alphabet", "x=1,yz=4", "--multiplier", "2", "--scale", "1", "--seed", "1",
            "--input", "xyz", "--parallelism", "3");

        assertNull(parser.getTerminalState());
        assertTrue(parser.isDebugMode());
        assertTrue(parser.isNoParallel());
        assertEquals("out.txt", parser.getOutputFile());
        assertEquals(2L, parser.getMultiplier());
        assertEquals(1L, parser.getScale());
        assertEquals(1L, parser.getSeed());
        assertEquals("xyz", parser.getInputText());
        assertEquals(4L, parser.getAlphabet().get("yz"));

        PolynomialFoldHash hash = parser.buildHash();
        // seed 1: (1 * 2 + 1) = 3, then (3 * 2 + 4) = 10
        assertEquals(10L, parser.resolveTerminalState(hash));

        ReverserConfiguration config = parser.buildConfiguration();
        assertEquals(ReverserConfiguration.ExpansionStrategy.SEQUENTIAL, config.getExpansionStrategy());
        assertEquals(3, config.getParallelism());
        assertTrue(config.isDebugMode());
    }

    @Test
    void helpNeedsNoOtherArguments() {
        assertTrue(parse("--help").isHelpRequested());
        assertTrue(parse("-h").isHelpRequested());
    }

    @Test
    void rejectsMissingOrMalformedArguments() {
        assertThrows(IllegalArgumentException.class, () -> parse("1205"));
        assertThrows(IllegalArgumentException.class, () -> parse("abc", "3"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "0"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "x"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--scale"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--scale", "five"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--alphabet", "a1"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--bogus"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--parallelism", "4294967297"));
    }

    @Test
    void requiresExactlyOneTerminalSource() {
        assertThrows(IllegalArgumentException.class, () -> parse("-", "3"));
        assertThrows(IllegalArgumentException.class, () -> parse("1205", "3", "--input", "aaa"));
    }
}
