package domain.model;

import domain.hash.PolynomialFoldHash;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class InversionRequestTest {

    private static final List<String> SYMBOLS = List.of("a", "b");
    private static final StateTransition<Long> REVERSE = (s, t) -> t - 1;
    private static final StateTransition<Long> CHECK = (s, t) -> t - 1;
    private static final Predicate<Long> ACCEPT = t -> true;

    @Test
    void capturesValidInput() {
        InversionRequest<Long> request = new InversionRequest<>(SYMBOLS, REVERSE, CHECK, ACCEPT, 5L, 0L, 3);
        assertEquals(SYMBOLS, request.getSymbols());
        assertSame(REVERSE, request.getReverseFunction());
        assertSame(CHECK, request.getCheckFunction());
        assertSame(ACCEPT, request.getAcceptanceFunction());
        assertEquals(5L, request.getTerminalState());
        assertEquals(0L, request.getInitialState());
        assertEquals(3, request.getMaxStringLength());
    }

    @Test
    void copiesTheAlphabet() {
        List<String> symbols = new ArrayList<>(SYMBOLS);
        InversionRequest<Long> request = new InversionRequest<>(symbols, REVERSE, CHECK, ACCEPT, 5L, 0L, 3);
        symbols.add("c");
        assertEquals(List.of("a", "b"), request.getSymbols());
        assertThrows(UnsupportedOperationException.class, () -> request.getSymbols().add("d"));
    }

    @Test
    void rejectsNullOrEmptyAlphabet() {
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(null, REVERSE, CHECK, ACCEPT, 5L, 0L, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(Collections.emptyList(), REVERSE, CHECK, ACCEPT, 5L, 0L, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(Arrays.asList("a", null), REVERSE, CHECK, ACCEPT, 5L, 0L, 3));
    }

    @Test
    void rejectsMissingCallbacks() {
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, null, CHECK, ACCEPT, 5L, 0L, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, REVERSE, null, ACCEPT, 5L, 0L, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, REVERSE, CHECK, null, 5L, 0L, 3));
    }

    @Test
    void rejectsDefaultTerminalState() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, REVERSE, CHECK, ACCEPT, 0L, 0L, 3));
        assertTrue(e.getMessage().startsWith("terminalState"));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<Long>(SYMBOLS, REVERSE, CHECK, ACCEPT, null, 0L, 3));
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, REVERSE, CHECK, ACCEPT, 5L, 0L, 0));
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<>(SYMBOLS, REVERSE, CHECK, ACCEPT, 5L, 0L, -1));
    }

    @Test
    void rejectsNullInitialState() {
        assertThrows(IllegalArgumentException.class,
            () -> new InversionRequest<Long>(SYMBOLS, REVERSE, CHECK, ACCEPT, 5L, null, 3));
    }

    @Test
    void adaptsStrategyObject() {
        PolynomialFoldHash hash = PolynomialFoldHash.defaults();
        InversionRequest<Long> request = InversionRequest.of(hash.getSymbols(), hash, 1205L, 0L, 3);
        assertEquals(80L, request.getReverseFunction().apply("a", 1205L));
        assertEquals(240L, request.getCheckFunction().apply("a", 1205L));
        assertTrue(request.getAcceptanceFunction().test(240L));
        assertThrows(IllegalArgumentException.class,
            () -> InversionRequest.of(hash.getSymbols(), null, 1205L, 0L, 3));
    }
}
