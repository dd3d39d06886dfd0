package infrastructure.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ValidationUtilsTest {

    @Test
    void validatePositiveRejectsZeroAndNegative() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ValidationUtils.validatePositive(0, "maxStringLength"));
        assertEquals("maxStringLength must be positive, got: 0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.validatePositive(-3L, "scale"));
        assertDoesNotThrow(() -> ValidationUtils.validatePositive(1, "k"));
    }

    @Test
    void validateNotEmptyRejectsNullAndEmpty() {
        assertEquals("symbols cannot be null",
            assertThrows(IllegalArgumentException.class,
                () -> ValidationUtils.validateNotEmpty(null, "symbols")).getMessage());
        assertEquals("symbols cannot be empty",
            assertThrows(IllegalArgumentException.class,
                () -> ValidationUtils.validateNotEmpty(Collections.emptyList(), "symbols")).getMessage());
        assertDoesNotThrow(() -> ValidationUtils.validateNotEmpty(List.of("a"), "symbols"));
    }

    @Test
    void recognisesDefaultValues() {
        assertTrue(ValidationUtils.isDefaultValue(null));
        assertTrue(ValidationUtils.isDefaultValue(0));
        assertTrue(ValidationUtils.isDefaultValue(0L));
        assertTrue(ValidationUtils.isDefaultValue((short) 0));
        assertTrue(ValidationUtils.isDefaultValue(0.0));
        assertTrue(ValidationUtils.isDefaultValue(0.0f));
        assertTrue(ValidationUtils.isDefaultValue(BigInteger.ZERO));
        assertTrue(ValidationUtils.isDefaultValue(new BigDecimal("0.000")));
        assertTrue(ValidationUtils.isDefaultValue(new AtomicLong()));
        assertTrue(ValidationUtils.isDefaultValue(false));
        assertTrue(ValidationUtils.isDefaultValue('\0'));
    }

    @Test
    void nonDefaultValuesPass() {
        assertFalse(ValidationUtils.isDefaultValue(1205L));
        assertFalse(ValidationUtils.isDefaultValue(-1));
        assertFalse(ValidationUtils.isDefaultValue(BigInteger.TEN));
        assertFalse(ValidationUtils.isDefaultValue(0.5));
        assertFalse(ValidationUtils.isDefaultValue(true));
        assertFalse(ValidationUtils.isDefaultValue('a'));
        assertFalse(ValidationUtils.isDefaultValue(""));
        assertDoesNotThrow(() -> ValidationUtils.validateNotDefault(7L, "terminalState"));
    }

    @Test
    void callerDefinedNumbersAreNeverDefaults() {
        Number customZero = new Number() {
            @Override public int intValue() { return 0; }
            @Override public long longValue() { return 0L; }
            @Override public float floatValue() { return 0f; }
            @Override public double doubleValue() { return 0.0; }
        };
        assertFalse(ValidationUtils.isDefaultValue(customZero));
        assertTrue(ValidationUtils.isDefaultValue((byte) 0));
        assertTrue(ValidationUtils.isDefaultValue(new AtomicInteger()));
    }

    @Test
    void validateNotDefaultNamesTheParameter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ValidationUtils.validateNotDefault(0L, "terminalState"));
        assertEquals("terminalState cannot be the default value, got: 0", e.getMessage());
    }
}
