package infrastructure.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Input validation utilities used at system boundaries (public entry point,
 * configuration building, CLI argument parsing).
 *
 * <p>All methods throw {@link IllegalArgumentException} with a descriptive message
 * on invalid input so callers can propagate or display the reason to the user.
 * Internal invariants (search logic) are protected by assertions, not these methods.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Prevent instantiation — static methods only
    }

    /**
     * Validates that an integer value is strictly positive (greater than zero).
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value <= 0}
     */
    public static void validatePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                paramName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a long value is strictly positive (greater than zero).
     *
     * @param value     the long value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value <= 0}
     */
    public static void validatePositive(long value, String paramName) {
        if (value <= 0L) {
            throw new IllegalArgumentException(
                paramName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a long value is zero or greater.
     *
     * @param value     the long value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < 0}
     */
    public static void validateNonNegative(long value, String paramName) {
        if (value < 0L) {
            throw new IllegalArgumentException(
                paramName + " must be non-negative, got: " + value);
        }
    }

    /**
     * Validates that a reference is set.
     *
     * @param value     the reference to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value == null}
     */
    public static void validateNotNull(Object value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " cannot be null");
        }
    }

    /**
     * Validates that a collection is set and holds at least one element.
     *
     * @param values    the collection to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code values} is null or empty
     */
    public static void validateNotEmpty(Collection<?> values, String paramName) {
        validateNotNull(values, paramName);
        if (values.isEmpty()) {
            throw new IllegalArgumentException(paramName + " cannot be empty");
        }
    }

    /**
     * Validates that a value is not the default value of its type.
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@link #isDefaultValue(Object)} holds
     * @see #isDefaultValue(Object)
     */
    public static void validateNotDefault(Object value, String paramName) {
        if (isDefaultValue(value)) {
            throw new IllegalArgumentException(
                paramName + " cannot be the default value, got: " + value);
        }
    }

    /**
     * Returns {@code true} if {@code value} is what an unset field of its type would hold.
     *
     * <p>Recognised defaults:
     * <ul>
     *   <li>{@code null} for every reference type</li>
     *   <li>numeric zero for the JDK {@link Number} types
     *       ({@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code Float},
     *       {@code Double}, {@link BigInteger}, {@link BigDecimal}, {@link AtomicInteger} and
     *       {@link AtomicLong})</li>
     *   <li>{@code Boolean.FALSE}</li>
     *   <li>{@code '\0'}</li>
     * </ul>
     * Any other value (including caller-defined state types) is never a default.
     *
     * @param value the value to inspect
     * @return {@code true} if the value is a recognised default
     */
    public static boolean isDefaultValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() == 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue() == 0.0;
        }
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return ((Number) value).longValue() == 0L;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Character) {
            return (Character) value == '\0';
        }
        return false;
    }
}
