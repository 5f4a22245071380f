package io.xmldecl.core.engine;

import io.xmldecl.core.model.PrimitiveType;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts between markup text and typed scalar values.
 *
 * <ul>
 * <li>{@code BOOLEAN}: {@code true}/{@code 1}/{@code yes} and {@code false}/{@code 0}/{@code no},
 * case-insensitive; written as {@code true}/{@code false}
 * <li>{@code INTEGER}: optional sign and base-10 digits fitting a 32-bit {@code int}
 * <li>{@code FLOAT}: optional sign, digits, optional fraction and exponent; no {@code NaN},
 * {@code Infinity}, hex or type suffixes
 * <li>{@code STRING}: identity, optionally trimmed; the empty string is a present value
 * </ul>
 *
 * <p>Surrounding whitespace is ignored for non-string types.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class PrimitiveCodec {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no");

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private PrimitiveCodec() {}

    /**
     * Parses raw markup text.
     *
     * @param text            the attribute value or element text, never null
     * @param type            the declared type
     * @param stripWhitespace trim strings before returning them
     * @return a {@link Boolean}, {@link Integer}, {@link Double} or {@link String}
     * @throws IllegalArgumentException if the text is not a valid value of {@code type}
     */
    public static Object parse(String text, PrimitiveType type, boolean stripWhitespace) {
        return switch (type) {
            case BOOLEAN -> parseBoolean(text);
            case INTEGER -> parseInteger(text);
            case FLOAT -> parseFloat(text);
            case STRING -> stripWhitespace ? text.strip() : text;
        };
    }

    /**
     * Formats a value for markup.
     *
     * @throws IllegalArgumentException if {@code value} is not of a Java type matching {@code type},
     *     or is a value {@link #parse} would reject: a non-finite float or an integer outside
     *     {@code int} range
     */
    public static String serialize(Object value, PrimitiveType type) {
        boolean accepted = switch (type) {
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte
                    || value instanceof BigInteger;
            case FLOAT -> value instanceof Number;
            case STRING -> value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>;
        };
        if (!accepted) {
            throw new IllegalArgumentException("Invalid " + type.id() + " value: " + describe(value));
        }
        if (type == PrimitiveType.FLOAT) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                throw new IllegalArgumentException("Invalid float value: " + describe(value) + " is not finite");
            }
            return Double.toString(number);
        }
        if (type == PrimitiveType.INTEGER && !fitsInt((Number) value)) {
            throw new IllegalArgumentException("Integer value out of range: " + describe(value));
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value.toString();
    }

    private static boolean fitsInt(Number value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < Integer.SIZE;
        }
        long number = value.longValue();
        return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE;
    }

    private static Boolean parseBoolean(String text) {
        String token = text.strip().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Invalid boolean value: \"" + text + "\"");
    }

    private static Integer parseInteger(String text) {
        String token = text.strip();
        if (!INTEGER_PATTERN.matcher(token).matches()) {
            throw new IllegalArgumentException("Invalid integer value: \"" + text + "\"");
        }
        try {
            return Integer.valueOf(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Integer value out of range: \"" + text + "\"", e);
        }
    }

    private static Double parseFloat(String text) {
        String token = text.strip();
        if (!FLOAT_PATTERN.matcher(token).matches()) {
            throw new IllegalArgumentException("Invalid float value: \"" + text + "\"");
        }
        return Double.valueOf(token);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
