package org.mbasiconjava.runtime.runtimetypes;

import java.util.Locale;
import java.util.Objects;

/**
 * An immutable runtime value: a 16-bit integer, a single or double float,
 * or a string.
 * <p>
 * Numeric payloads are held as a double. SINGLE values are rounded through
 * {@code float} on construction so they keep single precision, INTEGER values
 * are always whole numbers in the 16-bit range.
 * <p>
 * Conversions follow the legacy rules:
 * <ul>
 *   <li>to integer: round half to even, saturating at -32768 and 32767</li>
 *   <li>to string: leading space for non-negative numbers, trailing space always</li>
 *   <li>to boolean: zero and the empty string are false</li>
 * </ul>
 */
public final class BasicValue {
    public static final BasicValue ZERO = new BasicValue(VarType.INTEGER, 0, null);
    public static final BasicValue TRUE = new BasicValue(VarType.INTEGER, -1, null);
    public static final BasicValue EMPTY_STRING = new BasicValue(VarType.STRING, 0, "");

    private static final double ABSOLUTE_EPSILON = 1e-9;
    private static final double RELATIVE_EPSILON = 1e-6;

    private final VarType type;
    private final double number;
    private final String string;

    private BasicValue(VarType type, double number, String string) {
        this.type = type;
        this.number = number;
        this.string = string;
    }

    public static BasicValue ofInteger(int value) {
        return new BasicValue(VarType.INTEGER, (short) value, null);
    }

    public static BasicValue ofSingle(double value) {
        return new BasicValue(VarType.SINGLE, (float) value, null);
    }

    public static BasicValue ofDouble(double value) {
        return new BasicValue(VarType.DOUBLE, value, null);
    }

    public static BasicValue ofString(String value) {
        return new BasicValue(VarType.STRING, 0, Objects.requireNonNull(value));
    }

    public static BasicValue ofBoolean(boolean value) {
        return value ? TRUE : ZERO;
    }

    /**
     * Returns the value an unset variable of the given type reads as.
     */
    public static BasicValue defaultFor(VarType type) {
        return switch (type) {
            case INTEGER -> ZERO;
            case SINGLE -> ofSingle(0);
            case DOUBLE -> ofDouble(0);
            case STRING -> EMPTY_STRING;
        };
    }

    /**
     * Tolerant float equality: exact match, or a difference no larger than
     * the greater of 1e-9 and 1e-6 times the larger magnitude.
     */
    public static boolean floatEquals(double a, double b) {
        if (a == b) {
            return true;
        }
        double diff = Math.abs(a - b);
        double larger = Math.max(Math.abs(a), Math.abs(b));
        return diff <= Math.max(ABSOLUTE_EPSILON, larger * RELATIVE_EPSILON);
    }

    /**
     * Three-way comparison using {@link #floatEquals(double, double)} for the
     * equal case.
     */
    public static int compareNumbers(double a, double b) {
        if (floatEquals(a, b)) {
            return 0;
        }
        return a < b ? -1 : 1;
    }

    /**
     * Formats a number the way PRINT shows it, including the sign column and
     * the trailing space.
     */
    public static String formatNumber(double d) {
        return (d >= 0 ? " " : "") + formatNumberBody(d) + " ";
    }

    /**
     * Formats a number without the sign column or trailing space.
     * Whole values below 1e10 print as integers; everything else uses six
     * fixed decimals with trailing zeros removed.
     */
    public static String formatNumberBody(double d) {
        if (d == Math.floor(d) && Math.abs(d) < 1e10) {
            return Long.toString((long) d);
        }
        String s = String.format(Locale.ROOT, "%f", d);
        if (s.indexOf('.') >= 0) {
            int end = s.length();
            while (end > 0 && s.charAt(end - 1) == '0') {
                end--;
            }
            if (end > 0 && s.charAt(end - 1) == '.') {
                end--;
            }
            s = s.substring(0, end);
        }
        return s;
    }

    public VarType type() {
        return type;
    }

    public boolean isNumeric() {
        return type != VarType.STRING;
    }

    public boolean isString() {
        return type == VarType.STRING;
    }

    public double toNumber() {
        return type == VarType.STRING ? 0.0 : number;
    }

    /**
     * Converts to a 16-bit integer with banker's rounding, saturating at the
     * range limits.
     */
    public int toInteger() {
        double d = toNumber();
        if (d >= 32767.5) {
            return 32767;
        }
        if (d <= -32768.5) {
            return -32768;
        }
        return (int) Math.rint(d);
    }

    public String toBasicString() {
        return switch (type) {
            case STRING -> string;
            case INTEGER -> formatNumber((int) number);
            case SINGLE, DOUBLE -> formatNumber(number);
        };
    }

    public boolean toBoolean() {
        return type == VarType.STRING ? !string.isEmpty() : number != 0;
    }

    /**
     * Raw string payload; the empty string for numeric values.
     */
    public String getString() {
        return type == VarType.STRING ? string : "";
    }

    /**
     * Coerces to the target type. Numeric types widen or narrow; a numeric
     * value coerced to STRING becomes the empty string.
     */
    public BasicValue coerceTo(VarType target) {
        if (type == target) {
            return this;
        }
        return switch (target) {
            case INTEGER -> ofInteger(toInteger());
            case SINGLE -> ofSingle(toNumber());
            case DOUBLE -> ofDouble(toNumber());
            case STRING -> EMPTY_STRING;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BasicValue other)) {
            return false;
        }
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(string, other.string);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, string);
    }

    @Override
    public String toString() {
        return toBasicString();
    }
}
