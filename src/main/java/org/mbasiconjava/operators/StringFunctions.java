package org.mbasiconjava.operators;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.mbasiconjava.operators.BuiltinFunctions.integer;
import static org.mbasiconjava.operators.BuiltinFunctions.integerInRange;
import static org.mbasiconjava.operators.BuiltinFunctions.number;
import static org.mbasiconjava.operators.BuiltinFunctions.register;
import static org.mbasiconjava.operators.BuiltinFunctions.string;

/**
 * String built-ins and the number/text conversions they share with INPUT.
 */
public final class StringFunctions {
    private static final Pattern DECIMAL_PREFIX =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?");
    private static final Pattern DECIMAL_FULL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?[%!#]?");

    private StringFunctions() {
    }

    static void registerAll() {
        register("asc", 1, 1, StringFunctions::asc);
        register("chr$", 1, 1, (ctx, args) ->
                BasicValue.ofString(String.valueOf((char) integerInRange(args, 0, 0, 255))));
        register("hex$", 1, 1, (ctx, args) ->
                BasicValue.ofString(Integer.toHexString(integer(args, 0) & 0xFFFF).toUpperCase(Locale.ROOT)));
        register("oct$", 1, 1, (ctx, args) ->
                BasicValue.ofString(Integer.toOctalString(integer(args, 0) & 0xFFFF)));
        register("left$", 2, 2, StringFunctions::left);
        register("right$", 2, 2, StringFunctions::right);
        register("mid$", 2, 3, StringFunctions::mid);
        register("len", 1, 1, (ctx, args) -> BasicValue.ofInteger(string(args, 0).length()));
        register("str$", 1, 1, (ctx, args) -> BasicValue.ofString(strText(number(args, 0))));
        register("val", 1, 1, (ctx, args) -> BasicValue.ofDouble(parseValue(string(args, 0))));
        register("space$", 1, 1, (ctx, args) -> BasicValue.ofString(" ".repeat(repeatCount(args, 0))));
        register("string$", 2, 2, StringFunctions::stringOf);
        register("instr", 2, 3, StringFunctions::instr);
    }

    /**
     * STR$ text: the PRINT form of the number without the trailing space.
     */
    public static String strText(double value) {
        return (value >= 0 ? " " : "") + BasicValue.formatNumberBody(value);
    }

    /**
     * VAL semantics: blanks are ignored, the longest numeric prefix is used
     * and anything unparseable is zero. {@code &H} and {@code &O} prefixes
     * select hex and octal.
     */
    public static double parseValue(String text) {
        String s = text.replaceAll("[ \\t\\n]", "");
        if (s.length() > 1 && s.charAt(0) == '&') {
            return parseRadix(s);
        }
        Matcher m = DECIMAL_PREFIX.matcher(s);
        if (!m.find()) {
            return 0;
        }
        return parseDecimal(m.group());
    }

    /**
     * Parses a whole INPUT item as a number; null when the text is not
     * entirely numeric. An empty item is zero.
     */
    public static Double parseNumericItem(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return 0.0;
        }
        if (s.charAt(0) == '&') {
            return s.length() > 1 ? parseRadix(s) : null;
        }
        if (!DECIMAL_FULL.matcher(s).matches()) {
            return null;
        }
        char last = s.charAt(s.length() - 1);
        if (last == '%' || last == '!' || last == '#') {
            s = s.substring(0, s.length() - 1);
        }
        return parseDecimal(s);
    }

    /**
     * Decimal text with an optional E or D exponent; a magnitude beyond
     * double range is an overflow.
     */
    private static double parseDecimal(String text) {
        double value = Double.parseDouble(text.replace('d', 'e').replace('D', 'E'));
        if (Double.isInfinite(value)) {
            throw new BasicRuntimeException(ErrorCode.OVERFLOW, text);
        }
        return value;
    }

    private static double parseRadix(String s) {
        int radix = 8;
        int start = 1;
        char marker = Character.toUpperCase(s.charAt(1));
        if (marker == 'H') {
            radix = 16;
            start = 2;
        } else if (marker == 'O') {
            start = 2;
        }
        int value = 0;
        for (int i = start; i < s.length(); i++) {
            int digit = Character.digit(s.charAt(i), radix);
            if (digit < 0) {
                break;
            }
            value = value * radix + digit;
            if (value > 0xFFFF) {
                throw new BasicRuntimeException(ErrorCode.OVERFLOW, s);
            }
        }
        return (short) value;
    }

    private static BasicValue asc(BuiltinContext ctx, List<BasicValue> args) {
        String s = string(args, 0);
        if (s.isEmpty()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "ASC of empty string");
        }
        return BasicValue.ofInteger(s.charAt(0) & 0xFF);
    }

    private static BasicValue left(BuiltinContext ctx, List<BasicValue> args) {
        String s = string(args, 0);
        int n = integerInRange(args, 1, 0, Configuration.maxStringLength);
        return BasicValue.ofString(s.substring(0, Math.min(n, s.length())));
    }

    private static BasicValue right(BuiltinContext ctx, List<BasicValue> args) {
        String s = string(args, 0);
        int n = integerInRange(args, 1, 0, Configuration.maxStringLength);
        return BasicValue.ofString(s.substring(Math.max(0, s.length() - n)));
    }

    private static BasicValue mid(BuiltinContext ctx, List<BasicValue> args) {
        String s = string(args, 0);
        int start = integerInRange(args, 1, 1, Configuration.maxStringLength);
        int length = args.size() > 2
                ? integerInRange(args, 2, 0, Configuration.maxStringLength)
                : Configuration.maxStringLength;
        if (start > s.length()) {
            return BasicValue.EMPTY_STRING;
        }
        int end = (int) Math.min((long) start - 1 + length, s.length());
        return BasicValue.ofString(s.substring(start - 1, end));
    }

    private static int repeatCount(List<BasicValue> args, int index) {
        int n = integer(args, index);
        if (n < 0) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "negative count");
        }
        if (n > Configuration.maxStringLength) {
            throw new BasicRuntimeException(ErrorCode.STRING_TOO_LONG);
        }
        return n;
    }

    private static BasicValue stringOf(BuiltinContext ctx, List<BasicValue> args) {
        int n = repeatCount(args, 0);
        char c;
        if (args.get(1).isString()) {
            String s = args.get(1).getString();
            if (s.isEmpty()) {
                throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "STRING$ of empty string");
            }
            c = s.charAt(0);
        } else {
            c = (char) integerInRange(args, 1, 0, 255);
        }
        return BasicValue.ofString(String.valueOf(c).repeat(n));
    }

    /**
     * INSTR([start,] haystack, needle): 1-based position or 0.
     */
    private static BasicValue instr(BuiltinContext ctx, List<BasicValue> args) {
        int start = 1;
        int first = 0;
        if (args.size() == 3) {
            start = integerInRange(args, 0, 1, Configuration.maxStringLength);
            first = 1;
        }
        String haystack = string(args, first);
        String needle = string(args, first + 1);
        if (start > haystack.length()) {
            return BasicValue.ZERO;
        }
        if (needle.isEmpty()) {
            return BasicValue.ofInteger(start);
        }
        return BasicValue.ofInteger(haystack.indexOf(needle, start - 1) + 1);
    }
}
