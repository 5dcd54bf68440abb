package org.mbasiconjava.operators.using;

import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Renders values through a PRINT USING format string.
 * <p>
 * Fields consume values left to right. When the values run out, the
 * literal text before the next field is still written and formatting stops
 * there; values left over when the format ends are not written. A number
 * too wide for its field is written in full behind a {@code %}.
 */
public class UsingFormatter {

    /**
     * Formats the values, without a trailing newline.
     *
     * @throws BasicRuntimeException illegal function call for a format with
     *                               no fields, type mismatch for a value of
     *                               the wrong kind for its field
     */
    public static String format(String format, List<BasicValue> values) {
        UsingFormatParser.ParseResult parsed = UsingFormatParser.parse(format);
        if (!parsed.hasFields() && !values.isEmpty()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "no fields in USING format");
        }
        StringBuilder out = new StringBuilder();
        int next = 0;
        for (Object element : parsed.elements) {
            if (element instanceof String literal) {
                out.append(literal);
                continue;
            }
            if (next >= values.size()) {
                break;
            }
            UsingFieldSpecifier spec = (UsingFieldSpecifier) element;
            out.append(formatField(spec, values.get(next++)));
        }
        return out.toString();
    }

    public static String formatField(UsingFieldSpecifier spec, BasicValue value) {
        if (spec.isNumeric() != value.isNumeric()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "value does not match field " + spec.raw);
        }
        return switch (spec.kind) {
            case FIRST_CHARACTER -> value.getString().isEmpty() ? " " : value.getString().substring(0, 1);
            case WHOLE_STRING -> value.getString();
            case FIXED_STRING -> fit(value.getString(), spec.stringWidth);
            case NUMERIC -> spec.exponential
                    ? formatExponential(spec, value.toNumber())
                    : formatFixed(spec, value.toNumber());
        };
    }

    private static String fit(String s, int width) {
        if (s.length() >= width) {
            return s.substring(0, width);
        }
        return s + " ".repeat(width - s.length());
    }

    private static String formatFixed(UsingFieldSpecifier spec, double number) {
        boolean negative = number < 0;
        BigDecimal rounded = BigDecimal.valueOf(Math.abs(number))
                .setScale(spec.decimalPositions, RoundingMode.HALF_UP);
        if (negative && rounded.signum() == 0) {
            negative = false;
        }
        String digits = rounded.toPlainString();
        String integerPart = digits;
        String fraction = "";
        int dot = digits.indexOf('.');
        if (dot >= 0) {
            integerPart = digits.substring(0, dot);
            fraction = digits.substring(dot + 1);
        }
        if (spec.commas) {
            integerPart = groupThousands(integerPart);
        }

        String suffix = trailingSign(spec, negative);
        String prefix = signPrefix(spec, negative) + (spec.floatingDollar ? "$" : "");
        int width = spec.width();

        String body = integerPart + (spec.decimalPoint ? "." + fraction : "");
        if (integerPart.equals("0") && spec.decimalPoint
                && prefix.length() + body.length() + suffix.length() > width) {
            body = "." + fraction;
        }
        return pad(spec, prefix + body, suffix, width);
    }

    /**
     * Exponential form: the mantissa fills the digit positions left of the
     * point (one is kept for the sign when the field has no sign
     * character), followed by {@code E+dd}.
     */
    private static String formatExponential(UsingFieldSpecifier spec, double number) {
        boolean negative = number < 0;
        double magnitude = Math.abs(number);
        boolean signInDigits = !spec.leadingSign && spec.trailingSign == 0;
        int leading = Math.max(0, spec.digitPositions - (signInDigits ? 1 : 0));
        if (leading == 0 && spec.decimalPositions == 0) {
            leading = 1;
        }

        int exponent = 0;
        BigDecimal mantissa = BigDecimal.ZERO.setScale(spec.decimalPositions);
        if (magnitude != 0) {
            exponent = (int) Math.floor(Math.log10(magnitude)) - (leading - 1);
            mantissa = scaled(magnitude, exponent, spec.decimalPositions);
            BigDecimal limit = BigDecimal.TEN.pow(Math.max(leading, 0));
            if (mantissa.compareTo(limit) >= 0) {
                exponent++;
                mantissa = scaled(magnitude, exponent, spec.decimalPositions);
            }
        } else {
            negative = false;
        }

        String body = mantissa.toPlainString();
        if (leading == 0 && body.startsWith("0")) {
            body = body.substring(1);
        }
        if (!spec.decimalPoint && body.indexOf('.') >= 0) {
            body = body.substring(0, body.indexOf('.'));
        }
        String exponentText = "E" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
        String suffix = exponentText + trailingSign(spec, negative);
        return pad(spec, signPrefix(spec, negative) + body, suffix, spec.width());
    }

    private static BigDecimal scaled(double magnitude, int exponent, int decimals) {
        return BigDecimal.valueOf(magnitude)
                .movePointLeft(exponent)
                .setScale(decimals, RoundingMode.HALF_UP);
    }

    private static String signPrefix(UsingFieldSpecifier spec, boolean negative) {
        if (spec.leadingSign) {
            return negative ? "-" : "+";
        }
        if (spec.trailingSign != 0) {
            return "";
        }
        return negative ? "-" : "";
    }

    private static String trailingSign(UsingFieldSpecifier spec, boolean negative) {
        return switch (spec.trailingSign) {
            case '-' -> negative ? "-" : " ";
            case '+' -> negative ? "-" : "+";
            default -> "";
        };
    }

    private static String pad(UsingFieldSpecifier spec, String body, String suffix, int width) {
        int room = width - suffix.length();
        if (body.length() > room) {
            return "%" + body + suffix;
        }
        char fill = spec.asteriskFill ? '*' : ' ';
        return String.valueOf(fill).repeat(room - body.length()) + body + suffix;
    }

    private static String groupThousands(String digits) {
        StringBuilder sb = new StringBuilder();
        int count = 0;
        for (int i = digits.length() - 1; i >= 0; i--) {
            sb.append(digits.charAt(i));
            if (++count % 3 == 0 && i > 0) {
                sb.append(',');
            }
        }
        return sb.reverse().toString();
    }
}
