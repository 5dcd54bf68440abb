package org.mbasiconjava.operators;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.frontend.astnode.Operator;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

/**
 * Binary and unary operators over {@link BasicValue}.
 * <p>
 * Arithmetic yields DOUBLE, relational operators yield INTEGER -1 or 0, and
 * the integer operators round their operands to 16 bits first. Strings
 * only take part in concatenation and comparison with other strings.
 */
public final class NumericOperators {

    private NumericOperators() {
    }

    public static BasicValue binary(Operator op, BasicValue left, BasicValue right) {
        if (op == Operator.CONCAT || (op == Operator.ADD && (left.isString() || right.isString()))) {
            return concat(left, right);
        }
        if (op.isRelational()) {
            return compare(op, left, right);
        }
        if (left.isString() || right.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "string operand for " + op.symbol());
        }
        double a = left.toNumber();
        double b = right.toNumber();
        return switch (op) {
            case ADD -> checked(a + b);
            case SUBTRACT -> checked(a - b);
            case MULTIPLY -> checked(a * b);
            case DIVIDE -> {
                if (b == 0) {
                    throw new BasicRuntimeException(ErrorCode.DIVISION_BY_ZERO);
                }
                yield checked(a / b);
            }
            case POWER -> power(a, b);
            case INT_DIVIDE -> {
                int divisor = right.toInteger();
                if (divisor == 0) {
                    throw new BasicRuntimeException(ErrorCode.DIVISION_BY_ZERO);
                }
                yield integerResult(left.toInteger() / divisor);
            }
            case MOD -> {
                int divisor = right.toInteger();
                if (divisor == 0) {
                    throw new BasicRuntimeException(ErrorCode.DIVISION_BY_ZERO);
                }
                yield integerResult(left.toInteger() % divisor);
            }
            case AND -> BasicValue.ofInteger(left.toInteger() & right.toInteger());
            case OR -> BasicValue.ofInteger(left.toInteger() | right.toInteger());
            case XOR -> BasicValue.ofInteger(left.toInteger() ^ right.toInteger());
            case EQV -> BasicValue.ofInteger(~(left.toInteger() ^ right.toInteger()));
            case IMP -> BasicValue.ofInteger(~left.toInteger() | right.toInteger());
            default -> throw new BasicRuntimeException(ErrorCode.SYNTAX_ERROR, "not a binary operator: " + op);
        };
    }

    public static BasicValue unary(Operator op, BasicValue operand) {
        if (operand.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "string operand for " + op.symbol());
        }
        return switch (op) {
            case NEGATE -> operand.type() == VarType.INTEGER
                    && operand.toInteger() != -32768
                    ? BasicValue.ofInteger(-operand.toInteger())
                    : BasicValue.ofDouble(-operand.toNumber());
            case PLUS -> operand;
            case NOT -> BasicValue.ofInteger(~operand.toInteger());
            default -> throw new BasicRuntimeException(ErrorCode.SYNTAX_ERROR, "not a unary operator: " + op);
        };
    }

    private static BasicValue concat(BasicValue left, BasicValue right) {
        if (!left.isString() || !right.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "concatenation needs strings");
        }
        String result = left.getString() + right.getString();
        if (result.length() > Configuration.maxStringLength) {
            throw new BasicRuntimeException(ErrorCode.STRING_TOO_LONG);
        }
        return BasicValue.ofString(result);
    }

    private static BasicValue compare(Operator op, BasicValue left, BasicValue right) {
        int cmp;
        if (left.isString() && right.isString()) {
            cmp = Integer.signum(left.getString().compareTo(right.getString()));
        } else if (left.isString() || right.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "comparing string with number");
        } else {
            cmp = BasicValue.compareNumbers(left.toNumber(), right.toNumber());
        }
        boolean result = switch (op) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            default -> false;
        };
        return BasicValue.ofBoolean(result);
    }

    private static BasicValue power(double a, double b) {
        if (a == 0 && b < 0) {
            throw new BasicRuntimeException(ErrorCode.DIVISION_BY_ZERO);
        }
        double result = Math.pow(a, b);
        if (Double.isNaN(result)) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, a + " ^ " + b);
        }
        return checked(result);
    }

    private static BasicValue integerResult(int value) {
        if (value < -32768 || value > 32767) {
            throw new BasicRuntimeException(ErrorCode.OVERFLOW);
        }
        return BasicValue.ofInteger(value);
    }

    /**
     * Wraps an arithmetic result, raising overflow for infinities.
     */
    public static BasicValue checked(double value) {
        if (Double.isInfinite(value)) {
            throw new BasicRuntimeException(ErrorCode.OVERFLOW);
        }
        return BasicValue.ofDouble(value);
    }

    /**
     * Narrows to single precision, raising overflow when the value does not
     * fit a float.
     */
    public static BasicValue checkedSingle(double value) {
        if (Double.isInfinite(value) || Math.abs(value) > Float.MAX_VALUE) {
            throw new BasicRuntimeException(ErrorCode.OVERFLOW);
        }
        return BasicValue.ofSingle(value);
    }
}
