package org.mbasiconjava.frontend.astnode;

/**
 * Operators that appear in {@link Expr.Binary} and {@link Expr.Unary} nodes.
 */
public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    INT_DIVIDE("\\"),
    MOD("MOD"),
    POWER("^"),
    CONCAT("&"),
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    AND("AND"),
    OR("OR"),
    XOR("XOR"),
    EQV("EQV"),
    IMP("IMP"),
    // unary
    NOT("NOT"),
    NEGATE("-"),
    PLUS("+");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRelational() {
        return switch (this) {
            case EQ, NE, LT, LE, GT, GE -> true;
            default -> false;
        };
    }

    public boolean isLogical() {
        return switch (this) {
            case AND, OR, XOR, EQV, IMP, NOT -> true;
            default -> false;
        };
    }
}
