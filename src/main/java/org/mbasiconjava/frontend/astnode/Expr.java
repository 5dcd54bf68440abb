package org.mbasiconjava.frontend.astnode;

import org.mbasiconjava.frontend.analysis.ExprVisitor;

import java.util.List;
import java.util.Locale;

/**
 * Expression trees handed over by the parser. Names are normalized to lower
 * case and keep their type suffix.
 */
public sealed interface Expr permits LValue, Expr.NumberLiteral, Expr.StringLiteral,
        Expr.Binary, Expr.Unary, Expr.FunctionCall {

    <R> R accept(ExprVisitor<R> visitor);

    record NumberLiteral(double value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StringLiteral(String value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Variable(String name) implements LValue {
        public Variable {
            name = name.toLowerCase(Locale.ROOT);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrayAccess(String name, List<Expr> indices) implements LValue {
        public ArrayAccess {
            name = name.toLowerCase(Locale.ROOT);
            indices = List.copyOf(indices);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Binary(Operator op, Expr left, Expr right) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Unary(Operator op, Expr operand) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A built-in call such as {@code mid$(a$, 2)} or a user function
     * {@code fna(x)}; argument-less built-ins like {@code inkey$} have an
     * empty argument list.
     */
    record FunctionCall(String name, List<Expr> args) implements Expr {
        public FunctionCall {
            name = name.toLowerCase(Locale.ROOT);
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
