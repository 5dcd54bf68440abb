package org.mbasiconjava.frontend.analysis;

import org.mbasiconjava.frontend.astnode.Expr;

/**
 * Exhaustive dispatch over the expression variants.
 *
 * @param <R> result of visiting a node
 */
public interface ExprVisitor<R> {
    R visit(Expr.NumberLiteral node);

    R visit(Expr.StringLiteral node);

    R visit(Expr.Variable node);

    R visit(Expr.ArrayAccess node);

    R visit(Expr.Binary node);

    R visit(Expr.Unary node);

    R visit(Expr.FunctionCall node);
}
