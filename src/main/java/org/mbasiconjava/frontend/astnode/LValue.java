package org.mbasiconjava.frontend.astnode;

/**
 * An expression that names storage: a scalar variable or an array element.
 */
public sealed interface LValue extends Expr permits Expr.Variable, Expr.ArrayAccess {
    String name();
}
