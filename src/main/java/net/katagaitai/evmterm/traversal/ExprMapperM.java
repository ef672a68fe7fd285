package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.expr.Expr;

/**
 * Node-level rewrite that may fail. Throwing aborts the whole rewrite: no enclosing node is rebuilt and no partial
 * tree is returned. The result must have the same kind as the argument.
 *
 * @param <X> failure raised by the rewrite
 */
@FunctionalInterface
public interface ExprMapperM<X extends Exception> {
    Expr<?> apply(Expr<?> expr) throws X;
}
