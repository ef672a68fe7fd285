package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.expr.Expr;

import java.util.function.Function;

public interface Term<T> {
    T mapTerm(ExprMapper mapper);

    <B> B foldTerm(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc);
}
