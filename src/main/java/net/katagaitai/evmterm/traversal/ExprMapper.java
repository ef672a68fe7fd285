package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.expr.Expr;

@FunctionalInterface
public interface ExprMapper extends ExprMapperM<RuntimeException> {
    @Override
    Expr<?> apply(Expr<?> expr);

    static ExprMapper identity() {
        return expr -> expr;
    }

    default ExprMapper andThen(ExprMapper after) {
        return expr -> after.apply(apply(expr));
    }
}
