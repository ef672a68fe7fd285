package net.katagaitai.evmterm.pass;

import lombok.Getter;
import net.katagaitai.evmterm.expr.Expr;

public class UnresolvedPlaceholderException extends Exception {
    @Getter
    private final Expr.GVar<?> placeholder;

    public UnresolvedPlaceholderException(Expr.GVar<?> placeholder) {
        super("unbound placeholder: " + placeholder);
        this.placeholder = placeholder;
    }
}
