package net.katagaitai.evmterm.state;

import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;

@Value
public class Refund {
    @NonNull
    Expr<EAddr> address;
    long amount;
}
