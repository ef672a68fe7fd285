package net.katagaitai.evmterm.state;

import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;

import java.math.BigInteger;

@Value
public class StorageKey {
    @NonNull
    Expr<EAddr> address;
    @NonNull
    BigInteger slot;
}
