package net.katagaitai.evmterm.contract;

import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;

import java.util.Optional;

@Value
public class Contract {
    @NonNull
    ContractCode code;
    @NonNull
    Expr<EStorage> storage;
    @NonNull
    Expr<EStorage> origStorage;
    @NonNull
    Expr<EWord> balance;
    @NonNull
    Optional<Long> nonce;
}
