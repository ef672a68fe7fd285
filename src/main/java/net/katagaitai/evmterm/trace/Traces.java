package net.katagaitai.evmterm.trace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;

import java.util.List;
import java.util.Map;

@Value
public class Traces {
    public static final Traces EMPTY = new Traces(ImmutableList.of(), ImmutableMap.of());

    ImmutableList<TraceTree> forest;
    ImmutableMap<Expr<EAddr>, Contract> contracts;

    public Traces(@NonNull List<TraceTree> forest, @NonNull Map<? extends Expr<EAddr>, Contract> contracts) {
        this.forest = ImmutableList.copyOf(forest);
        this.contracts = ImmutableMap.copyOf(contracts);
    }
}
