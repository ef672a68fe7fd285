package net.katagaitai.evmterm.trace;

import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.contract.Contract;

@Value
public class Trace {
    int opIx;
    @NonNull
    Contract contract;
    @NonNull
    TraceData data;
}
