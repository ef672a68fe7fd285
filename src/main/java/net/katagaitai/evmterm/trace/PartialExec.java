package net.katagaitai.evmterm.trace;

import lombok.NonNull;
import lombok.Value;

@Value
public class PartialExec {
    @NonNull
    Reason reason;
    int pc;
    @NonNull
    String message;

    public enum Reason {
        UNEXPECTED_SYMBOLIC_ARG,
        MAX_ITERATIONS_REACHED,
        JUMP_INTO_SYMBOLIC_CODE
    }
}
