package net.katagaitai.evmterm.expr;

public final class EEnd {
    private EEnd() {
    }
}
