package net.katagaitai.evmterm.expr;

public final class ELog {
    private ELog() {
    }
}
