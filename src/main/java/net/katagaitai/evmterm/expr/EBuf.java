package net.katagaitai.evmterm.expr;

public final class EBuf {
    private EBuf() {
    }
}
