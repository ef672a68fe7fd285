package net.katagaitai.evmterm.expr;

public final class EByte {
    private EByte() {
    }
}
