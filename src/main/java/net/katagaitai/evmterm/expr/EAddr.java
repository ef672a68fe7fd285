package net.katagaitai.evmterm.expr;

public final class EAddr {
    private EAddr() {
    }
}
