package net.katagaitai.evmterm.expr;

public final class EContract {
    private EContract() {
    }
}
