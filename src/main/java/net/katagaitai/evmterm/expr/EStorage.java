package net.katagaitai.evmterm.expr;

public final class EStorage {
    private EStorage() {
    }
}
