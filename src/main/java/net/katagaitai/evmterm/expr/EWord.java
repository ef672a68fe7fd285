package net.katagaitai.evmterm.expr;

public final class EWord {
    private EWord() {
    }
}
