package net.katagaitai.evmterm.expr;

public enum Kind {
    WORD,
    BYTE,
    ADDR,
    BUF,
    STORAGE,
    CONTRACT,
    END,
    LOG
}
