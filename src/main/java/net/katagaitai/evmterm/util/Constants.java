package net.katagaitai.evmterm.util;

public class Constants {
    public static final int WORD_BITS = 256;
    public static final int ADDRESS_BITS = 160;
    public static final int WORD_BYTES = WORD_BITS / 8;
    // JoinBytesの子の数
    public static final int JOIN_BYTES_ARITY = WORD_BYTES;
    // 走査の再帰の深さの上限。スタックオーバーフローの前に止める
    public static final int MAX_TRAVERSAL_DEPTH = Integer.getInteger("evmterm.maxTraversalDepth", 1024);
}
