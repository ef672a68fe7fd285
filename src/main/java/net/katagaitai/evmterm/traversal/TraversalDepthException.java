package net.katagaitai.evmterm.traversal;

import lombok.Getter;

public class TraversalDepthException extends RuntimeException {
    @Getter
    private final int maxDepth;

    public TraversalDepthException(int maxDepth) {
        super("term nesting exceeds " + maxDepth);
        this.maxDepth = maxDepth;
    }
}
