package net.katagaitai.evmterm.traversal;

import lombok.extern.slf4j.Slf4j;

@Slf4j(topic = "evmterm")
class DepthGuard {
    private final int maxDepth;
    private int depth;

    DepthGuard(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    void enter() {
        if (depth == maxDepth) {
            log.debug("深さの上限 {} を超過", maxDepth);
            throw new TraversalDepthException(maxDepth);
        }
        depth++;
    }

    void exit() {
        depth--;
    }
}
