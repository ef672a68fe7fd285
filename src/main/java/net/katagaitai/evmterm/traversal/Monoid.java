package net.katagaitai.evmterm.traversal;

/**
 * Accumulator for {@link Traversals#foldExpr}. {@link #combine} must be associative and {@link #empty()} its
 * identity.
 */
public interface Monoid<B> {
    B empty();

    B combine(B lhs, B rhs);
}
