package net.neoforged.rewrite.transform;

import java.util.function.UnaryOperator;

/**
 * Implemented by structures that can be rebuilt with each of their direct children replaced.
 * <p>
 * This is the only capability the child-oriented combinators in {@link Transformations} require.
 *
 * @param <X> the type of the structure and of its children
 */
public interface Rebuildable<X extends Rebuildable<X>> {
    /**
     * Rebuilds this value, passing every direct child through {@code mapper} in order.
     * Implementations must call the mapper exactly once per child, and should return {@code this}
     * when every child was mapped to itself.
     */
    X withChildren(UnaryOperator<X> mapper);
}
