package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.transform.Rebuildable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable abstract syntax tree node.
 * <p>
 * Implementations are value types: rebuilding a node with the same children yields an equal node.
 * Nodes never hold a reference to their parent, so an edited tree shares all unchanged subtrees with
 * the tree it was derived from.
 */
public interface Tree extends Rebuildable<Tree> {
    Position position();

    /**
     * @return the direct children, in source order
     */
    List<Tree> children();

    /**
     * Rebuilds this node with every direct child replaced by the result of {@code mapper}.
     *
     * @throws IllegalArgumentException if a mapped child is of a kind this node cannot hold
     */
    @Override
    Tree withChildren(UnaryOperator<Tree> mapper);

    default boolean isEmpty() {
        return false;
    }
}
