package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Marks an absent optional part of a tree, such as a missing right-hand side.
 */
public enum EmptyTree implements Tree {
    INSTANCE;

    @Override
    public Position position() {
        return Position.synthetic();
    }

    @Override
    public List<Tree> children() {
        return List.of();
    }

    @Override
    public EmptyTree withChildren(UnaryOperator<Tree> mapper) {
        return this;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }
}
