package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Type that is not written in source, either inferred (transparent position) or supplied by a
 * transformation (synthetic position).
 */
public record TypeTree(Position position, String name) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of();
    }

    @Override
    public TypeTree withChildren(UnaryOperator<Tree> mapper) {
        return this;
    }
}
