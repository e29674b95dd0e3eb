package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

public record Super(Position position) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of();
    }

    @Override
    public Super withChildren(UnaryOperator<Tree> mapper) {
        return this;
    }
}
