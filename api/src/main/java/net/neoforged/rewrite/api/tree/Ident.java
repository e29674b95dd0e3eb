package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

public record Ident(Position position, String name, @Nullable Symbol symbol) implements RefTree {
    @Override
    public List<Tree> children() {
        return List.of();
    }

    @Override
    public Ident withChildren(UnaryOperator<Tree> mapper) {
        return this;
    }

    @Override
    public Ident withName(String name) {
        return new Ident(position, name, symbol);
    }
}
