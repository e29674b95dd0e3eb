package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Instance creation. Constructor arguments are supplied by an enclosing {@link Apply}.
 */
public record New(Position position, Tree tpt) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of(tpt);
    }

    @Override
    public New withChildren(UnaryOperator<Tree> mapper) {
        return new New(position, mapper.apply(tpt));
    }
}
