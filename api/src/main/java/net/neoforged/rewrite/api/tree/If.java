package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Conditional expression; {@code elsep} is {@link EmptyTree} if there is no else branch.
 */
public record If(Position position, Tree cond, Tree thenp, Tree elsep) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of(cond, thenp, elsep);
    }

    @Override
    public If withChildren(UnaryOperator<Tree> mapper) {
        return new If(position, mapper.apply(cond), mapper.apply(thenp), mapper.apply(elsep));
    }
}
