package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Sequence of statements followed by a result expression. The expression is {@link EmptyTree} if the
 * block ends with a definition.
 */
public record Block(Position position, List<Tree> stats, Tree expr) implements Tree {
    public Block {
        stats = List.copyOf(stats);
    }

    @Override
    public List<Tree> children() {
        return Trees.concat(stats, expr);
    }

    @Override
    public Block withChildren(UnaryOperator<Tree> mapper) {
        return new Block(position, Trees.mapAll(stats, mapper, Tree.class, this), mapper.apply(expr));
    }

    public Block withStats(List<Tree> stats) {
        return new Block(position, stats, expr);
    }
}
