package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Application of a type constructor or polymorphic function to type arguments.
 */
public record TypeApply(Position position, Tree fun, List<Tree> args) implements Tree {
    public TypeApply {
        args = List.copyOf(args);
    }

    @Override
    public List<Tree> children() {
        return Trees.concat(List.of(fun), args);
    }

    @Override
    public TypeApply withChildren(UnaryOperator<Tree> mapper) {
        return new TypeApply(position, mapper.apply(fun), Trees.mapAll(args, mapper, Tree.class, this));
    }
}
