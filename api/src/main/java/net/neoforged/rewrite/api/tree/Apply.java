package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Application of a function to arguments. Infix operations are applications of a {@link Select}
 * naming the operator to the right operand.
 */
public record Apply(Position position, Tree fun, List<Tree> args) implements Tree {
    public Apply {
        args = List.copyOf(args);
    }

    @Override
    public List<Tree> children() {
        return Trees.concat(List.of(fun), args);
    }

    @Override
    public Apply withChildren(UnaryOperator<Tree> mapper) {
        return new Apply(position, mapper.apply(fun), Trees.mapAll(args, mapper, Tree.class, this));
    }

    public Apply withArgs(List<Tree> args) {
        return new Apply(position, fun, args);
    }

    /**
     * @return whether this is a binary operation such as {@code a + b}
     */
    public boolean isInfix() {
        return args.size() == 1 && fun instanceof Select select && Names.isOperator(select.name())
                && !select.qualifier().isEmpty();
    }
}
