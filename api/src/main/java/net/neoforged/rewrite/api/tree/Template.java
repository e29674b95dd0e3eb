package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Parents and members of a class or object.
 *
 * @param parents the extended type and mixed-in traits, each optionally applied to arguments
 * @param body    constructor parameters, early definitions and members, in source order
 */
public record Template(Position position, List<Tree> parents, List<Tree> body) implements Tree {
    public Template {
        parents = List.copyOf(parents);
        body = List.copyOf(body);
    }

    @Override
    public List<Tree> children() {
        return Trees.concat(parents, body);
    }

    @Override
    public Template withChildren(UnaryOperator<Tree> mapper) {
        return new Template(position, Trees.mapAll(parents, mapper, Tree.class, this), Trees.mapAll(body, mapper, Tree.class, this));
    }

    public Template withBody(List<Tree> body) {
        return new Template(position, parents, body);
    }
}
