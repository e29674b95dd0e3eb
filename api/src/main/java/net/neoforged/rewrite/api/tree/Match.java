package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

public record Match(Position position, Tree selector, List<CaseDef> cases) implements Tree {
    public Match {
        cases = List.copyOf(cases);
    }

    @Override
    public List<Tree> children() {
        return Trees.concat(List.of(selector), cases);
    }

    @Override
    public Match withChildren(UnaryOperator<Tree> mapper) {
        return new Match(position, mapper.apply(selector), Trees.mapAll(cases, mapper, CaseDef.class, this));
    }
}
