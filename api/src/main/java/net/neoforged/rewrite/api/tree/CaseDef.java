package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.List;
import java.util.function.UnaryOperator;

public record CaseDef(Position position, Tree pat, Tree body) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of(pat, body);
    }

    @Override
    public CaseDef withChildren(UnaryOperator<Tree> mapper) {
        return new CaseDef(position, mapper.apply(pat), mapper.apply(body));
    }
}
