package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Type alias definition.
 */
public record TypeDef(Position position, Modifiers mods, String name, Tree rhs, @Nullable Symbol symbol) implements DefTree {
    @Override
    public List<Tree> children() {
        return Trees.concat(mods.annotations(), rhs);
    }

    @Override
    public TypeDef withChildren(UnaryOperator<Tree> mapper) {
        return new TypeDef(position, mods.mapAnnotations(mapper, this), name, mapper.apply(rhs), symbol);
    }

    @Override
    public TypeDef withName(String name) {
        return new TypeDef(position, mods, name, rhs, symbol);
    }

    @Override
    public TypeDef withMods(Modifiers mods) {
        return new TypeDef(position, mods, name, rhs, symbol);
    }
}
