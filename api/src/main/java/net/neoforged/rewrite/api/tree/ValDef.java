package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Value, variable or parameter definition. Variables carry {@link Flag#MUTABLE}.
 */
public record ValDef(Position position, Modifiers mods, String name, Tree tpt, Tree rhs, @Nullable Symbol symbol) implements DefTree {
    @Override
    public List<Tree> children() {
        return Trees.concat(mods.annotations(), tpt, rhs);
    }

    @Override
    public ValDef withChildren(UnaryOperator<Tree> mapper) {
        return new ValDef(position, mods.mapAnnotations(mapper, this), name, mapper.apply(tpt), mapper.apply(rhs), symbol);
    }

    @Override
    public ValDef withName(String name) {
        return new ValDef(position, mods, name, tpt, rhs, symbol);
    }

    @Override
    public ValDef withMods(Modifiers mods) {
        return new ValDef(position, mods, name, tpt, rhs, symbol);
    }

    public ValDef withRhs(Tree rhs) {
        return new ValDef(position, mods, name, tpt, rhs, symbol);
    }

    public boolean isParameter() {
        return mods.hasFlag(Flag.PARAM) || mods.hasFlag(Flag.PARAMACCESSOR) || mods.hasFlag(Flag.CASEACCESSOR);
    }
}
