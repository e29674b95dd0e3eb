package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Method definition.
 *
 * @param vparamss parameter lists; an empty outer list means the method has no parentheses at all
 * @param tpt      declared result type, or a {@link TypeTree} with a transparent position if inferred
 * @param rhs      body, or {@link EmptyTree} for abstract methods
 */
public record DefDef(Position position, Modifiers mods, String name, List<List<ValDef>> vparamss,
                     Tree tpt, Tree rhs, @Nullable Symbol symbol) implements DefTree {
    public DefDef {
        vparamss = vparamss.stream().map(List::copyOf).toList();
    }

    @Override
    public List<Tree> children() {
        var result = new ArrayList<Tree>(mods.annotations());
        vparamss.forEach(result::addAll);
        result.add(tpt);
        result.add(rhs);
        return List.copyOf(result);
    }

    @Override
    public DefDef withChildren(UnaryOperator<Tree> mapper) {
        var newMods = mods.mapAnnotations(mapper, this);
        var newParamss = new ArrayList<List<ValDef>>(vparamss.size());
        for (var vparams : vparamss) {
            newParamss.add(Trees.mapAll(vparams, mapper, ValDef.class, this));
        }
        return new DefDef(position, newMods, name, newParamss, mapper.apply(tpt), mapper.apply(rhs), symbol);
    }

    @Override
    public DefDef withName(String name) {
        return new DefDef(position, mods, name, vparamss, tpt, rhs, symbol);
    }

    @Override
    public DefDef withMods(Modifiers mods) {
        return new DefDef(position, mods, name, vparamss, tpt, rhs, symbol);
    }

    public DefDef withRhs(Tree rhs) {
        return new DefDef(position, mods, name, vparamss, tpt, rhs, symbol);
    }
}
