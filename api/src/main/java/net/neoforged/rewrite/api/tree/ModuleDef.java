package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Singleton object definition.
 */
public record ModuleDef(Position position, Modifiers mods, String name, @Nullable Symbol symbol, Template impl) implements DefTree {
    @Override
    public List<Tree> children() {
        return Trees.concat(mods.annotations(), impl);
    }

    @Override
    public ModuleDef withChildren(UnaryOperator<Tree> mapper) {
        var newMods = mods.mapAnnotations(mapper, this);
        var newImpl = Trees.cast(mapper.apply(impl), Template.class, this);
        return new ModuleDef(position, newMods, name, symbol, newImpl);
    }

    @Override
    public ModuleDef withName(String name) {
        return new ModuleDef(position, mods, name, symbol, impl);
    }

    @Override
    public ModuleDef withMods(Modifiers mods) {
        return new ModuleDef(position, mods, name, symbol, impl);
    }

    public ModuleDef withImpl(Template impl) {
        return new ModuleDef(position, mods, name, symbol, impl);
    }
}
