package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Class definition. Constructor parameters are {@link Flag#PARAMACCESSOR} values in the body of its
 * {@link Template}.
 */
public record ClassDef(Position position, Modifiers mods, String name, @Nullable Symbol symbol, Template impl) implements DefTree {
    @Override
    public List<Tree> children() {
        return Trees.concat(mods.annotations(), impl);
    }

    @Override
    public ClassDef withChildren(UnaryOperator<Tree> mapper) {
        var newMods = mods.mapAnnotations(mapper, this);
        var newImpl = Trees.cast(mapper.apply(impl), Template.class, this);
        return new ClassDef(position, newMods, name, symbol, newImpl);
    }

    @Override
    public ClassDef withName(String name) {
        return new ClassDef(position, mods, name, symbol, impl);
    }

    @Override
    public ClassDef withMods(Modifiers mods) {
        return new ClassDef(position, mods, name, symbol, impl);
    }

    public ClassDef withImpl(Template impl) {
        return new ClassDef(position, mods, name, symbol, impl);
    }
}
