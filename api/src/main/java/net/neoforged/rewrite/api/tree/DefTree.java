package net.neoforged.rewrite.api.tree;

import org.jetbrains.annotations.Nullable;

/**
 * A tree declaring a named entity.
 */
public interface DefTree extends Tree {
    Modifiers mods();

    String name();

    @Nullable
    Symbol symbol();

    DefTree withName(String name);

    DefTree withMods(Modifiers mods);
}
