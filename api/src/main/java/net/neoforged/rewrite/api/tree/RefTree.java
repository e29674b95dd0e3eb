package net.neoforged.rewrite.api.tree;

import org.jetbrains.annotations.Nullable;

/**
 * A tree referring to a named entity by name.
 */
public interface RefTree extends Tree {
    String name();

    @Nullable
    Symbol symbol();

    RefTree withName(String name);
}
