package net.neoforged.rewrite.regeneration;

import org.jetbrains.annotations.Nullable;

/**
 * Scope of a synthetic tree, such as the body of an inserted method. It has no source text; its
 * braces come from requisites.
 */
public final class SyntheticScope extends Scope {
    private final int indentation;

    SyntheticScope(@Nullable Scope parent, int indentation) {
        super(parent);
        this.indentation = indentation;
    }

    @Override
    public int start() {
        return -1;
    }

    @Override
    public int end() {
        return -1;
    }

    @Override
    public int childIndentation() {
        return indentation;
    }

    @Override
    public @Nullable Anchor anchor() {
        return null;
    }

    @Override
    public @Nullable Anchor endAnchor() {
        return null;
    }

    @Override
    SyntheticScope copy(@Nullable Scope parent) {
        return new SyntheticScope(parent, indentation);
    }

    @Override
    public String toString() {
        return "SyntheticScope[indentation=" + indentation + "]";
    }
}
