package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

/**
 * Leaf of a synthetic tree. It has no source text, only the text it prints as.
 */
public final class ArtificialFragment extends Fragment {
    private final Tree tree;
    private final String text;

    public ArtificialFragment(Tree tree, String text) {
        this.tree = tree;
        this.text = text;
    }

    public Tree tree() {
        return tree;
    }

    public String text() {
        return text;
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
    public @Nullable Anchor anchor() {
        return null;
    }

    @Override
    public String toString() {
        return "ArtificialFragment['" + text + "']";
    }
}
