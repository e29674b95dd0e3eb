package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

/**
 * Leaf covering original source text, usually the name token of a definition or reference.
 */
public final class SourceFragment extends Fragment {
    @Nullable
    private final Tree tree;
    private final SourceFile source;
    private final int start;
    private final int end;
    private final String token;

    /**
     * @param tree  the tree this leaf represents, or {@code null} for leaves not tied to one tree
     * @param token printed form of what the leaf denotes, compared to detect changed leaves
     */
    public SourceFragment(@Nullable Tree tree, SourceFile source, int start, int end, String token) {
        if (start < 0 || end < start || end > source.length()) {
            throw new IllegalArgumentException("Invalid leaf span [" + start + ", " + end + ") in " + source.name());
        }
        this.tree = tree;
        this.source = source;
        this.start = start;
        this.end = end;
        this.token = token;
    }

    public @Nullable Tree tree() {
        return tree;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int end() {
        return end;
    }

    public String token() {
        return token;
    }

    public String text() {
        return source.text(start, end);
    }

    @Override
    public Anchor anchor() {
        return new Anchor(Anchor.Kind.LEAF, start, end);
    }

    SourceFragment withSpan(int start, int end) {
        return new SourceFragment(tree, source, start, end, token);
    }

    @Override
    public String toString() {
        return "SourceFragment[" + describeSpan() + " '" + text() + "']";
    }
}
