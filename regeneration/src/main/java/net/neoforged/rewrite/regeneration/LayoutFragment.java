package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.SourceFile;
import org.jetbrains.annotations.Nullable;

/**
 * Whitespace, comments and punctuation between two adjacent anchors of the original source.
 */
public final class LayoutFragment extends Fragment {
    private final SourceFile source;
    private final int start;
    private final int end;

    public LayoutFragment(SourceFile source, int start, int end) {
        if (start < 0 || end <= start || end > source.length()) {
            throw new IllegalArgumentException("Invalid layout span [" + start + ", " + end + ")");
        }
        this.source = source;
        this.start = start;
        this.end = end;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int end() {
        return end;
    }

    public String text() {
        return source.text(start, end);
    }

    @Override
    public @Nullable Anchor anchor() {
        return null;
    }

    @Override
    public String toString() {
        return "LayoutFragment[" + describeSpan() + "]";
    }
}
