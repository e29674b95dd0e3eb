package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

/**
 * Scope of a tree that has source text, covering {@code [start, end)} of its file.
 */
public final class TreeScope extends Scope {
    private final Tree tree;
    private final SourceFile source;
    private final int start;
    private final int end;
    private final int indentation;
    private final int indentationStep;
    private final int recordedChildIndentation;

    /**
     * @param indentationStep          added to the indentation of the scope start's line for children
     *                                 that have no source line of their own, {@code 0} for scopes whose
     *                                 children are not indented
     * @param recordedChildIndentation child indentation known from an earlier partition of the same
     *                                 tree, or {@code -1}
     */
    TreeScope(@Nullable Scope parent, Tree tree, SourceFile source, int start, int end,
              int indentationStep, int recordedChildIndentation) {
        super(parent);
        if (start < 0 || end < start || end > source.length()) {
            throw new IllegalArgumentException("Invalid scope span [" + start + ", " + end + ") in " + source.name());
        }
        this.tree = tree;
        this.source = source;
        this.start = start;
        this.end = end;
        this.indentation = source.lineIndentation(start).length();
        this.indentationStep = indentationStep;
        this.recordedChildIndentation = recordedChildIndentation;
    }

    public Tree tree() {
        return tree;
    }

    public SourceFile source() {
        return source;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int end() {
        return end;
    }

    @Override
    public int childIndentation() {
        if (recordedChildIndentation >= 0) {
            return recordedChildIndentation;
        }
        int scopeLine = source.lineStart(start);
        for (var child : children()) {
            if (child.isOriginal() && !(child instanceof LayoutFragment) && source.lineStart(child.start()) > scopeLine) {
                return source.lineIndentation(child.start()).length();
            }
        }
        return indentation + indentationStep;
    }

    @Override
    public Anchor anchor() {
        return new Anchor(Anchor.Kind.BEGIN, start, end);
    }

    @Override
    public Anchor endAnchor() {
        return new Anchor(Anchor.Kind.END, start, end);
    }

    @Override
    TreeScope copy(@Nullable Scope parent) {
        return new TreeScope(parent, tree, source, start, end, indentationStep, recordedChildIndentation);
    }

    @Override
    public String toString() {
        return "TreeScope[" + tree.getClass().getSimpleName() + " " + describeSpan() + "]";
    }
}
