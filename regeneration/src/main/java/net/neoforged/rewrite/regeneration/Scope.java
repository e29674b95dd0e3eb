package net.neoforged.rewrite.regeneration;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fragment grouping the fragments of one tree. Children never overlap. When partitioning an original
 * tree they are in source order; an edited tree may list them in a different order.
 */
public abstract class Scope extends Fragment {
    private final List<Fragment> children = new ArrayList<>();
    @Nullable
    private final Scope parent;

    protected Scope(@Nullable Scope parent) {
        this.parent = parent;
    }

    public @Nullable Scope parent() {
        return parent;
    }

    @UnmodifiableView
    public List<Fragment> children() {
        return Collections.unmodifiableList(children);
    }

    public @Nullable Fragment lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * @return the number of columns lines started within this scope are indented by
     */
    public abstract int childIndentation();

    /**
     * @return the anchor marking the end of this scope, or {@code null} for synthetic scopes
     */
    public abstract @Nullable Anchor endAnchor();

    /**
     * Creates an empty scope with the same properties, owned by {@code parent}.
     */
    abstract Scope copy(@Nullable Scope parent);

    /**
     * Appends a child. An original leaf that lies within the last original child is dropped, one that
     * reaches past its end is clipped to start there. Leaves reaching past this scope are clipped to it.
     * Leaves wholly before the last original child stem from reordered trees and are kept as they are.
     *
     * @return the fragment that was appended, or {@code null} if it was dropped
     */
    @Nullable
    Fragment add(Fragment fragment) {
        if (fragment instanceof SourceFragment leaf) {
            int start = leaf.start();
            int end = leaf.end();
            var last = lastOriginalChild();
            if (last != null) {
                if (start >= last.start() && end <= last.end()) {
                    return null;
                }
                if (start < last.end() && end > last.end()) {
                    start = last.end();
                }
            }
            if (isOriginal() && start < end() && end > start()) {
                start = Math.max(start, start());
                end = Math.min(end, end());
            }
            if (end <= start) {
                return null;
            }
            if (start != leaf.start() || end != leaf.end()) {
                var clipped = leaf.withSpan(start, end);
                leaf.copyRequisitesTo(clipped);
                fragment = clipped;
            }
        }
        children.add(fragment);
        return fragment;
    }

    @Nullable
    private Fragment lastOriginalChild() {
        for (int i = children.size() - 1; i >= 0; i--) {
            var child = children.get(i);
            if (child.isOriginal()) {
                return child;
            }
        }
        return null;
    }
}
