package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Lookups over the fragments of an original source, used when rendering an edited tree.
 * <p>
 * The repository flattens a layout-filled fragment tree (see {@link Regenerator#fillLayout}) into the
 * sequence of its anchors in source order, and remembers the layout between each two of them.
 */
public final class FragmentRepository {
    private final List<Anchor> anchors = new ArrayList<>();
    private final List<StringBuilder> layouts = new ArrayList<>();
    private final Map<Anchor, Integer> indices = new HashMap<>();
    private final Map<Anchor, Fragment> fragments = new HashMap<>();
    private final Map<TreeKey, TreeScope> scopes = new HashMap<>();
    private final Map<TreeKey, Scope> leafScopes = new HashMap<>();

    public FragmentRepository(TreeScope root) {
        collect(root);
    }

    private void collect(Scope scope) {
        if (scope instanceof TreeScope treeScope) {
            record(treeScope.anchor(), treeScope);
            var key = TreeKey.of(treeScope.tree());
            if (key != null) {
                scopes.putIfAbsent(key, treeScope);
            }
        }
        for (var child : scope.children()) {
            if (child instanceof LayoutFragment layout) {
                if (!layouts.isEmpty()) {
                    layouts.get(layouts.size() - 1).append(layout.text());
                }
            } else if (child instanceof Scope nested) {
                collect(nested);
            } else {
                var anchor = child.anchor();
                if (anchor != null) {
                    record(anchor, child);
                }
                if (child instanceof SourceFragment leaf && leaf.tree() != null) {
                    var key = TreeKey.of(leaf.tree());
                    if (key != null) {
                        leafScopes.putIfAbsent(key, scope);
                    }
                }
            }
        }
        var endAnchor = scope.endAnchor();
        if (endAnchor != null) {
            record(endAnchor, scope);
        }
    }

    private void record(Anchor anchor, Fragment fragment) {
        indices.putIfAbsent(anchor, anchors.size());
        fragments.putIfAbsent(anchor, fragment);
        anchors.add(anchor);
        layouts.add(new StringBuilder());
    }

    public boolean contains(Anchor anchor) {
        return indices.containsKey(anchor);
    }

    /**
     * @return whether the original source has a fragment with the same anchor as {@code fragment}
     */
    public boolean exists(Fragment fragment) {
        var anchor = fragment.anchor();
        return anchor != null && contains(anchor);
    }

    /**
     * @return the anchor following {@code anchor} in the original source, if any
     */
    public @Nullable Anchor next(Anchor anchor) {
        var index = indices.get(anchor);
        return index != null && index + 1 < anchors.size() ? anchors.get(index + 1) : null;
    }

    /**
     * @return the anchor preceding {@code anchor} in the original source, if any
     */
    public @Nullable Anchor previous(Anchor anchor) {
        var index = indices.get(anchor);
        return index != null && index > 0 ? anchors.get(index - 1) : null;
    }

    /**
     * @return the original text between {@code anchor} and the anchor following it
     */
    public String layoutAfter(Anchor anchor) {
        var index = indices.get(anchor);
        return index != null ? layouts.get(index).toString() : "";
    }

    /**
     * @return the original text between the anchor preceding {@code anchor} and {@code anchor}
     */
    public String layoutBefore(Anchor anchor) {
        var previous = previous(anchor);
        return previous != null ? layoutAfter(previous) : "";
    }

    /**
     * @return the original fragment identified by {@code anchor}
     */
    public @Nullable Fragment leafAt(Anchor anchor) {
        return fragments.get(anchor);
    }

    /**
     * @return the original scope of a tree spanning the same range as {@code tree}
     */
    public @Nullable TreeScope findScope(Tree tree) {
        var key = TreeKey.of(tree);
        return key != null ? scopes.get(key) : null;
    }

    /**
     * @return the child indentation of the scope that holds the leaf of a tree spanning the same range
     * as {@code tree}
     */
    public OptionalInt scopeIndentation(Tree tree) {
        var key = TreeKey.of(tree);
        var scope = key != null ? leafScopes.get(key) : null;
        return scope != null ? OptionalInt.of(scope.childIndentation()) : OptionalInt.empty();
    }

    private record TreeKey(Class<?> type, int start, int end) {
        @Nullable
        static TreeKey of(Tree tree) {
            var position = tree.position();
            return position.isRange() ? new TreeKey(tree.getClass(), position.start(), position.end()) : null;
        }
    }
}
