package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.Change;
import net.neoforged.rewrite.api.RewriteContext;
import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

/**
 * Turns an edited tree back into source text, reusing the text of the original source wherever the
 * edit kept it.
 */
public final class Regenerator {
    private final RewriteContext context;
    private final Partitioner partitioner;

    public Regenerator(RewriteContext context) {
        this.context = context;
        this.partitioner = new Partitioner(context);
    }

    /**
     * Copies a fragment tree, adding a {@link LayoutFragment} for every non-empty gap between the
     * original fragments of a scope, including the gaps at the start and end of the scope.
     */
    public static TreeScope fillLayout(TreeScope scope) {
        return (TreeScope) fill(scope, null, scope.source());
    }

    private static Scope fill(Scope scope, @Nullable Scope parent, SourceFile source) {
        var copy = scope.copy(parent);
        scope.copyRequisitesTo(copy);
        int cursor = scope.isOriginal() ? scope.start() : -1;
        for (var child : scope.children()) {
            if (child instanceof LayoutFragment) {
                continue;
            }
            if (child.isOriginal()) {
                if (cursor >= 0 && child.start() > cursor) {
                    copy.add(new LayoutFragment(source, cursor, child.start()));
                }
                cursor = child.end();
            }
            copy.add(child instanceof Scope nested ? fill(nested, copy, source) : child);
        }
        if (scope.isOriginal() && cursor >= 0 && scope.end() > cursor) {
            copy.add(new LayoutFragment(source, cursor, scope.end()));
        }
        return copy;
    }

    /**
     * Renders {@code edited}, a tree derived from the tree {@code original} was partitioned from.
     * Rendering the unchanged tree reproduces the original source exactly.
     *
     * @param original the partition of the original tree, see {@link Partitioner#partition}
     * @throws IllegalArgumentException if {@code edited} does not belong to the source of {@code original}
     */
    public String render(TreeScope original, Tree edited) {
        var position = edited.position();
        if (!position.isRange() || !original.source().equals(position.source())) {
            throw new IllegalArgumentException("Edited tree " + position + " does not belong to " + original.source().name());
        }
        var repository = new FragmentRepository(fillLayout(original));
        var fragments = partitioner.partition(edited, repository);
        context.logger().debug("Rendering %s", original.source().name());
        return new Rendering(repository, context.preferences()).render(fragments);
    }

    /**
     * @return the change turning {@code original} into {@code edited}, covering only the region in
     * which they differ
     */
    public static Change createChange(String file, String original, String edited) {
        int max = Math.min(original.length(), edited.length());
        int prefix = 0;
        while (prefix < max && original.charAt(prefix) == edited.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < max - prefix
                && original.charAt(original.length() - 1 - suffix) == edited.charAt(edited.length() - 1 - suffix)) {
            suffix++;
        }
        return new Change(file, prefix, original.length() - suffix, edited.substring(prefix, edited.length() - suffix));
    }
}
