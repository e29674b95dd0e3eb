package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.Logger;
import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.ProblemId;
import net.neoforged.rewrite.api.ProblemSeverity;
import net.neoforged.rewrite.api.RewriteContext;
import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * State of one partition pass: the stack of open scopes and the before-requisites that wait for the
 * next emitted fragment.
 */
final class PartitionContext {
    private final RewriteContext context;
    private final SourceFile source;
    @Nullable
    private final FragmentRepository repository;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final List<Requisite> pendingBefore = new ArrayList<>();

    PartitionContext(RewriteContext context, SourceFile source, @Nullable FragmentRepository repository) {
        this.context = context;
        this.source = source;
        this.repository = repository;
    }

    SourceFile source() {
        return source;
    }

    Logger logger() {
        return context.logger();
    }

    TreeScope openRoot(Tree root) {
        if (!scopes.isEmpty()) {
            throw new IllegalStateException("Root scope already opened");
        }
        var recorded = recordedScope(root);
        var scope = new TreeScope(null, root, source, 0, source.length(), 0,
                recorded != null ? recorded.childIndentation() : -1);
        scopes.push(scope);
        return scope;
    }

    Scope top() {
        var scope = scopes.peek();
        if (scope == null) {
            throw new IllegalStateException("No open scope");
        }
        return scope;
    }

    /**
     * @return the scope an earlier partition of the original source created for a tree spanning the
     * same range as {@code tree}, if partitioning an edited tree
     */
    @Nullable
    TreeScope recordedScope(Tree tree) {
        return repository != null ? repository.findScope(tree) : null;
    }

    void emit(Fragment fragment) {
        var added = top().add(fragment);
        if (added == null) {
            logger().debug("Dropped empty leaf %s", fragment);
            return;
        }
        pendingBefore.forEach(added::requireBefore);
        pendingBefore.clear();
    }

    void requireBefore(Requisite requisite) {
        if (!pendingBefore.contains(requisite)) {
            pendingBefore.add(requisite);
        }
    }

    void requireAfter(Requisite requisite) {
        var last = top().lastChild();
        if (!pendingBefore.isEmpty() || last == null) {
            requireBefore(requisite);
        } else {
            last.requireAfter(requisite);
        }
    }

    /**
     * Runs {@code body} in a scope for {@code tree} spanning {@code [start, end)}. A scope recorded for
     * the same tree takes precedence over the given span, and no scope is opened if the current one
     * already has the span.
     *
     * @param indented whether lines within the scope are indented one step deeper than its first line
     */
    void inScope(Tree tree, int start, int end, boolean indented, Runnable body) {
        var recorded = recordedScope(tree);
        if (recorded != null) {
            start = recorded.start();
            end = recorded.end();
        }
        var current = top();
        if (current.isOriginal() && current.start() == start && current.end() == end) {
            body.run();
            return;
        }
        var scope = new TreeScope(current, tree, source, start, end,
                indented ? context.preferences().indentationStep() : 0,
                recorded != null ? recorded.childIndentation() : -1);
        emit(scope);
        scopes.push(scope);
        try {
            body.run();
        } finally {
            scopes.pop();
        }
    }

    /**
     * Runs {@code body} in a brace-delimited scope indented one step deeper than the current one.
     */
    void inSyntheticScope(Runnable body) {
        var current = top();
        var scope = new SyntheticScope(current, current.childIndentation() + context.preferences().indentationStep());
        requireBefore(new Requisite("{", " {\n"));
        emit(scope);
        scopes.push(scope);
        try {
            body.run();
        } finally {
            scopes.pop();
        }
        scope.requireAfter(new Requisite("}", "\n}"));
    }

    void report(ProblemId problemId, ProblemSeverity severity, Position position, String message) {
        logger().debug("%s at %s: %s", problemId, position, message);
        context.problemReporter().report(problemId, severity, position, message);
    }

    void finish() {
        if (!pendingBefore.isEmpty()) {
            logger().debug("Discarding requisites %s without a following fragment", pendingBefore);
            pendingBefore.clear();
        }
    }
}
