package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.Change;
import net.neoforged.rewrite.api.ProblemId;
import net.neoforged.rewrite.api.ProblemSeverity;
import net.neoforged.rewrite.api.RewriteContext;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.transform.Transformation;

import java.util.Optional;

/**
 * Applies a transformation to a tree and computes the resulting change to its source file.
 */
public final class SourceRewriter {
    static final ProblemId TRANSFORMATION_FAILED = ProblemId.create("transformation-failed", "Transformation Failed", Partitioner.PROBLEM_GROUP);

    private final RewriteContext context;
    private final Partitioner partitioner;
    private final Regenerator regenerator;

    public SourceRewriter(RewriteContext context) {
        this.context = context;
        this.partitioner = new Partitioner(context);
        this.regenerator = new Regenerator(context);
    }

    /**
     * @return the change to the source of {@code root}, or nothing if the transformation failed or did
     * not change the source text
     */
    public Optional<Change> rewrite(Tree root, Transformation<Tree, Tree> transformation) {
        var source = root.position().source();
        if (source == null || !root.position().isRange()) {
            throw new IllegalArgumentException("Cannot rewrite a tree without source text: " + root.position());
        }
        var logger = context.logger();

        logger.debug("Partitioning %s", source.name());
        var original = partitioner.partition(root);

        var edited = transformation.apply(root);
        if (edited.isEmpty()) {
            logger.error("Transformation did not apply to %s", source.name());
            context.problemReporter().report(TRANSFORMATION_FAILED, ProblemSeverity.INFO, root.position(),
                    "Transformation did not apply, leaving the source unchanged");
            return Optional.empty();
        }

        var text = regenerator.render(original, edited.get());
        if (text.equals(source.content())) {
            logger.debug("No changes to %s", source.name());
            return Optional.empty();
        }
        var change = Regenerator.createChange(source.name(), source.content(), text);
        logger.debug("Replacing [%d, %d) of %s", change.from(), change.to(), source.name());
        return Optional.of(change);
    }
}
