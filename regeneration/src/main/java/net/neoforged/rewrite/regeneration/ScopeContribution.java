package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.ProblemSeverity;
import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.Block;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.If;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.Template;
import org.jetbrains.annotations.Nullable;

/**
 * Opens the scopes of classes, objects, bodies, conditions and argument lists.
 */
final class ScopeContribution extends Contribution {
    ScopeContribution(Partitioner partitioner, @Nullable Contribution next) {
        super(partitioner, next);
    }

    @Override
    void handle(Site site, PartitionContext context) {
        var tree = site.tree();
        Runnable rest = () -> next(site, context);
        switch (site.role()) {
            case ITSELF -> {
                if (Partitioner.isImplDef(tree) && tree.position().isRange()) {
                    context.inScope(tree, implStart((DefTree) tree, context), tree.position().end(), false, rest);
                } else if (tree instanceof Match && tree.position().isRange()) {
                    context.inScope(tree, tree.position().start(), tree.position().end(), false, rest);
                } else {
                    rest.run();
                }
            }
            case BLOCK_BODY -> {
                if (tree.position().isRange()) {
                    context.inScope(tree, tree.position().start(), tree.position().end(), true, rest);
                } else if (tree instanceof Block) {
                    context.inSyntheticScope(rest);
                } else {
                    rest.run();
                }
            }
            case CLASS_BODY -> classBody((Template) tree, site, context, rest);
            case COND -> condition((If) tree, context, rest);
            case PARAM_LIST -> {
                var span = tree instanceof Apply apply ? partitioner.parenSpan(apply, context, true) : null;
                if (span != null) {
                    context.inScope(tree, span.start(), span.end(), false, rest);
                } else {
                    rest.run();
                }
            }
            default -> rest.run();
        }
    }

    private void classBody(Template template, Site site, PartitionContext context, Runnable rest) {
        if (template.position().isSynthetic()) {
            if (site.members().isEmpty()) {
                rest.run();
            } else {
                context.inSyntheticScope(rest);
            }
            return;
        }
        if (context.recordedScope(template) != null) {
            context.inScope(template, template.position().start(), template.position().end(), true, rest);
            return;
        }

        int searchStart = template.position().start();
        int abortOn = template.position().end();
        for (var child : template.body()) {
            if (child.position().isRange() && !site.members().contains(child)) {
                searchStart = Math.max(searchStart, child.position().end());
            }
        }
        for (var parent : template.parents()) {
            if (parent.position().isRange()) {
                searchStart = Math.max(searchStart, parent.position().end());
            }
        }
        for (var member : site.members()) {
            if (member.position().isRange()) {
                abortOn = Math.min(abortOn, member.position().start());
                break;
            }
        }

        var open = SourceHelper.forwardsTo(context.source(), '{', searchStart, abortOn);
        if (open.isPresent()) {
            context.inScope(template, open.getAsInt(), template.position().end(), true, rest);
        } else if (site.members().isEmpty()) {
            rest.run();
        } else {
            if (site.members().stream().anyMatch(member -> member.position().isRange())) {
                context.report(Partitioner.MISSING_DELIMITER, ProblemSeverity.INFO, template.position(),
                        "No opening brace found for template body");
            }
            context.inSyntheticScope(rest);
        }
    }

    private void condition(If tree, PartitionContext context, Runnable rest) {
        var cond = tree.cond();
        if (context.recordedScope(tree) != null) {
            context.inScope(tree, tree.position().start(), tree.position().end(), false, rest);
            return;
        }
        if (!tree.position().isRange() || !cond.position().isRange()) {
            rest.run();
            return;
        }
        var open = SourceHelper.backwardsSkipLayoutTo(context.source(), '(', cond.position().start());
        var close = SourceHelper.skipLayoutTo(context.source(), ')', cond.position().end());
        if (open.isPresent() && close.isPresent()) {
            context.inScope(tree, open.getAsInt(), close.getAsInt() + 1, false, rest);
        } else {
            context.report(Partitioner.MISSING_DELIMITER, ProblemSeverity.INFO, cond.position(),
                    "No parentheses found around condition");
            context.inScope(tree, cond.position().start(), cond.position().end(), false, rest);
        }
    }

    /**
     * Classes and objects start at their keyword; their scope also covers modifiers and annotations.
     */
    private static int implStart(DefTree def, PartitionContext context) {
        int start = def.position().start();
        for (var position : def.mods().positions().values()) {
            start = Math.min(start, position.start());
        }
        for (var annotation : def.mods().annotations()) {
            if (annotation.position().isRange()) {
                var at = SourceHelper.backwardsSkipLayoutTo(context.source(), '@', annotation.position().start());
                start = Math.min(start, at.orElse(annotation.position().start()));
            }
        }
        return start;
    }
}
