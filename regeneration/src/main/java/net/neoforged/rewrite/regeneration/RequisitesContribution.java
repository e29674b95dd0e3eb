package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.Template;
import net.neoforged.rewrite.api.tree.TypeApply;
import org.jetbrains.annotations.Nullable;

/**
 * Attaches the connective text a role needs: parentheses, separators, {@code =} before right-hand
 * sides and so on.
 */
final class RequisitesContribution extends Contribution {
    RequisitesContribution(Partitioner partitioner, @Nullable Contribution next) {
        super(partitioner, next);
    }

    @Override
    void handle(Site site, PartitionContext context) {
        switch (site.role()) {
            case MODS -> {
                if (Partitioner.hasModifiers(site.tree())) {
                    next(site, context);
                    context.requireAfter(Requisite.of(" "));
                }
            }
            case TPT -> {
                context.requireBefore(new Requisite(":", ": "));
                next(site, context);
            }
            case RHS -> {
                context.requireBefore(new Requisite("=", " = "));
                next(site, context);
            }
            case ARGS_SEPARATOR -> {
                context.requireAfter(new Requisite(",", ", "));
                next(site, context);
            }
            case STMTS_SEPARATOR -> {
                context.requireAfter(Requisite.of("\n"));
                next(site, context);
            }
            case WITH_SEPARATOR -> {
                context.requireAfter(new Requisite("with", " with "));
                next(site, context);
            }
            case PARENTS -> {
                var template = (Template) site.tree();
                context.requireBefore(Partitioner.earlyDefinitions(template).isEmpty()
                        ? new Requisite("extends", " extends ")
                        : new Requisite("with", " with "));
                next(site, context);
            }
            case CLASS_PARAMS -> {
                if (site.members().isEmpty()) {
                    next(site, context);
                } else {
                    enclosed(site, context, "(", ")");
                }
            }
            case PARAM_LIST -> {
                if (site.tree() instanceof Apply apply) {
                    if (apply.isInfix() || partitioner.parenSpan(apply, context, false) != null) {
                        next(site, context);
                    } else {
                        enclosed(site, context, "(", ")");
                    }
                } else if (site.tree() instanceof TypeApply) {
                    enclosed(site, context, "[", "]");
                } else {
                    enclosed(site, context, "(", ")");
                }
            }
            case COND -> {
                if (site.tree().position().isSynthetic()) {
                    context.requireBefore(new Requisite("if", "if "));
                    context.requireBefore(Requisite.of("("));
                    next(site, context);
                    context.requireAfter(Requisite.of(")"));
                } else {
                    next(site, context);
                }
            }
            case THEN -> {
                context.requireBefore(Requisite.of(" "));
                next(site, context);
            }
            case ELSE -> {
                context.requireBefore(new Requisite("else", " else "));
                next(site, context);
            }
            case CASES -> {
                context.requireAfter(new Requisite("match", " match {\n"));
                next(site, context);
            }
            case PATTERN -> {
                context.requireBefore(new Requisite("case", "case "));
                next(site, context);
            }
            case CASE_BODY -> {
                context.requireBefore(new Requisite("=>", " => "));
                next(site, context);
            }
            default -> next(site, context);
        }
    }

    /**
     * Surrounds the members with {@code open} and {@code close}. Synthetic trees without members get
     * both after the preceding fragment, since nothing follows that could take them.
     */
    private void enclosed(Site site, PartitionContext context, String open, String close) {
        if (site.members().isEmpty() && site.tree().position().isSynthetic()) {
            context.requireAfter(Requisite.of(open + close));
            next(site, context);
            return;
        }
        context.requireBefore(Requisite.of(open));
        next(site, context);
        context.requireAfter(Requisite.of(close));
    }
}
