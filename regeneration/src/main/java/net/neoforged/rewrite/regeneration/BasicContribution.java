package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.ClassDef;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.ModuleDef;
import net.neoforged.rewrite.api.tree.TypeApply;
import org.jetbrains.annotations.Nullable;

/**
 * Last link of the chain: descends into the trees a site consists of.
 */
final class BasicContribution extends Contribution {
    BasicContribution(Partitioner partitioner, @Nullable Contribution next) {
        super(partitioner, next);
    }

    @Override
    void handle(Site site, PartitionContext context) {
        var tree = site.tree();
        switch (site.role()) {
            case ITSELF -> {
                if (tree instanceof ClassDef classDef) {
                    partitioner.handle(new Site(tree, Role.MODS), context);
                    partitioner.handle(new Site(tree, Role.NAME), context);
                    partitioner.traverse(classDef.impl(), context);
                } else if (tree instanceof ModuleDef moduleDef) {
                    partitioner.handle(new Site(tree, Role.MODS), context);
                    partitioner.handle(new Site(tree, Role.NAME), context);
                    partitioner.traverse(moduleDef.impl(), context);
                } else if (tree instanceof Apply apply) {
                    partitioner.traverse(apply.fun(), context);
                    if (apply.isInfix()) {
                        context.requireBefore(Requisite.of(" "));
                        partitioner.traverse(apply.args().get(0), context);
                    } else {
                        partitioner.handle(new Site(tree, Role.PARAM_LIST, apply.args()), context);
                    }
                } else if (tree instanceof TypeApply typeApply) {
                    partitioner.traverse(typeApply.fun(), context);
                    partitioner.handle(new Site(tree, Role.PARAM_LIST, typeApply.args()), context);
                } else if (tree instanceof Match match && tree.position().isRange()) {
                    partitioner.traverse(match.selector(), context);
                    partitioner.handle(new Site(tree, Role.CASES, match.cases()), context);
                }
            }
            case PARAM_LIST, CLASS_PARAMS -> partitioner.traverseAll(site.members(), Role.ARGS_SEPARATOR, context);
            case PARENTS -> partitioner.traverseAll(site.members(), Role.WITH_SEPARATOR, context);
            case CLASS_BODY, BLOCK_BODY, CASES -> partitioner.traverseAll(site.members(), Role.STMTS_SEPARATOR, context);
            case TPT, RHS, COND, THEN, ELSE, PATTERN, CASE_BODY -> site.members().forEach(member -> partitioner.traverse(member, context));
            default -> {
            }
        }
    }
}
