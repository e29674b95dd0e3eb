package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.Literal;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.Names;
import net.neoforged.rewrite.api.tree.New;
import net.neoforged.rewrite.api.tree.RefTree;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Super;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TreePrinter;
import net.neoforged.rewrite.api.tree.TypeTree;
import org.jetbrains.annotations.Nullable;

/**
 * Emits the leaf of a tree: the name of a definition or reference, a literal, a keyword. Synthetic
 * trees get an {@link ArtificialFragment} with their printed text instead.
 */
final class FragmentContribution extends Contribution {
    FragmentContribution(Partitioner partitioner, @Nullable Contribution next) {
        super(partitioner, next);
    }

    @Override
    void handle(Site site, PartitionContext context) {
        var tree = site.tree();
        if (site.role() == Role.ITSELF && !Partitioner.isImplDef(tree)) {
            if (tree.position().isSynthetic()) {
                artificialLeaf(tree, context);
            } else {
                sourceLeaf(tree, context);
            }
        } else if (site.role() == Role.NAME) {
            if (tree.position().isSynthetic()) {
                context.emit(new ArtificialFragment(tree, TreePrinter.syntheticText(tree)));
            } else {
                context.emit(nameLeaf((DefTree) tree, context));
            }
        }
        next(site, context);
    }

    private static void artificialLeaf(Tree tree, PartitionContext context) {
        if (tree instanceof Select select && !select.isPrefixOperator()) {
            context.requireBefore(Names.isOperator(select.name()) ? Requisite.of(" ") : Requisite.of("."));
        }
        if (tree instanceof DefTree || tree instanceof RefTree || tree instanceof Literal || tree instanceof New
                || tree instanceof Super || tree instanceof Match
                || tree instanceof TypeTree typeTree && !typeTree.name().isEmpty()) {
            context.emit(new ArtificialFragment(tree, TreePrinter.syntheticText(tree)));
        }
    }

    private static void sourceLeaf(Tree tree, PartitionContext context) {
        var source = context.source();
        var position = tree.position();
        if (tree instanceof DefTree def) {
            context.emit(nameLeaf(def, context));
        } else if (tree instanceof Select select) {
            if (select.isPrefixOperator()) {
                int end = SourceHelper.tokenEnd(source, position.start());
                context.emit(new SourceFragment(tree, source, position.start(), end, TreePrinter.token(tree)));
            } else {
                context.requireBefore(Names.isOperator(select.name()) ? Requisite.of(" ") : Requisite.of("."));
                int end = SourceHelper.tokenEnd(source, position.point());
                context.emit(new SourceFragment(tree, source, position.point(), end, TreePrinter.token(tree)));
            }
        } else if (tree instanceof Ident ident) {
            var symbol = ident.symbol();
            if (symbol != null && symbol.hasFlag(Flag.SYNTHETIC)) {
                return;
            }
            var tag = symbol != null && symbol.isExternal() ? null : tree;
            context.emit(new SourceFragment(tag, source, position.start(), position.end(), TreePrinter.token(tree)));
        } else if (tree instanceof New) {
            int end = Math.min(position.end(), position.start() + "new".length());
            context.emit(new SourceFragment(tree, source, position.start(), end, TreePrinter.token(tree)));
        } else if (tree instanceof Literal || tree instanceof Super || tree instanceof TypeTree) {
            context.emit(new SourceFragment(tree, source, position.start(), position.end(), TreePrinter.token(tree)));
        }
    }

    /**
     * The name token of a definition, measured in the source so that a renamed definition keeps the
     * span of its original name.
     */
    private static SourceFragment nameLeaf(DefTree def, PartitionContext context) {
        var source = context.source();
        int point = def.position().point();
        return new SourceFragment(def, source, point, SourceHelper.tokenEnd(source, point), def.name());
    }
}
