package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.ProblemGroup;
import net.neoforged.rewrite.api.ProblemId;
import net.neoforged.rewrite.api.ProblemSeverity;
import net.neoforged.rewrite.api.RewriteContext;
import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.Block;
import net.neoforged.rewrite.api.tree.CaseDef;
import net.neoforged.rewrite.api.tree.ClassDef;
import net.neoforged.rewrite.api.tree.CompilationUnit;
import net.neoforged.rewrite.api.tree.DefDef;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.If;
import net.neoforged.rewrite.api.tree.Literal;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.ModuleDef;
import net.neoforged.rewrite.api.tree.New;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Super;
import net.neoforged.rewrite.api.tree.Template;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TypeApply;
import net.neoforged.rewrite.api.tree.TypeDef;
import net.neoforged.rewrite.api.tree.TypeTree;
import net.neoforged.rewrite.api.tree.ValDef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the source of a tree into fragments.
 * <p>
 * Every tree is visited once. What a tree contributes is decided by handing {@link Site sites} (the
 * tree in one of its {@link Role roles}) through a chain of {@link Contribution contributions}:
 * requisites, modifiers, scopes, leaves and finally the descent into children. Partitioning never
 * fails: trees it does not know are reported and only their children are visited.
 */
public final class Partitioner {
    static final ProblemGroup PROBLEM_GROUP = ProblemGroup.create("partitioning", "Partitioning", ProblemGroup.REWRITE);
    static final ProblemId UNKNOWN_TREE = ProblemId.create("unknown-tree", "Unknown Tree", PROBLEM_GROUP);
    static final ProblemId MISSING_DELIMITER = ProblemId.create("missing-delimiter", "Missing Delimiter", PROBLEM_GROUP);

    private final RewriteContext context;
    private final Contribution chain;

    public Partitioner(RewriteContext context) {
        this.context = context;
        this.chain = new RequisitesContribution(this,
                new ModifiersContribution(this,
                        new ScopeContribution(this,
                                new FragmentContribution(this,
                                        new BasicContribution(this, null)))));
    }

    /**
     * Partitions the source file of {@code root}.
     *
     * @return the scope covering the whole file
     * @throws IllegalArgumentException if {@code root} has no source text
     */
    public TreeScope partition(Tree root) {
        return partition(root, null);
    }

    /**
     * Partitions {@code root}, reusing the scopes recorded in {@code repository} for trees that kept
     * their position. This keeps the scope anchors of an edited tree identical to the original ones.
     */
    TreeScope partition(Tree root, @Nullable FragmentRepository repository) {
        if (!root.position().isRange()) {
            throw new IllegalArgumentException("Cannot partition a tree without source text: " + root.position());
        }
        var partitionContext = new PartitionContext(context, root.position().source(), repository);
        var scope = partitionContext.openRoot(root);
        traverse(root, partitionContext);
        partitionContext.finish();
        return scope;
    }

    void handle(Site site, PartitionContext context) {
        chain.handle(site, context);
    }

    void traverse(Tree tree, PartitionContext context) {
        if (tree.isEmpty() || tree.position().isTransparent()) {
            return;
        }

        if (tree instanceof CompilationUnit unit) {
            traverseAll(unit.stats(), Role.STMTS_SEPARATOR, context);
        } else if (tree instanceof ClassDef || tree instanceof ModuleDef) {
            handle(new Site(tree, Role.ITSELF), context);
        } else if (tree instanceof Template template) {
            traverseTemplate(template, context);
        } else if (tree instanceof DefDef defDef) {
            handle(new Site(tree, Role.MODS), context);
            handle(new Site(tree, Role.ITSELF), context);
            for (var vparams : defDef.vparamss()) {
                handle(new Site(tree, Role.PARAM_LIST, vparams), context);
            }
            if (isPrintable(defDef.tpt())) {
                handle(new Site(tree, Role.TPT, defDef.tpt()), context);
            }
            if (!defDef.rhs().isEmpty()) {
                handle(new Site(tree, Role.RHS, defDef.rhs()), context);
            }
        } else if (tree instanceof ValDef valDef) {
            handle(new Site(tree, Role.MODS), context);
            handle(new Site(tree, Role.ITSELF), context);
            if (isPrintable(valDef.tpt())) {
                handle(new Site(tree, Role.TPT, valDef.tpt()), context);
            }
            if (!valDef.rhs().isEmpty()) {
                handle(new Site(tree, Role.RHS, valDef.rhs()), context);
            }
        } else if (tree instanceof TypeDef typeDef) {
            handle(new Site(tree, Role.MODS), context);
            handle(new Site(tree, Role.ITSELF), context);
            handle(new Site(tree, Role.RHS, typeDef.rhs()), context);
        } else if (tree instanceof Select select) {
            if (select.isPrefixOperator()) {
                handle(new Site(tree, Role.ITSELF), context);
                traverse(select.qualifier(), context);
            } else {
                traverse(select.qualifier(), context);
                handle(new Site(tree, Role.ITSELF), context);
            }
        } else if (tree instanceof Block block) {
            var stats = new ArrayList<Tree>(block.stats());
            stats.add(block.expr());
            handle(new Site(tree, Role.BLOCK_BODY, stats), context);
        } else if (tree instanceof If ifTree) {
            handle(new Site(tree, Role.COND, ifTree.cond()), context);
            handle(new Site(tree, Role.THEN, ifTree.thenp()), context);
            if (!ifTree.elsep().isEmpty()) {
                handle(new Site(tree, Role.ELSE, ifTree.elsep()), context);
            }
        } else if (tree instanceof New newTree) {
            handle(new Site(tree, Role.ITSELF), context);
            traverse(newTree.tpt(), context);
        } else if (tree instanceof Apply || tree instanceof TypeApply || tree instanceof Match
                || tree instanceof Ident || tree instanceof Literal || tree instanceof Super || tree instanceof TypeTree) {
            handle(new Site(tree, Role.ITSELF), context);
        } else if (tree instanceof CaseDef caseDef) {
            handle(new Site(tree, Role.PATTERN, caseDef.pat()), context);
            handle(new Site(tree, Role.CASE_BODY, caseDef.body()), context);
        } else {
            context.report(UNKNOWN_TREE, ProblemSeverity.WARNING, tree.position(),
                    "Cannot partition " + tree.getClass().getName() + ", visiting its children only");
            tree.children().forEach(child -> traverse(child, context));
        }
    }

    /**
     * Traverses the visible trees among {@code trees}, handing a {@code separator} site to the chain
     * between each two of them.
     */
    void traverseAll(List<? extends Tree> trees, Role separator, PartitionContext context) {
        var visible = trees.stream()
                .filter(tree -> !tree.isEmpty() && !tree.position().isTransparent())
                .toList();
        for (int i = 0; i < visible.size(); i++) {
            var tree = visible.get(i);
            traverse(tree, context);
            if (i < visible.size() - 1) {
                handle(new Site(tree, separator), context);
            }
        }
    }

    private void traverseTemplate(Template template, PartitionContext context) {
        var params = new ArrayList<Tree>();
        var early = earlyDefinitions(template);
        var body = new ArrayList<Tree>();
        for (var stat : template.body()) {
            if (isClassParameter(stat)) {
                params.add(stat);
            } else if (!early.contains(stat)) {
                body.add(stat);
            }
        }

        handle(new Site(template, Role.CLASS_PARAMS, params), context);
        traverseAll(early, Role.STMTS_SEPARATOR, context);
        if (!template.parents().isEmpty()) {
            handle(new Site(template, Role.PARENTS, template.parents()), context);
        }
        handle(new Site(template, Role.CLASS_BODY, body), context);
    }

    /**
     * Locates the parentheses of a call's argument list. A call keeps the span recorded for it by an
     * earlier partition even when it lost all its arguments.
     *
     * @param report whether a call without parentheses is reported as a problem
     * @return the span from the opening to after the closing parenthesis, or {@code null} if the call
     * has no literal parentheses to reuse
     */
    @Nullable
    Span parenSpan(Apply apply, PartitionContext context, boolean report) {
        if (!apply.position().isRange() || apply.isInfix()) {
            return null;
        }
        var recorded = context.recordedScope(apply);
        if (recorded != null) {
            return new Span(recorded.start(), recorded.end());
        }
        if (apply.args().isEmpty() || !apply.fun().position().isRange()) {
            return null;
        }
        var source = context.source();
        var open = SourceHelper.skipLayoutTo(source, '(', apply.fun().position().end());
        int end = apply.position().end();
        if (open.isEmpty() || end == 0 || source.charAt(end - 1) != ')') {
            if (report) {
                context.report(MISSING_DELIMITER, ProblemSeverity.INFO, apply.position(), "No parentheses found around arguments");
            }
            return null;
        }
        return new Span(open.getAsInt(), end);
    }

    static boolean isImplDef(Tree tree) {
        return tree instanceof ClassDef || tree instanceof ModuleDef;
    }

    static boolean hasModifiers(Tree tree) {
        if (!(tree instanceof DefTree def)) {
            return false;
        }
        var mods = def.mods();
        return !mods.positions().isEmpty() || !mods.unpositionedFlags().isEmpty() || !mods.annotations().isEmpty();
    }

    static boolean isClassParameter(Tree tree) {
        return tree instanceof ValDef valDef
                && (valDef.mods().hasFlag(Flag.PARAMACCESSOR) || valDef.mods().hasFlag(Flag.CASEACCESSOR));
    }

    /**
     * @return definitions written between {@code extends} and the first parent
     */
    static List<Tree> earlyDefinitions(Template template) {
        var result = new ArrayList<Tree>();
        for (var stat : template.body()) {
            if (!isClassParameter(stat) && stat.position().isRange()
                    && template.parents().stream().anyMatch(parent -> stat.position().precedes(parent.position()))) {
                result.add(stat);
            }
        }
        return result;
    }

    private static boolean isPrintable(Tree tpt) {
        if (tpt.isEmpty() || tpt.position().isTransparent()) {
            return false;
        }
        return !(tpt instanceof TypeTree typeTree) || !typeTree.name().isEmpty() || tpt.position().isRange();
    }

    record Span(int start, int end) {
    }
}
