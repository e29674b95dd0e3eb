package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.transform.Sequences;
import net.neoforged.rewrite.transform.Transformation;
import net.neoforged.rewrite.transform.Transformations;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static net.neoforged.rewrite.transform.Transformations.everywhere;
import static net.neoforged.rewrite.transform.Transformations.forAllChildren;

/**
 * Ready-made transformations of trees. Edited nodes keep their positions, so the layout of everything
 * around an edit is preserved when the tree is regenerated.
 */
public final class TreeTransformations {
    private TreeTransformations() {
    }

    /**
     * Replaces every subtree equal to {@code from} with {@code to}. The replacement itself is not searched
     * again, so {@code to} may contain {@code from}.
     */
    public static Transformation<Tree, Tree> replaceTree(Tree from, Tree to) {
        return new Transformation<>() {
            @Override
            public Optional<Tree> apply(Tree tree) {
                return tree.equals(from) ? Optional.of(to) : forAllChildren(this).apply(tree);
            }
        };
    }

    /**
     * Removes all statements matching {@code remove} from blocks, class bodies and compilation units.
     */
    public static Transformation<Tree, Tree> filterStatements(Predicate<? super Tree> remove) {
        return mapStatements(stats -> stats.stream().filter(remove.negate()).toList());
    }

    /**
     * Replaces the statements {@code what} with {@code replacement} in every statement list that contains
     * the first of them. See {@link Sequences#replace(List, List, List)}.
     */
    public static Transformation<Tree, Tree> replaceStatements(List<Tree> what, List<Tree> replacement) {
        if (what.isEmpty()) {
            throw new IllegalArgumentException("Nothing to replace");
        }
        return mapStatements(stats -> stats.contains(what.get(0)) ? Sequences.replace(stats, what, replacement) : stats);
    }

    /**
     * Applies {@code mapper} to the statements of every block, class body and compilation unit.
     */
    public static Transformation<Tree, Tree> mapStatements(UnaryOperator<List<Tree>> mapper) {
        return everywhere(Transformations.<Tree, Tree>transform(tree -> {
            if (tree instanceof Block block) {
                return block.withStats(mapper.apply(block.stats()));
            } else if (tree instanceof Template template) {
                return template.withBody(mapper.apply(template.body()));
            } else if (tree instanceof CompilationUnit unit) {
                return unit.withStats(mapper.apply(unit.stats()));
            }
            return null;
        }));
    }

    /**
     * Renames the definition of {@code symbol} and every reference to it.
     */
    public static Transformation<Tree, Tree> renameSymbol(Symbol symbol, String newName) {
        return everywhere(Transformations.<Tree, Tree>transform(tree -> {
            if (tree instanceof DefTree def && def.symbol() == symbol) {
                return def.withName(newName);
            } else if (tree instanceof RefTree ref && ref.symbol() == symbol) {
                return ref.withName(newName);
            }
            return null;
        }));
    }

    /**
     * Applies {@code mapper} to the modifiers of the definition of {@code symbol}.
     */
    public static Transformation<Tree, Tree> changeModifiers(Symbol symbol, UnaryOperator<Modifiers> mapper) {
        return everywhere(Transformations.<Tree, Tree>transform(tree -> tree instanceof DefTree def && def.symbol() == symbol
                ? def.withMods(mapper.apply(def.mods()))
                : null));
    }
}
