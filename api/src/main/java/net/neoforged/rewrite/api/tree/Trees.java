package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Helpers for building and inspecting trees.
 */
public final class Trees {
    private Trees() {
    }

    /**
     * @return all trees of {@code root} in pre-order, {@code root} first
     */
    public static Stream<Tree> preorder(Tree root) {
        return Stream.concat(Stream.of(root), root.children().stream().flatMap(Trees::preorder));
    }

    public static <T extends Tree> Optional<T> find(Tree root, Class<T> type, Predicate<? super T> predicate) {
        return preorder(root)
                .filter(type::isInstance)
                .map(type::cast)
                .filter(predicate)
                .findFirst();
    }

    public static Optional<DefTree> findDefinition(Tree root, String name) {
        return find(root, DefTree.class, def -> def.name().equals(name));
    }

    /**
     * Creates a reference to an entity that is declared outside the rewritten source.
     */
    public static Ident ident(String name) {
        return new Ident(Position.synthetic(), name, Symbol.external(name));
    }

    public static Ident ident(Symbol symbol) {
        return new Ident(Position.synthetic(), symbol.name(), symbol);
    }

    public static Literal literal(Object value) {
        return new Literal(Position.synthetic(), value);
    }

    public static Select select(Tree qualifier, String name) {
        return new Select(Position.synthetic(), qualifier, name, Symbol.external(name));
    }

    public static Apply apply(Tree fun, Tree... args) {
        return new Apply(Position.synthetic(), fun, List.of(args));
    }

    public static Apply infix(Tree left, String operator, Tree right) {
        return apply(select(left, operator), right);
    }

    public static Block block(List<Tree> stats, Tree expr) {
        return new Block(Position.synthetic(), stats, expr);
    }

    public static ValDef param(String name, Tree tpt) {
        var symbol = new Symbol(name, Symbol.Kind.PARAMETER, null, Set.of(Flag.PARAM), Position.synthetic());
        return new ValDef(Position.synthetic(), Modifiers.of(Flag.PARAM), name, tpt, EmptyTree.INSTANCE, symbol);
    }

    public static ValDef valDef(Modifiers mods, String name, Tree tpt, Tree rhs) {
        var kind = mods.hasFlag(Flag.PARAM) ? Symbol.Kind.PARAMETER : Symbol.Kind.VALUE;
        var symbol = new Symbol(name, kind, null, mods.flags(), Position.synthetic());
        return new ValDef(Position.synthetic(), mods, name, tpt, rhs, symbol);
    }

    public static DefDef defDef(Modifiers mods, String name, List<List<ValDef>> vparamss, Tree tpt, Tree rhs) {
        var symbol = new Symbol(name, Symbol.Kind.METHOD, null, mods.flags(), Position.synthetic());
        return new DefDef(Position.synthetic(), mods, name, vparamss, tpt, rhs, symbol);
    }

    static <T extends Tree> T cast(Tree child, Class<T> type, Tree owner) {
        if (!type.isInstance(child)) {
            throw new IllegalArgumentException("Cannot use " + child.getClass().getSimpleName() + " as a "
                    + type.getSimpleName() + " child of " + owner.getClass().getSimpleName());
        }
        return type.cast(child);
    }

    static <T extends Tree> List<T> mapAll(List<T> trees, UnaryOperator<Tree> mapper, Class<T> type, Tree owner) {
        var result = new ArrayList<T>(trees.size());
        for (var tree : trees) {
            result.add(cast(mapper.apply(tree), type, owner));
        }
        return result;
    }

    static List<Tree> concat(List<? extends Tree> first, List<? extends Tree> second) {
        var result = new ArrayList<Tree>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return List.copyOf(result);
    }

    static List<Tree> concat(List<? extends Tree> first, Tree... rest) {
        return concat(first, Arrays.asList(rest));
    }
}
