package net.neoforged.rewrite.tests;

import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.EmptyTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.Modifiers;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TreeTransformations;
import net.neoforged.rewrite.api.tree.Trees;
import net.neoforged.rewrite.transform.Transformation;
import net.neoforged.rewrite.transform.Transformations;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An edit read from the {@code edit.json} of a test case.
 */
record Edit(
        String operation,
        String target,
        @Nullable String name,
        @Nullable String other,
        @Nullable String modifier,
        @Nullable String parameter,
        @Nullable String type,
        @Nullable Integer index,
        @Nullable Integer value
) {
    /**
     * @return the transformation performing this edit on {@code root}, or {@code null} if {@code root}
     * does not contain the target
     */
    @Nullable
    Transformation<Tree, Tree> toTransformation(Tree root) {
        var definition = Trees.findDefinition(root, target).orElse(null);
        switch (operation) {
            case "rename":
                return definition == null ? null : TreeTransformations.renameSymbol(definition.symbol(), required(name));
            case "remove_statement":
                return definition == null ? null : TreeTransformations.filterStatements(definition::equals);
            case "insert_value": {
                if (definition == null) {
                    return null;
                }
                var inserted = Trees.valDef(Modifiers.EMPTY, required(name), EmptyTree.INSTANCE, Trees.literal(required(value)));
                return TreeTransformations.replaceStatements(List.of(definition), List.of(definition, inserted));
            }
            case "swap_statements": {
                var second = Trees.findDefinition(root, required(other)).orElse(null);
                if (definition == null || second == null) {
                    return null;
                }
                return TreeTransformations.replaceStatements(List.of(definition, second), List.of(second, definition));
            }
            case "remove_modifier": {
                if (definition == null) {
                    return null;
                }
                var flag = Objects.requireNonNull(Flag.fromKeyword(required(modifier)), "Unknown modifier " + modifier);
                return TreeTransformations.changeModifiers(definition.symbol(), mods -> mods.withoutFlag(flag));
            }
            case "remove_argument":
                return editCalls(args -> {
                    var remaining = new ArrayList<>(args);
                    remaining.remove((int) required(index));
                    return remaining;
                });
            case "append_argument":
                return editCalls(args -> {
                    var extended = new ArrayList<>(args);
                    extended.add(Trees.ident(required(name)));
                    return extended;
                });
            case "insert_method": {
                if (definition == null) {
                    return null;
                }
                var param = Trees.param(required(parameter), Trees.ident(required(type)));
                var method = Trees.defDef(Modifiers.EMPTY, required(name), List.of(List.of(param)), Trees.ident(required(type)),
                        Trees.infix(Trees.ident(required(parameter)), "*", Trees.literal(required(value))));
                return TreeTransformations.replaceStatements(List.of(definition), List.of(definition, method));
            }
            default:
                throw new IllegalArgumentException("Unknown edit operation " + operation);
        }
    }

    private Transformation<Tree, Tree> editCalls(UnaryOperator<List<Tree>> mapper) {
        return Transformations.everywhere(Transformations.<Tree, Tree>transform(tree ->
                tree instanceof Apply apply && apply.fun() instanceof Ident fun && fun.name().equals(target)
                        ? apply.withArgs(mapper.apply(apply.args()))
                        : null));
    }

    private <T> T required(@Nullable T field) {
        if (field == null) {
            throw new IllegalArgumentException("Edit " + operation + " is missing a required field");
        }
        return field;
    }
}
