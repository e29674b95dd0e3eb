package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TreeTransformationsTest {
    // object A {
    //   val x = 1
    //   x + x
    // }
    private static final SourceFile SOURCE = new SourceFile("Test.scala", "object A {\n  val x = 1\n  x + x\n}");

    private final Symbol xSymbol = new Symbol("x", Symbol.Kind.VALUE, null, Set.of(), Position.range(SOURCE, 13, 17, 22));
    private final ValDef xDef = new ValDef(Position.range(SOURCE, 13, 17, 22), Modifiers.EMPTY, "x",
            new TypeTree(Position.transparent(SOURCE, 17, 17, 17), ""), new Literal(Position.range(SOURCE, 21, 22), 1), xSymbol);
    private final Ident left = new Ident(Position.range(SOURCE, 25, 26), "x", xSymbol);
    private final Ident right = new Ident(Position.range(SOURCE, 29, 30), "x", xSymbol);
    private final Apply sum = new Apply(Position.range(SOURCE, 25, 30),
            new Select(Position.range(SOURCE, 25, 27, 28), left, "+", Symbol.external("+")), List.of(right));
    private final ModuleDef module = new ModuleDef(Position.range(SOURCE, 0, 7, 32), Modifiers.EMPTY, "A", null,
            new Template(Position.range(SOURCE, 9, 32), List.of(), List.of(xDef, sum)));

    @Test
    void testRenameSymbol() {
        var renamed = TreeTransformations.renameSymbol(xSymbol, "y").apply(module).orElseThrow();

        var names = Trees.preorder(renamed)
                .filter(tree -> tree instanceof DefTree || tree instanceof Ident)
                .map(tree -> tree instanceof DefTree def ? def.name() : ((Ident) tree).name())
                .toList();
        assertThat(names).containsExactly("A", "y", "y", "y");
        assertThat(Trees.find(renamed, Ident.class, ident -> true).orElseThrow().position()).isEqualTo(left.position());
    }

    @Test
    void testFilterStatements() {
        var filtered = TreeTransformations.filterStatements(tree -> tree instanceof Apply).apply(module).orElseThrow();

        assertThat(((ModuleDef) filtered).impl().body()).containsExactly(xDef);
    }

    @Test
    void testReplaceTreeDoesNotRecurseIntoReplacement() {
        var negated = new Select(Position.synthetic(), left, Names.UNARY_PREFIX + "-", Symbol.external("unary_-"));
        var replaced = TreeTransformations.replaceTree(left, negated).apply(module).orElseThrow();

        var apply = Trees.find(replaced, Apply.class, tree -> true).orElseThrow();
        assertThat(((Select) apply.fun()).qualifier()).isEqualTo(negated);
        assertThat(apply.args()).containsExactly(right);
    }

    @Test
    void testReplaceStatements() {
        var call = Trees.apply(Trees.ident("println"), Trees.literal("sum"));
        var replaced = TreeTransformations.replaceStatements(List.of(sum), List.of(call, sum)).apply(module).orElseThrow();

        assertThat(((ModuleDef) replaced).impl().body()).containsExactly(xDef, call, sum);
    }

    @Test
    void testChangeModifiers() {
        var changed = TreeTransformations.changeModifiers(xSymbol, mods -> mods.withFlag(Flag.LAZY)).apply(module).orElseThrow();

        var definition = (ValDef) Trees.findDefinition(changed, "x").orElseThrow();
        assertThat(definition.mods().hasFlag(Flag.LAZY)).isTrue();
    }

    @Test
    void testRebuildWithWrongChildKind() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> module.withChildren(tree -> tree instanceof Template ? Trees.literal(0) : tree));
        assertThat(e).hasMessage("Cannot use Literal as a Template child of ModuleDef");
    }
}
