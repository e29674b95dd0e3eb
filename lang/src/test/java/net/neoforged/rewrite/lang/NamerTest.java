package net.neoforged.rewrite.lang;

import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.CompilationUnit;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.RefTree;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Symbol;
import net.neoforged.rewrite.api.tree.Trees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NamerTest {
    private static CompilationUnit parse(String text) throws SourceParseException {
        return SourceReader.parse(new SourceFile("Test.scala", text));
    }

    private static Symbol definition(CompilationUnit unit, String name) {
        return Trees.findDefinition(unit, name).map(DefTree::symbol).orElseThrow();
    }

    private static List<Symbol> references(CompilationUnit unit, String name) {
        return Trees.preorder(unit)
                .filter(tree -> tree instanceof RefTree ref && ref.name().equals(name))
                .map(tree -> ((RefTree) tree).symbol())
                .toList();
    }

    @Test
    void testForwardReferencesInTemplates() throws Exception {
        var unit = parse("""
                object A {
                  def f = g + 1
                  def g = 2
                }
                """);

        assertThat(references(unit, "g")).containsExactly(definition(unit, "g"));
    }

    @Test
    void testParametersShadowMembers() throws Exception {
        var unit = parse("""
                class A(x: Int) {
                  def f(x: Int) = x
                  def g = x
                }
                """);

        var refs = references(unit, "x");
        assertThat(refs).hasSize(2);
        assertThat(refs.get(0).kind()).isEqualTo(Symbol.Kind.PARAMETER);
        assertThat(refs.get(1).kind()).isEqualTo(Symbol.Kind.VALUE);
        assertThat(refs.get(1).owner()).isSameAs(definition(unit, "A"));
    }

    @Test
    void testSelectionsOfObjectMembers() throws Exception {
        var unit = parse("""
                object Util {
                  def twice(i: Int) = i * 2
                }
                object Main {
                  val four = Util.twice(2)
                }
                """);

        var select = Trees.find(unit, Select.class, s -> s.name().equals("twice")).orElseThrow();
        assertThat(select.symbol()).isSameAs(definition(unit, "twice"));
        assertThat(((Ident) select.qualifier()).symbol()).isSameAs(definition(unit, "Util"));
    }

    @Test
    void testUnresolvedNamesShareOneSymbol() throws Exception {
        var unit = parse("""
                println(1)
                println(2)
                """);

        var refs = references(unit, "println");
        assertThat(refs).hasSize(2);
        assertThat(refs.get(0)).isSameAs(refs.get(1));
        assertThat(refs.get(0).isExternal()).isTrue();
    }

    @Test
    void testBlockLocalsAreNotVisibleOutside() throws Exception {
        var unit = parse("""
                val a = {
                  val b = 1
                  b
                }
                val c = b
                """);

        var refs = references(unit, "b");
        assertThat(refs).hasSize(2);
        assertThat(refs.get(0)).isSameAs(definition(unit, "b"));
        assertThat(refs.get(1).isExternal()).isTrue();
    }
}
