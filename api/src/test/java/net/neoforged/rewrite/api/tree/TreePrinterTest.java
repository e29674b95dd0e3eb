package net.neoforged.rewrite.api.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreePrinterTest {
    @Test
    void testTokens() {
        assertThat(TreePrinter.token(Trees.literal("a\"b"))).isEqualTo("\"a\\\"b\"");
        assertThat(TreePrinter.token(Trees.literal('c'))).isEqualTo("'c'");
        assertThat(TreePrinter.token(Trees.literal(3L))).isEqualTo("3L");
        assertThat(TreePrinter.token(Trees.literal(null))).isEqualTo("null");
        assertThat(TreePrinter.token(Trees.select(Trees.ident("a"), "unary_!"))).isEqualTo("!");
    }

    @Test
    void testSyntheticText() {
        var param = Trees.param("a", new TypeTree(net.neoforged.rewrite.api.Position.synthetic(), "Int"));
        var variable = Trees.valDef(Modifiers.of(Flag.MUTABLE), "v", EmptyTree.INSTANCE, Trees.literal(1));

        assertThat(TreePrinter.syntheticText(param)).isEqualTo("a");
        assertThat(TreePrinter.syntheticText(variable)).isEqualTo("var v");
    }

    @Test
    void testPrintMethod() {
        var intType = new TypeTree(net.neoforged.rewrite.api.Position.synthetic(), "Int");
        var a = Trees.param("a", intType);
        var body = Trees.block(
                List.of(Trees.apply(Trees.ident("println"), Trees.ident(a.symbol()))),
                Trees.infix(Trees.ident(a.symbol()), "*", Trees.literal(2)));
        var method = Trees.defDef(Modifiers.of(Flag.PRIVATE), "twice", List.of(List.of(a)), intType, body);

        assertThat(TreePrinter.print(method)).isEqualTo("""
                private def twice(a: Int): Int = {
                  println(a)
                  a * 2
                }""");
    }
}
