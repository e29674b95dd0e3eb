package net.neoforged.rewrite.lang;

import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.Block;
import net.neoforged.rewrite.api.tree.ClassDef;
import net.neoforged.rewrite.api.tree.DefDef;
import net.neoforged.rewrite.api.tree.EmptyTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.If;
import net.neoforged.rewrite.api.tree.Literal;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.ModuleDef;
import net.neoforged.rewrite.api.tree.New;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TypeTree;
import net.neoforged.rewrite.api.tree.ValDef;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SourceReaderTest {
    private static Tree parseSingle(String text) throws SourceParseException {
        var unit = new SourceReader(new SourceFile("Test.scala", text)).read();
        assertThat(unit.stats()).hasSize(1);
        return unit.stats().get(0);
    }

    private static String text(Tree tree) {
        return tree.position().text();
    }

    @Nested
    class Definitions {
        @Test
        void testMethodSpansFromFirstModifier() throws Exception {
            var def = (DefDef) parseSingle("@inline private def f(a: Int, b: String): Int = a");

            assertThat(text(def)).isEqualTo("@inline private def f(a: Int, b: String): Int = a");
            assertThat(def.position().point()).isEqualTo(20);
            assertThat(def.mods().hasFlag(Flag.PRIVATE)).isTrue();
            assertThat(def.mods().positions().get(Flag.PRIVATE).text()).isEqualTo("private");
            assertThat(def.mods().annotations()).extracting(TreeTexts::of).containsExactly("inline");
            assertThat(def.vparamss()).hasSize(1);
            assertThat(def.vparamss().get(0)).extracting(TreeTexts::of).containsExactly("a: Int", "b: String");
            assertThat(def.vparamss().get(0).get(0).mods().hasFlag(Flag.PARAM)).isTrue();
            assertThat(text(def.tpt())).isEqualTo("Int");
            assertThat(text(def.rhs())).isEqualTo("a");
        }

        @Test
        void testInferredTypeAndAbsentBody() throws Exception {
            var def = (DefDef) parseSingle("def f");

            assertThat(def.vparamss()).isEmpty();
            assertThat(def.tpt()).isInstanceOf(TypeTree.class);
            assertThat(def.tpt().position().isTransparent()).isTrue();
            assertThat(def.rhs()).isSameAs(EmptyTree.INSTANCE);
        }

        @Test
        void testVariable() throws Exception {
            var valDef = (ValDef) parseSingle("lazy var x = 1");

            assertThat(valDef.mods().hasFlag(Flag.MUTABLE)).isTrue();
            assertThat(valDef.mods().hasFlag(Flag.LAZY)).isTrue();
            assertThat(valDef.mods().unpositionedFlags()).isEmpty();
            assertThat(((Literal) valDef.rhs()).value()).isEqualTo(1);
        }

        @Test
        void testCaseClassWithParents() throws Exception {
            var classDef = (ClassDef) parseSingle("case class A(x: Int) extends B(x) with C {\n  def y = x\n}");

            assertThat(classDef.position().start()).isEqualTo(5);
            assertThat(classDef.mods().hasFlag(Flag.CASE)).isTrue();
            assertThat(classDef.impl().parents()).extracting(TreeTexts::of).containsExactly("B(x)", "C");
            assertThat(classDef.impl().body()).hasSize(2);
            var param = (ValDef) classDef.impl().body().get(0);
            assertThat(param.mods().hasFlag(Flag.PARAMACCESSOR)).isTrue();
            assertThat(param.mods().hasFlag(Flag.CASEACCESSOR)).isTrue();
            assertThat(classDef.impl().position().start()).isEqualTo(param.position().start());
        }

        @Test
        void testEarlyDefinitions() throws Exception {
            var module = (ModuleDef) parseSingle("object A extends { val x = 1 } with B");

            assertThat(module.impl().body()).extracting(TreeTexts::of).containsExactly("val x = 1");
            assertThat(module.impl().parents()).extracting(TreeTexts::of).containsExactly("B");
        }

        @Test
        void testEmptyTemplateFollowsName() throws Exception {
            var module = (ModuleDef) parseSingle("object A");

            assertThat(module.impl().position().start()).isEqualTo(8);
            assertThat(module.impl().position().length()).isZero();
        }
    }

    @Nested
    class Expressions {
        @Test
        void testOperatorPrecedence() throws Exception {
            var sum = (Apply) parseSingle("a + b * c");

            assertThat(sum.isInfix()).isTrue();
            assertThat(((Select) sum.fun()).name()).isEqualTo("+");
            assertThat(text(sum.fun())).isEqualTo("a +");
            assertThat(sum.fun().position().point()).isEqualTo(2);
            assertThat(text(sum.args().get(0))).isEqualTo("b * c");
        }

        @Test
        void testPrefixOperator() throws Exception {
            var not = (Select) parseSingle("!done");

            assertThat(not.isPrefixOperator()).isTrue();
            assertThat(not.name()).isEqualTo("unary_!");
            assertThat(not.position().start()).isZero();
            assertThat(not.qualifier().position().start()).isEqualTo(1);
        }

        @Test
        void testSelectionsAndCalls() throws Exception {
            var call = (Apply) parseSingle("new A(1).foo(x,\n  y)");

            assertThat(call.args()).extracting(TreeTexts::of).containsExactly("x", "y");
            var select = (Select) call.fun();
            assertThat(select.position().point()).isEqualTo(9);
            var creation = (Apply) select.qualifier();
            assertThat(creation.fun()).isInstanceOf(New.class);
            assertThat(text(creation.fun())).isEqualTo("new A");
        }

        @Test
        void testBlockEndingInDefinition() throws Exception {
            var block = (Block) parseSingle("{\n  f()\n  val x = 1\n}");

            assertThat(text(block)).startsWith("{").endsWith("}");
            assertThat(block.stats()).hasSize(2);
            assertThat(block.expr()).isSameAs(EmptyTree.INSTANCE);
        }

        @Test
        void testIfAndMatch() throws Exception {
            var ifTree = (If) parseSingle("if (a)\n  b\nelse c match {\n  case 1 => \"one\"\n  case _ => \"other\"\n}");

            assertThat(text(ifTree.cond())).isEqualTo("a");
            var match = (Match) ifTree.elsep();
            assertThat(match.cases()).extracting(TreeTexts::of).containsExactly("case 1 => \"one\"", "case _ => \"other\"");
        }

        @Test
        void testLiterals() throws Exception {
            var unit = new SourceReader(new SourceFile("Test.scala", "1L\n2.5\n'c'\n\"a\\nb\"\ntrue\nnull")).read();

            assertThat(unit.stats()).extracting(tree -> ((Literal) tree).value())
                    .containsExactly(1L, 2.5, 'c', "a\nb", true, null);
        }
    }

    @Nested
    class Errors {
        @Test
        void testStatementsNeedLineBreaks() {
            var e = assertThrows(SourceParseException.class, () -> parseSingle("val a = 1 val b = 2"));
            assertThat(e.line).isEqualTo(1);
            assertThat(e.column).isEqualTo(11);
            assertThat(e).hasMessage("1:11: Expected line break before 'val' token");
        }

        @Test
        void testUnexpectedEndOfFile() {
            var e = assertThrows(SourceParseException.class, () -> parseSingle("object A {\n  def f(a: Int"));
            assertThat(e.line).isEqualTo(2);
            assertThat(e).hasMessageEndingWith("Expected ')' before end of file");
        }

        @Test
        void testUnterminatedString() {
            var e = assertThrows(SourceParseException.class, () -> parseSingle("val s = \"abc\n"));
            assertThat(e).hasMessage("1:9: Unexpected end of string");
        }

        @Test
        void testKeywordAsName() {
            assertThrows(SourceParseException.class, () -> parseSingle("val class = 1"));
        }

        @Test
        void testModifierWithoutDefinition() {
            var e = assertThrows(SourceParseException.class, () -> parseSingle("private x"));
            assertThat(e).hasMessage("1:9: Expected definition before 'x' token");
        }
    }

    private static final class TreeTexts {
        static String of(Tree tree) {
            return tree.position().text();
        }
    }
}
