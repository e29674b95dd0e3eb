package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.ProblemId;
import net.neoforged.rewrite.api.ProblemLocation;
import net.neoforged.rewrite.api.ProblemReporter;
import net.neoforged.rewrite.api.ProblemSeverity;
import net.neoforged.rewrite.api.RewriteContext;
import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.Logger;
import net.neoforged.rewrite.api.tree.CompilationUnit;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TreeTransformations;
import net.neoforged.rewrite.api.tree.Trees;
import net.neoforged.rewrite.lang.SourceParseException;
import net.neoforged.rewrite.lang.SourceReader;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PartitionerTest {
    private static final String SAMPLE = """
            // leading comment
            class B(x: Int, y: Int) extends A(x) with C {
              @deprecated private val z = x + y
              override def f(a: Int): Int = {
                if (a > z) a else -a
              }
              def g = new B(1, 2).f(z)
              val h = super.f match {
                case 1 => "one"
                case 2 => "two"
              }
            }
            """;

    private static CompilationUnit parse(String text) throws SourceParseException {
        return SourceReader.parse(new SourceFile("Test.scala", text));
    }

    private static TreeScope partition(Tree root) {
        return new Partitioner(RewriteContext.DEFAULT).partition(root);
    }

    private static List<Fragment> leaves(Scope scope) {
        var result = new ArrayList<Fragment>();
        for (var child : scope.children()) {
            if (child instanceof Scope nested) {
                result.addAll(leaves(nested));
            } else {
                result.add(child);
            }
        }
        return result;
    }

    private static String text(Fragment fragment) {
        if (fragment instanceof SourceFragment leaf) {
            return leaf.text();
        } else if (fragment instanceof FlagFragment flag) {
            return flag.text();
        } else if (fragment instanceof ArtificialFragment artificial) {
            return artificial.text();
        }
        throw new AssertionError("Unexpected leaf " + fragment);
    }

    private static void assertWellFormed(Scope scope) {
        int cursor = scope.isOriginal() ? scope.start() : -1;
        for (var child : scope.children()) {
            if (child.isOriginal()) {
                assertThat(child.start()).as("start of %s", child).isGreaterThanOrEqualTo(cursor);
                assertThat(child.end()).as("end of %s", child).isGreaterThanOrEqualTo(child.start());
                if (scope.isOriginal()) {
                    assertThat(child.end()).as("end of %s in %s", child, scope).isLessThanOrEqualTo(scope.end());
                }
                cursor = child.end();
            }
            if (child instanceof Scope nested) {
                assertThat(nested.parent()).isSameAs(scope);
                assertWellFormed(nested);
            }
        }
    }

    @Test
    void testRootSpansWholeSource() throws Exception {
        var unit = parse(SAMPLE);
        var root = partition(unit);

        assertThat(root.start()).isEqualTo(0);
        assertThat(root.end()).isEqualTo(SAMPLE.length());
        assertThat(root.tree()).isSameAs(unit);
        assertThat(root.parent()).isNull();
    }

    @Test
    void testFragmentsAreOrderedAndNested() throws Exception {
        assertWellFormed(partition(parse(SAMPLE)));
    }

    @Test
    void testLeavesFollowSourceOrder() throws Exception {
        var root = partition(parse("""
                object A {
                  private val x = 1
                  def f(a: Int) = a + x
                }
                """));

        assertThat(leaves(root)).extracting(PartitionerTest::text)
                .containsExactly("A", "private", "x", "1", "f", "a", "Int", "a", "+", "x");
    }

    @Test
    void testLeavesCarryRequisites() throws Exception {
        var root = partition(parse("""
                object A {
                  def f(a: Int, b: Int) = a
                }
                """));
        var leaves = leaves(root);

        var firstParam = leaves.get(2);
        assertThat(text(firstParam)).isEqualTo("a");
        assertThat(firstParam.requiredBefore()).extracting(Requisite::check).containsExactly("(");

        var firstType = leaves.get(3);
        assertThat(firstType.requiredBefore()).extracting(Requisite::check).containsExactly(":");
        assertThat(firstType.requiredAfter()).extracting(Requisite::check).containsExactly(",");

        var lastType = leaves.get(5);
        assertThat(lastType.requiredAfter()).extracting(Requisite::check).containsExactly(")");

        var rhs = leaves.get(6);
        assertThat(text(rhs)).isEqualTo("a");
        assertThat(rhs.requiredBefore()).extracting(Requisite::check).containsExactly("=");
    }

    @Test
    void testMatchCasesArePartitioned() throws Exception {
        var root = partition(parse("""
                object A {
                  val h = y match {
                    // only case
                    case 1 => "one"
                  }
                }
                """));
        var leaves = leaves(root);

        assertThat(leaves).extracting(PartitionerTest::text).containsExactly("A", "h", "y", "1", "\"one\"");
        assertThat(leaves.get(2).requiredAfter()).containsExactly(new Requisite("match", " match {\n"));
        assertThat(leaves.get(3).requiredBefore()).containsExactly(new Requisite("case", "case "));
        assertThat(leaves.get(4).requiredBefore()).containsExactly(new Requisite("=>", " => "));

        var template = (TreeScope) ((Scope) root.children().get(0)).children().get(1);
        var match = (TreeScope) template.children().get(1);
        assertThat(match.tree()).isInstanceOf(Match.class);
        assertThat(match.source().text(match.start(), match.end())).startsWith("y match {").endsWith("}");
        assertThat(match.childIndentation()).isEqualTo(4);
    }

    @Test
    void testEmptyBodyOpensScope() throws Exception {
        var root = partition(parse("object A {\n}\n"));

        var module = (TreeScope) root.children().get(0);
        var body = (TreeScope) module.children().get(1);
        assertThat(body.source().text(body.start(), body.end())).isEqualTo("{\n}");
        assertThat(body.children()).isEmpty();
        assertThat(body.childIndentation()).isEqualTo(2);
    }

    @Test
    void testBlocksAndBodiesOpenScopes() throws Exception {
        var unit = parse("""
                object A {
                  def f = {
                    1
                  }
                }
                """);
        var root = partition(unit);

        var module = (TreeScope) root.children().get(0);
        assertThat(module.start()).isEqualTo(0);
        var body = (TreeScope) module.children().get(1);
        assertThat(body.source().text(body.start(), body.start() + 1)).isEqualTo("{");
        assertThat(body.childIndentation()).isEqualTo(2);

        var block = (TreeScope) body.children().get(1);
        assertThat(block.source().text(block.start(), block.end())).isEqualTo("{\n    1\n  }");
        assertThat(block.childIndentation()).isEqualTo(4);
    }

    @Test
    void testRejectsSyntheticRoot() {
        assertThrows(IllegalArgumentException.class, () -> partition(Trees.ident("x")));
    }

    @Test
    void testUnknownTreesAreReported() throws Exception {
        var unit = parse("""
                object A {
                  val x = y
                }
                """);
        var y = Trees.find(unit, Ident.class, ident -> ident.name().equals("y")).orElseThrow();
        var edited = TreeTransformations.replaceTree(y, new Wrapper(y.position(), List.of(y))).apply(unit).orElseThrow();

        var reporter = new CollectingReporter();
        var root = new Partitioner(new RewriteContext(Logger.SILENT, reporter)).partition(edited);

        assertThat(reporter.ids).containsExactly(Partitioner.UNKNOWN_TREE);
        assertThat(reporter.severities).containsExactly(ProblemSeverity.WARNING);
        assertThat(leaves(root)).extracting(PartitionerTest::text).containsExactly("A", "x", "y");
    }

    @Nested
    class Context {
        private final SourceFile source = new SourceFile("Test.scala", "val a = b");

        @Test
        void testRequisitesAreDeduplicated() {
            var leaf = new SourceFragment(null, source, 4, 5, "a");
            leaf.requireAfter(Requisite.of(","));
            leaf.requireAfter(Requisite.of(","));
            leaf.requireBefore(Requisite.of("("));
            leaf.requireBefore(new Requisite("(", " ("));

            assertThat(leaf.requiredAfter()).containsExactly(Requisite.of(","));
            assertThat(leaf.requiredBefore()).hasSize(2);
        }

        @Test
        void testRequisiteAfterNothingPrecedesNextLeaf() throws Exception {
            var context = new PartitionContext(RewriteContext.DEFAULT, source, null);
            context.openRoot(parse(source.content()));

            context.requireAfter(Requisite.of(";"));
            var leaf = new SourceFragment(null, source, 4, 5, "a");
            context.emit(leaf);

            assertThat(leaf.requiredBefore()).containsExactly(Requisite.of(";"));
            assertThat(leaf.requiredAfter()).isEmpty();
        }

        @Test
        void testOverlappingLeavesAreClipped() throws Exception {
            var context = new PartitionContext(RewriteContext.DEFAULT, source, null);
            var root = context.openRoot(parse(source.content()));

            context.emit(new SourceFragment(null, source, 0, 5, "val a"));
            var overlapping = new SourceFragment(null, source, 4, 7, "a =");
            overlapping.requireBefore(Requisite.of("x"));
            context.emit(overlapping);
            context.emit(new SourceFragment(null, source, 6, 7, "="));

            assertThat(root.children()).hasSize(2);
            var clipped = (SourceFragment) root.children().get(1);
            assertThat(clipped.start()).isEqualTo(5);
            assertThat(clipped.end()).isEqualTo(7);
            assertThat(clipped.requiredBefore()).containsExactly(Requisite.of("x"));
        }

        @Test
        void testEmptyRequisiteIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new Requisite("", " "));
        }
    }

    private record Wrapper(Position position, List<Tree> children) implements Tree {
        @Override
        public Tree withChildren(UnaryOperator<Tree> mapper) {
            return new Wrapper(position, children.stream().map(mapper).toList());
        }
    }

    private static final class CollectingReporter implements ProblemReporter {
        final List<ProblemId> ids = new ArrayList<>();
        final List<ProblemSeverity> severities = new ArrayList<>();

        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, @Nullable ProblemLocation location, String message) {
            report(problemId, severity, message);
        }

        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, String message) {
            ids.add(problemId);
            severities.add(severity);
        }
    }
}
