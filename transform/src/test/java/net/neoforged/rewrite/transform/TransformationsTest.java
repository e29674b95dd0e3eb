package net.neoforged.rewrite.transform;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.neoforged.rewrite.transform.Node.leaf;
import static net.neoforged.rewrite.transform.Node.node;
import static net.neoforged.rewrite.transform.Transformations.bottomUp;
import static net.neoforged.rewrite.transform.Transformations.constant;
import static net.neoforged.rewrite.transform.Transformations.fail;
import static net.neoforged.rewrite.transform.Transformations.forAllChildren;
import static net.neoforged.rewrite.transform.Transformations.forAnyChild;
import static net.neoforged.rewrite.transform.Transformations.not;
import static net.neoforged.rewrite.transform.Transformations.predicate;
import static net.neoforged.rewrite.transform.Transformations.succeed;
import static net.neoforged.rewrite.transform.Transformations.topDown;
import static net.neoforged.rewrite.transform.Transformations.transform;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TransformationsTest {
    private static final List<Integer> INPUTS = List.of(-7, -1, 0, 1, 2, 3, 10, 11, 42);

    private static final Transformation<Integer, Integer> EVEN_HALVED = transform(i -> i % 2 == 0 ? i / 2 : null);
    private static final Transformation<Integer, Integer> POSITIVE_DECREMENTED = transform(i -> i > 0 ? i - 1 : null);
    private static final Transformation<Integer, Integer> SMALL_SQUARED = transform(i -> Math.abs(i) < 5 ? i * i : null);

    private static final Transformation<Node, Node> INCREMENT = transform(n -> n.withValue(n.value() + 1));
    private static final Transformation<Node, Node> ONLY_EVEN_INCREMENTED = transform(n -> n.value() % 2 == 0 ? n.withValue(n.value() + 1) : null);

    @Nested
    class Laws {
        @Test
        void testAndThenIsAssociative() {
            var left = EVEN_HALVED.andThen(POSITIVE_DECREMENTED).andThen(SMALL_SQUARED);
            var right = EVEN_HALVED.andThen(POSITIVE_DECREMENTED.andThen(SMALL_SQUARED));
            for (int input : INPUTS) {
                assertEquals(left.apply(input), right.apply(input), "input " + input);
            }
        }

        @Test
        void testOrElseIsAssociative() {
            var left = EVEN_HALVED.orElse(POSITIVE_DECREMENTED).orElse(SMALL_SQUARED);
            var right = EVEN_HALVED.orElse(POSITIVE_DECREMENTED.orElse(SMALL_SQUARED));
            for (int input : INPUTS) {
                assertEquals(left.apply(input), right.apply(input), "input " + input);
            }
        }

        @Test
        void testIdentityLaws() {
            for (int input : INPUTS) {
                var expected = EVEN_HALVED.apply(input);
                assertEquals(expected, Transformations.<Integer>succeed().andThen(EVEN_HALVED).apply(input));
                assertEquals(expected, EVEN_HALVED.andThen(succeed()).apply(input));
                assertEquals(expected, Transformations.<Integer>fail().orElse(EVEN_HALVED).apply(input));
                assertEquals(expected, EVEN_HALVED.orElse(fail()).apply(input));
            }
        }
    }

    @Test
    void testAndThenShortCircuits() {
        var invoked = new ArrayList<Integer>();
        Transformation<Integer, Integer> recording = i -> {
            invoked.add(i);
            return Optional.of(i);
        };

        assertEquals(Optional.empty(), EVEN_HALVED.andThen(recording).apply(3));
        assertEquals(Optional.of(2), EVEN_HALVED.andThen(recording).apply(4));
        assertThat(invoked).containsExactly(2);
    }

    @Test
    void testOrElseUsesOriginalInput() {
        assertEquals(Optional.of(2), EVEN_HALVED.orElse(POSITIVE_DECREMENTED).apply(3));
        assertEquals(Optional.of(3), EVEN_HALVED.orElse(POSITIVE_DECREMENTED).apply(6));
        assertEquals(Optional.empty(), EVEN_HALVED.orElse(POSITIVE_DECREMENTED).apply(-3));
    }

    @Test
    void testNot() {
        var invocations = new int[1];
        Transformation<Integer, Integer> counting = i -> {
            invocations[0]++;
            return EVEN_HALVED.apply(i);
        };

        assertEquals(Optional.of(3), not(counting).apply(3));
        assertEquals(Optional.empty(), not(counting).apply(4));
        assertEquals(2, invocations[0]);
    }

    @Test
    void testPredicate() {
        Transformation<Integer, Integer> positiveIfSmall = predicate(i -> Math.abs(i) < 10 ? i > 0 : null);

        assertEquals(Optional.of(3), positiveIfSmall.apply(3));
        assertEquals(Optional.empty(), positiveIfSmall.apply(-3));
        assertEquals(Optional.empty(), positiveIfSmall.apply(42));
    }

    @Test
    void testConstant() {
        Transformation<Integer, String> hello = constant("hello");

        assertEquals(Optional.of("hello"), hello.apply(1));
        assertEquals(Optional.of("hello"), hello.apply(-1));
    }

    @Nested
    class Children {
        private final Node tree = node(0, leaf(2), node(4, leaf(6)), leaf(8));

        @Test
        void testForAllChildrenRebuildsEveryChild() {
            var result = forAllChildren(INCREMENT).apply(tree);

            assertEquals(Optional.of(node(0, leaf(3), node(5, leaf(6)), leaf(9))), result);
        }

        @Test
        void testForAllChildrenFailsWithoutPartialRebuild() {
            var mixed = node(0, leaf(2), leaf(3), leaf(4));
            var visited = new ArrayList<Integer>();
            Transformation<Node, Node> recording = n -> {
                visited.add(n.value());
                return ONLY_EVEN_INCREMENTED.apply(n);
            };

            assertEquals(Optional.empty(), forAllChildren(recording).apply(mixed));
            assertThat(visited).containsExactly(2, 3);
        }

        @Test
        void testForAnyChildKeepsFailingChildren() {
            var mixed = node(0, leaf(2), leaf(3), leaf(4));

            assertEquals(Optional.of(node(0, leaf(3), leaf(3), leaf(5))), forAnyChild(ONLY_EVEN_INCREMENTED).apply(mixed));
        }

        @Test
        void testForAnyChildNeverFails() {
            var odd = node(1, leaf(3), leaf(5));

            assertEquals(Optional.of(odd), forAnyChild(Transformations.<Node>fail()).apply(odd));
        }

        @Test
        void testChildlessNode() {
            assertEquals(Optional.of(leaf(1)), forAllChildren(Transformations.<Node>fail()).apply(leaf(1)));
        }
    }

    @Nested
    class Traversals {
        @Test
        void testTopDownChildrenSeeTheirNewParent() {
            var parents = new ArrayList<Integer>();
            // Every node takes the value of its parent plus one, recording what it saw
            Transformation<Node, Node> propagate = n -> {
                var children = new ArrayList<Node>();
                for (var child : n.children()) {
                    parents.add(n.value());
                    children.add(child.withValue(n.value() + 1));
                }
                return Optional.of(new Node(n.value(), children));
            };

            var result = topDown(propagate).apply(node(10, node(0, leaf(0)), leaf(0)));

            assertEquals(Optional.of(node(10, node(11, leaf(12)), leaf(11))), result);
            assertThat(parents).containsExactly(10, 10, 11);
        }

        @Test
        void testTopDownFailsIfRootFails() {
            assertEquals(Optional.empty(), topDown(ONLY_EVEN_INCREMENTED).apply(node(1, leaf(2))));
        }

        @Test
        void testTopDownFailsIfAnyNodeFails() {
            // 0 becomes 1, so its children are visited; 3 fails
            assertEquals(Optional.empty(), topDown(ONLY_EVEN_INCREMENTED).apply(node(0, leaf(3))));
        }

        @Test
        void testBottomUpParentSeesTransformedChildren() {
            Transformation<Node, Node> sum = n -> Optional.of(n.withValue(n.value() + n.children().stream().mapToInt(Node::value).sum()));

            var result = bottomUp(sum).apply(node(1, node(2, leaf(3)), leaf(4)));

            assertEquals(Optional.of(node(10, node(5, leaf(3)), leaf(4))), result);
        }

        @Test
        void testBottomUpFailsIfAnyChildFails() {
            assertEquals(Optional.empty(), bottomUp(ONLY_EVEN_INCREMENTED).apply(node(0, leaf(2), leaf(1))));
        }

        @Test
        void testEverywhere() {
            var result = Transformations.everywhere(ONLY_EVEN_INCREMENTED).apply(node(0, leaf(2), leaf(1)));

            assertEquals(Optional.of(node(1, leaf(3), leaf(1))), result);
        }

        @Test
        void testTraversalAliases() {
            var tree = node(0, node(2, leaf(4)), leaf(6));

            assertEquals(topDown(INCREMENT).apply(tree), Transformations.preorder(INCREMENT).apply(tree));
            assertEquals(bottomUp(INCREMENT).apply(tree), Transformations.postorder(INCREMENT).apply(tree));
        }
    }

    @Test
    void testFoldRecursively() {
        // Unfolds a node into a string, descending into the children through the recursive transformation
        Transformation<Node, Node> root = Transformations.succeed();
        Transformation<Node, String> printer = root.foldRecursively((recurse, n) -> {
            var out = new StringBuilder().append(n.value());
            for (var child : n.children()) {
                out.append('(').append(recurse.apply(child).orElseThrow()).append(')');
            }
            return out.toString();
        });

        assertEquals(Optional.of("1(2(3))(4)"), printer.apply(node(1, node(2, leaf(3)), leaf(4))));
    }

    @Test
    void testFoldRecursivelyFailsWithItsBase() {
        Transformation<Node, Integer> depth = ONLY_EVEN_INCREMENTED.foldRecursively((recurse, n) -> 1);

        assertEquals(Optional.empty(), depth.apply(leaf(1)));
        assertEquals(Optional.of(1), depth.apply(leaf(2)));
    }
}
