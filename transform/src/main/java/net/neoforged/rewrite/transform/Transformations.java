package net.neoforged.rewrite.transform;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Basic transformations and the combinators that apply transformations to the children of
 * {@link Rebuildable} structures.
 * <p>
 * A typical rewrite is assembled from a partial mapping and a traversal strategy, for example:
 * <pre>{@code
 * var reverseBodies = Transformations.<Tree, Tree>fromPartialMapping(tree ->
 *         tree instanceof Template template ? template.withBody(reversed(template.body())) : null);
 * var result = Transformations.topDown(reverseBodies.orElse(Transformations.id())).apply(root);
 * }</pre>
 */
public final class Transformations {
    private Transformations() {
    }

    /**
     * Creates a transformation from a partial function. The function signals that it is not
     * defined for an input by returning {@code null}; the transformation fails for exactly those
     * inputs.
     */
    public static <X, Y> Transformation<X, Y> fromPartialMapping(Function<? super X, ? extends Y> f) {
        return x -> Optional.ofNullable(f.apply(x));
    }

    /**
     * Shorthand for {@link #fromPartialMapping(Function)}.
     */
    public static <X, Y> Transformation<X, Y> transform(Function<? super X, ? extends Y> f) {
        return fromPartialMapping(f);
    }

    /**
     * Uses a partial boolean function as a filter: succeeds with the unchanged input if the function
     * is defined for it (does not return {@code null}) and evaluates to {@code true}.
     */
    public static <X> Transformation<X, X> predicate(Function<? super X, Boolean> f) {
        return x -> Boolean.TRUE.equals(f.apply(x)) ? Optional.of(x) : Optional.empty();
    }

    /**
     * Total variant of {@link #predicate(Function)}.
     */
    public static <X> Transformation<X, X> filter(Predicate<? super X> p) {
        return x -> p.test(x) ? Optional.of(x) : Optional.empty();
    }

    /**
     * Always succeeds and returns the input unchanged.
     */
    public static <X> Transformation<X, X> succeed() {
        return Optional::of;
    }

    public static <X> Transformation<X, X> id() {
        return succeed();
    }

    /**
     * Always fails, independent of the input.
     */
    public static <X> Transformation<X, X> fail() {
        return x -> Optional.empty();
    }

    /**
     * Turns success of {@code t} into failure and failure into success with the original input.
     * {@code t} is applied exactly once.
     */
    public static <X> Transformation<X, X> not(Transformation<X, X> t) {
        return x -> t.apply(x).isPresent() ? Optional.empty() : Optional.of(x);
    }

    /**
     * Ignores the input and always produces {@code value}.
     */
    public static <X, Y> Transformation<X, Y> constant(Y value) {
        return x -> Optional.of(value);
    }

    /**
     * Applies {@code t} to all direct children of the input and rebuilds it with the results.
     * If {@code t} fails on any child, the whole application fails and no partially rebuilt value
     * is produced. {@code t} is not applied to the children following a failed one.
     */
    public static <X extends Rebuildable<X>> Transformation<X, X> forAllChildren(Transformation<X, X> t) {
        return x -> {
            boolean[] failed = {false};
            X rebuilt = x.withChildren(child -> {
                if (failed[0]) {
                    return child;
                }
                var result = t.apply(child);
                if (result.isEmpty()) {
                    failed[0] = true;
                    return child;
                }
                return result.get();
            });
            return failed[0] ? Optional.empty() : Optional.of(rebuilt);
        };
    }

    /**
     * Applies {@code t} to all direct children of the input, keeping the children on which it fails
     * unchanged. Never fails.
     */
    public static <X extends Rebuildable<X>> Transformation<X, X> forAnyChild(Transformation<X, X> t) {
        return forAllChildren(t.orElse(id()));
    }

    /**
     * Applies {@code t} to the input and then, if that succeeded, recursively to all children of the
     * transformed value. Children therefore see their new parent. Fails if {@code t} fails on any
     * node that is reached.
     */
    public static <X extends Rebuildable<X>> Transformation<X, X> topDown(Transformation<X, X> t) {
        return new Transformation<>() {
            @Override
            public Optional<X> apply(X x) {
                return t.andThen(forAllChildren(this)).apply(x);
            }
        };
    }

    public static <X extends Rebuildable<X>> Transformation<X, X> preorder(Transformation<X, X> t) {
        return topDown(t);
    }

    /**
     * Transforms all children first and then applies {@code t} to the value with its transformed
     * children. The parent therefore sees its transformed children.
     */
    public static <X extends Rebuildable<X>> Transformation<X, X> bottomUp(Transformation<X, X> t) {
        return new Transformation<>() {
            @Override
            public Optional<X> apply(X x) {
                return forAllChildren(this).andThen(t).apply(x);
            }
        };
    }

    public static <X extends Rebuildable<X>> Transformation<X, X> postorder(Transformation<X, X> t) {
        return bottomUp(t);
    }

    /**
     * Applies {@code t} everywhere it succeeds, top-down, leaving the rest of the structure unchanged.
     * Equivalent to {@code topDown(t.orElse(id()))}.
     */
    public static <X extends Rebuildable<X>> Transformation<X, X> everywhere(Transformation<X, X> t) {
        return topDown(t.orElse(id()));
    }
}
