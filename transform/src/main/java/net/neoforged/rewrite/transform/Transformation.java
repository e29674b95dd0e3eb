package net.neoforged.rewrite.transform;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * A transformation is a total function from {@code X} to an optional {@code Y}: it either succeeds
 * and produces a value, or fails and produces nothing.
 * <p>
 * Transformations are combined with {@link #andThen(Transformation)}, which only applies the
 * second transformation if the first one succeeded, and {@link #orElse(Transformation)}, which
 * applies the alternative to the same input when the first one failed. Because applying a
 * transformation has no side effects, speculative rewriting needs no rollback.
 * <p>
 * {@link Transformations} provides the basic transformations and the combinators that descend
 * into {@link Rebuildable} structures.
 */
@FunctionalInterface
public interface Transformation<X, Y> {
    Optional<Y> apply(X x);

    /**
     * Applies {@code next} to the result of this transformation. Fails if either fails.
     */
    default <Z> Transformation<X, Z> andThen(Transformation<? super Y, ? extends Z> next) {
        return x -> {
            var result = apply(x);
            if (result.isEmpty()) {
                return Optional.empty();
            }
            return next.apply(result.get()).map(z -> z);
        };
    }

    /**
     * Returns the result of this transformation if it succeeds, otherwise the result of applying
     * {@code alternative} to the same input.
     */
    default Transformation<X, Y> orElse(Transformation<? super X, ? extends Y> alternative) {
        return x -> {
            var result = apply(x);
            if (result.isPresent()) {
                return result;
            }
            return alternative.apply(x).map(y -> y);
        };
    }

    /**
     * Creates a transformation whose result is produced by {@code f}, which receives the
     * produced value of this transformation and a transformation that recurses: applying it runs
     * this transformation again and folds its result with {@code f}.
     * <p>
     * This lets the caller decide where to descend into substructure without hard-coding the
     * shape of the recursion.
     */
    default <Z> Transformation<X, Z> foldRecursively(BiFunction<Transformation<X, Z>, ? super Y, ? extends Z> f) {
        return new Transformation<>() {
            @Override
            public Optional<Z> apply(X x) {
                return Transformation.this.apply(x).map(y -> f.apply(this, y));
            }
        };
    }
}
