package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Constant. The value is a {@link String}, {@link Character}, {@link Boolean}, {@link Integer},
 * {@link Long}, {@link Double} or {@code null}.
 */
public record Literal(Position position, @Nullable Object value) implements Tree {
    @Override
    public List<Tree> children() {
        return List.of();
    }

    @Override
    public Literal withChildren(UnaryOperator<Tree> mapper) {
        return this;
    }
}
