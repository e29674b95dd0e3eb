package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Member selection {@code qualifier.name}. Prefix operators are selections of {@code unary_op} whose
 * position starts before the qualifier.
 */
public record Select(Position position, Tree qualifier, String name, @Nullable Symbol symbol) implements RefTree {
    @Override
    public List<Tree> children() {
        return List.of(qualifier);
    }

    @Override
    public Select withChildren(UnaryOperator<Tree> mapper) {
        return new Select(position, mapper.apply(qualifier), name, symbol);
    }

    @Override
    public Select withName(String name) {
        return new Select(position, qualifier, name, symbol);
    }

    public boolean isPrefixOperator() {
        return name.startsWith(Names.UNARY_PREFIX);
    }
}
