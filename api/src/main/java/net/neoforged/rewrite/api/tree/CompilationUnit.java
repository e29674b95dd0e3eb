package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.SourceFile;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Root of the tree of one source file.
 */
public record CompilationUnit(Position position, SourceFile source, List<Tree> stats) implements Tree {
    public CompilationUnit {
        stats = List.copyOf(stats);
    }

    @Override
    public List<Tree> children() {
        return stats;
    }

    @Override
    public CompilationUnit withChildren(UnaryOperator<Tree> mapper) {
        return withStats(Trees.mapAll(stats, mapper, Tree.class, this));
    }

    public CompilationUnit withStats(List<Tree> stats) {
        return new CompilationUnit(position, source, stats);
    }
}
