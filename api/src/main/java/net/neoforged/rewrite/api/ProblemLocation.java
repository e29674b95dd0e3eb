package net.neoforged.rewrite.api;

import org.jetbrains.annotations.Nullable;

/**
 * Where a problem was found. Everything but the file name is optional.
 *
 * @param line   1-based line number.
 * @param column 1-based column number.
 * @param offset 0-based character offset into the file.
 */
public record ProblemLocation(String file, @Nullable Integer line, @Nullable Integer column,
                              @Nullable Integer offset, @Nullable Integer length) {
    /**
     * Locates a position that maps to source text, or only its file if the position is synthetic.
     */
    public static @Nullable ProblemLocation ofPosition(Position position) {
        var source = position.source();
        if (source == null) {
            return null;
        }
        var start = position.start();
        return new ProblemLocation(source.name(), source.lineNumber(start), source.columnNumber(start), start, position.length());
    }
}
