package net.neoforged.rewrite.api;

import java.util.Objects;

/**
 * Immutable content of one source file, keyed by its name.
 * <p>
 * Offsets used throughout the rewriting engine are 0-based character offsets into {@link #content()}.
 */
public record SourceFile(String name, String content) {
    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
    }

    public int length() {
        return content.length();
    }

    public char charAt(int offset) {
        return content.charAt(offset);
    }

    public String text(int start, int end) {
        return content.substring(start, end);
    }

    /**
     * @return the offset of the first character of the line containing {@code offset}
     */
    public int lineStart(int offset) {
        int i = Math.min(offset, content.length());
        while (i > 0 && content.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /**
     * @return the whitespace at the start of the line containing {@code offset}
     */
    public String lineIndentation(int offset) {
        int start = lineStart(offset);
        int end = start;
        while (end < content.length() && isIndentation(content.charAt(end))) {
            end++;
        }
        return content.substring(start, end);
    }

    /**
     * @return whether only indentation precedes {@code offset} on its line
     */
    public boolean startsLine(int offset) {
        int start = lineStart(offset);
        for (int i = start; i < offset; i++) {
            if (!isIndentation(content.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the 1-based line number of {@code offset}
     */
    public int lineNumber(int offset) {
        int line = 1;
        int end = Math.min(offset, content.length());
        for (int i = 0; i < end; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * @return the 1-based column number of {@code offset}
     */
    public int columnNumber(int offset) {
        return offset - lineStart(offset) + 1;
    }

    private static boolean isIndentation(char c) {
        return c == ' ' || c == '\t';
    }

    @Override
    public String toString() {
        return "SourceFile[" + name + "]";
    }
}
