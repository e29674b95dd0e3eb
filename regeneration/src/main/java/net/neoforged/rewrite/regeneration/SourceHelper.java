package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Names;

import java.util.OptionalInt;

/**
 * Scanning helpers over source text. Layout is whitespace plus line and block comments.
 */
final class SourceHelper {
    private SourceHelper() {
    }

    /**
     * @return the offset following the layout that starts at {@code from}
     */
    static int skipLayout(CharSequence text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (startsWith(text, i, "//")) {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (startsWith(text, i, "/*")) {
                int close = indexOf(text, "*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * Skips whitespace and block comments backwards from {@code from}, never going below {@code limit}.
     */
    static int skipLayoutBackwards(CharSequence text, int from, int limit) {
        int i = from;
        while (i > limit) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                i--;
            } else if (i - 2 >= limit && startsWith(text, i - 2, "*/")) {
                int open = lastIndexOf(text, "/*", i - 2, limit);
                if (open < 0) {
                    break;
                }
                i = open;
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * @return the offset of {@code c} if only layout lies between it and {@code offset}, searching backwards
     */
    static OptionalInt backwardsSkipLayoutTo(SourceFile source, char c, int offset) {
        int i = skipLayoutBackwards(source.content(), offset, 0);
        return i > 0 && source.charAt(i - 1) == c ? OptionalInt.of(i - 1) : OptionalInt.empty();
    }

    /**
     * @return the offset of {@code c} if only layout lies between {@code offset} and it
     */
    static OptionalInt skipLayoutTo(SourceFile source, char c, int offset) {
        int i = skipLayout(source.content(), offset);
        return i < source.length() && source.charAt(i) == c ? OptionalInt.of(i) : OptionalInt.empty();
    }

    /**
     * @return the first offset of {@code c} in {@code [from, abortOn)} outside of comments
     */
    static OptionalInt forwardsTo(SourceFile source, char c, int from, int abortOn) {
        var content = source.content();
        int i = from;
        while (i < abortOn) {
            if (startsWith(content, i, "//") || startsWith(content, i, "/*")) {
                i = skipLayout(content, i);
            } else if (content.charAt(i) == c) {
                return OptionalInt.of(i);
            } else {
                i++;
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return the end of the identifier or operator token starting at {@code start}
     */
    static int tokenEnd(SourceFile source, int start) {
        var content = source.content();
        if (start >= content.length()) {
            return start;
        }
        int i = start + 1;
        if (Character.isJavaIdentifierStart(content.charAt(start))) {
            while (i < content.length() && Character.isJavaIdentifierPart(content.charAt(i))) {
                i++;
            }
        } else if (Names.isOperatorChar(content.charAt(start))) {
            while (i < content.length() && Names.isOperatorChar(content.charAt(i))) {
                i++;
            }
        }
        return i;
    }

    static boolean startsWith(CharSequence text, int offset, String prefix) {
        if (offset < 0 || offset + prefix.length() > text.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (text.charAt(offset + i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(CharSequence text, String needle, int from) {
        for (int i = from; i + needle.length() <= text.length(); i++) {
            if (startsWith(text, i, needle)) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(CharSequence text, String needle, int before, int limit) {
        for (int i = before - needle.length(); i >= limit; i--) {
            if (startsWith(text, i, needle)) {
                return i;
            }
        }
        return -1;
    }
}
