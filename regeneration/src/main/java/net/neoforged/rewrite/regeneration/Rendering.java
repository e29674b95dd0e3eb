package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.LayoutPreferences;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds the fragments of an edited tree into text.
 * <p>
 * The fragments are flattened into items: scope begin and end markers and leaves. Between two items
 * that are adjacent anchors of the original source, the original layout is copied. Elsewhere the
 * layout is assembled from the parts of the original layout that belong to the two items, and the
 * requisites of both items are resolved against it.
 */
final class Rendering {
    private final FragmentRepository repository;
    private final LayoutPreferences preferences;
    private final List<Item> items = new ArrayList<>();
    private final Set<Anchor> emitted = new HashSet<>();
    private final StringBuilder out = new StringBuilder();
    private int pendingIndentation = -1;

    Rendering(FragmentRepository repository, LayoutPreferences preferences) {
        this.repository = repository;
        this.preferences = preferences;
    }

    String render(TreeScope root) {
        collect(root, 0);
        append(items.get(0).text());
        for (int i = 1; i < items.size(); i++) {
            var left = items.get(i - 1);
            var right = items.get(i);
            if (left.anchor() != null && right.anchor() != null && right.anchor().equals(repository.next(left.anchor()))) {
                append(repository.layoutAfter(left.anchor()));
            } else {
                var gap = resolve(compose(left, right), left, right);
                append(gap.finish(right));
                if (gap.deferredIndentation >= 0) {
                    pendingIndentation = gap.deferredIndentation;
                }
            }
            append(right.text());
        }
        return out.toString();
    }

    private void collect(Scope scope, int outerIndentation) {
        int indentation = scope.childIndentation();
        items.add(new Item(known(scope.anchor()), "", scope.requiredBefore(), List.of(), indentation));
        for (var child : scope.children()) {
            if (child instanceof Scope nested) {
                collect(nested, indentation);
            } else {
                items.add(new Item(known(child.anchor()), text(child), child.requiredBefore(), child.requiredAfter(), indentation));
            }
        }
        items.add(new Item(known(scope.endAnchor()), "", List.of(), scope.requiredAfter(), outerIndentation));
    }

    @Nullable
    private Anchor known(@Nullable Anchor anchor) {
        if (anchor != null && repository.contains(anchor)) {
            emitted.add(anchor);
            return anchor;
        }
        return null;
    }

    private String text(Fragment fragment) {
        if (fragment instanceof SourceFragment leaf) {
            return repository.leafAt(leaf.anchor()) instanceof SourceFragment original && original.token().equals(leaf.token())
                    ? leaf.text()
                    : leaf.token();
        } else if (fragment instanceof FlagFragment flag) {
            return flag.text();
        } else if (fragment instanceof ArtificialFragment artificial) {
            return artificial.text();
        } else if (fragment instanceof LayoutFragment layout) {
            return layout.text();
        }
        throw new IllegalArgumentException("Unknown fragment " + fragment);
    }

    private String compose(Item left, Item right) {
        var trailing = trailing(left, right);
        var leading = leading(left, right);
        int lineBreak = lastLineBreak(trailing);
        if (lineBreak >= 0 && trailing.substring(lineBreak).isBlank() && (leading.startsWith("\n") || leading.startsWith("\r\n"))) {
            trailing = trailing.substring(0, lineBreak);
        }
        return trailing + leading;
    }

    /**
     * The part of the original layout after {@code left} that stays with it.
     */
    private String trailing(Item left, Item right) {
        var anchor = left.anchor();
        if (anchor == null) {
            return "";
        }
        var layout = repository.layoutAfter(anchor);
        if (anchor.kind() == Anchor.Kind.BEGIN) {
            if (isOwnEnd(anchor, repository.next(anchor))) {
                int closing = closingStart(layout);
                return layout.substring(0, closing) + openingSeparator(layout, closing, left.indentation());
            }
            if (right.anchor() != null) {
                int lineBreak = lastLineBreak(layout);
                return lineBreak < 0 ? layout : layout.substring(0, lineBreak);
            }
            return stripKeyword(layout);
        }
        int lineBreak = firstLineBreak(layout);
        return lineBreak < 0 ? "" : layout.substring(0, lineBreak);
    }

    /**
     * The part of the original layout before {@code right} that stays with it.
     */
    private String leading(Item left, Item right) {
        var anchor = right.anchor();
        if (anchor == null) {
            return "";
        }
        var previous = repository.previous(anchor);
        if (previous == null) {
            return "";
        }
        var layout = repository.layoutAfter(previous);
        if (anchor.kind() == Anchor.Kind.END) {
            if (isOwnEnd(previous, anchor)) {
                return layout.substring(closingStart(layout));
            }
            int lineBreak = firstLineBreak(layout);
            return emitted.contains(previous) && lineBreak >= 0 ? layout.substring(lineBreak) : layout;
        }
        if (left.anchor() == null) {
            int lineBreak = lastLineBreak(layout);
            return stripSeparator(lineBreak < 0 ? layout : layout.substring(layout.indexOf('\n', lineBreak) + 1));
        }
        int lineBreak = firstLineBreak(layout);
        if (previous.kind() == Anchor.Kind.BEGIN) {
            return lineBreak < 0 ? "" : layout.substring(lineBreak);
        }
        if (lineBreak >= 0) {
            return layout.substring(lineBreak);
        }
        var rest = stripSeparator(layout);
        return emitted.contains(previous) ? rest : lineBreakBefore(previous) + rest;
    }

    /**
     * Finds the line break and indentation that started the line of a removed anchor, looking back
     * over further removed anchors on the same line.
     */
    private String lineBreakBefore(Anchor removed) {
        var anchor = removed;
        while (true) {
            var previous = repository.previous(anchor);
            if (previous == null) {
                return "";
            }
            var layout = repository.layoutAfter(previous);
            int lineBreak = lastLineBreak(layout);
            if (lineBreak >= 0) {
                int end = layout.indexOf('\n', lineBreak) + 1;
                while (end < layout.length() && (layout.charAt(end) == ' ' || layout.charAt(end) == '\t')) {
                    end++;
                }
                return layout.substring(lineBreak, end);
            }
            if (emitted.contains(previous) || previous.kind() == Anchor.Kind.BEGIN) {
                return "";
            }
            anchor = previous;
        }
    }

    private Gap resolve(String layout, Item left, Item right) {
        var gap = new Gap(layout);
        int cursor = 0;
        for (var requisite : left.after()) {
            int layoutEnd = SourceHelper.skipLayout(gap.text, cursor);
            if (requisite.isBlank()) {
                if (containsBlank(gap.text, cursor, layoutEnd, requisite.check())) {
                    cursor = layoutEnd;
                } else {
                    cursor += gap.insert(cursor, requisite.write(), left.indentation(), right);
                }
            } else if (SourceHelper.startsWith(gap.text, layoutEnd, requisite.check())) {
                cursor = layoutEnd + requisite.check().length();
            } else {
                cursor += gap.insert(cursor, requisite.write(), left.indentation(), right);
            }
        }

        int end = gap.text.length();
        for (int i = right.before().size() - 1; i >= 0; i--) {
            var requisite = right.before().get(i);
            int layoutStart = SourceHelper.skipLayoutBackwards(gap.text, end, cursor);
            if (requisite.isBlank()) {
                if (containsBlank(gap.text, layoutStart, end, requisite.check())) {
                    end = layoutStart;
                } else {
                    gap.insert(end, requisite.write(), right.indentation(), right);
                }
            } else {
                int start = layoutStart - requisite.check().length();
                if (start >= cursor && SourceHelper.startsWith(gap.text, start, requisite.check())) {
                    end = start;
                } else {
                    gap.insert(end, requisite.write(), right.indentation(), right);
                }
            }
        }
        return gap;
    }

    private void append(String text) {
        if (text.isEmpty()) {
            return;
        }
        if (pendingIndentation >= 0) {
            if (!Character.isWhitespace(text.charAt(0))) {
                out.append(" ".repeat(pendingIndentation));
            }
            pendingIndentation = -1;
        }
        out.append(text);
    }

    private static boolean isOwnEnd(Anchor begin, @Nullable Anchor end) {
        return end != null && begin.kind() == Anchor.Kind.BEGIN && end.kind() == Anchor.Kind.END
                && begin.start() == end.start() && begin.end() == end.end();
    }

    /**
     * @return where the closing delimiter of an empty scope's layout starts, including the whitespace
     * before it
     */
    private static int closingStart(String layout) {
        int end = layout.length();
        while (end > 0 && Character.isWhitespace(layout.charAt(end - 1))) {
            end--;
        }
        if (end == 0) {
            return 0;
        }
        int start = end - 1;
        while (start > 0 && Character.isWhitespace(layout.charAt(start - 1))) {
            start--;
        }
        return start;
    }

    /**
     * The layout between the opening delimiter of an originally empty scope and its first child. It
     * repeats the layout before the closing delimiter, so children of a scope closed on its own line
     * start on a line of their own.
     */
    private static String openingSeparator(String layout, int closing, int indentation) {
        int delimiter = closing;
        while (delimiter < layout.length() && Character.isWhitespace(layout.charAt(delimiter))) {
            delimiter++;
        }
        var separator = layout.substring(closing, delimiter);
        int newline = separator.lastIndexOf('\n');
        return newline < 0 ? separator : separator.substring(0, newline + 1) + " ".repeat(indentation);
    }

    private static int firstLineBreak(String layout) {
        return lineBreakAt(layout, layout.indexOf('\n'));
    }

    private static int lastLineBreak(String layout) {
        return lineBreakAt(layout, layout.lastIndexOf('\n'));
    }

    private static int lineBreakAt(String layout, int newline) {
        return newline > 0 && layout.charAt(newline - 1) == '\r' ? newline - 1 : newline;
    }

    /**
     * Drops a trailing keyword such as {@code def } that belonged to the fragment following a scope start.
     */
    private static String stripKeyword(String layout) {
        int end = layout.length();
        while (end > 0 && (layout.charAt(end - 1) == ' ' || layout.charAt(end - 1) == '\t')) {
            end--;
        }
        int start = end;
        while (start > 0 && Character.isLetter(layout.charAt(start - 1))) {
            start--;
        }
        return start < end ? layout.substring(0, start) : layout;
    }

    private static String stripSeparator(String layout) {
        int i = 0;
        while (i < layout.length() && Character.isWhitespace(layout.charAt(i))) {
            i++;
        }
        if (i < layout.length() && layout.charAt(i) == ',') {
            i++;
            while (i < layout.length() && Character.isWhitespace(layout.charAt(i))) {
                i++;
            }
        }
        return layout.substring(i);
    }

    private static boolean containsBlank(CharSequence text, int from, int to, String check) {
        boolean lineBreak = check.indexOf('\n') >= 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (lineBreak ? c == '\n' : Character.isWhitespace(c)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param anchor      identity of the item in the original source, {@code null} for items without one
     * @param indentation column at which lines started before or after this item are indented
     */
    private record Item(@Nullable Anchor anchor, String text, List<Requisite> before, List<Requisite> after,
                        int indentation) {
    }

    /**
     * Layout between two items, with the positions after inserted line breaks that still need
     * indentation.
     */
    private final class Gap {
        private final StringBuilder text;
        private final List<Marker> markers = new ArrayList<>();
        private int deferredIndentation = -1;

        Gap(String layout) {
            this.text = new StringBuilder(layout);
        }

        /**
         * @return the number of characters inserted
         */
        int insert(int at, String write, int indentation, Item right) {
            char before = at > 0 ? text.charAt(at - 1) : out.isEmpty() ? '\n' : out.charAt(out.length() - 1);
            char after = at < text.length() ? text.charAt(at) : right.text().isEmpty() ? 'x' : right.text().charAt(0);
            if (write.startsWith(" ") && Character.isWhitespace(before)) {
                write = write.substring(1);
            }
            if (write.endsWith(" ") && Character.isWhitespace(after)) {
                write = write.substring(0, write.length() - 1);
            }
            if (write.isEmpty()) {
                return 0;
            }

            var inserted = new StringBuilder();
            var added = new ArrayList<Marker>();
            for (int i = 0; i < write.length(); i++) {
                char c = write.charAt(i);
                if (c == '\n') {
                    inserted.append(preferences.lineSeparator());
                    added.add(new Marker(at + inserted.length(), indentation));
                } else {
                    inserted.append(c);
                }
            }
            for (var marker : markers) {
                if (marker.offset > at) {
                    marker.offset += inserted.length();
                }
            }
            markers.addAll(added);
            text.insert(at, inserted);
            return inserted.length();
        }

        String finish(Item right) {
            markers.sort(Comparator.comparingInt((Marker marker) -> marker.offset).reversed());
            for (var marker : markers) {
                if (marker.offset < text.length()) {
                    if (!Character.isWhitespace(text.charAt(marker.offset))) {
                        text.insert(marker.offset, " ".repeat(marker.indentation));
                    }
                } else if (right.text().isEmpty()) {
                    deferredIndentation = marker.indentation;
                } else if (!Character.isWhitespace(right.text().charAt(0))) {
                    text.append(" ".repeat(marker.indentation));
                }
            }
            return text.toString();
        }
    }

    private static final class Marker {
        private int offset;
        private final int indentation;

        Marker(int offset, int indentation) {
            this.offset = offset;
            this.indentation = indentation;
        }
    }
}
