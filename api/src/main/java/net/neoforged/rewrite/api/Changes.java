package net.neoforged.rewrite.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-overlapping set of {@link Change changes} to one source file.
 */
public final class Changes {
    private final List<Change> changes;

    public Changes(List<Change> changes) {
        this.changes = new ArrayList<>(changes);
    }

    public Changes() {
        this(List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public void add(Change change) {
        changes.add(change);
    }

    public void replace(Position position, String newText) {
        add(new Change(position.source().name(), position.start(), position.end(), newText));
    }

    public void insertBefore(Position position, String newText) {
        add(new Change(position.source().name(), position.start(), position.start(), newText));
    }

    public void insertAfter(Position position, String newText) {
        add(new Change(position.source().name(), position.end(), position.end(), newText));
    }

    public String apply(CharSequence originalContent) {
        if (changes.isEmpty()) {
            return originalContent.toString();
        }

        // Assembling the result requires ascending and non-overlapping ranges
        changes.sort(Change.COMPARATOR);

        var writer = new StringBuilder(originalContent.length());
        writer.append(originalContent, 0, changes.get(0).from());
        for (int i = 0; i < changes.size(); i++) {
            var change = changes.get(i);
            if (i > 0) {
                var previous = changes.get(i - 1);
                if (previous.to() > change.from()) {
                    throw new IllegalStateException("Trying to replace overlapping ranges: " + change + " and " + previous);
                }
                writer.append(originalContent, previous.to(), change.from());
            }
            writer.append(change.text());
        }
        writer.append(originalContent, changes.get(changes.size() - 1).to(), originalContent.length());
        return writer.toString();
    }
}
