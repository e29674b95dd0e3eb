package net.neoforged.rewrite.api;

import java.util.Comparator;

/**
 * Replaces the characters {@code [from, to)} of {@code file} with {@code text}.
 */
public record Change(String file, int from, int to, String text) {
    public static final Comparator<Change> COMPARATOR = Comparator
            .comparingInt(Change::from)
            .thenComparingInt(Change::to);

    public Change {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid change range [" + from + ", " + to + ")");
        }
    }

    public boolean isInsertion() {
        return from == to;
    }
}
