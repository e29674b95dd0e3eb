package net.neoforged.rewrite.regeneration;

import java.util.Objects;

/**
 * Connective text that must appear next to a fragment, such as the comma between two arguments.
 * If the layout around the fragment already contains {@code check}, nothing happens; otherwise
 * {@code write} is inserted.
 */
public record Requisite(String check, String write) {
    public Requisite {
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(write, "write");
        if (check.isEmpty()) {
            throw new IllegalArgumentException("Empty requisite check");
        }
    }

    public static Requisite of(String text) {
        return new Requisite(text, text);
    }

    /**
     * @return whether the check only consists of whitespace, and is thus satisfied by any matching
     * whitespace in the layout
     */
    public boolean isBlank() {
        return check.isBlank();
    }
}
