package net.neoforged.rewrite.api;

/**
 * Formatting used for text that has no counterpart in the original source.
 *
 * @param indentationStep number of spaces one nesting level is indented by
 * @param lineSeparator   written wherever a line break has to be inserted
 */
public record LayoutPreferences(int indentationStep, String lineSeparator) {
    public static final LayoutPreferences DEFAULT = new LayoutPreferences(2, "\n");

    public LayoutPreferences {
        if (indentationStep < 0) {
            throw new IllegalArgumentException("Negative indentation step: " + indentationStep);
        }
        if (!lineSeparator.equals("\n") && !lineSeparator.equals("\r\n")) {
            throw new IllegalArgumentException("Unsupported line separator");
        }
    }
}
