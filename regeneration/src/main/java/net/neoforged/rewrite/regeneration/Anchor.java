package net.neoforged.rewrite.regeneration;

/**
 * Identity of an original fragment, used to find out whether two fragments of an edited tree were
 * adjacent in the original source.
 * <p>
 * Scope markers occupy no text: a {@link Kind#BEGIN} anchor sits at the scope start, an
 * {@link Kind#END} anchor at the scope end. Both carry the span of their scope.
 */
public record Anchor(Kind kind, int start, int end) {
    public enum Kind {
        BEGIN,
        END,
        LEAF,
        FLAG
    }
}
