package net.neoforged.rewrite.api;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Location of a tree in its source file: the half-open interval {@code [start, end)} plus the offset
 * of its name token ({@code point}).
 * <p>
 * Only {@link Kind#RANGE range} positions map to source text that may be reused when regenerating.
 * {@link Kind#SYNTHETIC Synthetic} positions belong to trees that were created by a transformation
 * or inserted by a compiler and have no source text at all. {@link Kind#TRANSPARENT Transparent}
 * positions carry offsets for diagnostics but are ignored for layout purposes.
 */
public record Position(Kind kind, @Nullable SourceFile source, int start, int point, int end) {
    private static final Position SYNTHETIC = new Position(Kind.SYNTHETIC, null, -1, -1, -1);

    public Position {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.SYNTHETIC) {
            Objects.requireNonNull(source, "source");
            if (start < 0 || end < start || end > source.length()) {
                throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") in " + source.name());
            }
            if (point < start || point > end) {
                throw new IllegalArgumentException("Point " + point + " outside of [" + start + ", " + end + ")");
            }
        }
    }

    public static Position range(SourceFile source, int start, int end) {
        return new Position(Kind.RANGE, source, start, start, end);
    }

    public static Position range(SourceFile source, int start, int point, int end) {
        return new Position(Kind.RANGE, source, start, point, end);
    }

    public static Position transparent(SourceFile source, int start, int point, int end) {
        return new Position(Kind.TRANSPARENT, source, start, point, end);
    }

    public static Position synthetic() {
        return SYNTHETIC;
    }

    public boolean isRange() {
        return kind == Kind.RANGE;
    }

    public boolean isSynthetic() {
        return kind == Kind.SYNTHETIC;
    }

    public boolean isTransparent() {
        return kind == Kind.TRANSPARENT;
    }

    public int length() {
        return isSynthetic() ? 0 : end - start;
    }

    /**
     * @return whether this position ends before {@code other} starts, both being in the same file
     */
    public boolean precedes(Position other) {
        return !isSynthetic() && !other.isSynthetic() && source.equals(other.source) && end <= other.start;
    }

    /**
     * @return whether both positions are ranges spanning the same interval of the same file
     */
    public boolean sameRange(Position other) {
        return isRange() && other.isRange() && source.equals(other.source) && start == other.start && end == other.end;
    }

    public boolean includes(Position other) {
        return !isSynthetic() && !other.isSynthetic() && source.equals(other.source)
                && start <= other.start && other.end <= end;
    }

    /**
     * @return the source text covered by this position
     * @throws IllegalStateException if the position is synthetic
     */
    public String text() {
        if (isSynthetic()) {
            throw new IllegalStateException("Synthetic positions have no source text");
        }
        return source.text(start, end);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SYNTHETIC -> "<synthetic>";
            case RANGE -> source.name() + "[" + start + ":" + point + ":" + end + "]";
            case TRANSPARENT -> source.name() + "<" + start + ":" + point + ":" + end + ">";
        };
    }

    public enum Kind {
        RANGE,
        SYNTHETIC,
        TRANSPARENT
    }
}
