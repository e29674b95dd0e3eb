package net.neoforged.rewrite.api;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Groups related {@link ProblemId problems}, for example all problems raised while partitioning a tree.
 * Groups form a hierarchy below {@link #REWRITE}; their qualified id joins the ids of the path with
 * {@code ':'}.
 */
public record ProblemGroup(String id, String displayName, @Nullable ProblemGroup parent) {
    private static final Pattern ID = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    public static final ProblemGroup REWRITE = create("rewrite", "Source Rewriting");

    public ProblemGroup {
        checkId(id);
        Objects.requireNonNull(displayName, "displayName");
    }

    public static ProblemGroup create(String id, String displayName) {
        return create(id, displayName, null);
    }

    public static ProblemGroup create(String id, String displayName, @Nullable ProblemGroup parent) {
        return new ProblemGroup(id, displayName, parent);
    }

    /**
     * @return whether this group is {@code other} or nested in it
     */
    public boolean isWithin(ProblemGroup other) {
        for (var group = this; group != null; group = group.parent) {
            if (group.equals(other)) {
                return true;
            }
        }
        return false;
    }

    static void checkId(String id) {
        Objects.requireNonNull(id, "id");
        if (!ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Problem ids are lower-case words joined by '-': " + id);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProblemGroup other && id.equals(other.id) && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parent);
    }

    @Override
    public String toString() {
        return parent != null ? parent + ":" + id : id;
    }
}
