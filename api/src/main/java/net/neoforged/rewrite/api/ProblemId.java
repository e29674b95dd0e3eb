package net.neoforged.rewrite.api;

import java.util.Objects;

/**
 * Identifies one kind of problem. Two ids are equal if they have the same id within the same group;
 * the display name is only used for presentation.
 */
public record ProblemId(String id, String displayName, ProblemGroup group) {
    public ProblemId {
        ProblemGroup.checkId(id);
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(group, "group");
    }

    public static ProblemId create(String id, String displayName, ProblemGroup group) {
        return new ProblemId(id, displayName, group);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProblemId other && id.equals(other.id) && group.equals(other.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, group);
    }

    @Override
    public String toString() {
        return group + ":" + id;
    }
}
