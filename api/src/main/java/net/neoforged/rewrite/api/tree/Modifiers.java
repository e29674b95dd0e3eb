package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Flags and annotations of a definition.
 *
 * @param flags       all flags, including those that are never written in source
 * @param positions   the source position of every flag that is written in source
 * @param annotations annotation trees, in source order
 */
public record Modifiers(Set<Flag> flags, Map<Flag, Position> positions, List<Tree> annotations) {
    public static final Modifiers EMPTY = new Modifiers(Set.of(), Map.of(), List.of());

    public Modifiers {
        flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags));
        positions = Collections.unmodifiableMap(positions.isEmpty() ? new EnumMap<Flag, Position>(Flag.class) : new EnumMap<Flag, Position>(positions));
        annotations = List.copyOf(annotations);
        for (var flag : positions.keySet()) {
            if (!flags.contains(flag)) {
                throw new IllegalArgumentException("Position given for absent flag " + flag);
            }
        }
    }

    public static Modifiers of(Flag... flags) {
        return new Modifiers(Set.of(flags), Map.of(), List.of());
    }

    public static Modifiers of(Collection<Flag> flags) {
        return new Modifiers(Set.copyOf(flags), Map.of(), List.of());
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    public boolean isEmpty() {
        return flags.isEmpty() && annotations.isEmpty();
    }

    /**
     * @return the flags written in source, ordered by their position
     */
    public List<Flag> positionedFlags() {
        var result = new ArrayList<>(positions.keySet());
        result.sort(Comparator.comparingInt(flag -> positions.get(flag).start()));
        return result;
    }

    /**
     * @return printable flags that have no source position, such as flags added by a transformation
     */
    public List<Flag> unpositionedFlags() {
        var result = new ArrayList<Flag>();
        for (var flag : flags) {
            if (flag.isPrintable() && !positions.containsKey(flag)) {
                result.add(flag);
            }
        }
        return result;
    }

    public Modifiers withFlag(Flag flag) {
        var newFlags = EnumSet.noneOf(Flag.class);
        newFlags.addAll(flags);
        newFlags.add(flag);
        return new Modifiers(newFlags, positions, annotations);
    }

    public Modifiers withoutFlag(Flag flag) {
        var newFlags = EnumSet.noneOf(Flag.class);
        newFlags.addAll(flags);
        newFlags.remove(flag);
        var newPositions = new EnumMap<Flag, Position>(Flag.class);
        newPositions.putAll(positions);
        newPositions.remove(flag);
        return new Modifiers(newFlags, newPositions, annotations);
    }

    public Modifiers withAnnotations(List<Tree> annotations) {
        return new Modifiers(flags, positions, annotations);
    }

    Modifiers mapAnnotations(UnaryOperator<Tree> mapper, Tree owner) {
        if (annotations.isEmpty()) {
            return this;
        }
        return withAnnotations(Trees.mapAll(annotations, mapper, Tree.class, owner));
    }
}
