package net.neoforged.rewrite.api.tree;

import net.neoforged.rewrite.api.Position;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Identity of a declared entity.
 * <p>
 * Two symbols are equal only if they are the same object; neither names nor positions are taken into
 * account. Trees that refer to the same declaration share one symbol instance.
 */
public final class Symbol {
    private final String name;
    private final Kind kind;
    @Nullable
    private final Symbol owner;
    private final Set<Flag> flags;
    private final Position position;

    public Symbol(String name, Kind kind, @Nullable Symbol owner, Set<Flag> flags, Position position) {
        this.name = name;
        this.kind = kind;
        this.owner = owner;
        this.flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags));
        this.position = position;
    }

    /**
     * Creates the symbol of an entity that is not declared in any source being rewritten.
     */
    public static Symbol external(String name) {
        return new Symbol(name, Kind.EXTERNAL, null, Set.of(), Position.synthetic());
    }

    /**
     * @return the name the entity was declared with
     */
    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public @Nullable Symbol owner() {
        return owner;
    }

    public Set<Flag> flags() {
        return flags;
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    /**
     * @return the position of the declaration, synthetic for entities declared outside the source
     */
    public Position position() {
        return position;
    }

    public boolean isExternal() {
        return position.isSynthetic();
    }

    @Override
    public String toString() {
        return owner != null ? owner + "." + name : name;
    }

    public enum Kind {
        CLASS,
        MODULE,
        METHOD,
        VALUE,
        PARAMETER,
        TYPE,
        EXTERNAL
    }
}
