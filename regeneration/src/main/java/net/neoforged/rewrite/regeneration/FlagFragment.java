package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.tree.Flag;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Leaf of one modifier keyword. Flags added by a transformation have no position.
 */
public final class FlagFragment extends Fragment {
    private final Flag flag;
    @Nullable
    private final Position position;

    public FlagFragment(Flag flag, @Nullable Position position) {
        if (!flag.isPrintable()) {
            throw new IllegalArgumentException("Flag " + flag + " has no keyword");
        }
        this.flag = flag;
        this.position = position != null && position.isRange() ? position : null;
    }

    public Flag flag() {
        return flag;
    }

    @Override
    public int start() {
        return position != null ? position.start() : -1;
    }

    @Override
    public int end() {
        return position != null ? position.end() : -1;
    }

    public String text() {
        return position != null ? position.text() : Objects.requireNonNull(flag.keyword());
    }

    @Override
    public @Nullable Anchor anchor() {
        return position != null ? new Anchor(Anchor.Kind.FLAG, position.start(), position.end()) : null;
    }

    @Override
    public String toString() {
        return "FlagFragment[" + flag + " " + describeSpan() + "]";
    }
}
