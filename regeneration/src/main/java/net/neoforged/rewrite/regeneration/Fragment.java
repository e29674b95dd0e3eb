package net.neoforged.rewrite.regeneration;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piece of the partitioned source: a scope, a leaf, or layout between them.
 * <p>
 * Fragments that stem from the original source have a span. Fragments created for synthetic trees
 * report {@code -1} for both ends.
 */
public abstract class Fragment {
    private final List<Requisite> requiredBefore = new ArrayList<>();
    private final List<Requisite> requiredAfter = new ArrayList<>();

    public abstract int start();

    public abstract int end();

    public boolean isOriginal() {
        return start() >= 0;
    }

    /**
     * @return the anchor identifying this fragment in the original source, if it is one
     */
    public abstract @Nullable Anchor anchor();

    public void requireBefore(Requisite requisite) {
        if (!requiredBefore.contains(requisite)) {
            requiredBefore.add(requisite);
        }
    }

    public void requireAfter(Requisite requisite) {
        if (!requiredAfter.contains(requisite)) {
            requiredAfter.add(requisite);
        }
    }

    @UnmodifiableView
    public List<Requisite> requiredBefore() {
        return Collections.unmodifiableList(requiredBefore);
    }

    @UnmodifiableView
    public List<Requisite> requiredAfter() {
        return Collections.unmodifiableList(requiredAfter);
    }

    void copyRequisitesTo(Fragment other) {
        requiredBefore.forEach(other::requireBefore);
        requiredAfter.forEach(other::requireAfter);
    }

    String describeSpan() {
        return isOriginal() ? "[" + start() + ", " + end() + ")" : "<synthetic>";
    }
}
