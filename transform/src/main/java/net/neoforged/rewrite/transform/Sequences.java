package net.neoforged.rewrite.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for rewriting ordered sequences such as statement lists.
 */
public final class Sequences {
    private Sequences() {
    }

    /**
     * Replaces the elements {@code what} in {@code from} with {@code replacement}.
     * <p>
     * The first element of {@code from} that equals the first element of {@code what} is replaced
     * by all of {@code replacement}; the remaining elements of {@code what} are removed where they
     * occur afterwards, in order. If no element of {@code what} is found, {@code from} is returned
     * unchanged.
     * <pre>{@code
     * replace([1, 2, 3, 4, 5], [2], [6])    == [1, 6, 3, 4, 5]
     * replace([1, 2, 3, 4, 5], [5], [6, 7]) == [1, 2, 3, 4, 6, 7]
     * replace([1, 2, 3, 4, 5], [6], [1])    == [1, 2, 3, 4, 5]
     * }</pre>
     */
    public static <T> List<T> replace(List<? extends T> from, List<? extends T> what, List<? extends T> replacement) {
        var result = new ArrayList<T>(from.size() + replacement.size());
        int matched = 0;
        boolean replaced = false;
        for (T element : from) {
            if (matched < what.size() && element.equals(what.get(matched))) {
                matched++;
                if (!replaced) {
                    result.addAll(replacement);
                    replaced = true;
                }
            } else {
                result.add(element);
            }
        }
        return result;
    }
}
