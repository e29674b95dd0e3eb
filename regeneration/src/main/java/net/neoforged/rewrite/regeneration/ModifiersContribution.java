package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.Tree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;

/**
 * Emits modifier keywords and annotations. Those written in source come first, in source order,
 * followed by the flags a transformation added.
 */
final class ModifiersContribution extends Contribution {
    ModifiersContribution(Partitioner partitioner, @Nullable Contribution next) {
        super(partitioner, next);
    }

    @Override
    void handle(Site site, PartitionContext context) {
        if (site.role() == Role.MODS && site.tree() instanceof DefTree def) {
            var mods = def.mods();
            var entries = new ArrayList<Entry>();
            for (var flag : mods.positionedFlags()) {
                entries.add(new Entry(mods.positions().get(flag).start(), flag, null));
            }
            for (var annotation : mods.annotations()) {
                int start = annotation.position().isSynthetic() ? -1 : annotation.position().start();
                entries.add(new Entry(start, null, annotation));
            }
            entries.sort(Comparator.comparingInt(Entry::start));

            for (var entry : entries) {
                if (entry.flag != null) {
                    context.emit(new FlagFragment(entry.flag, mods.positions().get(entry.flag)));
                } else if (entry.annotation != null) {
                    if (entry.annotation.position().isSynthetic()) {
                        context.requireBefore(Requisite.of("@"));
                    }
                    partitioner.traverse(entry.annotation, context);
                }
                context.requireAfter(Requisite.of(" "));
            }
            for (var flag : mods.unpositionedFlags()) {
                context.emit(new FlagFragment(flag, null));
                context.requireAfter(Requisite.of(" "));
            }
        }
        next(site, context);
    }

    private record Entry(int start, @Nullable Flag flag, @Nullable Tree annotation) {
    }
}
