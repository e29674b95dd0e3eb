package net.neoforged.rewrite.regeneration;

import org.jetbrains.annotations.Nullable;

/**
 * One link of the chain the {@link Partitioner} hands every {@link Site} to. A contribution either
 * does its part and passes the site on with {@link #next}, or returns to hide the site from the
 * contributions after it.
 */
abstract class Contribution {
    protected final Partitioner partitioner;
    @Nullable
    private final Contribution next;

    protected Contribution(Partitioner partitioner, @Nullable Contribution next) {
        this.partitioner = partitioner;
        this.next = next;
    }

    abstract void handle(Site site, PartitionContext context);

    protected final void next(Site site, PartitionContext context) {
        if (next != null) {
            next.handle(site, context);
        }
    }
}
