package net.neoforged.rewrite.regeneration;

import net.neoforged.rewrite.api.tree.Tree;

import java.util.List;

/**
 * A tree in a role, handed to the {@link Contribution} chain. {@code members} holds the trees the role
 * consists of, such as the arguments of a parameter list or the statements of a body.
 */
public record Site(Tree tree, Role role, List<? extends Tree> members) {
    public Site {
        members = List.copyOf(members);
    }

    public Site(Tree tree, Role role) {
        this(tree, role, List.of());
    }

    public Site(Tree tree, Role role, Tree member) {
        this(tree, role, List.of(member));
    }
}
