package net.neoforged.rewrite.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProblemIdTest {
    private static final ProblemGroup PARTITIONING = ProblemGroup.create("partitioning", "Partitioning", ProblemGroup.REWRITE);

    @Test
    void testQualifiedNames() {
        var id = ProblemId.create("unknown-tree", "Unknown Tree", PARTITIONING);

        assertThat(id).hasToString("rewrite:partitioning:unknown-tree");
        assertThat(PARTITIONING).hasToString("rewrite:partitioning");
    }

    @Test
    void testEqualityIgnoresDisplayName() {
        var id = ProblemId.create("unknown-tree", "Unknown Tree", PARTITIONING);
        var renamed = ProblemId.create("unknown-tree", "Unrecognized tree", PARTITIONING);
        var elsewhere = ProblemId.create("unknown-tree", "Unknown Tree", ProblemGroup.REWRITE);

        assertThat(id).isEqualTo(renamed).hasSameHashCodeAs(renamed);
        assertThat(id).isNotEqualTo(elsewhere);
    }

    @Test
    void testGroupHierarchy() {
        assertThat(PARTITIONING.isWithin(ProblemGroup.REWRITE)).isTrue();
        assertThat(PARTITIONING.isWithin(PARTITIONING)).isTrue();
        assertThat(ProblemGroup.REWRITE.isWithin(PARTITIONING)).isFalse();
    }

    @Test
    void testRejectsMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> ProblemId.create("Unknown Tree", "Unknown Tree", PARTITIONING));
        assertThrows(IllegalArgumentException.class, () -> ProblemGroup.create("-rewrite", "Rewrite"));
        assertThrows(NullPointerException.class, () -> ProblemId.create("unknown-tree", "Unknown Tree", null));
    }
}
