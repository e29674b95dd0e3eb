package net.neoforged.rewrite.api;

import org.jetbrains.annotations.Nullable;

/**
 * Receives problems found while rewriting. Problems never abort a rewrite by themselves; callers decide
 * what to do with them.
 */
public interface ProblemReporter {
    ProblemReporter NOOP = new ProblemReporter() {
        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, @Nullable ProblemLocation location, String message) {
        }

        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, String message) {
        }
    };

    void report(ProblemId problemId, ProblemSeverity severity, @Nullable ProblemLocation location, String message);

    /**
     * Reports a location independent problem.
     */
    void report(ProblemId problemId, ProblemSeverity severity, String message);

    default void report(ProblemId problemId, ProblemSeverity severity, Position position, String message) {
        var location = ProblemLocation.ofPosition(position);
        if (location != null) {
            report(problemId, severity, location, message);
        } else {
            report(problemId, severity, message);
        }
    }
}
