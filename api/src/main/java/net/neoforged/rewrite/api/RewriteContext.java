package net.neoforged.rewrite.api;

/**
 * Everything a rewrite needs besides the trees themselves.
 */
public record RewriteContext(Logger logger, ProblemReporter problemReporter, LayoutPreferences preferences) {
    public static final RewriteContext DEFAULT = new RewriteContext(Logger.SILENT);

    public RewriteContext(Logger logger) {
        this(logger, ProblemReporter.NOOP, LayoutPreferences.DEFAULT);
    }

    public RewriteContext(Logger logger, ProblemReporter problemReporter) {
        this(logger, problemReporter, LayoutPreferences.DEFAULT);
    }
}
