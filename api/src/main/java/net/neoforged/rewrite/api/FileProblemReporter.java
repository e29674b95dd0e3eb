package net.neoforged.rewrite.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;
import org.jetbrains.annotations.VisibleForTesting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Collects problems in memory and writes them as a JSON report when closed.
 */
public class FileProblemReporter implements ProblemReporter, AutoCloseable {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private final Logger logger;
    private final Path problemsReport;

    private final List<ProblemRecord> problems = new ArrayList<>();

    public FileProblemReporter(Logger logger, Path problemsReport) {
        this.logger = logger;
        this.problemsReport = problemsReport;
    }

    @Override
    public synchronized void report(ProblemId problemId, ProblemSeverity severity, @Nullable ProblemLocation location, String message) {
        problems.add(new ProblemRecord(problemId, severity, location, message));
    }

    @Override
    public void report(ProblemId problemId, ProblemSeverity severity, String message) {
        report(problemId, severity, (ProblemLocation) null, message);
    }

    public synchronized @UnmodifiableView List<ProblemRecord> problems() {
        return Collections.unmodifiableList(problems);
    }

    @Override
    public synchronized void close() throws IOException {
        logger.debug("Writing %d problem(s) to %s", problems.size(), problemsReport);
        var parent = problemsReport.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var writer = Files.newBufferedWriter(problemsReport, StandardCharsets.UTF_8)) {
            GSON.toJson(problems, writer);
        }
    }

    @VisibleForTesting
    public static List<ProblemRecord> loadRecords(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return Arrays.asList(GSON.fromJson(reader, ProblemRecord[].class));
        }
    }

    public record ProblemRecord(
            ProblemId problemId,
            ProblemSeverity severity,
            @Nullable ProblemLocation location,
            String message
    ) {
    }
}
