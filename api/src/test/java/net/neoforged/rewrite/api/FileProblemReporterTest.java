package net.neoforged.rewrite.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileProblemReporterTest {
    private static final ProblemId PROBLEM = ProblemId.create("unknown-tree", "Unknown tree", ProblemGroup.REWRITE);

    @TempDir
    Path tempDir;

    @Test
    void testReportIsWrittenOnClose() throws Exception {
        var source = new SourceFile("Test.scala", "val a = 1\nval b = 2\n");
        var report = tempDir.resolve("reports/problems.json");

        try (var reporter = new FileProblemReporter(Logger.SILENT, report)) {
            reporter.report(PROBLEM, ProblemSeverity.WARNING, Position.range(source, 14, 15), "Cannot handle b");
            reporter.report(PROBLEM, ProblemSeverity.INFO, Position.synthetic(), "Cannot handle synthetic tree");
            assertThat(reporter.problems()).hasSize(2);
        }

        assertThat(report).exists();
        var records = FileProblemReporter.loadRecords(report);
        assertThat(records).containsExactly(
                new FileProblemReporter.ProblemRecord(PROBLEM, ProblemSeverity.WARNING,
                        new ProblemLocation("Test.scala", 2, 5, 14, 1), "Cannot handle b"),
                new FileProblemReporter.ProblemRecord(PROBLEM, ProblemSeverity.INFO, null, "Cannot handle synthetic tree")
        );
    }

    @Test
    void testEmptyReport() throws Exception {
        var report = tempDir.resolve("problems.json");
        new FileProblemReporter(Logger.SILENT, report).close();

        assertThat(Files.readString(report).trim()).isEqualTo("[]");
        assertThat(FileProblemReporter.loadRecords(report)).isEmpty();
    }
}
