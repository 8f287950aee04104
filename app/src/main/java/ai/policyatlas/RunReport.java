package ai.policyatlas;

import ai.policyatlas.analyzer.IPolicyGraph;
import ai.policyatlas.diagnostics.Diagnostic;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run.
 *
 * @param written output file per language that completed
 * @param skipped languages without resource files
 * @param failed languages whose output could not be written, with the reason
 */
public record RunReport(
        IPolicyGraph.GraphMetrics metrics,
        Map<String, Path> written,
        List<String> skipped,
        Map<String, String> failed,
        List<Diagnostic> diagnostics) {

    public RunReport {
        written = Map.copyOf(written);
        skipped = List.copyOf(skipped);
        failed = Map.copyOf(failed);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean allLanguagesWritten() {
        return skipped.isEmpty() && failed.isEmpty();
    }
}
