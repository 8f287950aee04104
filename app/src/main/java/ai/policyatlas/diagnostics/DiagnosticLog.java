package ai.policyatlas.diagnostics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Collects the non-fatal problems of one run. Each report is logged at debug level as it happens; {@link #logSummary()}
 * surfaces all of them to the operator at the end of the run.
 */
public final class DiagnosticLog {
    private static final Logger logger = LogManager.getLogger(DiagnosticLog.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public synchronized void report(DiagnosticKind kind, @Nullable String location, String message) {
        var diagnostic = new Diagnostic(kind, location, message);
        diagnostics.add(diagnostic);
        logger.debug("{}", diagnostic);
    }

    public void report(DiagnosticKind kind, String message) {
        report(kind, null, message);
    }

    public synchronized List<Diagnostic> all() {
        return List.copyOf(diagnostics);
    }

    public synchronized List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    public synchronized boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public synchronized Map<DiagnosticKind, Integer> countsByKind() {
        var counts = new EnumMap<DiagnosticKind, Integer>(DiagnosticKind.class);
        for (var d : diagnostics) {
            counts.merge(d.kind(), 1, Integer::sum);
        }
        return counts;
    }

    /** Logs every collected diagnostic at warn level, grouped by kind, followed by the per-kind counts. */
    public synchronized void logSummary() {
        if (diagnostics.isEmpty()) {
            logger.info("Run completed without warnings");
            return;
        }
        for (var kind : DiagnosticKind.values()) {
            for (var d : diagnostics) {
                if (d.kind() == kind) {
                    logger.warn("{}", d);
                }
            }
        }
        logger.warn("Run completed with {} warning(s): {}", diagnostics.size(), countsByKind());
    }
}
