package ai.policyatlas.diagnostics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class DiagnosticLogTest {

    @Test
    public void collectsAndCountsByKind() {
        var log = new DiagnosticLog();
        assertTrue(log.isEmpty());

        log.report(DiagnosticKind.DUPLICATE_IDENTIFIER, "ns::A", "defined twice");
        log.report(DiagnosticKind.DUPLICATE_IDENTIFIER, "ns::B", "defined twice");
        log.report(DiagnosticKind.SOURCE_FILE_ERROR, "broken");

        assertEquals(3, log.all().size());
        assertEquals(2, log.ofKind(DiagnosticKind.DUPLICATE_IDENTIFIER).size());
        assertEquals(
                Map.of(DiagnosticKind.DUPLICATE_IDENTIFIER, 2, DiagnosticKind.SOURCE_FILE_ERROR, 1),
                log.countsByKind());
        log.logSummary();
    }

    @Test
    public void diagnosticRendersLocationWhenKnown() {
        assertEquals(
                "UNRESOLVED_REFERENCE [ns::P]: missing",
                new Diagnostic(DiagnosticKind.UNRESOLVED_REFERENCE, "ns::P", "missing").toString());
        assertEquals(
                "SOURCE_FILE_ERROR: broken", new Diagnostic(DiagnosticKind.SOURCE_FILE_ERROR, null, "broken").toString());
    }
}
