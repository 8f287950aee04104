package ai.policyatlas.diagnostics;

import org.jetbrains.annotations.Nullable;

/**
 * @param location the file, language or id the problem was found in, if known
 */
public record Diagnostic(DiagnosticKind kind, @Nullable String location, String message) {

    @Override
    public String toString() {
        return location == null ? kind + ": " + message : kind + " [" + location + "]: " + message;
    }
}
