package ai.policyatlas.diagnostics;

public enum DiagnosticKind {
    /** A definition lacks its required name; it was skipped. */
    MISSING_IDENTIFIER,
    /** Two definitions share an id; the later one won (or the first one, for supported-on definitions). */
    DUPLICATE_IDENTIFIER,
    /** A parent, supported-on, presentation or namespace reference could not be found. */
    UNRESOLVED_REFERENCE,
    /** Ambiguous but tolerated structure: value plus elements, half an enabled/disabled pair, a parent cycle. */
    STRUCTURAL_AMBIGUITY,
    /** A file could not be parsed and was skipped. */
    SOURCE_FILE_ERROR,
    /** A requested language had no resource files and was skipped. */
    MISSING_LANGUAGE_RESOURCES
}
