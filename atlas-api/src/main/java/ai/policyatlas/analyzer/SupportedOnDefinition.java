package ai.policyatlas.analyzer;

import org.jetbrains.annotations.Nullable;

/** A named platform requirement, keyed by its bare {@code name}. */
public record SupportedOnDefinition(String name, @Nullable String displayNameToken, SourceFile source) {}
