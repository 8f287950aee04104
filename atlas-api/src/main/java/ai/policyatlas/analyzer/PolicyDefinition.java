package ai.policyatlas.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A policy as declared in a definition file. All text fields are raw symbolic tokens; they are resolved per language.
 *
 * @param supportedOnRef the {@code supportedOn ref}, e.g. {@code windows:SUPPORTED_Windows7}
 * @param presentationToken the {@code presentation} attribute, e.g. {@code $(presentation.Foo)}
 * @param presentationKey {@code namespace::presentationId} parsed from {@code presentationToken}
 * @param parentCategoryRefRaw the {@code parentCategory ref} as written; resolved against the namespace map of
 *     {@code source}
 */
public record PolicyDefinition(
        String uniqueId,
        String name,
        String namespaceUri,
        PolicyClass policyClass,
        @Nullable String displayNameToken,
        @Nullable String explainTextToken,
        @Nullable String supportedOnRef,
        @Nullable String presentationToken,
        @Nullable String presentationKey,
        @Nullable String parentCategoryRefRaw,
        RegistryInfo registry,
        SourceFile source) {

    @Override
    public String toString() {
        return "POLICY[" + uniqueId + "]";
    }
}
