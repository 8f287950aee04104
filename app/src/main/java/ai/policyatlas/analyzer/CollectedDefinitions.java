package ai.policyatlas.analyzer;

import java.util.List;
import java.util.Map;

/**
 * The merged, language-neutral definitions of all files of a run, before any hierarchy links are made.
 *
 * @param namespaceByBaseName lowercased definition-file base name to its target namespace
 */
public record CollectedDefinitions(
        List<SourceFile> sourceFiles,
        Map<SourceFile, NamespaceMap> namespaceMaps,
        Map<String, String> namespaceByBaseName,
        Map<String, SupportedOnDefinition> supportedOn,
        Map<String, CategoryDefinition> categories,
        Map<String, PolicyDefinition> policies) {

    public CollectedDefinitions {
        sourceFiles = List.copyOf(sourceFiles);
        namespaceMaps = Map.copyOf(namespaceMaps);
        namespaceByBaseName = Map.copyOf(namespaceByBaseName);
        supportedOn = Map.copyOf(supportedOn);
        categories = Map.copyOf(categories);
        policies = Map.copyOf(policies);
    }
}
