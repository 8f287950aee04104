package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;

/**
 * Folds per-file definitions into global maps.
 *
 * <p>Files are folded in order of their relative path, so the outcome does not depend on the order they were found in.
 * Categories and policies: the last definition of an id wins. Supported-on definitions: the first one wins. Every
 * collision is reported with both files.
 */
public final class DefinitionMerger {

    private DefinitionMerger() {}

    public static CollectedDefinitions merge(Collection<FileDefinitions> perFile, DiagnosticLog diagnostics) {
        var ordered = perFile.stream()
                .sorted(Comparator.comparing((FileDefinitions fd) -> fd.source().displayPath()))
                .toList();

        var namespaceMaps = new HashMap<SourceFile, NamespaceMap>();
        var namespaceByBaseName = new HashMap<String, String>();
        var supportedOn = new HashMap<String, SupportedOnDefinition>();
        var categories = new HashMap<String, CategoryDefinition>();
        var policies = new HashMap<String, PolicyDefinition>();

        for (var fd : ordered) {
            namespaceMaps.put(fd.source(), fd.namespaces());

            var baseName = fd.source().baseName();
            var previousNamespace = namespaceByBaseName.put(baseName, fd.namespaces().targetNamespace());
            if (previousNamespace != null && !previousNamespace.equals(fd.namespaces().targetNamespace())) {
                diagnostics.report(
                        DiagnosticKind.DUPLICATE_IDENTIFIER,
                        fd.source().displayPath(),
                        "base name '%s' already maps to namespace %s; resource files now resolve to %s"
                                .formatted(baseName, previousNamespace, fd.namespaces().targetNamespace()));
            }

            for (var def : fd.supportedOn()) {
                var first = supportedOn.putIfAbsent(def.name(), def);
                if (first != null) {
                    diagnostics.report(
                            DiagnosticKind.DUPLICATE_IDENTIFIER,
                            def.name(),
                            "supportedOn defined in %s and %s; keeping the first"
                                    .formatted(first.source().displayPath(), def.source().displayPath()));
                }
            }

            for (var category : fd.categories()) {
                var previous = categories.put(category.uniqueId(), category);
                if (previous != null) {
                    diagnostics.report(
                            DiagnosticKind.DUPLICATE_IDENTIFIER,
                            category.uniqueId(),
                            "category defined in %s and %s; keeping the last"
                                    .formatted(previous.source().displayPath(), category.source().displayPath()));
                }
            }

            for (var policy : fd.policies()) {
                var previous = policies.put(policy.uniqueId(), policy);
                if (previous != null) {
                    diagnostics.report(
                            DiagnosticKind.DUPLICATE_IDENTIFIER,
                            policy.uniqueId(),
                            "policy defined in %s and %s; keeping the last"
                                    .formatted(previous.source().displayPath(), policy.source().displayPath()));
                }
            }
        }

        List<SourceFile> sources = ordered.stream().map(FileDefinitions::source).toList();
        return new CollectedDefinitions(sources, namespaceMaps, namespaceByBaseName, supportedOn, categories, policies);
    }
}
