package ai.policyatlas.analyzer;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The graph of one run: the merged definitions plus the links made by {@link HierarchyResolver}. Each run builds a
 * fresh instance; nothing here is shared between runs.
 */
public final class PolicyGraph implements IPolicyGraph {
    private final CollectedDefinitions definitions;
    private final Map<String, String> parentByCategory;
    private final Map<String, List<String>> childrenByCategory;
    private final Map<String, List<String>> policiesByCategory;
    private final Map<String, String> categoryByPolicy;

    PolicyGraph(
            CollectedDefinitions definitions,
            Map<String, String> parentByCategory,
            Map<String, List<String>> childrenByCategory,
            Map<String, List<String>> policiesByCategory,
            Map<String, String> categoryByPolicy) {
        this.definitions = definitions;
        this.parentByCategory = Map.copyOf(parentByCategory);
        this.childrenByCategory = copyLists(childrenByCategory);
        this.policiesByCategory = copyLists(policiesByCategory);
        this.categoryByPolicy = Map.copyOf(categoryByPolicy);
    }

    private static Map<String, List<String>> copyLists(Map<String, List<String>> source) {
        return source.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    @Override
    public List<SourceFile> sourceFiles() {
        return definitions.sourceFiles();
    }

    @Override
    public Collection<CategoryDefinition> categories() {
        return definitions.categories().values();
    }

    @Override
    public Collection<PolicyDefinition> policies() {
        return definitions.policies().values();
    }

    @Override
    public Collection<SupportedOnDefinition> supportedOnDefinitions() {
        return definitions.supportedOn().values();
    }

    @Override
    public Optional<PolicyDefinition> getPolicy(String uniqueId) {
        return Optional.ofNullable(definitions.policies().get(uniqueId));
    }

    @Override
    public Optional<SupportedOnDefinition> getSupportedOn(String name) {
        return Optional.ofNullable(definitions.supportedOn().get(name));
    }

    @Override
    public Optional<String> namespaceForBaseName(String baseName) {
        return Optional.ofNullable(definitions.namespaceByBaseName().get(baseName));
    }

    @Override
    public Optional<String> parentOf(String categoryId) {
        return Optional.ofNullable(parentByCategory.get(categoryId));
    }

    @Override
    public List<String> childrenOf(String categoryId) {
        return childrenByCategory.getOrDefault(categoryId, List.of());
    }

    @Override
    public List<String> policiesIn(String categoryId) {
        return policiesByCategory.getOrDefault(categoryId, List.of());
    }

    @Override
    public Optional<String> categoryOf(String policyId) {
        return Optional.ofNullable(categoryByPolicy.get(policyId));
    }
}
