package ai.policyatlas.analyzer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The language-neutral category/policy graph of one run. Read-only once built; every per-language projection reads
 * from the same instance.
 */
public interface IPolicyGraph {
    /** Record summarizing the size of the graph, for logging. */
    record GraphMetrics(int sourceFiles, int categories, int policies, int supportedOnDefinitions) {}

    /** The definition files that contributed to this graph. */
    List<SourceFile> sourceFiles();

    Collection<CategoryDefinition> categories();

    Collection<PolicyDefinition> policies();

    Collection<SupportedOnDefinition> supportedOnDefinitions();

    Optional<PolicyDefinition> getPolicy(String uniqueId);

    /** Supported-on definitions are keyed by bare name, not by namespace. */
    Optional<SupportedOnDefinition> getSupportedOn(String name);

    /**
     * The target namespace of the definition file with the given base name. Resource files are matched to definition
     * files by base name.
     */
    Optional<String> namespaceForBaseName(String baseName);

    /** The parent of a category, or empty for a top-level category. */
    Optional<String> parentOf(String categoryId);

    /** Direct child categories, sorted by id. */
    List<String> childrenOf(String categoryId);

    /** Policies placed directly in a category, sorted by id. */
    List<String> policiesIn(String categoryId);

    /** The category a policy was placed in, or empty if its parent reference did not resolve. */
    Optional<String> categoryOf(String policyId);

    /** Categories without a parent, sorted by id. */
    default List<String> topLevelCategories() {
        return categories().stream()
                .map(CategoryDefinition::uniqueId)
                .filter(id -> parentOf(id).isEmpty())
                .sorted()
                .toList();
    }

    /**
     * The display token for a policy's {@code supportedOn} reference: the referenced definition's display name token,
     * or the raw reference itself when no definition matches. Either way the result still needs resolving against a
     * string table.
     */
    default Optional<String> supportedOnToken(PolicyDefinition policy) {
        var ref = policy.supportedOnRef();
        if (ref == null) {
            return Optional.empty();
        }
        var definition = getSupportedOn(ref).or(() -> {
            int colon = ref.indexOf(':');
            return colon >= 0 ? getSupportedOn(ref.substring(colon + 1)) : Optional.<SupportedOnDefinition>empty();
        });
        return Optional.of(definition
                .map(SupportedOnDefinition::displayNameToken)
                .filter(token -> !token.isBlank())
                .orElse(ref));
    }

    default GraphMetrics getMetrics() {
        return new GraphMetrics(
                sourceFiles().size(),
                categories().size(),
                policies().size(),
                supportedOnDefinitions().size());
    }
}
