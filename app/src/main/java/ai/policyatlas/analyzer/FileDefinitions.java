package ai.policyatlas.analyzer;

import java.util.List;

/** Everything one definition file declares, before it is merged with the other files. */
public record FileDefinitions(
        SourceFile source,
        NamespaceMap namespaces,
        List<SupportedOnDefinition> supportedOn,
        List<CategoryDefinition> categories,
        List<PolicyDefinition> policies) {

    public FileDefinitions {
        supportedOn = List.copyOf(supportedOn);
        categories = List.copyOf(categories);
        policies = List.copyOf(policies);
    }
}
