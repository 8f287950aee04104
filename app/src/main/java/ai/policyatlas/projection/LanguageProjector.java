package ai.policyatlas.projection;

import ai.policyatlas.analyzer.CategoryDefinition;
import ai.policyatlas.analyzer.IPolicyGraph;
import ai.policyatlas.analyzer.PolicyDefinition;
import ai.policyatlas.analyzer.RegistryOption;
import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import java.util.ArrayList;
import java.util.Comparator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns the language-neutral graph into the records of one language. The graph is only read, so one instance of it
 * serves every language.
 */
public final class LanguageProjector {
    private static final Logger logger = LogManager.getLogger(LanguageProjector.class);

    static final String NO_DESCRIPTION = "no description";
    static final String NOT_SPECIFIED = "not specified";

    private final DiagnosticLog diagnostics;

    public LanguageProjector(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
    }

    public LanguageRecordSet project(IPolicyGraph graph, LanguageResources resources) {
        var categories = new ArrayList<CategoryRecord>();
        categories.add(CategoryRecord.root(graph.topLevelCategories()));
        graph.categories().stream()
                .sorted(Comparator.comparing(CategoryDefinition::uniqueId))
                .map(c -> toRecord(c, graph, resources))
                .forEach(categories::add);

        var policies = graph.policies().stream()
                .sorted(Comparator.comparing(PolicyDefinition::uniqueId))
                .map(p -> toRecord(p, graph, resources))
                .toList();

        logger.info(
                "Projected {} categories and {} policies for {}",
                categories.size() - 1,
                policies.size(),
                resources.language());
        return new LanguageRecordSet(resources.language(), categories, policies);
    }

    private CategoryRecord toRecord(CategoryDefinition category, IPolicyGraph graph, LanguageResources resources) {
        var id = category.uniqueId();
        return new CategoryRecord(
                id,
                category.name(),
                resolve(category.displayNameToken(), resources, category.name()),
                graph.parentOf(id).orElse(null),
                graph.childrenOf(id),
                graph.policiesIn(id));
    }

    private PolicyRecord toRecord(PolicyDefinition policy, IPolicyGraph graph, LanguageResources resources) {
        var strings = resources.strings();
        var registry = policy.registry().mapOptions(option -> resolveOption(option, strings));

        var presentation = resources.presentation(policy.presentationKey()).orElse(null);
        if (presentation == null && policy.presentationKey() != null) {
            diagnostics.report(
                    DiagnosticKind.UNRESOLVED_REFERENCE,
                    resources.language(),
                    "%s: presentation %s not found".formatted(policy.uniqueId(), policy.presentationKey()));
        }

        var supportedOn = graph.supportedOnToken(policy).orElse(null);
        return new PolicyRecord(
                policy.uniqueId(),
                policy.name(),
                policy.policyClass(),
                resolve(policy.displayNameToken(), resources, policy.name()),
                resolve(policy.explainTextToken(), resources, NO_DESCRIPTION),
                resolve(supportedOn, resources, NOT_SPECIFIED),
                graph.categoryOf(policy.uniqueId()).orElse(null),
                registry,
                presentation,
                policy.source().displayPath());
    }

    private static RegistryOption resolveOption(RegistryOption option, StringTable strings) {
        var display = ReferenceResolver.resolve(option.display(), strings, option.fallback());
        return option.withDisplay(display == null ? option.display() : display);
    }

    private static String resolve(@Nullable String token, LanguageResources resources, String fallback) {
        var resolved = ReferenceResolver.resolve(token, resources.strings(), fallback);
        return resolved == null ? fallback : resolved;
    }
}
