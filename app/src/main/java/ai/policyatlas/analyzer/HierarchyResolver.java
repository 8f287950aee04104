package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Links categories to their parents and policies to their categories.
 *
 * <p>Dangling parent references leave a category at the top level. Parent cycles are broken at the first category
 * seen twice, which then becomes top-level. Unresolvable policy placements leave the policy without a category.
 */
public final class HierarchyResolver {
    private static final Logger logger = LogManager.getLogger(HierarchyResolver.class);

    private final DiagnosticLog diagnostics;
    private final NamespaceResolver namespaceResolver;

    public HierarchyResolver(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
        this.namespaceResolver = new NamespaceResolver(diagnostics);
    }

    public PolicyGraph resolve(CollectedDefinitions definitions) {
        var parents = linkCategories(definitions);
        breakCycles(parents);

        var children = new TreeMap<String, List<String>>();
        parents.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> children.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey()));

        var categoryByPolicy = associatePolicies(definitions);
        var policiesByCategory = new TreeMap<String, List<String>>();
        categoryByPolicy.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> policiesByCategory.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey()));

        logger.info(
                "Linked {} of {} categories to parents, placed {} of {} policies",
                parents.size(),
                definitions.categories().size(),
                categoryByPolicy.size(),
                definitions.policies().size());
        return new PolicyGraph(definitions, parents, children, policiesByCategory, categoryByPolicy);
    }

    Map<String, String> linkCategories(CollectedDefinitions definitions) {
        var parents = new HashMap<String, String>();
        definitions.categories().values().stream()
                .filter(CategoryDefinition::declaresParent)
                .sorted(Comparator.comparing(CategoryDefinition::uniqueId))
                .forEach(category -> {
                    var parentId = category.parentRefUniqueId();
                    if (definitions.categories().containsKey(parentId)) {
                        parents.put(category.uniqueId(), parentId);
                    } else if (isQualified(parentId)) {
                        diagnostics.report(
                                DiagnosticKind.UNRESOLVED_REFERENCE,
                                category.uniqueId(),
                                "parent category '%s' not found; placed at top level"
                                        .formatted(category.parentRefRaw()));
                    }
                });
        return parents;
    }

    /** Removes the parent link of the first repeated category on every cycle. Mutates {@code parents}. */
    void breakCycles(Map<String, String> parents) {
        Set<String> reachesRoot = new HashSet<>();
        for (var start : parents.keySet().stream().sorted().toList()) {
            var path = new LinkedHashSet<String>();
            var current = start;
            while (current != null && !reachesRoot.contains(current)) {
                if (!path.add(current)) {
                    var cycle = cyclePath(path, current);
                    parents.remove(current);
                    diagnostics.report(
                            DiagnosticKind.STRUCTURAL_AMBIGUITY,
                            current,
                            "parent cycle %s; %s placed at top level".formatted(cycle, current));
                    break;
                }
                current = parents.get(current);
            }
            reachesRoot.addAll(path);
        }
    }

    private static String cyclePath(LinkedHashSet<String> path, String repeated) {
        var members = new ArrayList<String>();
        boolean inCycle = false;
        for (var id : path) {
            inCycle |= id.equals(repeated);
            if (inCycle) {
                members.add(id);
            }
        }
        members.add(repeated);
        return members.stream().collect(Collectors.joining(" -> "));
    }

    Map<String, String> associatePolicies(CollectedDefinitions definitions) {
        var categoryByPolicy = new HashMap<String, String>();
        var ordered = definitions.policies().values().stream()
                .sorted(Comparator.comparing(PolicyDefinition::uniqueId))
                .toList();
        for (var policy : ordered) {
            var raw = policy.parentCategoryRefRaw();
            if (raw == null) {
                diagnostics.report(
                        DiagnosticKind.UNRESOLVED_REFERENCE, policy.uniqueId(), "declares no parentCategory");
                continue;
            }
            // the reference is written relative to the defining file's prefixes, not the policy's namespace
            var namespaces = definitions.namespaceMaps().get(policy.source());
            if (namespaces == null) {
                diagnostics.report(
                        DiagnosticKind.UNRESOLVED_REFERENCE,
                        policy.uniqueId(),
                        "no namespace map for defining file " + policy.source().displayPath());
                continue;
            }
            var categoryId = namespaceResolver.resolve(raw, namespaces);
            if (definitions.categories().containsKey(categoryId)) {
                categoryByPolicy.put(policy.uniqueId(), categoryId);
            } else if (isQualified(categoryId)) {
                diagnostics.report(
                        DiagnosticKind.UNRESOLVED_REFERENCE,
                        policy.uniqueId(),
                        "parent category '%s' not found; policy has no category".formatted(raw));
            }
        }
        return categoryByPolicy;
    }

    /** False when the namespace resolver could not resolve the prefix; it has already reported that reference. */
    private static boolean isQualified(@Nullable String id) {
        return id != null && id.contains(NamespaceMap.QUALIFIER);
    }
}
