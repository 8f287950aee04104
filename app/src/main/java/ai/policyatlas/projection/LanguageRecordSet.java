package ai.policyatlas.projection;

import java.util.List;
import java.util.Optional;

/** Everything written for one language. {@code allCategories} starts with the virtual root. */
public record LanguageRecordSet(String language, List<CategoryRecord> allCategories, List<PolicyRecord> allPolicies) {

    public LanguageRecordSet {
        allCategories = List.copyOf(allCategories);
        allPolicies = List.copyOf(allPolicies);
    }

    public Optional<CategoryRecord> category(String id) {
        return allCategories.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public Optional<PolicyRecord> policy(String id) {
        return allPolicies.stream().filter(p -> p.id().equals(id)).findFirst();
    }
}
