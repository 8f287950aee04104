package ai.policyatlas.projection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A category as written for one language. {@code parent} is written as null for top-level categories. */
@JsonPropertyOrder({"id", "name", "displayName", "parent", "children", "policies"})
public record CategoryRecord(
        String id,
        String name,
        String displayName,
        @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable String parent,
        List<String> children,
        List<String> policies) {

    public static final String ROOT_ID = "ROOT";
    public static final String ROOT_NAME = "Root";

    public CategoryRecord {
        children = List.copyOf(children);
        policies = List.copyOf(policies);
    }

    /** The virtual root; its children are the top-level categories. */
    public static CategoryRecord root(List<String> topLevel) {
        return new CategoryRecord(ROOT_ID, ROOT_NAME, ROOT_NAME, null, topLevel, List.of());
    }
}
