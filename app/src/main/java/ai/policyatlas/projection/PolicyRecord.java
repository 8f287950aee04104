package ai.policyatlas.projection;

import ai.policyatlas.analyzer.PolicyClass;
import ai.policyatlas.analyzer.RegistryInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

/**
 * A policy as written for one language.
 *
 * @param categoryId written as null for orphaned policies
 * @param presentation omitted when the language has no matching template
 * @param admxFile the defining file, relative to the source root
 */
@JsonPropertyOrder({
    "id",
    "name",
    "class",
    "displayName",
    "explainText",
    "supportedOn",
    "categoryId",
    "registry",
    "presentation",
    "admxFile"
})
public record PolicyRecord(
        String id,
        String name,
        @JsonProperty("class") PolicyClass policyClass,
        String displayName,
        String explainText,
        String supportedOn,
        @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable String categoryId,
        RegistryInfo registry,
        @Nullable PresentationDefinition presentation,
        String admxFile) {}
