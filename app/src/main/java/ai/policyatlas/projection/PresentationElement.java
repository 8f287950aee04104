package ai.policyatlas.projection;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * One control of a presentation template, e.g. a {@code dropdownList} bound to the enum element {@code refId}.
 *
 * @param label resolved text, if the control has one
 * @param defaultValue the default as written in the template (a number, an item index, {@code true}, text)
 */
public record PresentationElement(
        String type,
        @Nullable String refId,
        @Nullable String label,
        @JsonProperty("default") @Nullable String defaultValue) {}
