package ai.policyatlas.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;

/**
 * A parameterized registry value belonging to a policy ({@code enum}, {@code decimal}, {@code text}, ...).
 *
 * @param key only present when the element writes to a different key than its policy
 */
public record RegistryElement(
        String id,
        @Nullable String key,
        @Nullable String valueName,
        RegistryValueType type,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<RegistryOption> options,
        @Nullable Long minValue,
        @Nullable Long maxValue,
        @Nullable Integer maxLength,
        boolean required) {

    public RegistryElement {
        options = List.copyOf(options);
    }

    public RegistryElement mapOptions(UnaryOperator<RegistryOption> mapper) {
        return new RegistryElement(
                id,
                key,
                valueName,
                type,
                options.stream().map(mapper).toList(),
                minValue,
                maxValue,
                maxLength,
                required);
    }
}
