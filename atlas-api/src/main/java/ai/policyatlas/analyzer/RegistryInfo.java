package ai.policyatlas.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;

/**
 * Where and how a policy is written to the registry.
 *
 * <p>A policy may carry both a top-level {@code valueName} (the on/off switch) and a list of {@code elements}. Both are
 * kept as found in the template.
 */
public record RegistryInfo(
        @Nullable String key,
        @Nullable String valueName,
        RegistryValueType type,
        @Nullable Object enabledValue,
        @Nullable Object disabledValue,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<RegistryOption> options,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<RegistryElement> elements) {

    public RegistryInfo {
        options = List.copyOf(options);
        elements = List.copyOf(elements);
    }

    public static RegistryInfo keyOnly(@Nullable String key) {
        return new RegistryInfo(key, null, RegistryValueType.UNKNOWN, null, null, List.of(), List.of());
    }

    @JsonIgnore
    public boolean hasValueAndElements() {
        return valueName != null && !elements.isEmpty();
    }

    /** Returns a copy whose options, including the options of every element, went through {@code mapper}. */
    public RegistryInfo mapOptions(UnaryOperator<RegistryOption> mapper) {
        return new RegistryInfo(
                key,
                valueName,
                type,
                enabledValue,
                disabledValue,
                options.stream().map(mapper).toList(),
                elements.stream().map(e -> e.mapOptions(mapper)).toList());
    }
}
