package ai.policyatlas.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** The registry hive scope of a policy. */
public enum PolicyClass {
    MACHINE("Machine"),
    USER("User"),
    BOTH("Both");

    private final String label;

    PolicyClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Parses the {@code class} attribute of a policy. Matching ignores case; blank or unknown values are empty. */
    public static Optional<PolicyClass> fromAttribute(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var trimmed = value.trim();
        return Arrays.stream(values())
                .filter(pc -> pc.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
