package ai.policyatlas.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

/**
 * One selectable value of a registry setting.
 *
 * <p>In the language-neutral graph {@code display} holds a symbolic token such as {@code $(string.Enabled)} and
 * {@code fallback} the text to use when the language has no entry for it. Projected options carry resolved text and no
 * fallback.
 *
 * @param value a {@link Long} for numeric values, a {@link String} otherwise
 */
@JsonIgnoreProperties({"fallback"})
public record RegistryOption(Object value, String display, @Nullable String fallback) {

    public RegistryOption(Object value, String display) {
        this(value, display, null);
    }

    public RegistryOption withDisplay(String resolved) {
        return new RegistryOption(value, resolved, null);
    }
}
