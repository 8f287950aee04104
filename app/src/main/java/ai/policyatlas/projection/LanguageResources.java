package ai.policyatlas.projection;

import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Everything one language contributes: its merged string table and its presentation templates. */
public record LanguageResources(String language, StringTable strings, Map<String, PresentationDefinition> presentations) {

    public LanguageResources {
        presentations = Map.copyOf(presentations);
    }

    public Optional<PresentationDefinition> presentation(@Nullable String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(presentations.get(key));
    }
}
