package ai.policyatlas.projection;

import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves symbolic tokens against a {@link StringTable}.
 *
 * <ul>
 *   <li>{@code $(string.ID)} looks up {@code ID};
 *   <li>{@code vendor:SUPPORTED_X} looks up {@code SUPPORTED_X};
 *   <li>anything else is literal text and comes back unchanged.
 * </ul>
 *
 * A reference that is not in the table yields the fallback when one is given, otherwise the token itself. Resolving
 * resolved text again returns it unchanged.
 */
public final class ReferenceResolver {
    private static final Pattern STRING_REF = Pattern.compile("^\\$\\(string\\.([^)]+)\\)$");
    private static final Pattern VENDOR_SUPPORTED_REF = Pattern.compile("^[^:\\s]+:(SUPPORTED_\\S*)$");

    private ReferenceResolver() {}

    public static String resolve(String token, StringTable table) {
        var resolved = resolve(token, table, null);
        return resolved == null ? token : resolved;
    }

    /** A null token resolves to the fallback. */
    public static @Nullable String resolve(@Nullable String token, StringTable table, @Nullable String fallback) {
        if (token == null) {
            return fallback;
        }
        var id = referencedId(token);
        if (id.isEmpty()) {
            return token;
        }
        return table.lookup(id.get()).orElse(fallback != null ? fallback : token);
    }

    /** The string id a token refers to, or empty if the token is literal text. */
    public static Optional<String> referencedId(String token) {
        var trimmed = token.trim();
        var stringRef = STRING_REF.matcher(trimmed);
        if (stringRef.matches()) {
            return Optional.of(stringRef.group(1));
        }
        var supportedRef = VENDOR_SUPPORTED_REF.matcher(trimmed);
        if (supportedRef.matches()) {
            return Optional.of(supportedRef.group(1));
        }
        return Optional.empty();
    }
}
