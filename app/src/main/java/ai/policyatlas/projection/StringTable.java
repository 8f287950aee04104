package ai.policyatlas.projection;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** String id to literal text for a single language. There is no fallback to other languages. */
public final class StringTable {
    private final Map<String, String> entries;

    public StringTable() {
        this.entries = new HashMap<>();
    }

    private StringTable(Map<String, String> entries) {
        this.entries = new HashMap<>(entries);
    }

    public static StringTable of(Map<String, String> entries) {
        return new StringTable(entries);
    }

    public static StringTable empty() {
        return new StringTable();
    }

    /** Adds or replaces an entry, returning the text it replaced. */
    public @Nullable String put(String id, String text) {
        return entries.put(id, text);
    }

    public Optional<String> lookup(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public int size() {
        return entries.size();
    }
}
