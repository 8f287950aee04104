package ai.policyatlas.analyzer;

import java.util.Map;
import java.util.Optional;

/**
 * The {@code policyNamespaces} section of one definition file: the file's own target namespace and the prefixes it
 * uses to refer to other files. The target prefix is part of {@code prefixes} as well.
 */
public record NamespaceMap(SourceFile source, String targetPrefix, String targetNamespace, Map<String, String> prefixes) {

    /** Separator between namespace and local name in every global id. */
    public static final String QUALIFIER = "::";

    public NamespaceMap {
        prefixes = Map.copyOf(prefixes);
    }

    public Optional<String> namespaceFor(String prefix) {
        return Optional.ofNullable(prefixes.get(prefix));
    }

    public static String qualify(String namespace, String localName) {
        return namespace + QUALIFIER + localName;
    }
}
