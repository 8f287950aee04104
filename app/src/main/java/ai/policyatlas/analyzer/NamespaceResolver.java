package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.SourceFileException;
import ai.policyatlas.util.XmlNodes;
import java.util.HashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Reads the {@code policyNamespaces} section of a definition file and turns possibly-prefixed names into global
 * {@code namespace::name} keys.
 */
public final class NamespaceResolver {
    private static final Logger logger = LogManager.getLogger(NamespaceResolver.class);

    private final DiagnosticLog diagnostics;

    public NamespaceResolver(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Builds the prefix map of one file.
     *
     * @throws SourceFileException if the file declares no target namespace; none of its definitions can be placed
     */
    public NamespaceMap read(SourceFile source, Element policyDefinitions) {
        var section = XmlNodes.child(policyDefinitions, "policyNamespaces")
                .orElseThrow(() -> new SourceFileException(source, "missing <policyNamespaces> section"));
        var target = XmlNodes.child(section, "target")
                .orElseThrow(() -> new SourceFileException(source, "no <target> namespace declared"));
        var targetNamespace = XmlNodes.attr(target, "namespace");
        if (targetNamespace == null) {
            throw new SourceFileException(source, "<target> has no namespace attribute");
        }
        var targetPrefix = XmlNodes.optionalAttr(target, "prefix").orElse("");

        var prefixes = new HashMap<String, String>();
        for (var using : XmlNodes.children(section, "using")) {
            var prefix = XmlNodes.attr(using, "prefix");
            var namespace = XmlNodes.attr(using, "namespace");
            if (prefix == null || namespace == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER,
                        source.displayPath(),
                        "<using> without prefix or namespace ignored");
                continue;
            }
            var previous = prefixes.put(prefix, namespace);
            if (previous != null && !previous.equals(namespace)) {
                diagnostics.report(
                        DiagnosticKind.DUPLICATE_IDENTIFIER,
                        source.displayPath(),
                        "prefix '%s' rebound from %s to %s".formatted(prefix, previous, namespace));
            }
        }
        // the file's own prefix always refers to its own namespace
        if (!targetPrefix.isEmpty()) {
            prefixes.put(targetPrefix, targetNamespace);
        }

        logger.debug("{}: target {} ({}), {} prefixes", source, targetNamespace, targetPrefix, prefixes.size());
        return new NamespaceMap(source, targetPrefix, targetNamespace, prefixes);
    }

    /** Resolves {@code name} against {@code map}, using the file's target namespace for unprefixed names. */
    public String resolve(String name, NamespaceMap map) {
        return resolve(name, map, map.targetNamespace());
    }

    /**
     * {@code prefix:local} becomes {@code uri::local} when the prefix is known; an unknown prefix is reported and the
     * name is returned unchanged, which never matches a global key. Unprefixed names are qualified with
     * {@code defaultUri}.
     */
    public String resolve(String name, NamespaceMap map, String defaultUri) {
        int colon = name.indexOf(':');
        if (colon < 0) {
            return NamespaceMap.qualify(defaultUri, name);
        }
        var prefix = name.substring(0, colon);
        var local = name.substring(colon + 1);
        var namespace = map.namespaceFor(prefix);
        if (namespace.isEmpty()) {
            diagnostics.report(
                    DiagnosticKind.UNRESOLVED_REFERENCE,
                    map.source().displayPath(),
                    "unknown namespace prefix '%s' in reference '%s'".formatted(prefix, name));
            return name;
        }
        return NamespaceMap.qualify(namespace.get(), local);
    }
}
