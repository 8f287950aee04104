package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.SourceFileException;
import ai.policyatlas.util.XmlNodes;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/** Parses one ADMX file into its {@link FileDefinitions}. Knows nothing about other files. */
public final class AdmxFileParser {
    private static final Logger logger = LogManager.getLogger(AdmxFileParser.class);

    private static final Pattern PRESENTATION_TOKEN = Pattern.compile("^\\$\\(presentation\\.([^)]+)\\)$");

    private final DiagnosticLog diagnostics;
    private final NamespaceResolver namespaceResolver;
    private final RegistryInfoExtractor registryExtractor;

    public AdmxFileParser(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
        this.namespaceResolver = new NamespaceResolver(diagnostics);
        this.registryExtractor = new RegistryInfoExtractor(diagnostics);
    }

    /**
     * @throws SourceFileException if the file cannot be read, is not well-formed, or declares no target namespace
     */
    public FileDefinitions parse(SourceFile source) {
        Element root;
        try {
            root = XmlNodes.parse(source.absPath()).getDocumentElement();
        } catch (IOException e) {
            throw new SourceFileException(source, "unreadable: " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new SourceFileException(source, "not well-formed XML: " + e.getMessage(), e);
        }
        if (!"policyDefinitions".equals(XmlNodes.localName(root))) {
            throw new SourceFileException(
                    source, "root element is <%s>, expected <policyDefinitions>".formatted(XmlNodes.localName(root)));
        }

        var namespaces = namespaceResolver.read(source, root);
        var supportedOn = parseSupportedOn(source, root);
        var categories = parseCategories(source, root, namespaces);
        var policies = parsePolicies(source, root, namespaces);

        logger.debug(
                "{}: {} supportedOn, {} categories, {} policies",
                source,
                supportedOn.size(),
                categories.size(),
                policies.size());
        return new FileDefinitions(source, namespaces, supportedOn, categories, policies);
    }

    private List<SupportedOnDefinition> parseSupportedOn(SourceFile source, Element root) {
        var result = new ArrayList<SupportedOnDefinition>();
        var definitions = XmlNodes.path(root, "supportedOn", "definitions");
        if (definitions.isEmpty()) {
            return result;
        }
        for (var definition : XmlNodes.children(definitions.get(), "definition")) {
            var name = XmlNodes.attr(definition, "name");
            if (name == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER,
                        source.displayPath(),
                        "supportedOn definition without name skipped");
                continue;
            }
            result.add(new SupportedOnDefinition(name, XmlNodes.attr(definition, "displayName"), source));
        }
        return result;
    }

    private List<CategoryDefinition> parseCategories(SourceFile source, Element root, NamespaceMap namespaces) {
        var result = new ArrayList<CategoryDefinition>();
        var section = XmlNodes.child(root, "categories");
        if (section.isEmpty()) {
            return result;
        }
        for (var category : XmlNodes.children(section.get(), "category")) {
            var name = XmlNodes.attr(category, "name");
            if (name == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER, source.displayPath(), "category without name skipped");
                continue;
            }
            var parentRaw = parentRef(category);
            var parentResolved = parentRaw == null ? null : namespaceResolver.resolve(parentRaw, namespaces);
            result.add(new CategoryDefinition(
                    NamespaceMap.qualify(namespaces.targetNamespace(), name),
                    name,
                    namespaces.targetNamespace(),
                    XmlNodes.attr(category, "displayName"),
                    parentRaw,
                    parentResolved,
                    source));
        }
        return result;
    }

    private List<PolicyDefinition> parsePolicies(SourceFile source, Element root, NamespaceMap namespaces) {
        var result = new ArrayList<PolicyDefinition>();
        var section = XmlNodes.child(root, "policies");
        if (section.isEmpty()) {
            return result;
        }
        for (var policy : XmlNodes.children(section.get(), "policy")) {
            var name = XmlNodes.attr(policy, "name");
            if (name == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER, source.displayPath(), "policy without name skipped");
                continue;
            }
            var uniqueId = NamespaceMap.qualify(namespaces.targetNamespace(), name);

            var classAttr = XmlNodes.attr(policy, "class");
            var policyClass = PolicyClass.fromAttribute(classAttr).orElseGet(() -> {
                diagnostics.report(
                        DiagnosticKind.STRUCTURAL_AMBIGUITY,
                        uniqueId,
                        "class '%s' is not Machine, User or Both; treated as Both".formatted(classAttr));
                return PolicyClass.BOTH;
            });

            var presentationToken = XmlNodes.attr(policy, "presentation");
            var presentationKey = presentationKey(presentationToken, namespaces, uniqueId);
            var supportedOnRef = XmlNodes.child(policy, "supportedOn")
                    .map(e -> XmlNodes.attr(e, "ref"))
                    .orElse(null);

            result.add(new PolicyDefinition(
                    uniqueId,
                    name,
                    namespaces.targetNamespace(),
                    policyClass,
                    XmlNodes.attr(policy, "displayName"),
                    XmlNodes.attr(policy, "explainText"),
                    supportedOnRef,
                    presentationToken,
                    presentationKey,
                    parentRef(policy),
                    registryExtractor.extract(policy, uniqueId),
                    source));
        }
        return result;
    }

    private static @Nullable String parentRef(Element element) {
        return XmlNodes.child(element, "parentCategory")
                .map(e -> XmlNodes.attr(e, "ref"))
                .orElse(null);
    }

    private @Nullable String presentationKey(@Nullable String token, NamespaceMap namespaces, String policyId) {
        if (token == null) {
            return null;
        }
        var matcher = PRESENTATION_TOKEN.matcher(token);
        if (!matcher.matches()) {
            diagnostics.report(
                    DiagnosticKind.UNRESOLVED_REFERENCE,
                    policyId,
                    "presentation '%s' is not a $(presentation.<id>) reference".formatted(token));
            return null;
        }
        return NamespaceMap.qualify(namespaces.targetNamespace(), matcher.group(1));
    }
}
