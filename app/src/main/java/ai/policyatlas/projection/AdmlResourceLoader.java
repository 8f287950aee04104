package ai.policyatlas.projection;

import ai.policyatlas.analyzer.IPolicyGraph;
import ai.policyatlas.analyzer.NamespaceMap;
import ai.policyatlas.analyzer.SourceFile;
import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.SourceFileException;
import ai.policyatlas.util.XmlNodes;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Loads the string and presentation tables of one language from its ADML files.
 *
 * <p>All string tables are merged first, so a presentation label may refer to a string from any file of the language.
 * Presentations are keyed with the target namespace of the ADMX file that has the same base name.
 */
public final class AdmlResourceLoader {
    private static final Logger logger = LogManager.getLogger(AdmlResourceLoader.class);

    private final DiagnosticLog diagnostics;

    public AdmlResourceLoader(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
    }

    public LanguageResources load(String language, List<SourceFile> files, IPolicyGraph graph) {
        var parsed = new LinkedHashMap<SourceFile, Element>();
        for (var file : files) {
            try {
                parsed.put(file, parseRoot(file));
            } catch (SourceFileException e) {
                logger.debug("Skipping {}", file, e);
                diagnostics.report(DiagnosticKind.SOURCE_FILE_ERROR, file.displayPath(), e.getMessage());
            }
        }

        var strings = new StringTable();
        for (var entry : parsed.entrySet()) {
            loadStrings(language, entry.getKey(), entry.getValue(), strings);
        }

        var presentations = new HashMap<String, PresentationDefinition>();
        for (var entry : parsed.entrySet()) {
            var namespace = namespaceFor(entry.getKey(), graph);
            for (var presentation : loadPresentations(entry.getKey(), entry.getValue(), namespace, strings)) {
                if (presentations.put(presentation.id(), presentation) != null) {
                    diagnostics.report(
                            DiagnosticKind.DUPLICATE_IDENTIFIER,
                            language,
                            "presentation %s redefined in %s".formatted(presentation.id(), entry.getKey().displayPath()));
                }
            }
        }

        logger.info(
                "Loaded {} strings and {} presentations for {} from {} of {} files",
                strings.size(),
                presentations.size(),
                language,
                parsed.size(),
                files.size());
        return new LanguageResources(language, strings, presentations);
    }

    private static Element parseRoot(SourceFile file) {
        Element root;
        try {
            root = XmlNodes.parse(file.absPath()).getDocumentElement();
        } catch (IOException e) {
            throw new SourceFileException(file, "unreadable: " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new SourceFileException(file, "not well-formed XML: " + e.getMessage(), e);
        }
        if (!"policyDefinitionResources".equals(XmlNodes.localName(root))) {
            throw new SourceFileException(
                    file,
                    "root element is <%s>, expected <policyDefinitionResources>".formatted(XmlNodes.localName(root)));
        }
        return root;
    }

    private String namespaceFor(SourceFile file, IPolicyGraph graph) {
        var namespace = graph.namespaceForBaseName(file.baseName());
        if (namespace.isEmpty()) {
            diagnostics.report(
                    DiagnosticKind.UNRESOLVED_REFERENCE,
                    file.displayPath(),
                    "no definition file named '%s'; presentations keyed by file name".formatted(file.baseName()));
            return file.baseName();
        }
        return namespace.get();
    }

    private void loadStrings(String language, SourceFile file, Element root, StringTable strings) {
        var table = XmlNodes.path(root, "resources", "stringTable");
        if (table.isEmpty()) {
            return;
        }
        for (var string : XmlNodes.children(table.get(), "string")) {
            var id = XmlNodes.attr(string, "id");
            if (id == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER, file.displayPath(), "string without id skipped");
                continue;
            }
            var text = string.getTextContent() == null ? "" : string.getTextContent();
            var previous = strings.put(id, text);
            if (previous != null) {
                var change = previous.equals(text) ? "same text" : "keeping the later text";
                diagnostics.report(
                        DiagnosticKind.DUPLICATE_IDENTIFIER,
                        language,
                        "string '%s' redefined in %s; %s".formatted(id, file.displayPath(), change));
            }
        }
    }

    private List<PresentationDefinition> loadPresentations(
            SourceFile file, Element root, String namespace, StringTable strings) {
        var table = XmlNodes.path(root, "resources", "presentationTable");
        if (table.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<PresentationDefinition>();
        for (var presentation : XmlNodes.children(table.get(), "presentation")) {
            var id = XmlNodes.attr(presentation, "id");
            if (id == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER, file.displayPath(), "presentation without id skipped");
                continue;
            }
            var elements = XmlNodes.childElements(presentation).stream()
                    .map(e -> toElement(e, strings))
                    .toList();
            result.add(new PresentationDefinition(NamespaceMap.qualify(namespace, id), elements));
        }
        return result;
    }

    private static PresentationElement toElement(Element control, StringTable strings) {
        var type = XmlNodes.localName(control);
        var label = labelOf(control).map(text -> ReferenceResolver.resolve(text, strings));
        return new PresentationElement(type, XmlNodes.attr(control, "refId"), label.orElse(null), defaultOf(control));
    }

    /** {@code textBox} and {@code comboBox} wrap their label in a child; the other controls use their own text. */
    private static Optional<String> labelOf(Element control) {
        var labelChild = XmlNodes.child(control, "label");
        if (labelChild.isPresent()) {
            return XmlNodes.text(labelChild.get());
        }
        return XmlNodes.text(control);
    }

    private static @Nullable String defaultOf(Element control) {
        for (var attribute : List.of("defaultValue", "defaultChecked", "defaultItem")) {
            var value = XmlNodes.attr(control, attribute);
            if (value != null) {
                return value;
            }
        }
        return XmlNodes.child(control, "defaultValue")
                .or(() -> XmlNodes.child(control, "default"))
                .flatMap(XmlNodes::text)
                .orElse(null);
    }
}
