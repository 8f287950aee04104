package ai.policyatlas.util;

import ai.policyatlas.exception.MalformedDefinitionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Null-safe accessors over DOM elements. Template files are matched by local name only, so documents that omit or
 * vary the policy-definitions namespace are read the same way.
 *
 * <p>Absent attributes and children come back empty. Only present-but-malformed values raise
 * {@link MalformedDefinitionException}.
 */
public final class XmlNodes {
    private static final Logger logger = LogManager.getLogger(XmlNodes.class);

    private XmlNodes() {}

    public static Document parse(Path path) throws IOException, SAXException {
        try (InputStream in = Files.newInputStream(path)) {
            return newDocumentBuilder().parse(in, path.toUri().toString());
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            var dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setExpandEntityReferences(false);
            var db = dbf.newDocumentBuilder();
            // the default handler prints to stderr; parse failures are reported by the caller instead
            db.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    logger.debug("XML warning in {}: {}", exception.getSystemId(), exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXException {
                    throw exception;
                }
            });
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public static String localName(Node node) {
        var local = node.getLocalName();
        if (local != null) {
            return local;
        }
        var name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** The attribute value, trimmed, or null when it is absent or blank. */
    public static @Nullable String attr(Element element, String name) {
        if (!element.hasAttribute(name)) {
            return null;
        }
        var value = element.getAttribute(name).trim();
        return value.isEmpty() ? null : value;
    }

    public static Optional<String> optionalAttr(Element element, String name) {
        return Optional.ofNullable(attr(element, name));
    }

    public static List<Element> childElements(Element parent) {
        var result = new ArrayList<Element>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e) {
                result.add(e);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent, String localName) {
        return childElements(parent).stream()
                .filter(e -> localName.equals(localName(e)))
                .toList();
    }

    public static Optional<Element> child(Element parent, String localName) {
        return childElements(parent).stream()
                .filter(e -> localName.equals(localName(e)))
                .findFirst();
    }

    /** Follows a chain of direct children, e.g. {@code path(root, "resources", "stringTable")}. */
    public static Optional<Element> path(Element start, String... localNames) {
        Optional<Element> current = Optional.of(start);
        for (var name : localNames) {
            current = current.flatMap(e -> child(e, name));
        }
        return current;
    }

    /** The trimmed text content, empty when the element has no non-blank text. */
    public static Optional<String> text(Element element) {
        var content = element.getTextContent();
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(content.trim());
    }

    public static Optional<Long> optionalLong(Element element, String name) {
        var raw = attr(element, name);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new MalformedDefinitionException(
                    "Attribute %s=\"%s\" on <%s> is not a number".formatted(name, raw, localName(element)), e);
        }
    }

    public static Optional<Integer> optionalInt(Element element, String name) {
        return optionalLong(element, name).map(value -> {
            if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                throw new MalformedDefinitionException(
                        "Attribute %s=\"%d\" on <%s> is out of range".formatted(name, value, localName(element)));
            }
            return value.intValue();
        });
    }

    public static Optional<Boolean> optionalBoolean(Element element, String name) {
        var raw = attr(element, name);
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1" -> Optional.of(true);
            case "false", "0" -> Optional.of(false);
            default -> throw new MalformedDefinitionException(
                    "Attribute %s=\"%s\" on <%s> is not a boolean".formatted(name, raw, localName(element)));
        };
    }
}
