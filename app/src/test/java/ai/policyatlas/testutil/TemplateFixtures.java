package ai.policyatlas.testutil;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.parsers.DocumentBuilderFactory;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

/** Builds small ADMX/ADML trees for tests. */
public final class TemplateFixtures {
    public static final String ADMX_NS = "http://schemas.microsoft.com/GroupPolicy/2006/07/PolicyDefinitions";

    private TemplateFixtures() {}

    /**
     * A complete ADMX document.
     *
     * @param usings zero or more {@code <using .../>} lines
     * @param body everything after {@code policyNamespaces}: supportedOn, categories, policies
     */
    public static String admx(String targetPrefix, String targetNamespace, String usings, String body) {
        return """
                <?xml version="1.0" encoding="utf-8"?>
                <policyDefinitions xmlns="%s" revision="1.0" schemaVersion="1.0">
                  <policyNamespaces>
                    <target prefix="%s" namespace="%s"/>
                    %s
                  </policyNamespaces>
                  <resources minRequiredRevision="1.0"/>
                  %s
                </policyDefinitions>
                """
                .formatted(ADMX_NS, targetPrefix, targetNamespace, usings, body);
    }

    public static String using(String prefix, String namespace) {
        return "<using prefix=\"%s\" namespace=\"%s\"/>".formatted(prefix, namespace);
    }

    /** A complete ADML document with the given string and presentation entries. */
    public static String adml(String strings, String presentations) {
        return """
                <?xml version="1.0" encoding="utf-8"?>
                <policyDefinitionResources xmlns="%s" revision="1.0" schemaVersion="1.0">
                  <displayName/>
                  <description/>
                  <resources>
                    <stringTable>
                      %s
                    </stringTable>
                    <presentationTable>
                      %s
                    </presentationTable>
                  </resources>
                </policyDefinitionResources>
                """
                .formatted(ADMX_NS, strings, presentations);
    }

    public static String string(String id, String text) {
        return "<string id=\"%s\">%s</string>".formatted(id, text);
    }

    /** A switch policy: valueName Foo-style with decimal enabled/disabled values. */
    public static String switchPolicy(String name, String parentRef, String valueName, long enabled, long disabled) {
        return """
                <policy name="%s" class="Machine" displayName="$(string.%s)" explainText="$(string.%s_Help)"
                        key="Software\\Policies\\Test" valueName="%s">
                  <parentCategory ref="%s"/>
                  <supportedOn ref="windows:SUPPORTED_Windows7"/>
                  <enabledValue><decimal value="%d"/></enabledValue>
                  <disabledValue><decimal value="%d"/></disabledValue>
                </policy>
                """
                .formatted(name, name, name, valueName, parentRef, enabled, disabled);
    }

    public static Path write(Path root, String relPath, String content) throws IOException {
        var file = root.resolve(relPath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /** Parses a standalone XML fragment and returns its root element. */
    public static Element element(String xml) {
        try {
            var dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            return dbf.newDocumentBuilder()
                    .parse(new InputSource(new StringReader(xml)))
                    .getDocumentElement();
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad test XML", e);
        }
    }
}
