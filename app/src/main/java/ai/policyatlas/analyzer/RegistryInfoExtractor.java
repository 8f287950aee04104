package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.MalformedDefinitionException;
import ai.policyatlas.util.XmlNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;

/** Extracts the registry key, switch value and parameter elements of a {@code <policy>} element. */
public final class RegistryInfoExtractor {
    private static final Logger logger = LogManager.getLogger(RegistryInfoExtractor.class);

    public static final String ENABLED_TOKEN = "$(string.Enabled)";
    public static final String DISABLED_TOKEN = "$(string.Disabled)";

    /** A single value found inside {@code enabledValue}, {@code trueValue}, an enum item's {@code value}, ... */
    record TypedValue(RegistryValueType type, Object value) {}

    private final DiagnosticLog diagnostics;

    public RegistryInfoExtractor(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
    }

    public RegistryInfo extract(Element policy, String policyId) {
        var key = XmlNodes.attr(policy, "key");
        var valueName = XmlNodes.attr(policy, "valueName");

        var type = RegistryValueType.UNKNOWN;
        Object enabledValue = null;
        Object disabledValue = null;
        var options = new ArrayList<RegistryOption>();

        if (valueName != null) {
            var enabled = readHeldValue(policy, "enabledValue", policyId);
            var disabled = readHeldValue(policy, "disabledValue", policyId);
            if (enabled.isPresent() && disabled.isPresent() && enabled.get().type() == disabled.get().type()) {
                type = enabled.get().type();
                enabledValue = enabled.get().value();
                disabledValue = disabled.get().value();
                options.add(new RegistryOption(enabledValue, ENABLED_TOKEN, "Enabled"));
                options.add(new RegistryOption(disabledValue, DISABLED_TOKEN, "Disabled"));
            } else {
                diagnostics.report(DiagnosticKind.STRUCTURAL_AMBIGUITY, policyId, describePair(enabled, disabled));
            }
        }

        var elements = XmlNodes.child(policy, "elements")
                .map(section -> extractElements(section, key, policyId))
                .orElse(List.of());

        var info = new RegistryInfo(key, valueName, type, enabledValue, disabledValue, options, elements);
        if (info.hasValueAndElements()) {
            diagnostics.report(
                    DiagnosticKind.STRUCTURAL_AMBIGUITY,
                    policyId,
                    "declares valueName '%s' and %d element(s); both kept".formatted(valueName, elements.size()));
        }
        return info;
    }

    private static String describePair(Optional<TypedValue> enabled, Optional<TypedValue> disabled) {
        if (enabled.isEmpty() && disabled.isEmpty()) {
            return "valueName without enabledValue/disabledValue; type left Unknown";
        }
        if (enabled.isEmpty() || disabled.isEmpty()) {
            return "only %s declared; type left Unknown".formatted(enabled.isPresent() ? "enabledValue" : "disabledValue");
        }
        return "enabledValue is %s but disabledValue is %s; type left Unknown"
                .formatted(enabled.get().type(), disabled.get().type());
    }

    private Optional<TypedValue> readHeldValue(Element parent, String holderName, String location) {
        var holder = XmlNodes.child(parent, holderName);
        if (holder.isEmpty()) {
            return Optional.empty();
        }
        try {
            return readValue(holder.get());
        } catch (MalformedDefinitionException e) {
            diagnostics.report(DiagnosticKind.STRUCTURAL_AMBIGUITY, location, holderName + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Reads the first {@code decimal}, {@code longDecimal} or {@code string} child. {@code delete} reads as empty. */
    static Optional<TypedValue> readValue(Element holder) {
        for (var child : XmlNodes.childElements(holder)) {
            switch (XmlNodes.localName(child)) {
                case "decimal" -> {
                    return XmlNodes.optionalLong(child, "value").map(v -> new TypedValue(RegistryValueType.REG_DWORD, v));
                }
                case "longDecimal" -> {
                    return XmlNodes.optionalLong(child, "value").map(v -> new TypedValue(RegistryValueType.REG_QWORD, v));
                }
                case "string" -> {
                    return Optional.of(new TypedValue(
                            RegistryValueType.REG_SZ, XmlNodes.text(child).orElse("")));
                }
                default -> {
                    // delete and anything unknown carry no value
                }
            }
        }
        return Optional.empty();
    }

    private List<RegistryElement> extractElements(Element section, @Nullable String policyKey, String policyId) {
        var result = new ArrayList<RegistryElement>();
        for (var child : XmlNodes.childElements(section)) {
            var kind = XmlNodes.localName(child);
            var id = XmlNodes.attr(child, "id");
            if (id == null) {
                diagnostics.report(
                        DiagnosticKind.MISSING_IDENTIFIER, policyId, "<%s> element without id skipped".formatted(kind));
                continue;
            }
            var location = policyId + "/" + id;
            try {
                extractElement(kind, id, child, policyKey, location).ifPresent(result::add);
            } catch (MalformedDefinitionException e) {
                diagnostics.report(
                        DiagnosticKind.STRUCTURAL_AMBIGUITY, location, "element skipped: " + e.getMessage());
            }
        }
        return result;
    }

    private Optional<RegistryElement> extractElement(
            String kind, String id, Element element, @Nullable String policyKey, String location) {
        var key = XmlNodes.attr(element, "key");
        if (key != null && key.equals(policyKey)) {
            key = null;
        }
        var valueName = XmlNodes.attr(element, "valueName");
        boolean required = XmlNodes.optionalBoolean(element, "required").orElse(false);
        var min = XmlNodes.optionalLong(element, "minValue").orElse(null);
        var max = XmlNodes.optionalLong(element, "maxValue").orElse(null);
        var maxLength = XmlNodes.optionalInt(element, "maxLength").orElse(null);

        return switch (kind) {
            case "enum" -> {
                var items = enumItems(element, location);
                var allStrings = !items.isEmpty() && items.stream().allMatch(o -> o.value() instanceof String);
                var type = allStrings ? RegistryValueType.REG_SZ : RegistryValueType.REG_DWORD;
                yield Optional.of(new RegistryElement(id, key, valueName, type, items, null, null, null, required));
            }
            case "decimal" -> Optional.of(new RegistryElement(
                    id, key, valueName, RegistryValueType.REG_DWORD, List.of(), min, max, null, required));
            case "longDecimal" -> Optional.of(new RegistryElement(
                    id, key, valueName, RegistryValueType.REG_QWORD, List.of(), min, max, null, required));
            case "text" -> {
                boolean expandable = XmlNodes.optionalBoolean(element, "expandable").orElse(false);
                var type = expandable ? RegistryValueType.REG_EXPAND_SZ : RegistryValueType.REG_SZ;
                yield Optional.of(new RegistryElement(id, key, valueName, type, List.of(), null, null, maxLength, required));
            }
            case "boolean" -> {
                var trueValue = readHeldValue(element, "trueValue", location).map(TypedValue::value).orElse(1L);
                var falseValue = readHeldValue(element, "falseValue", location).map(TypedValue::value).orElse(0L);
                var options = List.of(
                        new RegistryOption(trueValue, ENABLED_TOKEN, "Enabled"),
                        new RegistryOption(falseValue, DISABLED_TOKEN, "Disabled"));
                yield Optional.of(new RegistryElement(
                        id, key, valueName, RegistryValueType.REG_DWORD, options, null, null, null, required));
            }
            case "multiText" -> Optional.of(new RegistryElement(
                    id, key, valueName, RegistryValueType.REG_MULTI_SZ, List.of(), null, null, maxLength, required));
            default -> {
                logger.debug("Unrecognized element kind <{}> in {}", kind, location);
                diagnostics.report(
                        DiagnosticKind.STRUCTURAL_AMBIGUITY,
                        location,
                        "unrecognized element kind <%s> skipped".formatted(kind));
                yield Optional.empty();
            }
        };
    }

    private List<RegistryOption> enumItems(Element enumElement, String location) {
        var options = new ArrayList<RegistryOption>();
        for (var item : XmlNodes.children(enumElement, "item")) {
            var display = XmlNodes.attr(item, "displayName");
            var value = XmlNodes.child(item, "value").flatMap(RegistryInfoExtractor::readValue);
            if (value.isEmpty()) {
                diagnostics.report(
                        DiagnosticKind.STRUCTURAL_AMBIGUITY,
                        location,
                        "enum item '%s' has no value; skipped".formatted(display));
                continue;
            }
            options.add(new RegistryOption(value.get().value(), display == null ? "" : display));
        }
        return options;
    }
}
