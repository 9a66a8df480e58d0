package ai.exporter.graph;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import ai.exporter.model.TypeDescriptor;

/**
 * Renders a raw default value into its canonical literal, by type category:
 * <ul>
 *   <li>bool: {@code true} / {@code false}</li>
 *   <li>byte, int, int64: plain integer</li>
 *   <li>real, float, double: plain decimal with at least one fractional digit</li>
 *   <li>struct: {@code (X=1.0,Y=2.0)}, keys upper-cased, in field order</li>
 *   <li>collections: {@code (a,b,c)}</li>
 *   <li>object, class: no literal (the reference is carried as a default object)</li>
 *   <li>anything else: the text as given</li>
 * </ul>
 * Absent or null input renders to null.
 */
public final class LiteralRenderer {

    private LiteralRenderer() {
    }

    public static String render(TypeDescriptor type, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (type.collection() && raw.isArray()) {
            final TypeDescriptor element = new TypeDescriptor(type.category(), type.referencedType(), false);
            final List<String> items = new ArrayList<>(raw.size());
            for (JsonNode item : raw) {
                final String s = render(element, item);
                items.add(s == null ? "" : s);
            }
            return "(" + String.join(",", items) + ")";
        }
        return switch (type.category().toLowerCase(Locale.ROOT)) {
            case "bool" -> renderBool(raw);
            case "byte", "int", "int64" -> renderInteger(raw);
            case "real", "float", "double" -> renderReal(raw);
            case "struct" -> raw.isObject() ? renderStruct(raw) : text(raw);
            case TypeDescriptor.OBJECT, "class", "softobject", "softclass" -> null;
            default -> text(raw);
        };
    }

    private static String renderBool(JsonNode raw) {
        if (raw.isBoolean()) {
            return raw.booleanValue() ? "true" : "false";
        }
        final String t = raw.asText().trim();
        return Boolean.parseBoolean(t) ? "true" : "false";
    }

    private static String renderInteger(JsonNode raw) {
        if (raw.isIntegralNumber()) {
            return raw.bigIntegerValue().toString();
        }
        if (raw.isNumber()) {
            return raw.decimalValue().toBigInteger().toString();
        }
        return raw.asText().trim();
    }

    private static String renderReal(JsonNode raw) {
        if (raw.isNumber()) {
            return plainDecimal(raw.decimalValue());
        }
        final String t = raw.asText().trim();
        try {
            return plainDecimal(new BigDecimal(t));
        } catch (NumberFormatException ex) {
            return t;
        }
    }

    private static String renderStruct(JsonNode raw) {
        final List<String> parts = new ArrayList<>(raw.size());
        final Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final JsonNode v = e.getValue();
            final String rendered = v.isNumber() ? plainDecimal(v.decimalValue()) : text(v);
            parts.add(e.getKey().toUpperCase(Locale.ROOT) + "=" + rendered);
        }
        return "(" + String.join(",", parts) + ")";
    }

    static String plainDecimal(BigDecimal value) {
        BigDecimal v = value.stripTrailingZeros();
        if (v.scale() < 1) {
            v = v.setScale(1);
        }
        return v.toPlainString();
    }

    private static String text(JsonNode raw) {
        return raw.isValueNode() ? raw.asText() : raw.toString();
    }
}
