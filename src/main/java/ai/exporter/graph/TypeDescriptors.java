package ai.exporter.graph;

import ai.exporter.model.TypeDescriptor;

/**
 * Canonical type strings: {@code Base}, {@code Base<Ref>}, {@code Array<...>}.
 */
public final class TypeDescriptors {

    private TypeDescriptors() {
    }

    public static String encode(TypeDescriptor type) {
        if (type == null) {
            return "";
        }
        String s = type.category();
        if (type.referencedType() != null) {
            s = s + "<" + type.referencedType() + ">";
        }
        if (type.collection()) {
            s = "Array<" + s + ">";
        }
        return s;
    }
}
