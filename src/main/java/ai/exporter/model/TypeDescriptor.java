package ai.exporter.model;

/**
 * Semantic type of a port or variable.
 * <p>
 * category:
 * - "exec" for execution flow pins
 * - "object" / "class" for references to other assets or types
 * - "bool", "int", "real", "struct", ... for values
 * Categories compare case-insensitively.
 */
public record TypeDescriptor(
        String category,        // may be empty, never null
        String referencedType,  // sub-category object name, or null
        boolean collection
) {

    public static final String EXEC = "exec";
    public static final String OBJECT = "object";

    public TypeDescriptor {
        category = category == null ? "" : category;
        if (referencedType != null && referencedType.isBlank()) {
            referencedType = null;
        }
    }

    public static TypeDescriptor of(String category) {
        return new TypeDescriptor(category, null, false);
    }

    public static TypeDescriptor of(String category, String referencedType) {
        return new TypeDescriptor(category, referencedType, false);
    }

    public TypeDescriptor asCollection() {
        return new TypeDescriptor(category, referencedType, true);
    }

    public boolean isExec() {
        return EXEC.equalsIgnoreCase(category);
    }

    public boolean isObjectReference() {
        return OBJECT.equalsIgnoreCase(category);
    }
}
