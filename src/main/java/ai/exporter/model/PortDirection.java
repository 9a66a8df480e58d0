package ai.exporter.model;

import java.util.Locale;

/**
 * Pin direction, written lower-case ("input" | "output").
 */
public enum PortDirection {
    INPUT,
    OUTPUT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PortDirection parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("direction is missing");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "input", "in" -> INPUT;
            case "output", "out" -> OUTPUT;
            default -> throw new IllegalArgumentException("unknown direction: " + raw);
        };
    }
}
