package ai.exporter.model;

import java.util.Objects;

/**
 * Construction-script component: variable name plus the class of its template (null when no template).
 */
public record Component(String variableName, String templateClass) {

    public Component {
        Objects.requireNonNull(variableName, "variableName");
    }

    public boolean hasTemplate() {
        return templateClass != null && !templateClass.isEmpty();
    }
}
