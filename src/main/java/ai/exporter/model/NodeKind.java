package ai.exporter.model;

/**
 * Closed node taxonomy, declared in classification priority order.
 * OTHER must stay last; it has no defining type and matches everything.
 */
public enum NodeKind {
    EVENT("K2Node_Event", "Event"),
    FUNCTION_ENTRY("K2Node_FunctionEntry", "FunctionEntry"),
    CALL_EXTERNAL_FUNCTION("K2Node_CallFunction", "CallFunction"),
    VARIABLE_READ("K2Node_VariableGet", "VariableGet"),
    VARIABLE_WRITE("K2Node_VariableSet", "VariableSet"),
    OTHER(null, null);

    private final String definingType;
    private final String tag;

    NodeKind(String definingType, String tag) {
        this.definingType = definingType;
        this.tag = tag;
    }

    /** Node type whose presence in a node's lineage selects this kind. */
    public String definingType() {
        return definingType;
    }

    /** Value written to the node's "type" field; null for OTHER. */
    public String tag() {
        return tag;
    }
}
