package ai.exporter.graph;

import ai.exporter.document.PinRecord;
import ai.exporter.model.Port;

public final class PortEncoder {

    private PortEncoder() {
    }

    public static PinRecord encode(Port port) {
        return new PinRecord(
                port.name(),
                port.displayName(),
                port.direction().wireName(),
                TypeDescriptors.encode(port.type()),
                port.hasDefaultValue() ? port.defaultValue() : null
        );
    }
}
