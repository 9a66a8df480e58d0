package ai.exporter.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import ai.exporter.Fixtures;
import ai.exporter.document.NodeRecord;
import ai.exporter.document.PinRecord;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.Port;
import ai.exporter.model.PortRef;
import ai.exporter.model.TypeDescriptor;

class NodeEncoderTest {

    private static final TypeDescriptor EXEC = TypeDescriptor.of(TypeDescriptor.EXEC);

    @Test
    void encodesEventNode() {
        final NodeRecord rec = NodeEncoder.encode(Fixtures.eventGraph(), 0);

        assertEquals("N1", rec.id());
        assertEquals("Event", rec.type());
        assertEquals("Event BeginPlay", rec.title());
        assertEquals("", rec.category());
        assertEquals(0, rec.position().x());
        assertEquals(List.of("N2"), rec.connections());
        assertEquals(1, rec.pins().size());

        final PinRecord then = rec.pins().get(0);
        assertEquals("then", then.name());
        assertEquals("output", then.direction());
        assertEquals("exec", then.type());
        assertNull(then.defaultValue());
    }

    @Test
    void inputPinsDoNotProduceConnections() {
        final NodeRecord rec = NodeEncoder.encode(Fixtures.eventGraph(), 1);

        assertEquals("CallFunction", rec.type());
        assertEquals("Utilities|String", rec.category());
        assertEquals(200, rec.position().x());
        assertTrue(rec.connections().isEmpty());
        assertEquals("In String", rec.pins().get(1).displayName());
        assertEquals("Hello", rec.pins().get(1).defaultValue());
    }

    @Test
    @DisplayName("fan-out lists each target once, in wire order")
    void fanOut() {
        final Graph g = Graph.builder("G")
                .node(Node.builder("N1", "K2Node_ExecutionSequence")
                        .port(Port.output("then_0", EXEC))
                        .port(Port.output("then_1", EXEC))
                        .build())
                .node(Node.builder("N2", "K2Node_CallFunction").port(Port.input("execute", EXEC)).build())
                .node(Node.builder("N3", "K2Node_CallFunction").port(Port.input("execute", EXEC)).build())
                .link("N1", "then_0", "N2", "execute")
                .link("N1", "then_1", "N3", "execute")
                .link("N1", "then_1", "N2", "execute")
                .build();

        assertEquals(List.of("N2", "N3"), NodeEncoder.connectedNodes(g, 0));
        assertEquals(1, g.wiresFrom(new PortRef(0, 0)).size());
        assertEquals(2, g.wiresFrom(new PortRef(0, 1)).size());
    }

    @Test
    void emptyDefaultIsOmitted() {
        final Port port = Port.input("A", TypeDescriptor.of("string")).withDefaultValue("");

        assertNull(PortEncoder.encode(port).defaultValue());
    }
}
