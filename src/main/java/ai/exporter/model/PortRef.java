package ai.exporter.model;

/**
 * Address of a port inside a {@link Graph}: node index, then port index within that node.
 */
public record PortRef(int node, int port) {

    public PortRef {
        if (node < 0 || port < 0) {
            throw new IllegalArgumentException("negative port reference: " + node + "/" + port);
        }
    }
}
