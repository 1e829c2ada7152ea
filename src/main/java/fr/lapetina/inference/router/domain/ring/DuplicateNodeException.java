package fr.lapetina.inference.router.domain.ring;

/**
 * Thrown when adding a physical node that is already on the ring.
 */
public class DuplicateNodeException extends RuntimeException {

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Node already present on the ring: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
