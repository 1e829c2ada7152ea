package fr.lapetina.inference.router.domain.ring;

/**
 * Thrown when removing a physical node that is not on the ring.
 */
public class UnknownNodeException extends RuntimeException {

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("Node not present on the ring: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
