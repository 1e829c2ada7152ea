package fr.lapetina.inference.router.domain.ring;

import java.util.Objects;

/**
 * One ring position owned by a physical node.
 *
 * @param ringPosition unsigned 64-bit position on the ring
 * @param physicalId   id of the owning physical node
 * @param replicaIndex index of this replica among the owner's virtual nodes
 */
public record VirtualNode(long ringPosition, String physicalId, int replicaIndex) {

    public VirtualNode {
        Objects.requireNonNull(physicalId, "Physical ID is required");
    }

    @Override
    public String toString() {
        return physicalId + "#" + replicaIndex + "@" + Long.toUnsignedString(ringPosition);
    }
}
