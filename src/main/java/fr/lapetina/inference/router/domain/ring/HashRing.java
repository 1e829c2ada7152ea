package fr.lapetina.inference.router.domain.ring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consistent hash ring with virtual nodes.
 *
 * <p><b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Each physical node owns exactly {@code virtualNodesPerPhysical} positions.</li>
 *   <li>Removing a node only reassigns the keys its positions owned.</li>
 *   <li>The key to node mapping is deterministic for a given membership.</li>
 * </ul>
 *
 * <p><b>Thread-safety:</b> lookups read an immutable snapshot through a volatile field
 * and never block. Membership changes are serialized by a lock, build a new snapshot
 * and publish it in one write, so a reader sees either the whole change or none of it.
 */
public final class HashRing {

    private static final Logger log = LoggerFactory.getLogger(HashRing.class);

    public static final int DEFAULT_VIRTUAL_NODES = 150;

    private final int virtualNodesPerPhysical;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public HashRing() {
        this(DEFAULT_VIRTUAL_NODES);
    }

    public HashRing(int virtualNodesPerPhysical) {
        if (virtualNodesPerPhysical < 1) {
            throw new IllegalArgumentException("virtualNodesPerPhysical must be >= 1, got " + virtualNodesPerPhysical);
        }
        this.virtualNodesPerPhysical = virtualNodesPerPhysical;
    }

    /**
     * Inserts the virtual nodes of a physical node.
     *
     * @throws DuplicateNodeException if the node is already on the ring
     */
    public void addNode(String physicalId) {
        Objects.requireNonNull(physicalId, "Physical ID is required");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (current.owned.containsKey(physicalId)) {
                throw new DuplicateNodeException(physicalId);
            }

            TreeMap<Long, VirtualNode> positions = new TreeMap<>(Long::compareUnsigned);
            positions.putAll(current.positions);
            List<VirtualNode> replicas = new ArrayList<>(virtualNodesPerPhysical);

            for (int i = 0; i < virtualNodesPerPhysical; i++) {
                int salt = 0;
                long position = RingHashing.virtualNodePosition(physicalId, i, salt);
                while (positions.containsKey(position)) {
                    salt++;
                    position = RingHashing.virtualNodePosition(physicalId, i, salt);
                }
                VirtualNode vnode = new VirtualNode(position, physicalId, i);
                positions.put(position, vnode);
                replicas.add(vnode);
            }

            Map<String, List<VirtualNode>> owned = new LinkedHashMap<>(current.owned);
            owned.put(physicalId, Collections.unmodifiableList(replicas));
            snapshot = new Snapshot(positions, owned);

            log.info("Node added to ring: nodeId={}, virtualNodes={}, physicalNodes={}",
                    physicalId, replicas.size(), owned.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes all virtual nodes of a physical node.
     *
     * @throws UnknownNodeException if the node is not on the ring
     */
    public void removeNode(String physicalId) {
        Objects.requireNonNull(physicalId, "Physical ID is required");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            List<VirtualNode> replicas = current.owned.get(physicalId);
            if (replicas == null) {
                throw new UnknownNodeException(physicalId);
            }

            TreeMap<Long, VirtualNode> positions = new TreeMap<>(Long::compareUnsigned);
            positions.putAll(current.positions);
            for (VirtualNode vnode : replicas) {
                positions.remove(vnode.ringPosition());
            }

            Map<String, List<VirtualNode>> owned = new LinkedHashMap<>(current.owned);
            owned.remove(physicalId);
            snapshot = new Snapshot(positions, owned);

            log.info("Node removed from ring: nodeId={}, physicalNodes={}", physicalId, owned.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the physical node owning the first virtual node at or after the key's
     * position, wrapping to the smallest position.
     *
     * @throws EmptyRingException if no physical node is registered
     */
    public String lookup(String key) {
        Objects.requireNonNull(key, "Key is required");
        Snapshot current = snapshot;
        if (current.positions.isEmpty()) {
            throw new EmptyRingException();
        }
        return ownerOf(current.positions, RingHashing.keyPosition(key)).physicalId();
    }

    /**
     * Returns up to {@code count} distinct physical nodes walking clockwise from the
     * key's position. The first element is {@link #lookup(String)}'s answer.
     *
     * @throws EmptyRingException if no physical node is registered
     */
    public List<String> successors(String key, int count) {
        Objects.requireNonNull(key, "Key is required");
        Snapshot current = snapshot;
        if (current.positions.isEmpty()) {
            throw new EmptyRingException();
        }
        if (count <= 0) {
            return List.of();
        }

        int wanted = Math.min(count, current.owned.size());
        Set<String> seen = new LinkedHashSet<>();
        long position = RingHashing.keyPosition(key);

        for (VirtualNode vnode : current.positions.tailMap(position, true).values()) {
            if (seen.add(vnode.physicalId()) && seen.size() >= wanted) {
                return List.copyOf(seen);
            }
        }
        for (VirtualNode vnode : current.positions.headMap(position, false).values()) {
            if (seen.add(vnode.physicalId()) && seen.size() >= wanted) {
                return List.copyOf(seen);
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Counts how many of the given keys each physical node owns.
     * Every node on the ring appears in the result, with zero if it owns none.
     */
    public Map<String, Integer> distribution(Collection<String> keys) {
        Snapshot current = snapshot;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String nodeId : current.owned.keySet()) {
            counts.put(nodeId, 0);
        }
        if (current.positions.isEmpty()) {
            return counts;
        }
        for (String key : keys) {
            String owner = ownerOf(current.positions, RingHashing.keyPosition(key)).physicalId();
            counts.merge(owner, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Coefficient of variation of the load the ring would give its nodes for
     * {@code sampleKeys} synthetic keys {@code key_0 .. key_n}. Measures ring
     * balance independently of the traffic actually seen.
     */
    public double sampledLoadCv(int sampleKeys) {
        List<String> keys = new ArrayList<>(sampleKeys);
        for (int i = 0; i < sampleKeys; i++) {
            keys.add("key_" + i);
        }
        return LoadBalance.coefficientOfVariation(distribution(keys).values());
    }

    public boolean contains(String physicalId) {
        return snapshot.owned.containsKey(physicalId);
    }

    /**
     * Physical node ids in insertion order.
     */
    public List<String> nodes() {
        return List.copyOf(snapshot.owned.keySet());
    }

    public int size() {
        return snapshot.owned.size();
    }

    public boolean isEmpty() {
        return snapshot.owned.isEmpty();
    }

    public int virtualNodeCount() {
        return snapshot.positions.size();
    }

    /**
     * Virtual nodes of a physical node, in replica order; empty if unknown.
     */
    public List<VirtualNode> virtualNodesOf(String physicalId) {
        return snapshot.owned.getOrDefault(physicalId, List.of());
    }

    public int getVirtualNodesPerPhysical() {
        return virtualNodesPerPhysical;
    }

    private static VirtualNode ownerOf(NavigableMap<Long, VirtualNode> positions, long position) {
        Map.Entry<Long, VirtualNode> entry = positions.ceilingEntry(position);
        if (entry == null) {
            // Wrap around to the first position
            entry = positions.firstEntry();
        }
        return entry.getValue();
    }

    @Override
    public String toString() {
        Snapshot current = snapshot;
        return "HashRing{" +
                "physicalNodes=" + current.owned.size() +
                ", virtualNodes=" + current.positions.size() +
                '}';
    }

    /**
     * Immutable ring state. Positions are ordered as unsigned 64-bit values.
     */
    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(new TreeMap<>(Long::compareUnsigned), new HashMap<>());

        final NavigableMap<Long, VirtualNode> positions;
        final Map<String, List<VirtualNode>> owned;

        Snapshot(TreeMap<Long, VirtualNode> positions, Map<String, List<VirtualNode>> owned) {
            this.positions = Collections.unmodifiableNavigableMap(positions);
            this.owned = Collections.unmodifiableMap(owned);
        }
    }
}
