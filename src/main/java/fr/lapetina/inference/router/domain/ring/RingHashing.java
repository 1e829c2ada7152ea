package fr.lapetina.inference.router.domain.ring;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Hash functions used to place virtual nodes and keys on the ring.
 * Pure functions: the same input always yields the same unsigned 64-bit position.
 */
public final class RingHashing {

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    private RingHashing() {
    }

    /**
     * Position of a lookup key.
     */
    public static long keyPosition(String key) {
        return MURMUR3.hashString(key, StandardCharsets.UTF_8).asLong();
    }

    /**
     * Position of replica {@code replicaIndex} of a physical node.
     * A non-zero {@code salt} is only used to move a replica that collided with
     * an existing position.
     */
    public static long virtualNodePosition(String physicalId, int replicaIndex, int salt) {
        String vnodeKey = salt == 0
                ? physicalId + "#" + replicaIndex
                : physicalId + "#" + replicaIndex + "~" + salt;
        return MURMUR3.hashString(vnodeKey, StandardCharsets.UTF_8).asLong();
    }
}
