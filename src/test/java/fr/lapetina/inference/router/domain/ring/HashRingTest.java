package fr.lapetina.inference.router.domain.ring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashRingTest {

    private HashRing ring;

    @BeforeEach
    void setUp() {
        ring = new HashRing();
    }

    private static List<String> randomKeys(int count) {
        List<String> keys = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            keys.add(UUID.randomUUID().toString());
        }
        return keys;
    }

    @Nested
    @DisplayName("Membership")
    class MembershipTests {

        @Test
        @DisplayName("should place 150 virtual nodes per physical node by default")
        void shouldPlaceDefaultVirtualNodes() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");

            assertThat(ring.virtualNodeCount()).isEqualTo(300);
            assertThat(ring.virtualNodesOf("worker-1")).hasSize(150);
            assertThat(ring.virtualNodesOf("worker-2")).hasSize(150);
            assertThat(ring.nodes()).containsExactly("worker-1", "worker-2");
        }

        @Test
        @DisplayName("should honour a configured virtual node count")
        void shouldHonourConfiguredVirtualNodes() {
            HashRing small = new HashRing(10);
            small.addNode("a");

            assertThat(small.virtualNodeCount()).isEqualTo(10);
            assertThat(small.getVirtualNodesPerPhysical()).isEqualTo(10);
        }

        @Test
        @DisplayName("should reject a duplicate node")
        void shouldRejectDuplicate() {
            ring.addNode("worker-1");

            assertThatThrownBy(() -> ring.addNode("worker-1"))
                    .isInstanceOf(DuplicateNodeException.class)
                    .hasMessageContaining("worker-1");
            assertThat(ring.virtualNodeCount()).isEqualTo(150);
        }

        @Test
        @DisplayName("should reject removal of an unknown node")
        void shouldRejectUnknownRemoval() {
            ring.addNode("worker-1");

            assertThatThrownBy(() -> ring.removeNode("worker-9"))
                    .isInstanceOf(UnknownNodeException.class)
                    .hasMessageContaining("worker-9");
        }

        @Test
        @DisplayName("should remove every virtual node of a removed node")
        void shouldRemoveAllVirtualNodes() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");

            ring.removeNode("worker-1");

            assertThat(ring.contains("worker-1")).isFalse();
            assertThat(ring.virtualNodeCount()).isEqualTo(150);
            assertThat(ring.virtualNodesOf("worker-1")).isEmpty();
        }

        @Test
        @DisplayName("should derive virtual nodes deterministically")
        void shouldDeriveDeterministically() {
            HashRing other = new HashRing();
            ring.addNode("worker-1");
            other.addNode("worker-1");

            assertThat(ring.virtualNodesOf("worker-1")).isEqualTo(other.virtualNodesOf("worker-1"));
        }

        @Test
        @DisplayName("should keep positions unique")
        void shouldKeepPositionsUnique() {
            for (int i = 0; i < 20; i++) {
                ring.addNode("worker-" + i);
            }
            Set<Long> positions = new HashSet<>();
            for (String node : ring.nodes()) {
                ring.virtualNodesOf(node).forEach(v -> positions.add(v.ringPosition()));
            }

            assertThat(positions).hasSize(20 * 150);
        }
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("should fail on an empty ring")
        void shouldFailOnEmptyRing() {
            assertThatThrownBy(() -> ring.lookup("key"))
                    .isInstanceOf(EmptyRingException.class);
            assertThatThrownBy(() -> ring.successors("key", 2))
                    .isInstanceOf(EmptyRingException.class);
        }

        @Test
        @DisplayName("should route every key to the only node")
        void shouldRouteToSingleNode() {
            ring.addNode("solo");

            for (String key : randomKeys(1000)) {
                assertThat(ring.lookup(key)).isEqualTo("solo");
            }
        }

        @Test
        @DisplayName("should return the same node for the same key")
        void shouldBeStable() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");
            ring.addNode("worker-3");

            for (String key : randomKeys(100)) {
                assertThat(ring.lookup(key)).isEqualTo(ring.lookup(key));
            }
        }

        @Test
        @DisplayName("should wrap around past the highest position")
        void shouldWrapAround() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");
            ring.addNode("worker-3");
            List<VirtualNode> all = new ArrayList<>();
            ring.nodes().forEach(n -> all.addAll(ring.virtualNodesOf(n)));
            all.sort((a, b) -> Long.compareUnsigned(a.ringPosition(), b.ringPosition()));
            VirtualNode lowest = all.get(0);
            VirtualNode highest = all.get(all.size() - 1);

            String wrappingKey = null;
            for (int i = 0; i < 1_000_000 && wrappingKey == null; i++) {
                String candidate = "key-" + i;
                if (Long.compareUnsigned(RingHashing.keyPosition(candidate), highest.ringPosition()) > 0) {
                    wrappingKey = candidate;
                }
            }

            assertThat(wrappingKey).isNotNull();
            assertThat(ring.lookup(wrappingKey)).isEqualTo(lowest.physicalId());
        }

        @Test
        @DisplayName("should list distinct successors starting with the owner")
        void shouldListSuccessors() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");
            ring.addNode("worker-3");

            for (String key : randomKeys(50)) {
                List<String> successors = ring.successors(key, 5);
                assertThat(successors).hasSize(3).doesNotHaveDuplicates();
                assertThat(successors.get(0)).isEqualTo(ring.lookup(key));
            }
            assertThat(ring.successors("key", 0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Distribution")
    class DistributionTests {

        @Test
        @DisplayName("should spread random keys evenly across nodes")
        void shouldSpreadEvenly() {
            for (int i = 1; i <= 5; i++) {
                ring.addNode("worker-" + i);
            }

            Map<String, Integer> counts = ring.distribution(randomKeys(100_000));

            assertThat(counts).hasSize(5);
            assertThat(LoadBalance.coefficientOfVariation(counts.values())).isLessThan(0.10);
        }

        @Test
        @DisplayName("should keep three nodes within ten percent over ten thousand keys")
        void shouldBalanceThreeNodes() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");
            ring.addNode("worker-3");
            List<String> keys = new ArrayList<>();
            for (int i = 0; i < 10_000; i++) {
                keys.add("key-" + i);
            }

            Map<String, Integer> counts = ring.distribution(keys);

            assertThat(counts.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(10_000);
            assertThat(LoadBalance.coefficientOfVariation(counts.values())).isLessThan(0.10);
        }

        @Test
        @DisplayName("should only remap keys owned by a removed node")
        void shouldRemapMinimally() {
            for (int i = 1; i <= 5; i++) {
                ring.addNode("worker-" + i);
            }
            List<String> keys = randomKeys(20_000);
            Map<String, String> before = new HashMap<>();
            keys.forEach(k -> before.put(k, ring.lookup(k)));

            ring.removeNode("worker-3");

            int moved = 0;
            for (String key : keys) {
                String owner = ring.lookup(key);
                if (!owner.equals(before.get(key))) {
                    moved++;
                    assertThat(before.get(key)).isEqualTo("worker-3");
                }
                assertThat(owner).isNotEqualTo("worker-3");
            }
            double movedFraction = moved / (double) keys.size();
            assertThat(movedFraction).isBetween(0.10, 0.30);
        }

        @Test
        @DisplayName("should report zero for nodes owning no keys")
        void shouldReportAllNodes() {
            ring.addNode("worker-1");
            ring.addNode("worker-2");

            Map<String, Integer> counts = ring.distribution(List.of());

            assertThat(counts).containsOnlyKeys("worker-1", "worker-2");
            assertThat(counts.values()).containsOnly(0);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should serve lookups while membership changes")
        void shouldServeLookupsDuringMutation() throws Exception {
            ring.addNode("stable-1");
            ring.addNode("stable-2");
            Set<String> valid = Set.of("stable-1", "stable-2", "churn");

            int readers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(readers);
            AtomicBoolean running = new AtomicBoolean(true);
            ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
            ConcurrentLinkedQueue<String> unexpected = new ConcurrentLinkedQueue<>();
            CountDownLatch started = new CountDownLatch(readers);

            for (int t = 0; t < readers; t++) {
                executor.submit(() -> {
                    started.countDown();
                    int i = 0;
                    while (running.get()) {
                        try {
                            String owner = ring.lookup("key-" + (i++));
                            if (!valid.contains(owner)) {
                                unexpected.add(owner);
                            }
                        } catch (Throwable e) {
                            errors.add(e);
                        }
                    }
                });
            }

            started.await();
            for (int i = 0; i < 200; i++) {
                ring.addNode("churn");
                ring.removeNode("churn");
            }
            running.set(false);
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(errors).isEmpty();
            assertThat(unexpected).isEmpty();
            assertThat(ring.virtualNodeCount()).isEqualTo(300);
        }
    }
}
