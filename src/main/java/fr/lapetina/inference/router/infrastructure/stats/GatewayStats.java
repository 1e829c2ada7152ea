package fr.lapetina.inference.router.infrastructure.stats;

import fr.lapetina.inference.router.domain.ring.LoadBalance;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Gateway-wide request statistics.
 *
 * Thread-safe: counters are {@link LongAdder}s written from the forwarding callbacks
 * and read by the {@code /stats} endpoint without locking.
 */
public final class GatewayStats {

    private final Map<String, NodeStats> nodes = new ConcurrentHashMap<>();
    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder totalFailures = new LongAdder();
    private final LongAdder unroutedRequests = new LongAdder();
    private final Clock clock;

    public GatewayStats(Clock clock) {
        this.clock = clock;
    }

    public GatewayStats() {
        this(Clock.systemUTC());
    }

    /**
     * Counts a request accepted by the gateway.
     */
    public void recordRequest() {
        totalRequests.increment();
    }

    /**
     * Counts a request that ended in an error response, whatever the cause.
     */
    public void recordFailure() {
        totalFailures.increment();
    }

    /**
     * Counts a request that found no node on the ring.
     */
    public void recordUnrouted() {
        unroutedRequests.increment();
    }

    public void recordFirstAttempt(String nodeId, boolean success, long latencyMs) {
        node(nodeId).recordAttempt(false, success, latencyMs, clock.instant());
    }

    public void recordRetry(String nodeId, boolean success, long latencyMs) {
        node(nodeId).recordAttempt(true, success, latencyMs, clock.instant());
    }

    /**
     * Ensures a node shows up in the stats before it served anything.
     */
    public void track(String nodeId) {
        node(nodeId);
    }

    private NodeStats node(String nodeId) {
        return nodes.computeIfAbsent(nodeId, NodeStats::new);
    }

    public NodeStats getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public long getTotalRequests() {
        return totalRequests.sum();
    }

    public long getTotalFailures() {
        return totalFailures.sum();
    }

    public long getUnroutedRequests() {
        return unroutedRequests.sum();
    }

    /**
     * Coefficient of variation of first-attempt counts over the given nodes.
     * Nodes that never received a request count as zero.
     */
    public double loadBalanceCv(Collection<String> ringNodes) {
        List<Long> counts = new ArrayList<>(ringNodes.size());
        for (String nodeId : ringNodes) {
            NodeStats stats = nodes.get(nodeId);
            counts.add(stats == null ? 0L : stats.getFirstAttempts());
        }
        return LoadBalance.coefficientOfVariation(counts);
    }

    /**
     * Stats document served on {@code /stats}. Nodes that left the ring keep their
     * counters but do not take part in the coefficient of variation.
     */
    public Map<String, Object> snapshot(Collection<String> ringNodes, double maxLoadBalanceCv) {
        Map<String, Object> perNode = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>(ringNodes);
        for (String id : nodes.keySet()) {
            if (!ids.contains(id)) {
                ids.add(id);
            }
        }
        for (String id : ids) {
            NodeStats stats = nodes.get(id);
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("requests_handled", stats == null ? 0L : stats.getRequestsHandled());
            node.put("requests_failed", stats == null ? 0L : stats.getRequestsFailed());
            node.put("retries_handled", stats == null ? 0L : stats.getRetriesHandled());
            node.put("retries_failed", stats == null ? 0L : stats.getRetriesFailed());
            node.put("avg_latency_ms", stats == null ? 0.0 : stats.getAvgLatencyMs());
            node.put("last_seen", stats == null || stats.getLastSeen() == null ? null : stats.getLastSeen().toString());
            node.put("on_ring", ringNodes.contains(id));
            perNode.put(id, node);
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("total_requests", getTotalRequests());
        doc.put("total_failures", getTotalFailures());
        doc.put("unrouted_requests", getUnroutedRequests());
        doc.put("load_balance_cv", loadBalanceCv(ringNodes));
        doc.put("max_load_balance_cv", maxLoadBalanceCv);
        doc.put("nodes", perNode);
        return doc;
    }
}
