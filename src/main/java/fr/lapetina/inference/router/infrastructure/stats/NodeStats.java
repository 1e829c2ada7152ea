package fr.lapetina.inference.router.infrastructure.stats;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters the gateway keeps for one worker.
 * First attempts and fallback attempts are counted apart so that ring fairness is
 * measured on first attempts only.
 */
public final class NodeStats {

    private final String nodeId;
    private final LongAdder requestsHandled = new LongAdder();
    private final LongAdder requestsFailed = new LongAdder();
    private final LongAdder retriesHandled = new LongAdder();
    private final LongAdder retriesFailed = new LongAdder();
    private final LongAdder latencySumMs = new LongAdder();
    private final LongAdder latencyCount = new LongAdder();
    private volatile Instant lastSeen;

    NodeStats(String nodeId) {
        this.nodeId = nodeId;
    }

    void recordAttempt(boolean retry, boolean success, long latencyMs, Instant now) {
        if (retry) {
            (success ? retriesHandled : retriesFailed).increment();
        } else {
            (success ? requestsHandled : requestsFailed).increment();
        }
        if (success) {
            latencySumMs.add(latencyMs);
            latencyCount.increment();
        }
        lastSeen = now;
    }

    public String getNodeId() {
        return nodeId;
    }

    public long getRequestsHandled() {
        return requestsHandled.sum();
    }

    public long getRequestsFailed() {
        return requestsFailed.sum();
    }

    public long getRetriesHandled() {
        return retriesHandled.sum();
    }

    public long getRetriesFailed() {
        return retriesFailed.sum();
    }

    /**
     * First attempts routed to this node, successful or not.
     */
    public long getFirstAttempts() {
        return requestsHandled.sum() + requestsFailed.sum();
    }

    /**
     * Mean latency of successful attempts, 0 when there were none.
     */
    public double getAvgLatencyMs() {
        long count = latencyCount.sum();
        return count == 0 ? 0.0 : (double) latencySumMs.sum() / count;
    }

    /**
     * Time of the last attempt on this node, null if never tried.
     */
    public Instant getLastSeen() {
        return lastSeen;
    }
}
