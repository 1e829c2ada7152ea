package fr.lapetina.inference.router.domain.model;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A worker process the gateway can forward requests to.
 * Identity is the worker id, which is also the physical node id on the hash ring.
 * Thread-safe for concurrent access from pipeline handlers and the health checker.
 */
public final class WorkerEndpoint {
    private final String id;
    private final URI baseUrl;

    // Mutable state - thread-safe
    private final AtomicReference<NodeHealth> health;
    private final AtomicInteger consecutiveFailures;
    private volatile long lastHealthCheck;
    private volatile long lastSuccessfulRequest;

    private WorkerEndpoint(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Worker ID is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        this.health = new AtomicReference<>(builder.initialHealth);
        this.consecutiveFailures = new AtomicInteger(0);
        this.lastHealthCheck = System.currentTimeMillis();
        this.lastSuccessfulRequest = 0L;
    }

    public String getId() {
        return id;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Resolves a path such as {@code /infer} against the worker base URL.
     */
    public URI resolve(String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    public NodeHealth getHealth() {
        return health.get();
    }

    public void setHealth(NodeHealth newHealth) {
        this.health.set(newHealth);
        this.lastHealthCheck = System.currentTimeMillis();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        lastSuccessfulRequest = System.currentTimeMillis();
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public void resetFailures() {
        consecutiveFailures.set(0);
    }

    public long getLastHealthCheck() {
        return lastHealthCheck;
    }

    public long getLastSuccessfulRequest() {
        return lastSuccessfulRequest;
    }

    /**
     * Same id and same URL: used by hot reload to decide whether a configured
     * worker changed.
     */
    public boolean sameTarget(String otherId, URI otherUrl) {
        return id.equals(otherId) && baseUrl.equals(otherUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerEndpoint that = (WorkerEndpoint) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerEndpoint{" +
                "id='" + id + '\'' +
                ", baseUrl=" + baseUrl +
                ", health=" + health.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private URI baseUrl;
        private NodeHealth initialHealth = NodeHealth.UP;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder initialHealth(NodeHealth health) {
            this.initialHealth = health;
            return this;
        }

        public WorkerEndpoint build() {
            return new WorkerEndpoint(this);
        }
    }
}
