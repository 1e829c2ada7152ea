package fr.lapetina.inference.router.infrastructure.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration shared by the gateway and the workers.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private ServerConfig server = new ServerConfig();
    private List<WorkerConfig> workers = new ArrayList<>();
    private RingConfig ring = new RingConfig();
    private BatchConfig batch = new BatchConfig();
    private ComputeConfig compute = new ComputeConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private ValidationConfig validation = new ValidationConfig();
    private StatsConfig stats = new StatsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<WorkerConfig> getWorkers() { return workers; }
    public void setWorkers(List<WorkerConfig> workers) { this.workers = workers; }

    public RingConfig getRing() { return ring; }
    public void setRing(RingConfig ring) { this.ring = ring; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public ComputeConfig getCompute() { return compute; }
    public void setCompute(ComputeConfig compute) { this.compute = compute; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public StatsConfig getStats() { return stats; }
    public void setStats(StatsConfig stats) { this.stats = stats; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int handlerThreads = 64;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getHandlerThreads() { return handlerThreads; }
        public void setHandlerThreads(int handlerThreads) { this.handlerThreads = handlerThreads; }
    }

    /**
     * A worker the gateway routes to. The id is the physical node id on the ring
     * and defaults to the URL.
     */
    public static class WorkerConfig {
        private String id;
        private String url;

        public WorkerConfig() {
        }

        public WorkerConfig(String id, String url) {
            this.id = id;
            this.url = url;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String effectiveId() {
            return id == null || id.isBlank() ? url : id;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WorkerConfig that = (WorkerConfig) o;
            return Objects.equals(effectiveId(), that.effectiveId()) && Objects.equals(url, that.url);
        }

        @Override
        public int hashCode() {
            return Objects.hash(effectiveId(), url);
        }
    }

    /**
     * Consistent hash ring configuration.
     */
    public static class RingConfig {
        private int virtualNodesPerPhysical = 150;

        public int getVirtualNodesPerPhysical() { return virtualNodesPerPhysical; }
        public void setVirtualNodesPerPhysical(int count) { this.virtualNodesPerPhysical = count; }
    }

    /**
     * Worker-side dynamic batching configuration.
     */
    public static class BatchConfig {
        private int maxBatchSize = 32;
        private long timeoutMs = 20;
        private long resultTimeoutMs = 10000;
        private int executionThreads = 2;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getResultTimeoutMs() { return resultTimeoutMs; }
        public void setResultTimeoutMs(long resultTimeoutMs) { this.resultTimeoutMs = resultTimeoutMs; }

        public int getExecutionThreads() { return executionThreads; }
        public void setExecutionThreads(int executionThreads) { this.executionThreads = executionThreads; }
    }

    /**
     * Simulated compute engine profile.
     */
    public static class ComputeConfig {
        private long baseLatencyMs = 2;
        private long perItemLatencyMicros = 250;
        private int numClasses = 10;
        private double failureRate = 0.0;

        public long getBaseLatencyMs() { return baseLatencyMs; }
        public void setBaseLatencyMs(long baseLatencyMs) { this.baseLatencyMs = baseLatencyMs; }

        public long getPerItemLatencyMicros() { return perItemLatencyMicros; }
        public void setPerItemLatencyMicros(long micros) { this.perItemLatencyMicros = micros; }

        public int getNumClasses() { return numClasses; }
        public void setNumClasses(int numClasses) { this.numClasses = numClasses; }

        public double getFailureRate() { return failureRate; }
        public void setFailureRate(double failureRate) { this.failureRate = failureRate; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxGlobalInFlight = 1000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxGlobalInFlight() { return maxGlobalInFlight; }
        public void setMaxGlobalInFlight(int maxGlobalInFlight) { this.maxGlobalInFlight = maxGlobalInFlight; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long forwardTimeoutMs = 10000;
        private long connectTimeoutMs = 2000;
        private long healthCheckTimeoutMs = 2000;

        public long getForwardTimeoutMs() { return forwardTimeoutMs; }
        public void setForwardTimeoutMs(long forwardTimeoutMs) { this.forwardTimeoutMs = forwardTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    }

    /**
     * Ring fallback retry configuration. Disabled unless explicitly enabled.
     */
    public static class RetryConfig {
        private boolean enabled = false;
        private int maxAttempts = 2;
        private long initialBackoffMs = 10;
        private long maxBackoffMs = 200;
        private double backoffMultiplier = 2.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Worker health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private int degradedThreshold = 3;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getDegradedThreshold() { return degradedThreshold; }
        public void setDegradedThreshold(int degradedThreshold) { this.degradedThreshold = degradedThreshold; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxRoutingKeyLength = 1024;

        public int getMaxRoutingKeyLength() { return maxRoutingKeyLength; }
        public void setMaxRoutingKeyLength(int maxRoutingKeyLength) { this.maxRoutingKeyLength = maxRoutingKeyLength; }
    }

    /**
     * Gateway statistics configuration.
     */
    public static class StatsConfig {
        private double maxLoadBalanceCv = 0.10;

        public double getMaxLoadBalanceCv() { return maxLoadBalanceCv; }
        public void setMaxLoadBalanceCv(double maxLoadBalanceCv) { this.maxLoadBalanceCv = maxLoadBalanceCv; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_router";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
