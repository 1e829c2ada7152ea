package fr.lapetina.inference.router;

import fr.lapetina.inference.router.api.GatewayHttpServer;
import fr.lapetina.inference.router.disruptor.GatewayPipeline;
import fr.lapetina.inference.router.domain.routing.RetryPolicy;
import fr.lapetina.inference.router.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.infrastructure.health.WorkerHealthChecker;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.http.RequestForwarder;
import fr.lapetina.inference.router.infrastructure.http.WorkerHttpClient;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Factory for a fully-wired gateway built from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("router.yaml").start()) {
 *     GatewayPipeline pipeline = factory.getPipeline();
 *     ForwardOutcome outcome = pipeline.submit(InferenceRequest.ofPayload(payload)).get();
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final ConfigLoader configLoader;
    private final boolean workersFromConfig;
    private volatile RouterConfig config;

    private final MetricsRegistry metricsRegistry;
    private final WorkerRegistry workerRegistry;
    private final GatewayStats stats;
    private final WorkerHttpClient httpClient;
    private final WorkerHealthChecker healthChecker;
    private final RequestForwarder forwarder;
    private final GatewayPipeline pipeline;
    private final Clock clock;

    /**
     * @param config            configuration to build from
     * @param configLoader      loader to watch for changes, or null
     * @param workersFromConfig whether configuration changes may alter the ring
     * @param httpClientOverride client to use instead of a real one, or null
     * @param clock             time source for stats and latencies
     */
    protected GatewayFactory(
            RouterConfig config,
            ConfigLoader configLoader,
            boolean workersFromConfig,
            WorkerHttpClient httpClientOverride,
            Clock clock
    ) {
        this.config = ConfigLoader.validate(config);
        this.configLoader = configLoader;
        this.workersFromConfig = workersFromConfig;
        this.clock = clock;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.stats = new GatewayStats(clock);
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient(config, clock);

        this.workerRegistry = new WorkerRegistry(config.getRing().getVirtualNodesPerPhysical());
        workerRegistry.addListener(this::onRegistryEvent);
        workerRegistry.syncWorkers(config.getWorkers());

        this.healthChecker = new WorkerHealthChecker(
                workerRegistry,
                httpClient,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                config.getHealthCheck().getDegradedThreshold()
        );

        this.forwarder = new RequestForwarder(
                workerRegistry,
                httpClient,
                RetryPolicy.fromConfig(config.getRetry()),
                stats,
                metricsRegistry,
                clock
        );

        this.pipeline = GatewayPipeline.builder()
                .fromConfig(config)
                .registry(workerRegistry)
                .forwarder(forwarder)
                .stats(stats)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        if (configLoader != null) {
            configLoader.addListener(this::onConfigChanged);
        }

        log.info("GatewayFactory initialized: workers={}, virtualNodesPerPhysical={}, retryEnabled={}",
                workerRegistry.size(), config.getRing().getVirtualNodesPerPhysical(), config.getRetry().isEnabled());
    }

    /**
     * Creates a factory from a configuration file, watching it for changes.
     */
    public static GatewayFactory create(String configPath) {
        ConfigLoader loader = new ConfigLoader(configPath);
        return new GatewayFactory(loader.load(), loader, true, null, Clock.systemUTC());
    }

    /**
     * Creates a factory from an already loaded configuration.
     *
     * @param workersFromConfig false when the worker list comes from elsewhere and
     *                          configuration reloads must leave the ring alone
     */
    public static GatewayFactory create(RouterConfig config, ConfigLoader loader, boolean workersFromConfig) {
        return new GatewayFactory(config, loader, workersFromConfig, null, Clock.systemUTC());
    }

    /**
     * Creates a factory from an in-memory configuration.
     */
    public static GatewayFactory create(RouterConfig config) {
        return new GatewayFactory(config, null, false, null, Clock.systemUTC());
    }

    /**
     * Starts the pipeline, the health checker and the configuration watcher.
     */
    public GatewayFactory start() {
        pipeline.start();
        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start();
        }
        if (configLoader != null) {
            configLoader.startWatching();
        }
        log.info("Gateway started");
        return this;
    }

    /**
     * Builds the HTTP surface of this gateway. The caller starts and closes it.
     */
    public GatewayHttpServer createHttpServer(int port) throws IOException {
        RouterConfig.ServerConfig server = config.getServer();
        return GatewayHttpServer.builder()
                .host(server.getHost())
                .port(port)
                .backlog(server.getBacklog())
                .handlerThreads(server.getHandlerThreads())
                .pipeline(pipeline)
                .registry(workerRegistry)
                .httpClient(httpClient)
                .stats(stats)
                .metricsRegistry(metricsRegistry)
                .configLoader(configLoader)
                .maxLoadBalanceCv(() -> config.getStats().getMaxLoadBalanceCv())
                .responseTimeout(responseTimeout(config))
                .clock(clock)
                .build();
    }

    public GatewayPipeline getPipeline() {
        return pipeline;
    }

    public WorkerRegistry getWorkerRegistry() {
        return workerRegistry;
    }

    public GatewayStats getStats() {
        return stats;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public WorkerHttpClient getHttpClient() {
        return httpClient;
    }

    public WorkerHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public RequestForwarder getForwarder() {
        return forwarder;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static WorkerHttpClient createHttpClient(RouterConfig config, Clock clock) {
        return new WorkerHttpClient(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getForwardTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getHealthCheckTimeoutMs()),
                config.getHealthCheck().getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(config.getHealthCheck().getCircuitBreakerRecoveryMs()),
                clock
        );
    }

    /**
     * Longest a request can legitimately take: every attempt timing out plus the
     * backoff between them, with some slack.
     */
    static Duration responseTimeout(RouterConfig config) {
        int attempts = config.getRetry().isEnabled() ? config.getRetry().getMaxAttempts() : 1;
        long millis = attempts * (config.getTimeouts().getForwardTimeoutMs() + config.getRetry().getMaxBackoffMs());
        return Duration.ofMillis(millis + 5_000);
    }

    private void onRegistryEvent(WorkerRegistry.RegistryEvent event) {
        String workerId = event.worker().getId();
        switch (event.type()) {
            case ADDED -> {
                stats.track(workerId);
                metricsRegistry.registerNodeHealth(workerId, () -> switch (event.worker().getHealth()) {
                    case UP -> 2;
                    case DEGRADED -> 1;
                    case DOWN -> 0;
                });
            }
            case REMOVED -> {
                metricsRegistry.removeNodeGauges(workerId);
                httpClient.removeCircuitBreaker(workerId);
            }
            case HEALTH_CHANGED -> log.debug("Worker health event: workerId={}, health={}",
                    workerId, event.worker().getHealth());
        }
        metricsRegistry.setActiveNodes(workerRegistry.size());
    }

    private void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        log.info("Configuration changed, applying updates...");
        this.config = newConfig;

        forwarder.setRetryPolicy(RetryPolicy.fromConfig(newConfig.getRetry()));

        if (workersFromConfig) {
            workerRegistry.onConfigChanged(oldConfig, newConfig);
        } else {
            log.info("Worker list given on the command line, ignoring configured workers");
        }

        if (oldConfig != null
                && oldConfig.getRing().getVirtualNodesPerPhysical() != newConfig.getRing().getVirtualNodesPerPhysical()) {
            log.warn("ring.virtualNodesPerPhysical changed to {}, restart required to apply",
                    newConfig.getRing().getVirtualNodesPerPhysical());
        }
        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            healthChecker.close();
        } catch (RuntimeException e) {
            log.warn("Error closing health checker", e);
        }

        try {
            pipeline.close();
        } catch (RuntimeException e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            httpClient.close();
        } catch (RuntimeException e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (RuntimeException e) {
                log.warn("Error closing config loader", e);
            }
        }

        log.info("GatewayFactory shut down");
    }
}
