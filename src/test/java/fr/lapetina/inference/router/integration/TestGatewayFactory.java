package fr.lapetina.inference.router.integration;

import fr.lapetina.inference.router.GatewayFactory;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.infrastructure.http.StubWorkerHttpClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway wired to an in-process stub instead of real workers.
 */
public final class TestGatewayFactory extends GatewayFactory {

    private TestGatewayFactory(RouterConfig config) {
        super(config, null, false, new StubWorkerHttpClient(), Clock.systemUTC());
    }

    /**
     * Starts a gateway over the given worker ids, health checks off.
     */
    public static TestGatewayFactory withWorkers(RouterConfig config, String... workerIds) {
        List<RouterConfig.WorkerConfig> workers = new ArrayList<>();
        for (int i = 0; i < workerIds.length; i++) {
            workers.add(new RouterConfig.WorkerConfig(workerIds[i], "http://localhost:" + (19001 + i)));
        }
        config.setWorkers(workers);
        config.getHealthCheck().setEnabled(false);
        TestGatewayFactory factory = new TestGatewayFactory(config);
        factory.start();
        return factory;
    }

    public static TestGatewayFactory withWorkers(String... workerIds) {
        RouterConfig config = new RouterConfig();
        config.getRing().setVirtualNodesPerPhysical(100);
        config.getDisruptor().setRingBufferSize(256);
        return withWorkers(config, workerIds);
    }

    public StubWorkerHttpClient getStub() {
        return (StubWorkerHttpClient) getHttpClient();
    }
}
