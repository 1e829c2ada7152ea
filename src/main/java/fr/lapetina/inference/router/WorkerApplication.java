package fr.lapetina.inference.router;

import fr.lapetina.inference.router.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.worker.WorkerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Worker entry point: one batch queue and simulated compute engine behind HTTP.
 */
@CommandLine.Command(name = "worker", mixinStandardHelpOptions = true,
        description = "Inference worker with dynamic batching")
public class WorkerApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkerApplication.class);

    @CommandLine.Option(names = {"-p", "--port"}, description = "Port to listen on (default: ${DEFAULT-VALUE})")
    int port = 8001;

    @CommandLine.Option(names = {"-n", "--node-id"}, description = "Node id (default: worker_<port>)")
    String nodeId;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration file or classpath resource")
    String configPath = ConfigLoader.DEFAULT_RESOURCE;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    @Override
    public Integer call() throws Exception {
        RouterConfig config;
        try (ConfigLoader loader = new ConfigLoader(configPath)) {
            config = loader.load();
        }
        String id = nodeId != null && !nodeId.isBlank() ? nodeId : WorkerNode.defaultNodeId(port);

        WorkerNode worker = WorkerNode.create(config, id, port).start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            worker.close();
            shutdownLatch.countDown();
        }, "worker-shutdown"));

        log.info("Worker ready: nodeId={}, url={}", id, worker.getBaseUrl());
        shutdownLatch.await();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new WorkerApplication()).execute(args));
    }
}
