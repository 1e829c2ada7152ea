package fr.lapetina.inference.router;

import fr.lapetina.inference.router.api.GatewayHttpServer;
import fr.lapetina.inference.router.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Gateway entry point: routes inference requests to workers over a consistent hash ring.
 */
@CommandLine.Command(name = "gateway", mixinStandardHelpOptions = true,
        description = "Consistent-hash gateway in front of the inference workers")
public class GatewayApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    @CommandLine.Option(names = {"-p", "--port"}, description = "Port to listen on (default: server.port)")
    Integer port;

    @CommandLine.Option(names = {"-w", "--workers"}, split = ",",
            description = "Worker base URLs; overrides the configured list and disables its hot reload")
    List<String> workers;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration file or classpath resource")
    String configPath = ConfigLoader.DEFAULT_RESOURCE;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    @Override
    public Integer call() throws Exception {
        ConfigLoader loader = new ConfigLoader(configPath);
        RouterConfig config = loader.load();

        boolean workersFromConfig = workers == null || workers.isEmpty();
        if (!workersFromConfig) {
            List<RouterConfig.WorkerConfig> fromCli = new ArrayList<>();
            for (String url : workers) {
                fromCli.add(new RouterConfig.WorkerConfig(null, url.trim()));
            }
            config.setWorkers(fromCli);
        }
        int listenPort = port != null ? port : config.getServer().getPort();

        log.info("Starting gateway: port={}, workers={}, config={}", listenPort, config.getWorkers().size(), configPath);

        GatewayFactory factory = GatewayFactory.create(config, loader, workersFromConfig).start();
        GatewayHttpServer server = factory.createHttpServer(listenPort);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gateway...");
            try {
                server.close();
            } catch (RuntimeException e) {
                log.warn("Error closing HTTP server", e);
            }
            factory.close();
            shutdownLatch.countDown();
        }, "gateway-shutdown"));

        server.start();
        log.info("Gateway started on port {}", server.getPort());
        shutdownLatch.await();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new GatewayApplication()).execute(args));
    }
}
