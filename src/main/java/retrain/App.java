package retrain;

import retrain.orchestrator.cli.RetrainCli;
import retrain.orchestrator.config.Dependencies;
import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.server.OrchestratorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Starts the HTTP server, then the scheduler, and stops both on JVM shutdown.
 * With arguments it runs as the command-line client instead, see {@link RetrainCli}.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        if (args.length > 0) {
            RetrainCli.main(args);
            return;
        }

        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        OrchestratorNettyServer server = new OrchestratorNettyServer(deps.routerHandler());

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (IllegalStateException e) {
            log.error("Server startup failed", e);
            deps.close();
            System.exit(1);
            return;
        }

        deps.startScheduler();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "retrain-shutdown"));

        log.info("Retrain orchestrator running on port {}", server.port());
        stopped.await();
    }
}
