package taskforge;

import taskforge.coordinator.config.CoordinatorConfig;
import taskforge.coordinator.config.Dependencies;
import taskforge.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Wires dependencies, starts the HTTP server and then the background scheduler.
 * Stops both on JVM shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        CoordinatorNettyServer server = new CoordinatorNettyServer(
                deps.routerHandler(), config.serverHost(), config.serverPort());
        try {
            server.start();
        } catch (RuntimeException e) {
            log.error("Coordinator failed to start", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "taskforge-shutdown"));

        log.info("Coordinator ready on port {}", server.port());
        stopped.await();
    }
}
