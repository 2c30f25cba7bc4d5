package voicecover;

import voicecover.engine.config.Dependencies;
import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Engine entry point.
 *
 * Without arguments, starts the worker pool and background tasks and runs
 * until the JVM is stopped. {@code sweep [--dry-run]} runs one result sweep
 * and exits.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config;
        try {
            config = EngineConfig.fromEnv().validate();
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        List<String> argList = List.of(args);
        if (argList.contains("sweep")) {
            try (Dependencies deps = Dependencies.create(config)) {
                boolean dryRun = argList.contains("--dry-run");
                SweepResult result = deps.resultSweeper().sweep(deps.clock().instant(), dryRun);
                log.info("Sweep finished{}: {}", dryRun ? " (dry run)" : "", result);
            }
            return;
        }

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping engine...");
            deps.close();
            stopped.countDown();
        }, "voicecover-shutdown"));

        deps.start();
        log.info("Voice cover engine running with {} workers, assets in {}",
                config.workerCount(), config.assetRoot().toAbsolutePath());
        stopped.await();
    }
}
