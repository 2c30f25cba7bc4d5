package voicecover.engine.scheduler;

import voicecover.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - StaleJobReaper: recovers jobs whose worker stopped heartbeating
 * - ResultSweeper: reclaims artifacts and records past retention
 *
 * Uses a single-threaded executor so the two never run concurrently.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleJobReaper reaper;
    private final ResultSweeper sweeper;
    private final EngineConfig config;

    private volatile boolean running = false;

    public Scheduler(StaleJobReaper reaper, ResultSweeper sweeper, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voicecover-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.reaper = reaper;
        this.sweeper = sweeper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                reaper,
                reaperIntervalMs, // initial delay
                reaperIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Stale job reaper scheduled every {}ms", reaperIntervalMs);

        // First sweep right away: a restart may follow a long downtime
        long sweepIntervalMs = config.sweepInterval().toMillis();
        executor.scheduleAtFixedRate(sweeper, 0, sweepIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Result sweeper scheduled every {}ms", sweepIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}
