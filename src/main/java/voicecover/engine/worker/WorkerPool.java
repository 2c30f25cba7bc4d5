package voicecover.engine.worker;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.service.CancellationController;
import voicecover.engine.service.CoverOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed number of workers.
 * Call start() to spawn them, stop() to interrupt them all; an interrupted
 * worker kills the tool it is running.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkClaim workClaim;
    private final CoverOrchestrator orchestrator;
    private final CancellationController cancellation;
    private final CoverJobRepository repository;
    private final EngineConfig config;

    private ExecutorService executor;
    private ScheduledExecutorService heartbeats;
    private final List<String> workerIds = new ArrayList<>();
    private volatile boolean running;

    public WorkerPool(WorkClaim workClaim, CoverOrchestrator orchestrator, CancellationController cancellation,
            CoverJobRepository repository, EngineConfig config) {
        this.workClaim = workClaim;
        this.orchestrator = orchestrator;
        this.cancellation = cancellation;
        this.repository = repository;
        this.config = config;
    }

    /**
     * Start the configured number of workers.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        int workers = config.workerCount();
        workerIds.clear();
        executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });
        heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voicecover-heartbeat");
            t.setDaemon(true);
            return t;
        });

        long pid = ProcessHandle.current().pid();
        for (int i = 1; i <= workers; i++) {
            String workerId = "worker-" + pid + "-" + i;
            workerIds.add(workerId);
            executor.submit(new CoverWorker(workerId, workClaim, orchestrator, cancellation, repository,
                    heartbeats, config.heartbeatInterval(), config.idlePollInterval()));
        }

        running = true;
        log.info("Worker pool started: {} workers", workers);
    }

    /**
     * Interrupt all workers and wait for them to exit.
     */
    public synchronized void stop() {
        if (!running)
            return;

        running = false;

        executor.shutdownNow();
        heartbeats.shutdownNow();
        try {
            if (!executor.awaitTermination(config.killGrace().toMillis() + 5000, TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        heartbeats = null;
        workerIds.clear();

        log.info("Worker pool stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<String> workerIds() {
        return List.copyOf(workerIds);
    }
}
