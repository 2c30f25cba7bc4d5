package voicecover.engine.config;

import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.runner.ProcessStageRunner;
import voicecover.engine.runner.StageRunner;
import voicecover.engine.scheduler.ResultSweeper;
import voicecover.engine.scheduler.Scheduler;
import voicecover.engine.scheduler.StaleJobReaper;
import voicecover.engine.service.CancellationController;
import voicecover.engine.service.CoverJobService;
import voicecover.engine.service.CoverOrchestrator;
import voicecover.engine.store.Database;
import voicecover.engine.store.JdbcCoverJobRepository;
import voicecover.engine.store.JdbcWorkClaim;
import voicecover.engine.worker.WorkClaim;
import voicecover.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.start(); // workers + background tasks
 * CoverJobService service = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final Database database;
    private final CoverJobRepository jobRepository;
    private final WorkClaim workClaim;
    private final StageRunner stageRunner;
    private final CancellationController cancellationController;
    private final CoverOrchestrator orchestrator;
    private final CoverJobService jobService;
    private final ResultSweeper resultSweeper;
    private final StaleJobReaper staleJobReaper;

    // Lazy-initialized
    private Scheduler scheduler;
    private WorkerPool workerPool;

    private Dependencies(EngineConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcCoverJobRepository(database);
        this.workClaim = new JdbcWorkClaim(database, clock);

        // Pipeline
        this.stageRunner = new ProcessStageRunner(config.killGrace(), config.diagnosticChars());
        this.cancellationController = new CancellationController(jobRepository, config.killGrace(), clock);
        this.orchestrator = new CoverOrchestrator(jobRepository, stageRunner, cancellationController, config, clock);

        // Services
        this.jobService = new CoverJobService(jobRepository, cancellationController, config, clock);
        this.resultSweeper = new ResultSweeper(jobRepository, config, clock);
        this.staleJobReaper = new StaleJobReaper(workClaim, jobRepository, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create(EngineConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public CoverJobRepository jobRepository() {
        return jobRepository;
    }

    public WorkClaim workClaim() {
        return workClaim;
    }

    public StageRunner stageRunner() {
        return stageRunner;
    }

    public CancellationController cancellationController() {
        return cancellationController;
    }

    public CoverOrchestrator orchestrator() {
        return orchestrator;
    }

    public CoverJobService jobService() {
        return jobService;
    }

    public ResultSweeper resultSweeper() {
        return resultSweeper;
    }

    public StaleJobReaper staleJobReaper() {
        return staleJobReaper;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(staleJobReaper, resultSweeper, config);
        }
        return scheduler;
    }

    /**
     * Get the worker pool (creates it if not yet created).
     */
    public synchronized WorkerPool workerPool() {
        if (workerPool == null) {
            workerPool = new WorkerPool(workClaim, orchestrator, cancellationController, jobRepository, config);
        }
        return workerPool;
    }

    /**
     * Start workers and the background scheduler.
     */
    public void start() {
        if (!database.isHealthy()) {
            throw new IllegalStateException("Database is not reachable: " + config.databaseUrl());
        }
        workerPool().start();
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Workers first so no stage is mid-write when the pool closes
        if (workerPool != null) {
            try {
                workerPool.stop();
            } catch (Exception e) {
                log.warn("Error stopping workers: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        cancellationController.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
