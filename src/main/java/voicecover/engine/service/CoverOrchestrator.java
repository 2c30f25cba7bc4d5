package voicecover.engine.service;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.config.StageSettings;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.repository.JobConflictException;
import voicecover.engine.repository.JobNotFoundException;
import voicecover.engine.runner.StageResult;
import voicecover.engine.runner.StageRunner;
import voicecover.engine.service.CancellationController.TerminationGuard;
import voicecover.engine.util.JobFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Drives one job from queued to a terminal state.
 *
 * State machine: queued -> running(preprocess .. finalize) -> succeeded |
 * failed | canceled. Every write is conditional on the state this run last
 * saw; a conflicting write means someone else (a cancel, the reaper) moved
 * the job and is resolved by re-reading it.
 *
 * No stage is ever retried; external tools are not assumed idempotent.
 */
public class CoverOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CoverOrchestrator.class);

    private static final String PASS_THROUGH = "pass-through";

    private final CoverJobRepository repository;
    private final StageRunner runner;
    private final CancellationController cancellation;
    private final EngineConfig config;
    private final Clock clock;

    public CoverOrchestrator(CoverJobRepository repository, StageRunner runner,
            CancellationController cancellation, EngineConfig config, Clock clock) {
        this.repository = repository;
        this.runner = runner;
        this.cancellation = cancellation;
        this.config = config.validate();
        this.clock = clock;
    }

    /**
     * Run the job to completion.
     *
     * Safe under duplicate delivery: a job that is already running or
     * terminal is returned untouched.
     *
     * @param jobId      job to run
     * @param taskHandle id of the execution unit, stored on the job
     * @return the job as last persisted
     * @throws InterruptedException if the worker is interrupted mid-stage;
     *                              the job is left running for the reaper
     */
    public CoverJob run(String jobId, String taskHandle) throws InterruptedException {
        CoverJob job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.isTerminal()) {
            log.info("Job {} already {}, ignoring duplicate delivery", jobId, job.status().value());
            return job;
        }
        if (job.status() == JobStatus.RUNNING) {
            log.warn("Job {} is already running under {}, not starting it again", jobId, job.externalTaskHandle());
            return job;
        }

        try {
            job = repository.markRunning(jobId, taskHandle, Stage.first(), ProgressTracker.initial(), now());
        } catch (JobConflictException e) {
            CoverJob current = reload(jobId);
            log.info("Job {} was started elsewhere (now {}), skipping", jobId, current.status().value());
            return current;
        }

        // Only the run that won markRunning owns the guard; a cancel landing
        // before registration is seen through the stored flag
        try (TerminationGuard guard = cancellation.register(jobId)) {
            log.info("Job {} started (handle={})", jobId, taskHandle);
            return execute(job, guard);
        }
    }

    private CoverJob execute(CoverJob job, TerminationGuard guard) throws InterruptedException {
        String jobId = job.id();
        StagePlan plan = new StagePlan(job, JobFiles.jobDir(config.assetRoot(), jobId), config);
        Stage stage = Stage.first();

        while (true) {
            if (cancelRequested(jobId, guard)) {
                log.info("Job {} canceled before stage {}", jobId, stage.value());
                return finishCanceled(jobId, plan);
            }

            StageSettings settings = config.stage(stage);
            String tool;
            StageResult result;
            if (settings.isPassThrough()) {
                tool = PASS_THROUGH;
                result = plan.passThrough(stage);
            } else {
                tool = settings.template().toolName();
                result = runner.run(plan.invocation(stage), guard);
            }

            if (result.canceled()) {
                log.info("Job {} canceled during stage {}", jobId, stage.value());
                return finishCanceled(jobId, plan);
            }
            if (!result.succeeded()) {
                String message = result.summary(tool, config.diagnosticChars());
                CoverJob failed = writeOnce(jobId, plan,
                        () -> repository.markFailed(jobId, message, expiry(), now()));
                log.warn("Job {} ended {}: {}", jobId, failed.status().value(), message);
                return failed;
            }

            plan.record(stage, result.outputs());

            if (stage.isLast()) {
                String output = result.outputPath().toString();
                CoverJob done = writeOnce(jobId, plan,
                        () -> repository.markSucceeded(jobId, output, expiry(), now()));
                log.info("Job {} ended {} (output={})", jobId, done.status().value(), done.outputPath());
                return done;
            }

            Stage current = stage;
            Stage next = stage.next();
            int progress = ProgressTracker.progressAfter(stage);
            CoverJob advanced = writeOnce(jobId, plan,
                    () -> repository.advanceStage(jobId, current, next, progress, now()));
            if (advanced.isTerminal()) {
                return advanced;
            }
            log.info("Job {} stage {} done, progress {}%", jobId, stage.value(), progress);
            stage = next;
        }
    }

    /**
     * Apply a write, resolving a single conflict: a terminal job is returned
     * as is, a pending cancel turns into a canceled job, anything else gets
     * one retry. A second conflict fails the job.
     */
    private CoverJob writeOnce(String jobId, StagePlan plan, Supplier<CoverJob> write) {
        try {
            return write.get();
        } catch (JobConflictException e) {
            CoverJob current = reload(jobId);
            if (current.isTerminal()) {
                log.info("Job {} reached {} concurrently", jobId, current.status().value());
                return current;
            }
            if (current.cancelRequested()) {
                log.info("Job {} canceled while its last step was being recorded", jobId);
                return finishCanceled(jobId, plan);
            }
            log.warn("Conflicting write on job {} ({}), retrying once", jobId, e.getMessage());
            try {
                return write.get();
            } catch (JobConflictException again) {
                return failAfterRepeatedConflict(jobId, plan, again);
            }
        }
    }

    /**
     * Stop a run whose state writes keep conflicting. The job fails with
     * the conflict as its message instead of waiting for the reaper.
     */
    private CoverJob failAfterRepeatedConflict(String jobId, StagePlan plan, JobConflictException conflict) {
        CoverJob current = reload(jobId);
        if (current.isTerminal()) {
            return current;
        }
        if (current.cancelRequested()) {
            return finishCanceled(jobId, plan);
        }
        String message = "job state update conflicted twice: " + conflict.getMessage();
        log.error("Job {}: {}", jobId, message);
        return repository.markFailed(jobId, message, expiry(), now());
    }

    private CoverJob finishCanceled(String jobId, StagePlan plan) {
        CoverJob canceled;
        try {
            canceled = repository.markCanceled(jobId, expiry(), now());
        } catch (JobConflictException e) {
            CoverJob current = reload(jobId);
            if (!current.isTerminal()) {
                throw e;
            }
            return current;
        }
        discardIntermediates(jobId, plan.jobDir());
        return canceled;
    }

    private void discardIntermediates(String jobId, Path jobDir) {
        try {
            long freed = JobFiles.deleteRecursively(JobFiles.workDir(jobDir))
                    + JobFiles.deleteRecursively(JobFiles.outputDir(jobDir));
            log.debug("Removed intermediates of canceled job {} ({} bytes)", jobId, freed);
        } catch (UncheckedIOException e) {
            // The sweeper removes the whole directory later
            log.warn("Could not clean up canceled job {}: {}", jobId, e.getMessage());
        }
    }

    private boolean cancelRequested(String jobId, TerminationGuard guard) {
        return guard.isCancelRequested() || reload(jobId).cancelRequested();
    }

    private CoverJob reload(String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private Instant now() {
        return clock.instant();
    }

    private Instant expiry() {
        return now().plus(config.retentionWindow());
    }
}
