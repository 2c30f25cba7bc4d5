package voicecover.engine.service;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.CancelResult;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobParameters;
import voicecover.engine.model.JobStatus;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.repository.JobNotFoundException;
import voicecover.engine.service.dto.CancelJobResponse;
import voicecover.engine.service.dto.JobStatusResponse;
import voicecover.engine.util.JobFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Submission and query operations for cover jobs.
 * Validation happens here, before anything is persisted.
 */
public class CoverJobService {

    private static final Logger log = LoggerFactory.getLogger(CoverJobService.class);

    private final CoverJobRepository repository;
    private final CancellationController cancellation;
    private final EngineConfig config;
    private final Clock clock;

    public CoverJobService(CoverJobRepository repository, CancellationController cancellation,
            EngineConfig config, Clock clock) {
        this.repository = repository;
        this.cancellation = cancellation;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Create a queued job. Both files are copied into the job's input
     * directory so later cleanup of the originals cannot affect the run.
     *
     * @param modelId    voice model, null for the default
     * @param pitchShift semitones, null for 0
     * @throws IllegalArgumentException on a missing file, unsupported format
     *                                  or out-of-range parameter
     */
    public CoverJob createJob(Path referenceVoice, Path song, String modelId, Integer pitchShift) {
        return createJob(referenceVoice, song, JobParameters.of(modelId, pitchShift != null ? pitchShift : 0));
    }

    public CoverJob createJob(Path referenceVoice, Path song, JobParameters parameters) {
        String voiceExt = validateAudio("referenceVoice", referenceVoice);
        String songExt = validateAudio("song", song);
        parameters.validate();

        String jobId = repository.generateId();
        Path jobDir = JobFiles.jobDir(config.assetRoot(), jobId);
        Path inputDir = JobFiles.inputDir(jobDir);
        Path voicePath = inputDir.resolve("reference_voice." + voiceExt);
        Path songPath = inputDir.resolve("song." + songExt);

        try {
            Files.createDirectories(inputDir);
            Files.copy(referenceVoice, voicePath);
            Files.copy(song, songPath);
        } catch (IOException e) {
            JobFiles.deleteRecursively(jobDir);
            throw new UncheckedIOException("Failed to store input files for job " + jobId, e);
        }

        Instant now = clock.instant();
        CoverJob job = CoverJob.builder()
                .id(jobId)
                .status(JobStatus.QUEUED)
                .referenceVoicePath(voicePath.toString())
                .songPath(songPath.toString())
                .parameters(parameters)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            repository.save(job);
        } catch (RuntimeException e) {
            JobFiles.deleteRecursively(jobDir);
            throw e;
        }

        log.info("Created job {} (model={}, pitch={})", jobId, parameters.modelId(), parameters.pitchShift());
        return job;
    }

    public Optional<JobStatusResponse> getJob(String jobId) {
        return repository.findById(jobId).map(JobStatusResponse::from);
    }

    /**
     * Recent jobs, newest first.
     */
    public List<JobStatusResponse> listRecent(int limit) {
        return repository.findRecent(limit).stream()
                .map(JobStatusResponse::from)
                .toList();
    }

    /**
     * Path of the finished artifact.
     *
     * @throws JobNotFoundException        if the job does not exist
     * @throws ResultNotAvailableException if the job has not succeeded or its
     *                                     files are gone
     */
    public Path getResult(String jobId) {
        CoverJob job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.status() != JobStatus.SUCCEEDED) {
            throw new ResultNotAvailableException(jobId, job.status(), "job is " + job.status().value());
        }
        if (job.artifactsPurged()) {
            throw new ResultNotAvailableException(jobId, job.status(), "result expired");
        }
        Path output = Path.of(job.outputPath());
        if (!Files.isRegularFile(output)) {
            throw new ResultNotAvailableException(jobId, job.status(), "result file is missing");
        }
        return output;
    }

    public CancelJobResponse cancelJob(String jobId) {
        CancelResult result = cancellation.requestCancel(jobId);
        String status = repository.findById(jobId)
                .map(job -> job.status().value())
                .orElse(null);
        return new CancelJobResponse(jobId, result, status);
    }

    private String validateAudio(String field, Path file) {
        if (file == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException(field + " does not exist: " + file);
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!config.allowedFormats().contains(ext)) {
            throw new IllegalArgumentException(
                    field + " has unsupported format '" + ext + "', expected one of " + config.allowedFormats());
        }
        return ext;
    }
}
