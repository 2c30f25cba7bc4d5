package voicecover.engine.scheduler;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.SweepResult;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.util.JobFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reclaims storage of finished jobs.
 *
 * A sweep:
 * 1. Deletes the directory of every terminal job past its expiry and marks
 * its artifacts purged
 * 2. Deletes records once the record grace period has also passed
 * 3. Deletes directories under the asset root that belong to no record and
 * are older than the retention window
 *
 * Running it twice in a row deletes nothing the second time. Jobs that are
 * not terminal are never touched.
 */
public class ResultSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultSweeper.class);

    private final CoverJobRepository repository;
    private final EngineConfig config;
    private final Clock clock;

    public ResultSweeper(CoverJobRepository repository, EngineConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            SweepResult result = sweep(clock.instant());
            if (!result.isEmpty()) {
                log.info("Sweep: {} artifacts, {} records, {} orphans removed, {} bytes freed",
                        result.deletedArtifacts(), result.deletedRecords(),
                        result.orphanedDirectories(), result.freedBytes());
            } else {
                log.debug("Sweep: nothing expired");
            }
        } catch (Exception e) {
            log.error("Result sweeper error", e);
        }
    }

    public SweepResult sweep(Instant now) {
        return sweep(now, false);
    }

    /**
     * @param dryRun report what would be deleted without deleting it
     */
    public SweepResult sweep(Instant now, boolean dryRun) {
        int artifacts = 0;
        int records = 0;
        int orphans = 0;
        long freed = 0;

        for (String jobId : repository.listExpired(now)) {
            Path dir = JobFiles.jobDir(config.assetRoot(), jobId);
            try {
                freed += dryRun ? JobFiles.sizeOf(dir) : JobFiles.deleteRecursively(dir);
                if (dryRun || repository.markArtifactsPurged(jobId, now)) {
                    artifacts++;
                }
                log.debug("{}artifacts of job {}", dryRun ? "Would delete " : "Deleted ", jobId);
            } catch (UncheckedIOException e) {
                log.warn("Could not delete artifacts of job {}: {}", jobId, e.getMessage());
            }
        }

        Optional<Duration> grace = config.recordGracePeriod();
        if (grace.isPresent()) {
            for (String jobId : repository.listRecordsExpired(now.minus(grace.get()))) {
                if (dryRun) {
                    records++;
                    continue;
                }
                try {
                    freed += JobFiles.deleteRecursively(JobFiles.jobDir(config.assetRoot(), jobId));
                    if (repository.delete(jobId)) {
                        records++;
                    }
                } catch (UncheckedIOException e) {
                    log.warn("Could not delete remaining files of job {}: {}", jobId, e.getMessage());
                }
            }
        }

        Instant orphanCutoff = now.minus(config.retentionWindow());
        Set<String> known = repository.existingIds();
        for (Path dir : orphanCandidates(orphanCutoff, known)) {
            try {
                freed += dryRun ? JobFiles.sizeOf(dir) : JobFiles.deleteRecursively(dir);
                orphans++;
                log.debug("{}orphaned directory {}", dryRun ? "Would delete " : "Deleted ", dir);
            } catch (UncheckedIOException e) {
                log.warn("Could not delete orphaned directory {}: {}", dir, e.getMessage());
            }
        }

        return new SweepResult(artifacts, records, orphans, freed, dryRun);
    }

    private List<Path> orphanCandidates(Instant cutoff, Set<String> known) {
        Path root = config.assetRoot();
        List<Path> candidates = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return candidates;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : entries) {
                if (known.contains(dir.getFileName().toString())) {
                    continue;
                }
                if (Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)) {
                    candidates.add(dir);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan asset root " + root, e);
        }
        return candidates;
    }
}
