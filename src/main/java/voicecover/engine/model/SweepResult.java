package voicecover.engine.model;

/**
 * Outcome of one result-lifecycle sweep.
 *
 * @param deletedArtifacts    expired jobs whose files were removed
 * @param deletedRecords      job records removed after the grace period
 * @param orphanedDirectories job directories removed that had no record
 * @param freedBytes          total size of deleted files
 * @param dryRun              true if nothing was actually deleted
 */
public record SweepResult(
        int deletedArtifacts,
        int deletedRecords,
        int orphanedDirectories,
        long freedBytes,
        boolean dryRun) {

    public boolean isEmpty() {
        return deletedArtifacts == 0 && deletedRecords == 0 && orphanedDirectories == 0;
    }
}
