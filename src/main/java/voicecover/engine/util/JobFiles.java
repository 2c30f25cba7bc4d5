package voicecover.engine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-job directory layout under the asset root:
 *
 * <pre>
 * &lt;root&gt;/&lt;jobId&gt;/input/    submitted files
 * &lt;root&gt;/&lt;jobId&gt;/work/     intermediates and logs/
 * &lt;root&gt;/&lt;jobId&gt;/output/   final artifact
 * </pre>
 */
public final class JobFiles {

    private static final Logger log = LoggerFactory.getLogger(JobFiles.class);

    private JobFiles() {
    }

    public static Path jobDir(Path assetRoot, String jobId) {
        Path root = assetRoot.toAbsolutePath().normalize();
        Path dir = root.resolve(jobId).normalize();
        if (!dir.startsWith(root) || dir.equals(root)) {
            throw new IllegalArgumentException("Invalid job id for a directory name: " + jobId);
        }
        return dir;
    }

    public static Path inputDir(Path jobDir) {
        return jobDir.resolve("input");
    }

    public static Path workDir(Path jobDir) {
        return jobDir.resolve("work");
    }

    public static Path outputDir(Path jobDir) {
        return jobDir.resolve("output");
    }

    /** Total size of regular files below {@code dir}; 0 if it does not exist */
    public static long sizeOf(Path dir) {
        if (!Files.exists(dir)) {
            return 0;
        }
        AtomicLong total = new AtomicLong();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    total.addAndGet(attrs.size());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to measure " + dir, e);
        }
        return total.get();
    }

    /**
     * Delete a directory tree.
     *
     * @return bytes freed; 0 if the directory was already gone
     */
    public static long deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return 0;
        }
        AtomicLong freed = new AtomicLong();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    long size = attrs.size();
                    if (Files.deleteIfExists(file)) {
                        freed.addAndGet(size);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (exc instanceof NoSuchFileException) {
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
        log.debug("Deleted {} ({} bytes)", dir, freed.get());
        return freed.get();
    }
}
