package voicecover.engine.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * StageRunner backed by {@link ProcessBuilder}.
 *
 * stdout and stderr go to {@code work/logs/<stage>.stdout.log} and
 * {@code .stderr.log} inside the job directory; the tail of each is returned
 * in the result. On any outcome other than SUCCEEDED the declared outputs
 * are deleted.
 */
public class ProcessStageRunner implements StageRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessStageRunner.class);

    private final Duration killGrace;
    private final int diagnosticChars;

    public ProcessStageRunner(Duration killGrace, int diagnosticChars) {
        this.killGrace = killGrace;
        this.diagnosticChars = diagnosticChars;
    }

    @Override
    public StageResult run(StageInvocation invocation, ProcessGuard guard) throws InterruptedException {
        long startNanos = System.nanoTime();
        Path jobDir = invocation.jobDir().toAbsolutePath().normalize();

        String escaping = findEscapingPath(jobDir, invocation);
        if (escaping != null) {
            return finish(invocation, startNanos, StageOutcome.SPAWN_FAILURE, null, "", "",
                    "path outside job directory: " + escaping);
        }

        List<String> command;
        try {
            command = invocation.template().render(invocation.values());
        } catch (IllegalArgumentException e) {
            return finish(invocation, startNanos, StageOutcome.SPAWN_FAILURE, null, "", "",
                    "bad command template: " + e.getMessage());
        }

        Path stdoutLog = invocation.logDir().resolve(invocation.stage().value() + ".stdout.log");
        Path stderrLog = invocation.logDir().resolve(invocation.stage().value() + ".stderr.log");

        Process process;
        try {
            Files.createDirectories(invocation.logDir());
            for (Path output : invocation.outputs()) {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.deleteIfExists(output);
            }
            process = new ProcessBuilder(command)
                    .directory(jobDir.toFile())
                    .redirectOutput(stdoutLog.toFile())
                    .redirectError(stderrLog.toFile())
                    .start();
        } catch (IOException e) {
            return finish(invocation, startNanos, StageOutcome.SPAWN_FAILURE, null, "", "",
                    "could not start " + command.get(0) + ": " + e.getMessage());
        }

        log.debug("Stage {} started pid={} command={}", invocation.stage().value(), process.pid(), command);

        if (!guard.attach(process)) {
            log.debug("Stage {} terminated right after start (cancel already requested)",
                    invocation.stage().value());
        }

        boolean finished;
        try {
            finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("Stage {} interrupted, killing pid={}", invocation.stage().value(), process.pid());
            ProcessKiller.terminate(process, killGrace);
            guard.settle();
            discardOutputs(invocation);
            throw e;
        }

        if (!finished) {
            log.warn("Stage {} exceeded timeout of {}ms, killing pid={}",
                    invocation.stage().value(), invocation.timeout().toMillis(), process.pid());
            ProcessKiller.terminate(process, killGrace);
        }

        boolean canceled = guard.settle();
        Integer exitCode = finished ? process.exitValue() : null;
        String stdout = readTail(stdoutLog);
        String stderr = readTail(stderrLog);

        if (canceled) {
            return finish(invocation, startNanos, StageOutcome.CANCELED, exitCode, stdout, stderr,
                    "terminated on cancel request");
        }
        if (!finished) {
            return finish(invocation, startNanos, StageOutcome.TIMEOUT, null, stdout, stderr,
                    "timed out after " + invocation.timeout().toSeconds() + "s");
        }
        if (exitCode != 0) {
            return finish(invocation, startNanos, StageOutcome.NON_ZERO_EXIT, exitCode, stdout, stderr,
                    "exit code " + exitCode);
        }
        String missing = findMissingOutput(invocation);
        if (missing != null) {
            return finish(invocation, startNanos, StageOutcome.MISSING_OUTPUT, exitCode, stdout, stderr,
                    "did not produce output: " + missing);
        }
        return finish(invocation, startNanos, StageOutcome.SUCCEEDED, exitCode, stdout, stderr, null);
    }

    private StageResult finish(StageInvocation invocation, long startNanos, StageOutcome outcome,
            Integer exitCode, String stdout, String stderr, String detail) {
        if (outcome != StageOutcome.SUCCEEDED) {
            discardOutputs(invocation);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        StageResult result = new StageResult(invocation.stage(), outcome, exitCode, stdout, stderr,
                outcome == StageOutcome.SUCCEEDED ? invocation.outputs() : List.of(), duration, detail);

        if (outcome == StageOutcome.SUCCEEDED) {
            log.info("Stage {} ({}) succeeded in {}ms", invocation.stage().value(),
                    invocation.template().toolName(), duration.toMillis());
        } else {
            log.warn("Stage {} ({}) ended {} in {}ms exit={} detail={} stderr={}",
                    invocation.stage().value(), invocation.template().toolName(), outcome,
                    duration.toMillis(), exitCode, detail, StageResult.tail(stderr.strip(), diagnosticChars));
        }
        return result;
    }

    private static String findEscapingPath(Path jobDir, StageInvocation invocation) {
        List<Path> all = new ArrayList<>(invocation.inputs());
        all.addAll(invocation.outputs());
        for (Path p : all) {
            if (!p.toAbsolutePath().normalize().startsWith(jobDir)) {
                return p.toString();
            }
        }
        return null;
    }

    private static String findMissingOutput(StageInvocation invocation) {
        for (Path output : invocation.outputs()) {
            try {
                if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                    return output.toString();
                }
            } catch (IOException e) {
                return output + " (" + e.getMessage() + ")";
            }
        }
        return null;
    }

    private static void discardOutputs(StageInvocation invocation) {
        for (Path output : invocation.outputs()) {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("Could not discard partial output {}: {}", output, e.getMessage());
            }
        }
    }

    /** Read at most the last few KB of a log; tools can be very chatty. */
    private String readTail(Path file) {
        long maxBytes = Math.max(4096L, diagnosticChars * 4L);
        try (SeekableByteChannel ch = Files.newByteChannel(file)) {
            long size = ch.size();
            long start = Math.max(0, size - maxBytes);
            ch.position(start);
            ByteBuffer buf = ByteBuffer.allocate((int) (size - start));
            while (buf.hasRemaining() && ch.read(buf) > 0) {
                // keep reading
            }
            String text = new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8);
            return StageResult.tail(text, diagnosticChars);
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }
}
