package com.phillippitts.denoisebatch.service.process;

import com.phillippitts.denoisebatch.util.ProcessTimeouts;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a short-lived external tool (ffprobe, ffmpeg filter pass, demucs) to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently so neither pipe can fill up</li>
 *   <li>Enforce a timeout and terminate runaway processes</li>
 *   <li>Report the outcome as a {@link ProcessResult}; callers decide which exception type a
 *       failure maps to</li>
 * </ul>
 *
 * <p>Instances are stateless and safe to share between workers.
 */
public final class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    private final ProcessFactory processFactory;
    private final int maxOutputChars;

    public ExternalProcessRunner(ProcessFactory processFactory, int maxOutputChars) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        if (maxOutputChars <= 0) {
            throw new IllegalArgumentException("maxOutputChars must be positive");
        }
        this.maxOutputChars = maxOutputChars;
    }

    /**
     * Runs {@code command} and waits for it to exit or time out.
     *
     * @param command command line, executable first
     * @param workingDir working directory, may be null
     * @param timeout maximum run time
     * @return result; a timed-out process has been destroyed and reports {@code timedOut=true}
     * @throws IOException if the process cannot be started
     * @throws InterruptedIOException if the calling thread is interrupted while waiting
     */
    public ProcessResult run(List<String> command, Path workingDir, Duration timeout) throws IOException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        String tool = command.isEmpty() ? "?" : Path.of(command.get(0)).getFileName().toString();
        LOG.debug("Running {}: {}", tool, command);

        long start = System.nanoTime();
        Process process = processFactory.start(command, workingDir);
        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread outGobbler = StreamGobbler.start(process.getInputStream(), stdout, tool + "-out", maxOutputChars);
        Thread errGobbler = StreamGobbler.start(process.getErrorStream(), stderr, tool + "-err", maxOutputChars);
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("{} exceeded timeout of {}s; destroying", tool, timeout.toSeconds());
                destroyQuietly(process);
                StreamGobbler.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
                StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
                return new ProcessResult(-1, stdout.toString(), stderr.toString(),
                        TimeUtils.elapsedMillis(start), true, timeout);
            }
            StreamGobbler.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            int exitCode = process.exitValue();
            long durationMs = TimeUtils.elapsedMillis(start);
            LOG.debug("{} exited with {} after {}ms", tool, exitCode, durationMs);
            return new ProcessResult(exitCode, stdout.toString(), stderr.toString(), durationMs, false, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyQuietly(process);
            InterruptedIOException ex = new InterruptedIOException("Interrupted while waiting for " + tool);
            ex.initCause(e);
            throw ex;
        }
    }

    /**
     * Destroys a process gracefully, escalating to a forcible kill. Never throws.
     *
     * @param process process to terminate, may be null
     */
    public static void destroyQuietly(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
