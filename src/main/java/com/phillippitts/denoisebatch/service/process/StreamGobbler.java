package com.phillippitts.denoisebatch.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process text stream into a capped buffer on a daemon thread.
 *
 * <p>Once the cap is reached the stream keeps being read without accumulating, so the child
 * process never blocks on a full pipe.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuffer sink;
    private final String name;
    private final int maxChars;

    private StreamGobbler(InputStream inputStream, StringBuffer sink, String name, int maxChars) {
        this.inputStream = inputStream;
        this.sink = sink;
        this.name = name;
        this.maxChars = maxChars;
    }

    /**
     * Starts a daemon thread gobbling {@code inputStream} into {@code sink}.
     *
     * @param inputStream process stream
     * @param sink thread-safe accumulator
     * @param name thread name, also used in cap warnings
     * @param maxChars accumulation cap
     * @return the started thread
     */
    public static Thread start(InputStream inputStream, StringBuffer sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (sink.length() >= maxChars) {
                    if (!capReached) {
                        LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                        capReached = true;
                    }
                    continue;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = maxChars - sink.length();
                sink.append(line.length() > available ? line.substring(0, Math.max(0, available)) : line);
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /**
     * Joins a gobbler thread for at most {@code millis}, restoring the interrupt flag if interrupted.
     */
    public static void joinQuietly(Thread thread, long millis) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
