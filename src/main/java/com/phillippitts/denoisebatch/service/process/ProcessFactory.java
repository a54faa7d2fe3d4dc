package com.phillippitts.denoisebatch.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so that tool-driving code can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a
 * fake {@link Process} with controlled stdout, stderr and exit behaviour.
 */
@FunctionalInterface
public interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
