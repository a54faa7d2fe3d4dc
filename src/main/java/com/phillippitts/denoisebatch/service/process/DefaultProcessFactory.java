package com.phillippitts.denoisebatch.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Production {@link ProcessFactory} backed by {@link ProcessBuilder}. Stdout and stderr stay
 * separate because decoders stream binary PCM on stdout.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
