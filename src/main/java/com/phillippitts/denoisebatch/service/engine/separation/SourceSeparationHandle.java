package com.phillippitts.denoisebatch.service.engine.separation;

import com.phillippitts.denoisebatch.domain.SourceSeparationConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.util.TempFiles;

import java.nio.file.Path;

final class SourceSeparationHandle implements EngineHandle {

    final SourceSeparationConfig config;
    final StreamInfo stream;
    final Path workDir;
    int chunkIndex;

    SourceSeparationHandle(SourceSeparationConfig config, StreamInfo stream, Path workDir) {
        this.config = config;
        this.stream = stream;
        this.workDir = workDir;
    }

    @Override
    public StreamInfo stream() {
        return stream;
    }

    @Override
    public void close() {
        TempFiles.deleteRecursively(workDir);
    }
}
