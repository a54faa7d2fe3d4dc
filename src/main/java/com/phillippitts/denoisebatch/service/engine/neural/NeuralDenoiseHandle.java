package com.phillippitts.denoisebatch.service.engine.neural;

import com.phillippitts.denoisebatch.domain.NeuralDenoiseConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.util.TempFiles;

import java.nio.file.Path;

final class NeuralDenoiseHandle implements EngineHandle {

    final NeuralDenoiseConfig config;
    final StreamInfo stream;
    final Path model;
    final Path workDir;
    int chunkIndex;

    NeuralDenoiseHandle(NeuralDenoiseConfig config, StreamInfo stream, Path model, Path workDir) {
        this.config = config;
        this.stream = stream;
        this.model = model;
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
