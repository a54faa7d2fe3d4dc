package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.ffmpeg.FfmpegMediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.wav.WavMediaIoAdapter;
import com.phillippitts.denoisebatch.service.process.DefaultProcessFactory;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the media I/O backend from {@code media.backend}.
 */
@Configuration
public class MediaAdapterConfig {

    private static final Logger LOG = LogManager.getLogger(MediaAdapterConfig.class);

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public MediaIoAdapter mediaIoAdapter(MediaProperties mediaProperties, ProcessFactory processFactory) {
        MediaIoAdapter adapter = mediaProperties.usesFfmpeg()
                ? new FfmpegMediaIoAdapter(mediaProperties, processFactory)
                : new WavMediaIoAdapter(mediaProperties.chunkMillis());
        LOG.info("Media backend: {}", adapter.name());
        return adapter;
    }
}
