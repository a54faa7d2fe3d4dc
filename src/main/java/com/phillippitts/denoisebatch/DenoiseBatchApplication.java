package com.phillippitts.denoisebatch;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.config.properties.NeuralEngineProperties;
import com.phillippitts.denoisebatch.config.properties.PreviewProperties;
import com.phillippitts.denoisebatch.config.properties.SeparationEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MediaProperties.class,
        NeuralEngineProperties.class,
        SeparationEngineProperties.class,
        PreviewProperties.class
})
@EnableScheduling
public class DenoiseBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DenoiseBatchApplication.class, args);
    }

}
