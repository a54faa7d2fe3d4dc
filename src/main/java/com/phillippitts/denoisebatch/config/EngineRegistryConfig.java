package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.config.properties.NeuralEngineProperties;
import com.phillippitts.denoisebatch.config.properties.SeparationEngineProperties;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.engine.neural.NeuralDenoiseEngine;
import com.phillippitts.denoisebatch.service.engine.separation.SourceSeparationEngine;
import com.phillippitts.denoisebatch.service.engine.spectral.SpectralGateEngine;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in engines. Adding an algorithm means one more {@code register} call.
 */
@Configuration
public class EngineRegistryConfig {

    @Bean
    public EngineRegistry engineRegistry(NeuralEngineProperties neuralProperties,
                                         SeparationEngineProperties separationProperties,
                                         ProcessFactory processFactory,
                                         ApplicationEventPublisher publisher) {
        EngineRegistry registry = new EngineRegistry();
        registry.register(EngineKind.SPECTRAL_GATE, () -> new SpectralGateEngine(publisher));
        registry.register(EngineKind.NEURAL_DENOISE,
                () -> new NeuralDenoiseEngine(neuralProperties, processFactory, publisher));
        registry.register(EngineKind.SOURCE_SEPARATION,
                () -> new SourceSeparationEngine(separationProperties, processFactory, publisher));
        return registry;
    }
}
