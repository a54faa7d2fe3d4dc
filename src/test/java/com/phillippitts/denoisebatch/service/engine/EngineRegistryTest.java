package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import com.phillippitts.denoisebatch.service.engine.spectral.SpectralGateEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineRegistryTest {

    @Test
    void shouldCreateFreshEnginePerCall() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(EngineKind.SPECTRAL_GATE, SpectralGateEngine::new);

        NoiseReductionEngine first = registry.create(EngineKind.SPECTRAL_GATE);
        NoiseReductionEngine second = registry.create(EngineKind.SPECTRAL_GATE);

        assertThat(first).isNotSameAs(second);
        assertThat(first.kind()).isEqualTo(EngineKind.SPECTRAL_GATE);
        assertThat(first.isHealthy()).isFalse();
    }

    @Test
    void unregisteredKindShouldBeUnsupported() {
        EngineRegistry registry = new EngineRegistry();

        assertThatThrownBy(() -> registry.create(EngineKind.SOURCE_SEPARATION))
                .isInstanceOf(UnsupportedConfigurationException.class)
                .hasMessageContaining("SOURCE_SEPARATION");
        assertThat(registry.isRegistered(EngineKind.SOURCE_SEPARATION)).isFalse();
    }

    @Test
    void shouldListRegisteredKinds() {
        EngineRegistry registry = new EngineRegistry();
        assertThat(registry.registeredKinds()).isEmpty();

        registry.register(EngineKind.SPECTRAL_GATE, SpectralGateEngine::new);
        registry.register(EngineKind.SPECTRAL_GATE, SpectralGateEngine::new);

        assertThat(registry.registeredKinds()).containsExactly(EngineKind.SPECTRAL_GATE);
    }

    @Test
    void engineKindIdsShouldRoundTrip() {
        for (EngineKind kind : EngineKind.values()) {
            assertThat(EngineKind.fromId(kind.id())).isEqualTo(kind);
        }
    }
}
