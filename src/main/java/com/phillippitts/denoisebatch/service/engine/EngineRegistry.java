package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps an {@link EngineKind} to a factory of fresh, uninitialized engines. Adding an algorithm is
 * one {@link #register} call; the scheduler and queue never see concrete engine types.
 *
 * <p>Thread-safe: registration and lookup synchronize on the registry.
 */
public class EngineRegistry {

    private static final Logger LOG = LogManager.getLogger(EngineRegistry.class);

    private final Map<EngineKind, Supplier<? extends NoiseReductionEngine>> factories =
            new EnumMap<>(EngineKind.class);

    /**
     * Registers or replaces the factory for {@code kind}.
     */
    public synchronized void register(EngineKind kind, Supplier<? extends NoiseReductionEngine> factory) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(factory, "factory");
        if (factories.put(kind, factory) != null) {
            LOG.info("Replaced engine factory for {}", kind.id());
        } else {
            LOG.debug("Registered engine factory for {}", kind.id());
        }
    }

    /**
     * Creates a new, uninitialized engine.
     *
     * @throws UnsupportedConfigurationException if no factory is registered for {@code kind}
     */
    public NoiseReductionEngine create(EngineKind kind) {
        Supplier<? extends NoiseReductionEngine> factory;
        synchronized (this) {
            factory = factories.get(kind);
        }
        if (factory == null) {
            throw new UnsupportedConfigurationException("No engine registered for kind " + kind,
                    kind == null ? "null" : kind.id());
        }
        return factory.get();
    }

    public synchronized Set<EngineKind> registeredKinds() {
        return factories.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(factories.keySet()));
    }

    public synchronized boolean isRegistered(EngineKind kind) {
        return factories.containsKey(kind);
    }
}
