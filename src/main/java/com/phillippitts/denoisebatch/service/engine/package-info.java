/**
 * Engine plugin contract and registry.
 *
 * <p>Engines are created per worker through {@link com.phillippitts.denoisebatch.service.engine.EngineRegistry},
 * prepared once per job and fed decoded buffers in order. Concrete engines live in the
 * {@code spectral}, {@code neural} and {@code separation} subpackages.
 */
package com.phillippitts.denoisebatch.service.engine;
