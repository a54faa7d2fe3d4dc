/**
 * External process plumbing shared by the ffmpeg media adapter and the tool-backed engines.
 *
 * <p>All processes are started through {@link com.phillippitts.denoisebatch.service.process.ProcessFactory}
 * so tests can substitute fake processes.
 */
package com.phillippitts.denoisebatch.service.process;
