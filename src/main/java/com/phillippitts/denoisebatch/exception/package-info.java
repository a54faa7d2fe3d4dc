/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.denoisebatch.exception.BatchDenoiseException}:
 * <ul>
 *   <li>{@link com.phillippitts.denoisebatch.exception.InvalidStateException} - queue or scheduler
 *       not accepting the operation</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException} - engine
 *       and input stream are incompatible, detected at prepare</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.OutOfRangeException} - parameter or preview
 *       window out of bounds</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.PathException} - output path unresolvable
 *       or unwritable</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.MediaException} - decode, encode or remux
 *       failure</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.EngineFailureException} - algorithm-internal
 *       error</li>
 *   <li>{@link com.phillippitts.denoisebatch.exception.ProcessingAbortedException} - job aborted at
 *       a checkpoint after stop</li>
 * </ul>
 *
 * <p>Cancellation of a job that never started is a terminal job status, not an exception.
 * REST status codes are assigned in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.denoisebatch.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.denoisebatch.exception;
