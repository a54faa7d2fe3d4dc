/**
 * Media I/O boundary: probing, chunked decoding and streaming encoding.
 *
 * <p>Two backends implement {@link com.phillippitts.denoisebatch.service.media.MediaIoAdapter}:
 * {@code ffmpeg} (any allow-listed container, video remux) and {@code wav} (pure Java, PCM WAV only).
 * The backend is selected with {@code media.backend}.
 */
package com.phillippitts.denoisebatch.service.media;
