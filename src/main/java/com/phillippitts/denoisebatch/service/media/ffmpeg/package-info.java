/**
 * ffmpeg/ffprobe media backend. Every process goes through
 * {@link com.phillippitts.denoisebatch.service.process.ProcessFactory} so tests can run
 * without the binaries installed.
 */
package com.phillippitts.denoisebatch.service.media.ffmpeg;
