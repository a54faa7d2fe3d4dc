/**
 * Pure-Java WAV backend, used where ffmpeg is unavailable and in tests.
 */
package com.phillippitts.denoisebatch.service.media.wav;
