package com.phillippitts.denoisebatch.service.media.wav;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.testutil.TestAudio;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WavMediaIoAdapterTest {

    @TempDir
    Path dir;

    private final WavMediaIoAdapter adapter = new WavMediaIoAdapter(250);

    @Test
    void probeShouldReportLayoutAndDuration() throws IOException {
        Path wav = TestAudio.writeTone(dir.resolve("a.wav"), 16_000, 2, 1.5);

        MediaInfo info = adapter.probe(wav);

        assertThat(info.sampleRate()).isEqualTo(16_000);
        assertThat(info.channels()).isEqualTo(2);
        assertThat(info.durationSeconds()).isCloseTo(1.5, within(1e-6));
        assertThat(info.hasAudio()).isTrue();
        assertThat(info.hasVideo()).isFalse();
        assertThat(info.audioCodec()).isEqualTo("pcm_s16le");
    }

    @Test
    void decodeShouldUseConfiguredChunkLength() throws IOException {
        Path wav = TestAudio.writeTone(dir.resolve("a.wav"), 8_000, 1, 1.0);

        try (AudioStream stream = adapter.decode(wav, null)) {
            AudioBuffer first = stream.read();
            assertThat(first.frames()).isEqualTo(2_000);
        }
    }

    @Test
    void decodeRangeShouldReturnOnlyWindow() throws IOException {
        Path wav = TestAudio.writeTone(dir.resolve("a.wav"), 8_000, 1, 2.0);

        int frames = 0;
        try (AudioStream stream = adapter.decodeRange(wav, 0.5, 1.0, null)) {
            AudioBuffer chunk;
            while ((chunk = stream.read()) != null) {
                frames += chunk.frames();
            }
        }

        assertThat(frames).isEqualTo(8_000);
    }

    @Test
    void shouldRefuseToResample() throws IOException {
        Path wav = TestAudio.writeTone(dir.resolve("a.wav"), 8_000, 1, 0.1);

        assertThatThrownBy(() -> adapter.decode(wav, 16_000))
                .isInstanceOf(MediaException.class)
                .hasMessageContaining("resample");
    }

    @Test
    void shouldRejectNonWavFiles() throws IOException {
        Path mp3 = Files.writeString(dir.resolve("a.mp3"), "id3");

        assertThatThrownBy(() -> adapter.probe(mp3)).isInstanceOf(MediaException.class);
        assertThatThrownBy(() -> adapter.probe(dir.resolve("missing.wav"))).isInstanceOf(MediaException.class);
    }

    @Test
    void encoderShouldOnlyWriteWavWithoutVideo() {
        StreamInfo stream = new StreamInfo(8_000, 1, -1);
        MediaInfo video = new MediaInfo(dir.resolve("v.mp4"), 8_000, 1, 1.0, true, true, "aac", "mp4");

        assertThatThrownBy(() -> adapter.openEncoder(dir.resolve("out.mp3"), stream, null, false))
                .isInstanceOf(MediaException.class);
        assertThatThrownBy(() -> adapter.openEncoder(dir.resolve("out.wav"), stream, video, true))
                .isInstanceOf(MediaException.class)
                .hasMessageContaining("video");
    }
}
