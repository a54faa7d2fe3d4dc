package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegMediaIoAdapterTest {

    private static final String PROBE_JSON = """
            {"streams":[{"codec_type":"audio","codec_name":"pcm_s16le","sample_rate":"8000","channels":1}],
             "format":{"format_name":"wav","duration":"0.5"}}
            """;

    @TempDir
    Path dir;

    private final MediaProperties props = new MediaProperties("ffmpeg", "ffmpeg", "ffprobe", 5, 5, 100, 4096);

    private static byte[] rawFloats(int count, float value) {
        ByteBuffer buf = ByteBuffer.allocate(count * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            buf.putFloat(value);
        }
        return buf.array();
    }

    @Test
    void probeShouldRunFfprobeAndParseResult() throws IOException {
        Path input = Files.createFile(dir.resolve("a.wav"));
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.success(PROBE_JSON)));
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props, factory);

        MediaInfo info = adapter.probe(input);

        assertThat(info.sampleRate()).isEqualTo(8_000);
        assertThat(factory.commands()).hasSize(1);
        assertThat(factory.commands().get(0)).startsWith("ffprobe");
    }

    @Test
    void probeFailureShouldBecomeMediaException() throws IOException {
        Path input = Files.createFile(dir.resolve("a.wav"));
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props,
                new StubProcessFactory(new TestProcess(ProcessBehavior.failure(1, "Invalid data found"))));

        assertThatThrownBy(() -> adapter.probe(input))
                .isInstanceOf(MediaException.class)
                .hasMessageContaining("exitCode=1");
    }

    @Test
    void probeShouldRejectUnsupportedExtensionWithoutRunningTool() throws IOException {
        Path input = Files.createFile(dir.resolve("notes.txt"));
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.success(PROBE_JSON)));

        assertThatThrownBy(() -> new FfmpegMediaIoAdapter(props, factory).probe(input))
                .isInstanceOf(MediaException.class);
        assertThat(factory.commands()).isEmpty();
    }

    @Test
    void decodeShouldChunkRawSamples() throws IOException {
        Path input = Files.createFile(dir.resolve("a.wav"));
        // 8000 Hz, 100 ms chunks -> 800 frames per chunk; 2000 frames total
        StubProcessFactory factory = new StubProcessFactory(cmd -> cmd.get(0).equals("ffprobe")
                ? new TestProcess(ProcessBehavior.success(PROBE_JSON))
                : new TestProcess(rawFloats(2000, 0.25f), 0));
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props, factory);

        int frames = 0;
        int chunks = 0;
        try (AudioStream stream = adapter.decode(input, null)) {
            assertThat(stream.info().sampleRate()).isEqualTo(8_000);
            AudioBuffer buffer;
            while ((buffer = stream.read()) != null) {
                frames += buffer.frames();
                chunks++;
                assertThat(buffer.sample(0, 0)).isEqualTo(0.25f);
            }
        }

        assertThat(frames).isEqualTo(2000);
        assertThat(chunks).isEqualTo(3);
    }

    @Test
    void decoderExitFailureShouldSurfaceAtEndOfStream() throws IOException {
        Path input = Files.createFile(dir.resolve("a.wav"));
        StubProcessFactory factory = new StubProcessFactory(cmd -> cmd.get(0).equals("ffprobe")
                ? new TestProcess(ProcessBehavior.success(PROBE_JSON))
                : new TestProcess(rawFloats(100, 0.1f), 1));
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props, factory);

        try (AudioStream stream = adapter.decode(input, null)) {
            assertThatThrownBy(stream::read).isInstanceOf(MediaException.class).hasMessageContaining("Decode failed");
        }
    }

    @Test
    void encoderShouldPipeSamplesToStdin() throws IOException {
        Path target = dir.resolve("out.wav");
        TestProcess encoder = new TestProcess(ProcessBehavior.success(""));
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props, new StubProcessFactory(encoder));
        StreamInfo stream = new StreamInfo(8_000, 1, -1);

        try (MediaEncoder out = adapter.openEncoder(target, stream, null, false)) {
            out.write(new AudioBuffer(new float[] {0.5f, -0.5f}, 1, 8_000));
            Files.createFile(target);
            out.complete();
            assertThat(out.isCompleted()).isTrue();
        }

        ByteBuffer written = ByteBuffer.wrap(encoder.stdinBytes()).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(written.getFloat()).isEqualTo(0.5f);
        assertThat(written.getFloat()).isEqualTo(-0.5f);
    }

    @Test
    void encoderWithoutOutputFileShouldFail() {
        Path target = dir.resolve("out.wav");
        FfmpegMediaIoAdapter adapter = new FfmpegMediaIoAdapter(props,
                new StubProcessFactory(new TestProcess(ProcessBehavior.success(""))));

        MediaEncoder out = adapter.openEncoder(target, new StreamInfo(8_000, 1, -1), null, false);

        assertThatThrownBy(out::complete).isInstanceOf(IOException.class).hasMessageContaining("no file");
        assertThat(out.isCompleted()).isFalse();
    }
}
