package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegCommandsTest {

    private static final StreamInfo STEREO_48K = new StreamInfo(48_000, 2, -1);

    @Test
    void decodeShouldEmitRawFloatsAndHonourWindow() {
        List<String> cmd = FfmpegCommands.decode("ffmpeg", Path.of("/in/a.mp3"), 2.5, 10.0, 16_000);

        assertThat(cmd).containsSubsequence("-ss", "2.500", "-i", "/in/a.mp3", "-t", "10.000");
        assertThat(cmd).containsSubsequence("-f", "f32le", "-acodec", "pcm_f32le", "-ar", "16000", "pipe:1");
    }

    @Test
    void decodeWithoutWindowShouldNotSeek() {
        List<String> cmd = FfmpegCommands.decode("ffmpeg", Path.of("/in/a.mp3"), null, null, null);

        assertThat(cmd).doesNotContain("-ss", "-t", "-ar");
    }

    @Test
    void encodeWithVideoShouldCopyVideoAndMapPipedAudio() {
        MediaInfo source = new MediaInfo(Path.of("/in/clip.mkv"), 48_000, 2, 30, true, true, "aac", "matroska");

        List<String> cmd = FfmpegCommands.encode("ffmpeg", Path.of("/out/clip.mkv"), STEREO_48K, source, true);

        assertThat(cmd).containsSubsequence("-i", "/in/clip.mkv", "-f", "f32le", "-i", "pipe:0");
        assertThat(cmd).containsSubsequence("-map", "0:v:0?", "-c:v", "copy", "-map", "1:a:0");
        assertThat(cmd).containsSubsequence("-map", "0:s?", "-c:s", "copy");
        assertThat(cmd).containsSubsequence("-map_metadata", "0");
        assertThat(cmd.get(cmd.size() - 1)).isEqualTo("/out/clip.mkv");
    }

    @Test
    void encodeAudioOnlyShouldNotMapVideo() {
        MediaInfo source = new MediaInfo(Path.of("/in/clip.mp4"), 48_000, 2, 30, true, true, "aac", "mp4");

        List<String> cmd = FfmpegCommands.encode("ffmpeg", Path.of("/out/clip.mp3"), STEREO_48K, source, false);

        assertThat(cmd).doesNotContain("0:v:0?");
        assertThat(cmd).containsSubsequence("-c:a", "libmp3lame");
    }

    @Test
    void mp4ShouldNotCopySubtitles() {
        MediaInfo source = new MediaInfo(Path.of("/in/clip.mp4"), 48_000, 2, 30, true, true, "aac", "mp4");

        List<String> cmd = FfmpegCommands.encode("ffmpeg", Path.of("/out/clip.mp4"), STEREO_48K, source, true);

        assertThat(cmd).doesNotContain("0:s?");
        assertThat(cmd).containsSubsequence("-c:a", "aac");
    }

    @Test
    void codecShouldFollowTargetExtension() {
        assertThat(FfmpegCommands.audioCodecArgs(Path.of("x.flac"))).containsExactly("-c:a", "flac");
        assertThat(FfmpegCommands.audioCodecArgs(Path.of("x.wav"))).containsExactly("-c:a", "pcm_s16le");
        assertThat(FfmpegCommands.audioCodecArgs(Path.of("x.aiff"))).containsExactly("-c:a", "pcm_s16be");
    }
}
