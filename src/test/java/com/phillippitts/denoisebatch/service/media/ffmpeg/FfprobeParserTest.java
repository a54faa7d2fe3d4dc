package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfprobeParserTest {

    private static final Path FILE = Path.of("/media/input.mp4");

    @Test
    void shouldParseAudioOnlyFile() {
        String json = """
                {"streams":[{"index":0,"codec_type":"audio","codec_name":"mp3","sample_rate":"44100","channels":2}],
                 "format":{"format_name":"mp3","duration":"12.500000"}}
                """;

        MediaInfo info = FfprobeParser.parse(json, FILE);

        assertThat(info.hasAudio()).isTrue();
        assertThat(info.hasVideo()).isFalse();
        assertThat(info.sampleRate()).isEqualTo(44_100);
        assertThat(info.channels()).isEqualTo(2);
        assertThat(info.durationSeconds()).isEqualTo(12.5);
        assertThat(info.audioCodec()).isEqualTo("mp3");
        assertThat(info.formatName()).isEqualTo("mp3");
    }

    @Test
    void shouldDetectVideoStream() {
        String json = """
                {"streams":[
                  {"index":0,"codec_type":"video","codec_name":"h264"},
                  {"index":1,"codec_type":"audio","codec_name":"aac","sample_rate":"48000","channels":1}],
                 "format":{"format_name":"mov,mp4,m4a,3gp,3g2,mj2","duration":"60.0"}}
                """;

        MediaInfo info = FfprobeParser.parse(json, FILE);

        assertThat(info.hasVideo()).isTrue();
        assertThat(info.hasAudio()).isTrue();
        assertThat(info.sampleRate()).isEqualTo(48_000);
        assertThat(info.channels()).isEqualTo(1);
    }

    @Test
    void coverArtShouldNotCountAsVideo() {
        String json = """
                {"streams":[
                  {"codec_type":"audio","codec_name":"flac","sample_rate":"96000","channels":2},
                  {"codec_type":"video","codec_name":"mjpeg","disposition":{"attached_pic":1}}],
                 "format":{"duration":"3.0"}}
                """;

        assertThat(FfprobeParser.parse(json, FILE).hasVideo()).isFalse();
    }

    @Test
    void shouldReportMissingAudio() {
        String json = """
                {"streams":[{"codec_type":"video","codec_name":"h264"}],"format":{"duration":"N/A"}}
                """;

        MediaInfo info = FfprobeParser.parse(json, FILE);

        assertThat(info.hasAudio()).isFalse();
        assertThat(info.durationSeconds()).isZero();
    }

    @Test
    void shouldFallBackToStreamDuration() {
        String json = """
                {"streams":[{"codec_type":"audio","sample_rate":"8000","channels":1,"duration":"4.25"}],"format":{}}
                """;

        assertThat(FfprobeParser.parse(json, FILE).durationSeconds()).isEqualTo(4.25);
    }

    @Test
    void shouldRejectMalformedOutput() {
        assertThatThrownBy(() -> FfprobeParser.parse("not json", FILE)).isInstanceOf(MediaException.class);
        assertThatThrownBy(() -> FfprobeParser.parse("  ", FILE)).isInstanceOf(MediaException.class);
    }
}
