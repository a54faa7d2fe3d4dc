package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds ffprobe/ffmpeg command lines. Raw audio crosses the pipes as interleaved 32-bit
 * little-endian floats.
 */
final class FfmpegCommands {

    static final String RAW_FORMAT = "f32le";
    static final int BYTES_PER_SAMPLE = 4;

    private FfmpegCommands() {}

    static List<String> probe(String ffprobe, Path input) {
        return List.of(ffprobe, "-v", "quiet", "-print_format", "json", "-show_format", "-show_streams",
                input.toString());
    }

    static List<String> version(String binary) {
        return List.of(binary, "-version");
    }

    /**
     * @param offsetSeconds seek position, or null to start at the beginning
     * @param durationSeconds window length, or null for the rest of the stream
     * @param sampleRate resample target, or null to keep the source rate
     */
    static List<String> decode(String ffmpeg, Path input, Double offsetSeconds, Double durationSeconds,
                               Integer sampleRate) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg);
        cmd.add("-nostdin");
        cmd.add("-v");
        cmd.add("error");
        if (offsetSeconds != null && offsetSeconds > 0) {
            cmd.add("-ss");
            cmd.add(seconds(offsetSeconds));
        }
        cmd.add("-i");
        cmd.add(input.toString());
        if (durationSeconds != null) {
            cmd.add("-t");
            cmd.add(seconds(durationSeconds));
        }
        cmd.add("-map");
        cmd.add("0:a:0");
        cmd.add("-vn");
        cmd.add("-f");
        cmd.add(RAW_FORMAT);
        cmd.add("-acodec");
        cmd.add("pcm_f32le");
        if (sampleRate != null) {
            cmd.add("-ar");
            cmd.add(Integer.toString(sampleRate));
        }
        cmd.add("pipe:1");
        return cmd;
    }

    /**
     * Encodes raw audio from stdin into {@code target}. When a source is given it is opened as
     * input 0 for its metadata and, with {@code keepVideo}, its video and subtitle streams.
     */
    static List<String> encode(String ffmpeg, Path target, StreamInfo stream, MediaInfo source, boolean keepVideo) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg);
        cmd.add("-nostdin");
        cmd.add("-v");
        cmd.add("error");
        cmd.add("-y");
        boolean withSource = source != null && source.path() != null;
        if (withSource) {
            cmd.add("-i");
            cmd.add(source.path().toString());
        }
        cmd.add("-f");
        cmd.add(RAW_FORMAT);
        cmd.add("-ar");
        cmd.add(Integer.toString(stream.sampleRate()));
        cmd.add("-ac");
        cmd.add(Integer.toString(stream.channels()));
        cmd.add("-i");
        cmd.add("pipe:0");

        String pipeInput = withSource ? "1" : "0";
        if (withSource && keepVideo) {
            cmd.add("-map");
            cmd.add("0:v:0?");
            cmd.add("-c:v");
            cmd.add("copy");
        }
        cmd.add("-map");
        cmd.add(pipeInput + ":a:0");
        if (withSource && keepVideo && supportsSubtitleCopy(target)) {
            cmd.add("-map");
            cmd.add("0:s?");
            cmd.add("-c:s");
            cmd.add("copy");
        }
        if (withSource) {
            cmd.add("-map_metadata");
            cmd.add("0");
        }
        cmd.addAll(audioCodecArgs(target));
        cmd.add(target.toString());
        return cmd;
    }

    /**
     * Audio codec arguments chosen from the target extension.
     */
    static List<String> audioCodecArgs(Path target) {
        String ext = SupportedFormats.extensionOf(target);
        return switch (ext) {
            case ".mp3" -> List.of("-c:a", "libmp3lame", "-q:a", "0");
            case ".aac", ".m4a", ".mp4", ".mov", ".m4v", ".mkv", ".flv" -> List.of("-c:a", "aac", "-b:a", "192k");
            case ".flac" -> List.of("-c:a", "flac");
            case ".ogg" -> List.of("-c:a", "libvorbis", "-q:a", "6");
            case ".webm" -> List.of("-c:a", "libopus", "-b:a", "160k");
            case ".wma", ".wmv" -> List.of("-c:a", "wmav2", "-b:a", "192k");
            case ".avi" -> List.of("-c:a", "libmp3lame", "-q:a", "0");
            case ".aiff" -> List.of("-c:a", "pcm_s16be");
            default -> List.of("-c:a", "pcm_s16le");
        };
    }

    // mp4-family containers reject most text subtitle codecs on stream copy
    private static boolean supportsSubtitleCopy(Path target) {
        String ext = SupportedFormats.extensionOf(target);
        return ".mkv".equals(ext) || ".webm".equals(ext);
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
