package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;

/**
 * Parses {@code ffprobe -print_format json -show_format -show_streams} output.
 *
 * <p>Embedded cover art (a video stream with {@code disposition.attached_pic=1}) does not count
 * as video.
 */
final class FfprobeParser {

    private FfprobeParser() {}

    static MediaInfo parse(String json, Path path) {
        if (json == null || json.isBlank()) {
            throw new MediaException("ffprobe returned no output", path.toString());
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new MediaException("Malformed ffprobe output", path.toString(), e);
        }

        JSONObject audio = null;
        boolean hasVideo = false;
        JSONArray streams = root.optJSONArray("streams");
        if (streams != null) {
            for (int i = 0; i < streams.length(); i++) {
                JSONObject stream = streams.optJSONObject(i);
                if (stream == null) {
                    continue;
                }
                String type = stream.optString("codec_type", "");
                if ("audio".equals(type) && audio == null) {
                    audio = stream;
                } else if ("video".equals(type) && !isAttachedPicture(stream)) {
                    hasVideo = true;
                }
            }
        }

        JSONObject format = root.optJSONObject("format");
        double duration = format != null ? parseDouble(format.optString("duration", null)) : -1;
        if (duration <= 0 && audio != null) {
            duration = parseDouble(audio.optString("duration", null));
        }
        String formatName = format != null ? format.optString("format_name", null) : null;

        if (audio == null) {
            return new MediaInfo(path, 0, 0, Math.max(duration, 0), hasVideo, false, null, formatName);
        }
        int sampleRate = (int) parseDouble(audio.optString("sample_rate", "0"));
        int channels = audio.optInt("channels", 0);
        return new MediaInfo(path, sampleRate, channels, Math.max(duration, 0), hasVideo, true,
                audio.optString("codec_name", null), formatName);
    }

    private static boolean isAttachedPicture(JSONObject stream) {
        JSONObject disposition = stream.optJSONObject("disposition");
        return disposition != null && disposition.optInt("attached_pic", 0) == 1;
    }

    private static double parseDouble(String s) {
        if (s == null || s.isBlank() || "N/A".equals(s)) {
            return -1;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
