package com.phillippitts.denoisebatch.service.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Allow-list of input containers, checked before a job is accepted.
 */
public final class SupportedFormats {

    public static final Set<String> AUDIO_EXTENSIONS =
            Set.of(".wav", ".mp3", ".flac", ".aac", ".ogg", ".m4a", ".wma", ".aiff");

    public static final Set<String> VIDEO_EXTENSIONS =
            Set.of(".mp4", ".avi", ".mkv", ".mov", ".wmv", ".flv", ".webm", ".m4v");

    private SupportedFormats() {
    }

    /**
     * @return lowercase extension including the dot, or "" if the name has none
     */
    public static String extensionOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * @return file name without its extension
     */
    public static String stemOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    public static boolean isAudio(Path path) {
        return AUDIO_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isVideo(Path path) {
        return VIDEO_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isSupported(Path path) {
        return isAudio(path) || isVideo(path);
    }
}
