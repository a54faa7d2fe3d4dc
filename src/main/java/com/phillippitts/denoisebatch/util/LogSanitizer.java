package com.phillippitts.denoisebatch.util;

import java.nio.file.Path;

/** Helpers that keep log lines short and free of full user paths. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * File name component of a path for INFO-level logs; the full path goes to DEBUG only.
     */
    public static String fileName(Path path) {
        if (path == null) {
            return "";
        }
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
