package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.OutputOptions;
import com.phillippitts.denoisebatch.exception.PathException;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves output paths from a naming pattern.
 *
 * <p>Placeholders:
 * <ul>
 *   <li>{@code {parent}}: absolute directory of the input</li>
 *   <li>{@code {name}} / {@code {stem}}: sanitized input file name without extension</li>
 *   <li>{@code {ext}}: output extension including the dot</li>
 * </ul>
 * A pattern that yields a relative path is resolved against the input's directory.
 */
public class OutputPathResolver {

    public static final String DEFAULT_PATTERN = "{parent}/clean/{name}_clean{ext}";

    private static final Set<String> PLACEHOLDERS = Set.of("parent", "name", "stem", "ext");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");
    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_{2,}");
    private static final String PROBE_PREFIX = ".denoise-write-probe-";
    private static final double MEGABYTE = 1024.0 * 1024.0;

    private final String pattern;
    private final long minFreeBytes;
    private final UsableSpace usableSpace;

    /**
     * Free space available to this process on the file store holding a directory.
     */
    @FunctionalInterface
    interface UsableSpace {
        long bytes(Path dir) throws IOException;
    }

    /**
     * Resolver without a free-space check.
     */
    public OutputPathResolver(String pattern) {
        this(pattern, 0);
    }

    /**
     * @param minFreeBytes usable space the output directory must have at enqueue; 0 disables the check
     * @throws PathException if the pattern is blank or uses an unknown placeholder
     */
    public OutputPathResolver(String pattern, long minFreeBytes) {
        this(pattern, minFreeBytes, dir -> Files.getFileStore(dir).getUsableSpace());
    }

    OutputPathResolver(String pattern, long minFreeBytes, UsableSpace usableSpace) {
        if (pattern == null || pattern.isBlank()) {
            throw new PathException("Output pattern must not be blank", String.valueOf(pattern));
        }
        Matcher m = PLACEHOLDER.matcher(pattern);
        while (m.find()) {
            if (!PLACEHOLDERS.contains(m.group(1))) {
                throw new PathException("Unknown placeholder {" + m.group(1) + "} in output pattern "
                        + "(allowed: " + PLACEHOLDERS + ")", pattern);
            }
        }
        if (minFreeBytes < 0) {
            throw new IllegalArgumentException("minFreeBytes must be >= 0, got " + minFreeBytes);
        }
        this.pattern = pattern;
        this.minFreeBytes = minFreeBytes;
        this.usableSpace = usableSpace;
    }

    public String pattern() {
        return pattern;
    }

    /**
     * Computes the output path without touching the filesystem. Same input, same result.
     *
     * @param input input media file
     * @param options output options of the job
     * @param inputHasVideo whether the probed input carries a video stream
     */
    public Path resolve(Path input, OutputOptions options, boolean inputHasVideo) {
        Path absolute = input.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        String stem = sanitize(SupportedFormats.stemOf(absolute));
        String expanded = pattern
                .replace("{parent}", parent == null ? "" : parent.toString())
                .replace("{name}", stem)
                .replace("{stem}", stem)
                .replace("{ext}", extensionFor(absolute, options, inputHasVideo));
        try {
            Path resolved = Path.of(expanded);
            if (!resolved.isAbsolute() && parent != null) {
                resolved = parent.resolve(resolved);
            }
            return resolved.normalize();
        } catch (InvalidPathException e) {
            throw new PathException("Output pattern produced an invalid path: " + e.getMessage(), expanded, e);
        }
    }

    /**
     * Resolves the output path, creates its directory and checks that it is writable and has at
     * least the configured free space.
     *
     * @throws PathException if the directory cannot be created or written, or is short of space
     */
    public Path prepare(Path input, OutputOptions options, boolean inputHasVideo) {
        Path output = resolve(input, options, inputHasVideo);
        if (output.equals(input.toAbsolutePath().normalize())) {
            throw new PathException("Output path would overwrite the input file", output.toString());
        }
        Path dir = output.getParent();
        if (dir == null) {
            throw new PathException("Output path has no parent directory", output.toString());
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PathException("Cannot create output directory: " + e.getMessage(), dir.toString(), e);
        }
        try {
            Path probe = Files.createTempFile(dir, PROBE_PREFIX, ".tmp");
            Files.delete(probe);
        } catch (IOException e) {
            throw new PathException("Output directory is not writable: " + e.getMessage(), dir.toString(), e);
        }
        requireFreeSpace(dir);
        return output;
    }

    private void requireFreeSpace(Path dir) {
        if (minFreeBytes == 0) {
            return;
        }
        long available;
        try {
            available = usableSpace.bytes(dir);
        } catch (IOException e) {
            throw new PathException("Cannot determine free disk space: " + e.getMessage(), dir.toString(), e);
        }
        if (available < minFreeBytes) {
            throw new PathException(String.format(Locale.ROOT, "Insufficient disk space: %.1f MB available, %.1f MB required",
                    available / MEGABYTE, minFreeBytes / MEGABYTE), dir.toString());
        }
    }

    /**
     * @return {@code path} if nothing exists there, otherwise the first free
     *         {@code stem_N.ext} sibling
     */
    public static Path uniquePath(Path path) {
        return uniquePath(path, p -> false);
    }

    /**
     * Like {@link #uniquePath(Path)}, but also skips paths for which {@code reserved} answers true.
     */
    public static Path uniquePath(Path path, Predicate<Path> reserved) {
        if (!isTaken(path, reserved)) {
            return path;
        }
        String stem = SupportedFormats.stemOf(path);
        String name = path.getFileName().toString();
        String ext = name.substring(stem.length());
        for (int i = 1; ; i++) {
            Path candidate = path.resolveSibling(stem + "_" + i + ext);
            if (!isTaken(candidate, reserved)) {
                return candidate;
            }
        }
    }

    private static boolean isTaken(Path path, Predicate<Path> reserved) {
        return Files.exists(path) || reserved.test(path);
    }

    /**
     * @return hidden sibling the encoder of job {@code jobId} writes to before the final move
     */
    public static Path partialPath(Path output, UUID jobId) {
        String stem = SupportedFormats.stemOf(output);
        String ext = output.getFileName().toString().substring(stem.length());
        return output.resolveSibling("." + stem + "." + jobId.toString().substring(0, 8) + ".partial" + ext);
    }

    /**
     * Replaces characters that are illegal in file names, collapses underscore runs and trims
     * dots and spaces from both ends.
     *
     * @return sanitized name, {@code "untitled"} if nothing is left
     */
    public static String sanitize(String name) {
        String cleaned = ILLEGAL_CHARS.matcher(name == null ? "" : name).replaceAll("_");
        cleaned = UNDERSCORE_RUNS.matcher(cleaned).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && isTrimmable(cleaned.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(cleaned.charAt(end - 1))) {
            end--;
        }
        cleaned = cleaned.substring(start, end);
        return cleaned.isEmpty() ? "untitled" : cleaned;
    }

    private static boolean isTrimmable(char c) {
        return c == '.' || c == ' ';
    }

    private static String extensionFor(Path input, OutputOptions options, boolean inputHasVideo) {
        if (inputHasVideo && options.preserveVideo()) {
            return SupportedFormats.extensionOf(input);
        }
        if (!options.keepsInputFormat()) {
            return "." + options.outputFormat();
        }
        return SupportedFormats.extensionOf(input);
    }
}
