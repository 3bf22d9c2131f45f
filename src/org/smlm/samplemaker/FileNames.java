package org.smlm.samplemaker;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Output file name helpers.
 */
public final class FileNames {

    private static final DateTimeFormatter WITH_HOUR = DateTimeFormatter.ofPattern("-yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DAY_ONLY = DateTimeFormatter.ofPattern("-yyyyMMdd");

    private FileNames() {}

    /** Appends {@code extension} unless the name already ends with it. */
    public static String addExtension(String filename, String extension) {
        String ext = extension.startsWith(".") ? extension : "." + extension;
        return filename.endsWith(ext) ? filename : filename + ext;
    }

    /** Inserts {@code suffix} before the last extension, if any. */
    public static String addSuffix(String filename, String suffix) {
        int dot = filename.lastIndexOf('.');
        int sep = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot <= sep) return filename + suffix;
        return filename.substring(0, dot) + suffix + filename.substring(dot);
    }

    public static String timestampSuffix(boolean withHour) {
        return timestampSuffix(LocalDateTime.now(), withHour);
    }

    static String timestampSuffix(LocalDateTime time, boolean withHour) {
        return (withHour ? WITH_HOUR : DAY_ONLY).format(time);
    }
}
