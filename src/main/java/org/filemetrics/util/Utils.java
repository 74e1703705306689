package org.filemetrics.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;

/**
 * Small helpers shared by the parsers and result records.
 */
public final class Utils {

    private Utils() {
    }

    /**
     * Extension of the file name including the dot, or an empty string. Hidden files such as
     * {@code .profile} have no extension.
     */
    public static String extension(final Path path) {
        Path name = path.getFileName();
        if (name == null) return "";
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot) : "";
    }

    /**
     * Cuts {@code value} to {@code max} characters, appending "..." when something was cut.
     */
    public static String truncate(final String value, final int max) {
        if (value == null) return "";
        return value.length() > max ? value.substring(0, max) + "..." : value;
    }

    public static double round(final double value, final int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * {@code part / total * 100} rounded to 2 decimals, 0 when {@code total} is 0.
     */
    public static double percentage(final long part, final long total) {
        return total > 0 ? round(part * 100.0 / total, 2) : 0.0;
    }
}
