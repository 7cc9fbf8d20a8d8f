package com.github.stormino.transcoder.util;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.Locale;

/**
 * Utility class for formatting sizes and durations in log messages.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes to human-readable size string using binary units.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GiB", "456.78 MiB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= DownloadConstants.BYTES_PER_GIB) {
            return String.format(Locale.ROOT, "%.2f GiB", (double) bytes / DownloadConstants.BYTES_PER_GIB);
        } else if (bytes >= DownloadConstants.BYTES_PER_MIB) {
            return String.format(Locale.ROOT, "%.2f MiB", (double) bytes / DownloadConstants.BYTES_PER_MIB);
        } else if (bytes >= DownloadConstants.BYTES_PER_KIB) {
            return String.format(Locale.ROOT, "%.2f KiB", (double) bytes / DownloadConstants.BYTES_PER_KIB);
        } else {
            return String.format(Locale.ROOT, "%d B", bytes);
        }
    }

    /**
     * Format a duration to human-readable time string.
     *
     * @param duration Duration, may be null
     * @return Formatted string like "2h 15m 30s", "45m 12s", or "23s"
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0s";
        }

        long seconds = duration.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, secs);
        } else {
            return String.format(Locale.ROOT, "%ds", secs);
        }
    }
}
