package com.drautomation.api.util;

import java.time.Duration;

/**
 * Formatting helpers for log lines and notifications.
 */
public final class FormatUtils {

    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
    }

    /**
     * Format bytes into human-readable form, e.g. "1.50 GB".
     */
    public static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < BYTE_UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format("%.2f %s", size, BYTE_UNITS[unitIndex]);
    }

    /**
     * Format a duration as e.g. "2m 5s" or "850ms".
     */
    public static String formatDuration(long millis) {
        if (millis < 1000) {
            return Math.max(millis, 0) + "ms";
        }
        Duration duration = Duration.ofMillis(millis);
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        }
        return seconds + "s";
    }

    /**
     * Percentage of {@code part} in {@code total}, rounded to the nearest integer.
     * Returns 100 when total is zero.
     */
    public static int percentage(long part, long total) {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.round(part * 100.0 / total);
    }
}
