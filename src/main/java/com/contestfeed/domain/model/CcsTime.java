package com.contestfeed.domain.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * CCS time formats.
 *
 * <ul>
 *   <li>RELTIME: {@code H:MM:SS.sss}, e.g. {@code 1:05:09.250}</li>
 *   <li>TIME: {@code yyyy-MM-dd'T'HH:mm:ss.SSSXXX}, e.g. {@code 2025-01-01T10:00:00.000+02:00}</li>
 * </ul>
 */
public final class CcsTime {

    private static final DateTimeFormatter ABSOLUTE_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private CcsTime() {
    }

    public static String formatRelTime(long millis) {
        String sign = millis < 0 ? "-" : "";
        long abs = Math.abs(millis);
        long hours = abs / 3_600_000;
        long minutes = (abs % 3_600_000) / 60_000;
        long seconds = (abs % 60_000) / 1000;
        long ms = abs % 1000;
        return String.format("%s%d:%02d:%02d.%03d", sign, hours, minutes, seconds, ms);
    }

    /**
     * Parses a RELTIME string back into milliseconds. The fractional part is optional.
     */
    public static long parseRelTime(String relTime) {
        if (relTime == null || relTime.isBlank()) {
            throw new IllegalArgumentException("Empty RELTIME");
        }
        String value = relTime.trim();
        boolean negative = value.startsWith("-");
        if (negative) {
            value = value.substring(1);
        }

        String[] parts = value.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed RELTIME: " + relTime);
        }
        try {
            long hours = Long.parseLong(parts[0]);
            long minutes = Long.parseLong(parts[1]);
            String[] secondsParts = parts[2].split("\\.");
            long seconds = Long.parseLong(secondsParts[0]);
            long millis = 0;
            if (secondsParts.length > 1) {
                String fraction = (secondsParts[1] + "00").substring(0, 3);
                millis = Long.parseLong(fraction);
            }
            long total = hours * 3_600_000 + minutes * 60_000 + seconds * 1000 + millis;
            return negative ? -total : total;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed RELTIME: " + relTime, e);
        }
    }

    public static String formatAbsolute(OffsetDateTime time) {
        return ABSOLUTE_FORMATTER.format(time);
    }

    /**
     * Absolute wall-clock time of a contest-relative offset.
     */
    public static String absoluteAt(OffsetDateTime contestStart, long contestTimeMillis) {
        return formatAbsolute(contestStart.plus(Duration.ofMillis(contestTimeMillis)));
    }
}
