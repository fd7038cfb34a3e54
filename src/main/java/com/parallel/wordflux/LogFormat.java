package com.parallel.wordflux;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Shared formatting for status lines.
 */
public final class LogFormat {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private LogFormat() {
    }

    public static String stamp(String message) {
        return "[" + TIMESTAMP.format(LocalDateTime.now()) + "] " + message;
    }

    public static String number(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    public static String seconds(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String rule(char c) {
        return String.valueOf(c).repeat(60);
    }
}
