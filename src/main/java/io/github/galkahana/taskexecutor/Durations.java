package io.github.galkahana.taskexecutor;

import java.time.Duration;
import java.util.Locale;

final class Durations {

    private Durations() {
    }

    /**
     * Short human form used in log lines and error messages, e.g. {@code 250ms}, {@code 1.5s}, {@code 2m0s}.
     */
    static String format(Duration duration) {
        if (duration == null) {
            return "0s";
        }
        long nanos = saturatedNanos(duration);
        if (nanos < 1_000L) {
            return nanos + "ns";
        }
        if (nanos < 1_000_000L) {
            return trim(nanos / 1_000d) + "µs";
        }
        if (nanos < 1_000_000_000L) {
            return trim(nanos / 1_000_000d) + "ms";
        }
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return trim(nanos / 1_000_000_000d) + "s";
        }
        return (seconds / 60) + "m" + (seconds % 60) + "s";
    }

    static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private static String trim(double value) {
        String text = String.format(Locale.ROOT, "%.3f", value);
        text = text.replaceAll("0+$", "");
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }
}
