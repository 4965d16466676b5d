package com.demochat.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Human readable distance between two instants, e.g. "5 minutes ago" or "in 2 hours".
 */
public final class RelativeTime {

    private RelativeTime() {
        // Utility class - prevent instantiation
    }

    public static String describe(Instant then, Instant now) {
        Duration distance = Duration.between(now, then);
        boolean future = !distance.isNegative();
        long seconds = distance.abs().getSeconds();

        if (seconds < 60) {
            return "just now";
        }

        String amount;
        if (seconds < 3_600) {
            amount = plural(seconds / 60, "minute");
        } else if (seconds < 86_400) {
            amount = plural(seconds / 3_600, "hour");
        } else if (seconds < 30L * 86_400) {
            amount = plural(seconds / 86_400, "day");
        } else if (seconds < 365L * 86_400) {
            amount = plural(seconds / (30L * 86_400), "month");
        } else {
            amount = plural(seconds / (365L * 86_400), "year");
        }
        return future ? "in " + amount : amount + " ago";
    }

    private static String plural(long value, String unit) {
        return value == 1 ? "1 " + unit : value + " " + unit + "s";
    }
}
