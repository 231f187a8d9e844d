package dev.melt.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Relative time strings for the list and changelog views. */
public final class TimeFormat {
    private static final DateTimeFormatter MONTH_DAY =
            DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH).withZone(ZoneId.systemDefault());

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long MONTH = 30 * DAY;
    private static final long YEAR = 365 * DAY;

    private TimeFormat() {}

    /** "3 days ago" style, from a unix timestamp in seconds. */
    public static String relative(long epochSeconds, Instant now) {
        return relative(Instant.ofEpochSecond(epochSeconds), now);
    }

    public static String relative(Instant then, Instant now) {
        long secs = Duration.between(then, now).getSeconds();
        if (secs < MINUTE) {
            return "just now";
        }
        long[] units = {YEAR, MONTH, WEEK, DAY, HOUR, MINUTE};
        String[] singular = {"year", "month", "week", "day", "hour", "min"};
        String[] plural = {"years", "months", "weeks", "days", "hours", "mins"};
        for (int i = 0; i < units.length; i++) {
            if (secs >= units[i]) {
                long count = secs / units[i];
                return count + " " + (count == 1 ? singular[i] : plural[i]) + " ago";
            }
        }
        return "just now";
    }

    /** "3d ago" style; anything older than a month becomes "Jan 05". */
    public static String relativeShort(Instant then, Instant now) {
        long secs = Duration.between(then, now).getSeconds();
        if (secs < MINUTE) {
            return "now";
        }
        if (secs >= MONTH) {
            return MONTH_DAY.format(then);
        }
        if (secs >= WEEK) {
            return secs / WEEK + "w ago";
        }
        if (secs >= DAY) {
            return secs / DAY + "d ago";
        }
        if (secs >= HOUR) {
            return secs / HOUR + "h ago";
        }
        return secs / MINUTE + "m ago";
    }
}
