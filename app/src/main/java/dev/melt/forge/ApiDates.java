package dev.melt.forge;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import org.jetbrains.annotations.Nullable;

final class ApiDates {
    private ApiDates() {}

    /** RFC 3339 timestamp, or now when missing or malformed. */
    static Instant parseOrNow(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
