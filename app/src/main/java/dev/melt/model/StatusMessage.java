package dev.melt.model;

import java.time.Duration;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/** Status bar message; everything but {@link Level#INFO} expires on its own. */
public record StatusMessage(String text, Level level, @Nullable Instant expiresAt) {

    public enum Level {
        INFO,
        SUCCESS,
        WARNING,
        ERROR
    }

    public static StatusMessage info(String text) {
        return new StatusMessage(text, Level.INFO, null);
    }

    public static StatusMessage success(String text) {
        return new StatusMessage(text, Level.SUCCESS, Instant.now().plus(Duration.ofSeconds(3)));
    }

    public static StatusMessage warning(String text) {
        return new StatusMessage(text, Level.WARNING, Instant.now().plus(Duration.ofSeconds(4)));
    }

    public static StatusMessage error(String text) {
        return new StatusMessage(text, Level.ERROR, Instant.now().plus(Duration.ofSeconds(5)));
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
