package dev.melt.model;

import java.time.Instant;

/**
 * A commit as shown in the changelog.
 *
 * @param sha full commit id
 * @param message first line of the commit message
 * @param author author name
 * @param date commit timestamp
 * @param locked true iff this is the input's pinned revision
 */
public record Commit(String sha, String message, String author, Instant date, boolean locked) {

    public String shortSha() {
        return sha.substring(0, Math.min(7, sha.length()));
    }

    public Commit asLocked() {
        return locked ? this : new Commit(sha, message, author, date, true);
    }

    /** First line of a full commit message. */
    public static String firstLine(String message) {
        int nl = message.indexOf('\n');
        var line = nl >= 0 ? message.substring(0, nl) : message;
        return line.strip();
    }
}
