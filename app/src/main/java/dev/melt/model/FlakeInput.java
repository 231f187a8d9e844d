package dev.melt.model;

import java.util.Optional;

/**
 * One dependency entry of a flake. Snapshots are immutable; a metadata reload replaces the whole list.
 */
public sealed interface FlakeInput permits GitInput, PathInput, OtherInput {

    String name();

    /** Short display label of the input kind. */
    String typeDisplay();

    /** First seven characters of the pinned revision, if the input has one. */
    default Optional<String> shortRev() {
        return Optional.empty();
    }

    /** Unix timestamp (seconds) of the pinned revision, if known. */
    default Optional<Long> lastModified() {
        return Optional.empty();
    }

    static String shorten(String rev) {
        return rev.substring(0, Math.min(7, rev.length()));
    }
}
