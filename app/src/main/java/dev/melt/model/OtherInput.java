package dev.melt.model;

import java.util.Optional;

/** Tarballs, files and git inputs whose owner/repo could not be determined. */
public record OtherInput(String name, String url, String rev, long lastModifiedEpoch) implements FlakeInput {
    @Override
    public String typeDisplay() {
        return "other";
    }

    @Override
    public Optional<String> shortRev() {
        return rev.isEmpty() ? Optional.empty() : Optional.of(FlakeInput.shorten(rev));
    }

    @Override
    public Optional<Long> lastModified() {
        return Optional.of(lastModifiedEpoch);
    }
}
