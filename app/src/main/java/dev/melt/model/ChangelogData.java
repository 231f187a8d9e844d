package dev.melt.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Ordered (newest-first) commit history of an input's remote.
 *
 * <p>When {@code lockedIndex} is present, entries before it are newer than the locked commit and entries from it
 * onward are the historical tail, starting with the locked commit. When absent the locked revision could not be
 * found and every entry is "ahead".
 */
public record ChangelogData(List<Commit> commits, OptionalInt lockedIndex) {
    public static final int TAIL_LIMIT = 50;

    public ChangelogData {
        commits = List.copyOf(commits);
        if (lockedIndex.isPresent()) {
            int idx = lockedIndex.getAsInt();
            if (idx < 0 || idx >= commits.size()) {
                throw new IllegalArgumentException("locked index " + idx + " outside of " + commits.size());
            }
        }
    }

    /** Number of commits newer than the locked one. */
    public int commitsAhead() {
        return lockedIndex.orElse(commits.size());
    }

    /** Number of commits older than the locked one. */
    public int commitsBehind() {
        if (lockedIndex.isEmpty()) {
            return 0;
        }
        return Math.max(0, commits.size() - (lockedIndex.getAsInt() + 1));
    }

    public Optional<Commit> lockedCommit() {
        return lockedIndex.isPresent() ? Optional.of(commits.get(lockedIndex.getAsInt())) : Optional.empty();
    }
}
