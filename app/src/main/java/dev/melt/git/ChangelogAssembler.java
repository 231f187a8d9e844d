package dev.melt.git;

import dev.melt.model.ChangelogData;
import dev.melt.model.Commit;
import dev.melt.model.GitInput;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/** Combines "ahead" commits with the historical tail into a {@link ChangelogData}. */
public final class ChangelogAssembler {
    private ChangelogAssembler() {}

    /**
     * @param ahead commits newer than the locked revision, newest first
     * @param tail the locked commit followed by its ancestors; may be empty when the locked revision is unknown
     */
    public static ChangelogData assemble(List<Commit> ahead, List<Commit> tail) {
        var all = new ArrayList<Commit>(ahead.size() + tail.size());
        all.addAll(ahead);
        if (tail.isEmpty()) {
            return new ChangelogData(all, OptionalInt.empty());
        }
        all.add(tail.get(0).asLocked());
        all.addAll(tail.subList(1, tail.size()));
        return new ChangelogData(all, OptionalInt.of(ahead.size()));
    }

    /**
     * Builds a changelog from a single newest-first listing (as returned by a forge API). The first entry matching
     * the locked revision splits the listing; the tail is capped at {@link ChangelogData#TAIL_LIMIT}. When the
     * locked revision is not listed every entry counts as ahead.
     */
    public static ChangelogData fromListing(List<Commit> listing, GitInput input) {
        for (int i = 0; i < listing.size(); i++) {
            if (input.isLockedRev(listing.get(i).sha())) {
                var tailEnd = Math.min(listing.size(), i + ChangelogData.TAIL_LIMIT);
                return assemble(unlocked(listing.subList(0, i)), unlocked(listing.subList(i, tailEnd)));
            }
        }
        return new ChangelogData(unlocked(listing), OptionalInt.empty());
    }

    private static List<Commit> unlocked(List<Commit> commits) {
        var out = new ArrayList<Commit>(commits.size());
        for (var c : commits) {
            out.add(c.locked() ? new Commit(c.sha(), c.message(), c.author(), c.date(), false) : c);
        }
        return out;
    }
}
