package dev.melt.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.melt.model.ChangelogData;
import dev.melt.model.Commit;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ChangelogAssemblerTest {

    private static Commit commit(String sha) {
        return new Commit(sha, "m", "a", Instant.EPOCH, false);
    }

    private static GitInput lockedAt(String rev) {
        return new GitInput("dep", "o", "r", ForgeType.GITHUB, null, null, rev, 0, "github:o/r");
    }

    @Test
    void lockedCommitStartsTheTail() {
        var data = ChangelogAssembler.assemble(List.of(commit("c"), commit("b")), List.of(commit("a"), commit("z")));
        assertEquals(OptionalInt.of(2), data.lockedIndex());
        assertTrue(data.commits().get(2).locked());
        assertFalse(data.commits().get(3).locked());
        assertEquals(1, data.commitsBehind());
    }

    @Test
    void emptyTailHasNoLockedIndex() {
        var data = ChangelogAssembler.assemble(List.of(commit("c")), List.of());
        assertEquals(OptionalInt.empty(), data.lockedIndex());
        assertEquals(1, data.commitsAhead());
    }

    @Test
    void upToDateInputHasLockedCommitFirst() {
        var data = ChangelogAssembler.assemble(List.of(), List.of(commit("a")));
        assertEquals(OptionalInt.of(0), data.lockedIndex());
        assertEquals(0, data.commitsAhead());
    }

    @Test
    void listingIsSplitAtAbbreviatedLockedRevision() {
        var data = ChangelogAssembler.fromListing(
                List.of(commit("ccc"), commit("bbb111"), commit("aaa")), lockedAt("bbb"));
        assertEquals(OptionalInt.of(1), data.lockedIndex());
        assertEquals("bbb111", data.lockedCommit().orElseThrow().sha());
    }

    @Test
    void listingTailIsCapped() {
        var listing = new ArrayList<Commit>();
        listing.add(commit("new"));
        listing.add(commit("locked"));
        for (int i = 0; i < 80; i++) {
            listing.add(commit("old" + i));
        }
        var data = ChangelogAssembler.fromListing(listing, lockedAt("locked"));
        assertEquals(1 + ChangelogData.TAIL_LIMIT, data.commits().size());
        assertEquals(ChangelogData.TAIL_LIMIT - 1, data.commitsBehind());
    }

    @Test
    void listingWithoutLockedRevisionIsAllAhead() {
        var stale = new Commit("x", "m", "a", Instant.EPOCH, true);
        var data = ChangelogAssembler.fromListing(List.of(stale, commit("y")), lockedAt("zzz"));
        assertEquals(OptionalInt.empty(), data.lockedIndex());
        assertEquals(2, data.commitsAhead());
        assertFalse(data.commits().get(0).locked());
    }
}
