package dev.melt.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ChangelogDataTest {

    private static Commit commit(String sha) {
        return new Commit(sha, "msg " + sha, "Alice", Instant.EPOCH, false);
    }

    @Test
    void countsAroundLockedIndex() {
        var data = new ChangelogData(
                List.of(commit("a"), commit("b"), commit("c").asLocked(), commit("d")), OptionalInt.of(2));
        assertEquals(2, data.commitsAhead());
        assertEquals(1, data.commitsBehind());
        assertEquals("c", data.lockedCommit().orElseThrow().sha());
    }

    @Test
    void missingLockedIndexMeansEverythingIsAhead() {
        var data = new ChangelogData(List.of(commit("a"), commit("b")), OptionalInt.empty());
        assertEquals(2, data.commitsAhead());
        assertEquals(0, data.commitsBehind());
        assertFalse(data.lockedCommit().isPresent());
    }

    @Test
    void lockedIndexMustPointIntoCommits() {
        assertThrows(IllegalArgumentException.class, () -> new ChangelogData(List.of(), OptionalInt.of(0)));
        assertThrows(
                IllegalArgumentException.class, () -> new ChangelogData(List.of(commit("a")), OptionalInt.of(-1)));
    }

    @Test
    void firstLineStripsBodyAndWhitespace() {
        assertEquals("fix: thing", Commit.firstLine("  fix: thing \n\nlong body"));
        assertEquals("single", Commit.firstLine("single"));
    }

    @Test
    void statusMessagesExpireExceptInfo() {
        var later = Instant.now().plusSeconds(60);
        assertFalse(StatusMessage.info("x").isExpired(later));
        assertTrue(StatusMessage.success("x").isExpired(later));
        assertTrue(StatusMessage.error("x").isExpired(later));
        assertFalse(StatusMessage.warning("x").isExpired(Instant.now()));
    }

    @Test
    void updateStatusDisplay() {
        assertEquals("+3", UpdateStatus.fromAheadCount(3).display());
        assertEquals(UpdateStatus.UP_TO_DATE, UpdateStatus.fromAheadCount(0));
        assertTrue(new UpdateStatus.Error("boom").isTerminal());
        assertFalse(UpdateStatus.CHECKING.isTerminal());
    }
}
