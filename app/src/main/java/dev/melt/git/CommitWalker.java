package dev.melt.git;

import dev.melt.model.Commit;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.jetbrains.annotations.Nullable;

/** Enumerates commit history in a local mirror, newest first by commit time. */
public final class CommitWalker {
    private static final Logger logger = LogManager.getLogger(CommitWalker.class);

    public static final int AHEAD_LIMIT = 500;

    private CommitWalker() {}

    /**
     * Commits reachable from {@code headRef} but not from {@code baseRev}, capped at {@link #AHEAD_LIMIT}.
     *
     * <p>An unresolvable base yields an empty list; an unresolvable head is an error.
     *
     * @param headRef branch or tag to walk from, or null for HEAD
     */
    public static List<Commit> commitsSince(Repository repo, String baseRev, @Nullable String headRef)
            throws GitServiceException {
        var head = headRef == null || headRef.isBlank() ? Constants.HEAD : headRef;
        try (var walk = new RevWalk(repo)) {
            var headId = resolveHead(repo, head);
            if (headId == null) {
                throw new GitServiceException.RevisionNotFound("Revision not found: " + head);
            }
            var base = parseIfPresent(repo, walk, baseRev);
            if (base == null) {
                logger.debug("Base revision {} not present in {}", baseRev, repo.getDirectory());
                return List.of();
            }
            if (base.getId().equals(headId)) {
                return List.of();
            }
            walk.sort(RevSort.COMMIT_TIME_DESC);
            walk.markStart(walk.parseCommit(headId));
            walk.markUninteresting(base);
            return collect(walk, AHEAD_LIMIT);
        } catch (IOException e) {
            throw new GitServiceException.CacheError("Failed to walk history: " + e.getMessage(), e);
        }
    }

    /** Up to {@code limit} commits starting at {@code rev} (inclusive) and going back. Empty if rev is absent. */
    public static List<Commit> commitsFrom(Repository repo, String rev, int limit) throws GitServiceException {
        try (var walk = new RevWalk(repo)) {
            var start = parseIfPresent(repo, walk, rev);
            if (start == null) {
                return List.of();
            }
            walk.sort(RevSort.COMMIT_TIME_DESC);
            walk.markStart(start);
            return collect(walk, limit);
        } catch (IOException e) {
            throw new GitServiceException.CacheError("Failed to walk history: " + e.getMessage(), e);
        }
    }

    private static @Nullable ObjectId resolveHead(Repository repo, String head) throws IOException {
        for (var candidate : List.of(Constants.R_REMOTES + "origin/" + head, Constants.R_HEADS + head)) {
            var ref = repo.exactRef(candidate);
            if (ref != null && ref.getObjectId() != null) {
                return ref.getObjectId();
            }
        }
        if (head.equals(Constants.HEAD)) {
            var ref = repo.exactRef(Constants.HEAD);
            if (ref != null && ref.getObjectId() != null) {
                return ref.getObjectId();
            }
        }
        return resolveQuietly(repo, head);
    }

    private static @Nullable RevCommit parseIfPresent(Repository repo, RevWalk walk, String rev) throws IOException {
        var id = resolveQuietly(repo, rev);
        if (id == null) {
            return null;
        }
        try {
            return walk.parseCommit(id);
        } catch (MissingObjectException e) {
            return null;
        }
    }

    private static @Nullable ObjectId resolveQuietly(Repository repo, String rev) throws IOException {
        try {
            return repo.resolve(rev + "^{commit}");
        } catch (RevisionSyntaxException | MissingObjectException e) {
            logger.debug("Cannot resolve {}: {}", rev, e.getMessage());
            return null;
        }
    }

    private static List<Commit> collect(RevWalk walk, int limit) {
        var commits = new ArrayList<Commit>();
        for (RevCommit c : walk) {
            if (commits.size() >= limit) {
                break;
            }
            commits.add(toCommit(c));
        }
        return commits;
    }

    static Commit toCommit(RevCommit c) {
        var author = c.getAuthorIdent();
        return new Commit(
                c.getName(),
                c.getShortMessage(),
                author == null ? "Unknown" : author.getName(),
                Instant.ofEpochSecond(c.getCommitTime()),
                false);
    }
}
