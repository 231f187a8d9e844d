package dev.melt.git;

import dev.melt.config.ServiceConfig;
import dev.melt.forge.ForgeClient;
import dev.melt.model.ChangelogData;
import dev.melt.model.GitInput;
import dev.melt.util.CancellationToken;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Answers update checks and changelogs from the local mirror. The blocking JGit work runs on its own executor so
 * the caller can give up after the configured timeout; a started fetch or clone is left to finish on its own.
 */
final class MirrorHistory implements ForgeClient.MirrorFallback {
    private static final Logger logger = LogManager.getLogger(MirrorHistory.class);

    @FunctionalInterface
    private interface VcsTask<T> {
        T run() throws GitServiceException;
    }

    private final MirrorCache cache;
    private final CancellationToken cancel;
    private final ExecutorService vcsExecutor;
    private final ServiceConfig.Timeouts timeouts;

    MirrorHistory(
            MirrorCache cache, CancellationToken cancel, ExecutorService vcsExecutor, ServiceConfig.Timeouts timeouts) {
        this.cache = cache;
        this.cancel = cancel;
        this.vcsExecutor = vcsExecutor;
        this.timeouts = timeouts;
    }

    @Override
    public int countAhead(GitInput input) throws GitServiceException {
        var url = requireUrl(input);
        logger.debug("Using local mirror for update check of {}", input.name());
        return runBounded(
                () -> {
                    try (var repo = cache.ensureRepo(url, input.reference(), cancel)) {
                        return CommitWalker.commitsSince(repo, input.rev(), input.reference())
                                .size();
                    }
                },
                timeouts.gitUpdateCheck(),
                "Timeout checking updates for " + input.name());
    }

    @Override
    public ChangelogData changelog(GitInput input) throws GitServiceException {
        var url = requireUrl(input);
        logger.debug("Using local mirror for changelog of {}", input.name());
        return runBounded(
                () -> {
                    try (var repo = cache.ensureRepo(url, input.reference(), cancel)) {
                        var ahead = CommitWalker.commitsSince(repo, input.rev(), input.reference());
                        var tail = CommitWalker.commitsFrom(repo, input.rev(), ChangelogData.TAIL_LIMIT);
                        return ChangelogAssembler.assemble(ahead, tail);
                    }
                },
                timeouts.gitChangelog(),
                "Timeout loading changelog for " + input.name());
    }

    private static String requireUrl(GitInput input) throws GitServiceException {
        var url = input.mirrorUrl();
        if (url.isEmpty()) {
            throw new GitServiceException.Unsupported("No clone URL for input " + input.name());
        }
        return url;
    }

    private <T> T runBounded(VcsTask<T> task, Duration timeout, String timeoutMessage) throws GitServiceException {
        if (cancel.isCancelled()) {
            throw new GitServiceException.Cancelled();
        }
        Callable<T> callable = task::run;
        var future = vcsExecutor.submit(callable);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn(timeoutMessage);
            throw new GitServiceException.Timeout(timeoutMessage);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitServiceException.Cancelled();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof GitServiceException gse) {
                throw gse;
            }
            logger.error("Mirror task failed", cause);
            throw new GitServiceException.CloneFailed("Task failed: " + cause.getMessage(), cause);
        }
    }
}
