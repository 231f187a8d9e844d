package dev.melt.git;

import dev.melt.config.ServiceConfig;
import dev.melt.forge.ForgeClient;
import dev.melt.model.ChangelogData;
import dev.melt.model.FlakeInput;
import dev.melt.model.GitInput;
import dev.melt.model.UpdateStatus;
import dev.melt.util.CancellationToken;
import dev.melt.util.DaemonThreads;
import dev.melt.util.OperationLimiter;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BiConsumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wires the forge client, mirror cache and update checker together behind {@link GitOperations}. Every remote
 * operation holds one permit of the shared {@link OperationLimiter} for its whole duration, the forge API request
 * included, so the limit covers REST calls as well as mirror clones and fetches.
 */
public final class GitService implements GitOperations, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitService.class);

    private final CancellationToken cancel;
    private final OperationLimiter limiter;
    private final ForgeClient forgeClient;
    private final UpdateChecker updateChecker;
    private final ExecutorService workers;
    private final ExecutorService vcsExecutor;

    public GitService(ServiceConfig config, CancellationToken cancel) {
        this(config, cancel, new OperationLimiter(config.gitConcurrency()));
    }

    public GitService(ServiceConfig config, CancellationToken cancel, OperationLimiter limiter) {
        this.cancel = cancel;
        this.limiter = limiter;
        this.workers = Executors.newCachedThreadPool(DaemonThreads.named("melt-check"));
        this.vcsExecutor = Executors.newCachedThreadPool(DaemonThreads.named("melt-vcs"));
        var mirrors = new MirrorCache(config.cacheDir(), config.githubToken());
        var history = new MirrorHistory(mirrors, cancel, vcsExecutor, config.timeouts());
        this.forgeClient = new ForgeClient(config, history);
        this.updateChecker = new UpdateChecker(forgeClient::countAhead, limiter, cancel, workers);
        logger.debug("Git service using cache {} with {} permits", config.cacheDir(), limiter.capacity());
    }

    @Override
    public void checkUpdates(List<FlakeInput> inputs, BiConsumer<String, UpdateStatus> onStatus) {
        updateChecker.checkUpdates(inputs, onStatus);
    }

    @Override
    public ChangelogData getChangelog(GitInput input) throws GitServiceException {
        if (cancel.isCancelled()) {
            throw new GitServiceException.Cancelled();
        }
        OperationLimiter.Permit permit;
        try {
            permit = limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitServiceException.Cancelled();
        }
        try (permit) {
            logger.debug("Loading changelog for {} ({})", input.name(), input.forge());
            return forgeClient.changelog(input);
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        vcsExecutor.shutdown();
    }
}
