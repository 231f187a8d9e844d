package dev.melt.git;

import dev.melt.model.FlakeInput;
import dev.melt.model.GitInput;
import dev.melt.model.UpdateStatus;
import dev.melt.util.CancellationToken;
import dev.melt.util.OperationLimiter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiConsumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs one update check per git input with bounded concurrency and reports each status through a callback as soon
 * as it is known. Non-git inputs are ignored.
 *
 * <p>A permit is taken before a check is submitted and held until it finishes, whether the answer comes from the
 * forge API or the mirror. The permit count therefore also bounds the number of checker threads.
 */
public final class UpdateChecker {
    private static final Logger logger = LogManager.getLogger(UpdateChecker.class);

    /** Counts commits between an input's locked revision and its tracked ref. */
    @FunctionalInterface
    public interface RemoteCheck {
        int countAhead(GitInput input) throws GitServiceException;
    }

    private final RemoteCheck remoteCheck;
    private final OperationLimiter limiter;
    private final CancellationToken cancel;
    private final ExecutorService workers;

    public UpdateChecker(
            RemoteCheck remoteCheck, OperationLimiter limiter, CancellationToken cancel, ExecutorService workers) {
        this.remoteCheck = remoteCheck;
        this.limiter = limiter;
        this.cancel = cancel;
        this.workers = workers;
    }

    /**
     * Emits {@link UpdateStatus#CHECKING} for every git input, then a terminal status per input as its check
     * finishes. Returns once every started check has reported. After cancellation no new check is started and
     * nothing further is emitted for the inputs that were skipped.
     *
     * <p>{@code onStatus} is invoked from worker threads.
     */
    public void checkUpdates(List<FlakeInput> inputs, BiConsumer<String, UpdateStatus> onStatus) {
        var gitInputs = new ArrayList<GitInput>();
        for (var input : inputs) {
            if (input instanceof GitInput git) {
                gitInputs.add(git);
            }
        }
        for (var input : gitInputs) {
            onStatus.accept(input.name(), UpdateStatus.CHECKING);
        }

        var pending = new ArrayList<Future<?>>(gitInputs.size());
        for (var input : gitInputs) {
            if (cancel.isCancelled()) {
                logger.debug("Update check cancelled before {}", input.name());
                break;
            }
            var permit = acquire();
            if (permit == null) {
                break;
            }
            if (cancel.isCancelled()) {
                permit.close();
                break;
            }
            pending.add(workers.submit(() -> {
                try (permit) {
                    checkOne(input, onStatus);
                }
            }));
        }

        for (var future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                logger.error("Update check task failed unexpectedly", e.getCause());
            }
        }
    }

    private @Nullable OperationLimiter.Permit acquire() {
        try {
            return limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private void checkOne(GitInput input, BiConsumer<String, UpdateStatus> onStatus) {
        UpdateStatus status;
        try {
            int ahead = remoteCheck.countAhead(input);
            logger.debug("{} is {} commits behind", input.name(), ahead);
            status = UpdateStatus.fromAheadCount(ahead);
        } catch (GitServiceException.Cancelled e) {
            return;
        } catch (GitServiceException e) {
            logger.warn("Failed to check {}: {}", input.name(), e.getMessage());
            status = new UpdateStatus.Error(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure checking {}", input.name(), e);
            status = new UpdateStatus.Error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        onStatus.accept(input.name(), status);
    }
}
