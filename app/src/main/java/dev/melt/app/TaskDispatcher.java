package dev.melt.app;

import dev.melt.util.DaemonThreads;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs blocking work off the control thread. Tasks report through an unbounded queue that the control loop drains
 * once per frame, so posting never blocks a worker.
 */
public final class TaskDispatcher implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TaskDispatcher.class);

    private final ExecutorService pool = Executors.newCachedThreadPool(DaemonThreads.named("melt-task"));
    private final LinkedBlockingQueue<TaskResult> results = new LinkedBlockingQueue<>();

    /**
     * Runs {@code task} on a worker. The task receives a sink for intermediate results and returns its final
     * result, or null when it has nothing more to report.
     *
     * @param onFailure converts an unexpected exception into the task's final result
     */
    public void spawn(
            String name,
            Function<Consumer<TaskResult>, TaskResult> task,
            Function<RuntimeException, TaskResult> onFailure) {
        pool.execute(() -> {
            TaskResult result;
            try {
                result = task.apply(results::add);
            } catch (RuntimeException e) {
                logger.error("Task {} failed", name, e);
                result = onFailure.apply(e);
            }
            if (result != null) {
                results.add(result);
            }
        });
    }

    /** Removes and returns every result queued so far, in arrival order. */
    public List<TaskResult> drain() {
        var drained = new ArrayList<TaskResult>();
        results.drainTo(drained);
        return drained;
    }

    /** Waits up to {@code timeout} for the next result. */
    public @Nullable TaskResult poll(Duration timeout) throws InterruptedException {
        return results.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        pool.shutdown();
    }
}
