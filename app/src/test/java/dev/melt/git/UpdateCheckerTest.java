package dev.melt.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.melt.model.FlakeInput;
import dev.melt.model.ForgeType;
import dev.melt.model.GitInput;
import dev.melt.model.OtherInput;
import dev.melt.model.PathInput;
import dev.melt.model.UpdateStatus;
import dev.melt.util.CancellationToken;
import dev.melt.util.DaemonThreads;
import dev.melt.util.OperationLimiter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpdateCheckerTest {

    private ExecutorService workers;
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, UpdateStatus> finalStatus = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool(DaemonThreads.named("test-check"));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private static GitInput git(String name, String rev) {
        return new GitInput(name, "o", name, ForgeType.GITHUB, null, null, rev, 0, "github:o/" + name);
    }

    private void record(String name, UpdateStatus status) {
        events.add(name + "=" + status.display());
        finalStatus.put(name, status);
    }

    @Test
    void emitsCheckingForEveryGitInputBeforeAnyResult() {
        var checker = new UpdateChecker(in -> 0, new OperationLimiter(2), new CancellationToken(), workers);
        List<FlakeInput> inputs = List.of(git("a", "1"), git("b", "2"), git("c", "3"));
        checker.checkUpdates(inputs, this::record);

        assertEquals(List.of("a=...", "b=...", "c=..."), events.subList(0, 3));
        assertEquals(6, events.size());
        assertEquals(UpdateStatus.UP_TO_DATE, finalStatus.get("c"));
    }

    @Test
    void nonGitInputsAreIgnored() {
        var checker = new UpdateChecker(in -> 3, new OperationLimiter(1), new CancellationToken(), workers);
        checker.checkUpdates(
                List.of(new PathInput("local", "./sub"), new OtherInput("tar", "https://x/y.tar.gz", "", 0), git("g", "1")),
                this::record);
        assertEquals(Map.of("g", new UpdateStatus.Behind(3)), finalStatus);
    }

    @Test
    void oneFailureDoesNotAbortTheBatch() {
        UpdateChecker.RemoteCheck check = in -> {
            if (in.name().equals("bad")) {
                throw new GitServiceException.Network("connection refused");
            }
            return 2;
        };
        var checker = new UpdateChecker(check, new OperationLimiter(4), new CancellationToken(), workers);
        checker.checkUpdates(List.of(git("bad", "1"), git("good", "2")), this::record);

        var bad = assertInstanceOf(UpdateStatus.Error.class, finalStatus.get("bad"));
        assertTrue(bad.reason().contains("connection refused"));
        assertEquals(new UpdateStatus.Behind(2), finalStatus.get("good"));
    }

    @Test
    void concurrentChecksNeverExceedTheLimit() {
        var limiter = new OperationLimiter(2);
        var running = new AtomicInteger();
        var peak = new AtomicInteger();
        UpdateChecker.RemoteCheck check = in -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return 0;
        };
        var inputs = new ArrayList<FlakeInput>();
        for (int i = 0; i < 8; i++) {
            inputs.add(git("in" + i, "r"));
        }
        new UpdateChecker(check, limiter, new CancellationToken(), workers).checkUpdates(inputs, this::record);

        assertTrue(peak.get() <= 2, "peak " + peak.get());
        assertEquals(8, finalStatus.size());
        assertEquals(2, limiter.available());
    }

    @Test
    void cancellationStopsNewChecksAndSuppressesCancelledResults() {
        var cancel = new CancellationToken();
        var calls = new AtomicInteger();
        UpdateChecker.RemoteCheck check = in -> {
            calls.incrementAndGet();
            cancel.cancel();
            throw new GitServiceException.Cancelled();
        };
        var checker = new UpdateChecker(check, new OperationLimiter(1), cancel, workers);
        checker.checkUpdates(List.of(git("a", "1"), git("b", "2"), git("c", "3")), this::record);

        assertTrue(calls.get() <= 2, "calls " + calls.get());
        for (var status : finalStatus.values()) {
            assertEquals(UpdateStatus.CHECKING, status);
        }
    }
}
