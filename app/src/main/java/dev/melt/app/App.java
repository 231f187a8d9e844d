package dev.melt.app;

import java.time.Duration;
import java.time.Instant;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The single-threaded control loop: render, wait up to one frame for a key, apply every queued task result,
 * expire the status message. Runs until the state machine reaches {@link AppState.Quitting}.
 */
public final class App {
    private static final Logger logger = LogManager.getLogger(App.class);

    static final Duration FRAME = Duration.ofMillis(16);

    /** Source of key presses; returns null when no key arrived within the timeout. */
    @FunctionalInterface
    public interface KeySource {
        @Nullable Key poll(Duration timeout) throws InterruptedException;
    }

    private final StateMachine machine;
    private final TaskDispatcher dispatcher;
    private final TuiView view;
    private final KeySource keys;
    private long tick;

    public App(StateMachine machine, TaskDispatcher dispatcher, TuiView view, KeySource keys) {
        this.machine = machine;
        this.dispatcher = dispatcher;
        this.view = view;
        this.keys = keys;
    }

    public void run() throws InterruptedException {
        machine.start();
        try {
            while (!machine.isQuitting()) {
                view.render(machine.state(), machine.status(), tick);
                var key = keys.poll(FRAME);
                if (key != null) {
                    machine.handleKey(key);
                }
                for (var result : dispatcher.drain()) {
                    machine.handleResult(result);
                }
                tick++;
                machine.tick(Instant.now());
            }
        } finally {
            logger.debug("Control loop finished after {} frames", tick);
            view.shutdown();
        }
    }
}
