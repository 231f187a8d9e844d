package dev.melt.cli;

import dev.melt.app.App;
import dev.melt.app.Key;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes raw terminal input into {@link Key}s on a daemon thread so the control loop can poll with a timeout.
 */
public final class KeyReader implements App.KeySource {
    private static final Logger logger = LogManager.getLogger(KeyReader.class);

    private static final int ESCAPE = 27;
    private static final char BACKSPACE = '\b';
    private static final int DELETE = 127;
    private static final long ESCAPE_WAIT_MILLIS = 30;

    private final BufferedReader reader;
    private final LinkedBlockingQueue<Key> keys = new LinkedBlockingQueue<>();
    private volatile boolean running = true;

    public KeyReader(Reader inputReader) {
        Objects.requireNonNull(inputReader, "inputReader");
        this.reader = inputReader instanceof BufferedReader br ? br : new BufferedReader(inputReader);
    }

    public void start() {
        var t = new Thread(this::readLoop, "melt-keys");
        t.setDaemon(true);
        t.start();
    }

    public void stop() {
        running = false;
    }

    @Override
    public @Nullable Key poll(Duration timeout) throws InterruptedException {
        return keys.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void readLoop() {
        try {
            decode();
        } catch (IOException e) {
            logger.warn("Input error: {}", e.getMessage());
        }
    }

    /** Reads until end of input, queueing every decoded key. */
    void decode() throws IOException {
        var skipNextLineFeed = false;
        int code;
        while (running && (code = reader.read()) != -1) {
            if (skipNextLineFeed) {
                skipNextLineFeed = false;
                if (code == '\n') {
                    continue;
                }
            }
            if (code == '\r') {
                keys.add(Key.of(Key.Code.ENTER));
                skipNextLineFeed = true;
                continue;
            }
            if (code == '\n') {
                keys.add(Key.of(Key.Code.ENTER));
                continue;
            }
            if (code == '\t') {
                keys.add(Key.of(Key.Code.TAB));
                continue;
            }
            if (code == BACKSPACE || code == DELETE) {
                keys.add(Key.of(Key.Code.BACKSPACE));
                continue;
            }
            if (code == ESCAPE) {
                handleEscapeSequence();
                continue;
            }
            if (code >= 1 && code <= 26) {
                keys.add(Key.ctrl((char) ('a' + code - 1)));
                continue;
            }
            var ch = (char) code;
            if (!Character.isISOControl(ch)) {
                keys.add(Key.of(ch));
            }
        }
    }

    private void handleEscapeSequence() throws IOException {
        if (!reader.ready()) {
            try {
                Thread.sleep(ESCAPE_WAIT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!reader.ready()) {
            keys.add(Key.of(Key.Code.ESCAPE));
            return;
        }
        reader.mark(2);
        var modifier = reader.read();
        if (modifier != '[' && modifier != 'O') {
            reader.reset();
            keys.add(Key.of(Key.Code.ESCAPE));
            return;
        }
        var code = reader.read();
        switch (code) {
            case 'A' -> keys.add(Key.of(Key.Code.UP));
            case 'B' -> keys.add(Key.of(Key.Code.DOWN));
            case -1 -> keys.add(Key.of(Key.Code.ESCAPE));
            default -> logger.debug("Ignoring escape sequence ending in {}", code);
        }
    }
}
