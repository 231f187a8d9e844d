package dev.melt.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Puts the controlling terminal into raw mode through {@code stty} and restores it afterwards. */
public final class TerminalMode implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TerminalMode.class);

    public record Size(int columns, int rows) {}

    private final @Nullable String savedSettings;

    private TerminalMode(@Nullable String savedSettings) {
        this.savedSettings = savedSettings;
    }

    /** Saves the current settings and switches to raw, no-echo input. */
    public static TerminalMode enterRaw() {
        var saved = stty("-g");
        if (saved == null) {
            logger.warn("Could not read terminal settings; keys may echo");
            return new TerminalMode(null);
        }
        stty("raw -echo");
        return new TerminalMode(saved.trim());
    }

    /** Current terminal size, or 100x30 when it cannot be determined. */
    public static Size size() {
        var out = stty("size");
        if (out != null) {
            var parts = out.trim().split("\\s+");
            if (parts.length == 2) {
                try {
                    return new Size(Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
                } catch (NumberFormatException e) {
                    logger.debug("Unexpected stty size output: {}", out);
                }
            }
        }
        return new Size(100, 30);
    }

    @Override
    public void close() {
        if (savedSettings != null) {
            stty(savedSettings);
        }
    }

    private static @Nullable String stty(String args) {
        var pb = new ProcessBuilder(List.of("/bin/sh", "-c", "stty " + args + " < /dev/tty"));
        pb.redirectErrorStream(true);
        try {
            var p = pb.start();
            var output = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (!p.waitFor(2, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                return null;
            }
            return p.exitValue() == 0 ? output : null;
        } catch (IOException e) {
            logger.debug("stty {} failed: {}", args, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}
