package dev.melt.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves per-user melt locations:
 * - git mirror cache directory
 * - data directory holding the log file
 *
 * Default resolution is platform-aware:
 * - Linux: $XDG_CACHE_HOME/melt/git or $HOME/.cache/melt/git, $XDG_DATA_HOME/melt or $HOME/.local/share/melt
 * - macOS: $HOME/Library/Caches/melt/git, $HOME/Library/Application Support/melt
 *
 * For tests and overrides use {@link #forBaseDir(Path)}.
 */
public final class MeltPaths {
    private final Path cacheDir;
    private final Path dataDir;

    private MeltPaths(Path cacheDir, Path dataDir) {
        this.cacheDir = Objects.requireNonNull(cacheDir);
        this.dataDir = Objects.requireNonNull(dataDir);
    }

    /**
     * Compute platform-appropriate defaults based on environment / system properties.
     */
    public static MeltPaths defaults() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        boolean isMac = os.contains("mac") || os.contains("darwin");
        Path home = Paths.get(System.getProperty("user.home"));

        if (isMac) {
            return new MeltPaths(
                    home.resolve("Library").resolve("Caches").resolve("melt").resolve("git"),
                    home.resolve("Library").resolve("Application Support").resolve("melt"));
        }

        String xdgCache = System.getenv("XDG_CACHE_HOME");
        Path cacheBase = xdgCache != null && !xdgCache.isBlank() ? Paths.get(xdgCache) : home.resolve(".cache");
        String xdgData = System.getenv("XDG_DATA_HOME");
        Path dataBase = xdgData != null && !xdgData.isBlank()
                ? Paths.get(xdgData)
                : home.resolve(".local").resolve("share");
        return new MeltPaths(cacheBase.resolve("melt").resolve("git"), dataBase.resolve("melt"));
    }

    /**
     * Create a paths object anchored at a single base directory. Useful for tests.
     */
    public static MeltPaths forBaseDir(Path baseDir) {
        return new MeltPaths(baseDir.resolve("cache").resolve("git"), baseDir.resolve("data"));
    }

    /** Directory holding the bare mirrors, e.g. ~/.cache/melt/git */
    public Path getCacheDir() {
        return cacheDir;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getLogFile() {
        return dataDir.resolve("melt.log");
    }

    /**
     * Ensure the data directory exists (creates parents as needed).
     */
    public Path ensureDataDirExists() throws IOException {
        if (!Files.exists(dataDir)) {
            Files.createDirectories(dataDir);
        }
        return dataDir;
    }
}
