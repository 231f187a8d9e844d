package dev.melt.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServiceConfigTest {

    private static final MeltPaths PATHS = MeltPaths.forBaseDir(Path.of("/tmp/melt-test"));

    @Test
    void defaultsFromEmptyEnvironment() {
        var config = ServiceConfig.fromEnvironment(Map.of(), PATHS);
        assertEquals(ServiceConfig.DEFAULT_GIT_CONCURRENCY, config.gitConcurrency());
        assertNull(config.githubToken());
        assertEquals("https://api.github.com", config.githubApiBase());
        assertEquals("nix", config.nixExecutable());
        assertEquals(PATHS.getCacheDir(), config.cacheDir());
        assertEquals(Duration.ofSeconds(120), config.timeouts().nixCommand());
        assertEquals(Duration.ofSeconds(30), config.timeouts().httpRequest());
    }

    @Test
    void githubTokenTakesPrecedenceOverGhToken() {
        assertEquals(
                "primary",
                ServiceConfig.fromEnvironment(Map.of("GITHUB_TOKEN", "primary", "GH_TOKEN", "secondary"), PATHS)
                        .githubToken());
        assertEquals(
                "secondary",
                ServiceConfig.fromEnvironment(Map.of("GITHUB_TOKEN", "  ", "GH_TOKEN", " secondary\n"), PATHS)
                        .githubToken());
    }

    @Test
    void invalidConcurrencyFallsBackToDefault() {
        assertEquals(4, ServiceConfig.fromEnvironment(Map.of("MELT_GIT_CONCURRENCY", "4"), PATHS).gitConcurrency());
        assertEquals(10, ServiceConfig.fromEnvironment(Map.of("MELT_GIT_CONCURRENCY", "0"), PATHS).gitConcurrency());
        assertEquals(10, ServiceConfig.fromEnvironment(Map.of("MELT_GIT_CONCURRENCY", "lots"), PATHS).gitConcurrency());
    }

    @Test
    void withersReplaceSingleFields() {
        var base = ServiceConfig.fromEnvironment(Map.of(), PATHS);
        var changed = base.withGitConcurrency(2).withForgeEndpoints("http://127.0.0.1:9999/", "http");
        assertEquals(2, changed.gitConcurrency());
        assertEquals("http://127.0.0.1:9999", changed.githubApiBase());
        assertEquals("http", changed.forgeScheme());
        assertEquals(base.cacheDir(), changed.cacheDir());
    }

    @Test
    void concurrencyMustBePositive() {
        var base = ServiceConfig.fromEnvironment(Map.of(), PATHS);
        assertThrows(IllegalArgumentException.class, () -> base.withGitConcurrency(0));
    }
}
