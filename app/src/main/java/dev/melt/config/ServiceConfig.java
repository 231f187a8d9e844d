package dev.melt.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runtime settings shared by the nix and git services.
 *
 * @param timeouts per-category operation timeouts
 * @param gitConcurrency number of remote operations allowed in flight at once
 * @param githubToken token for GitHub API requests and HTTPS clones, if any
 * @param githubApiBase base URL of the GitHub REST API
 * @param forgeScheme URL scheme used for GitLab and SourceHut API hosts
 * @param nixExecutable name or path of the nix binary
 * @param cacheDir directory holding the bare mirrors
 */
public record ServiceConfig(
        Timeouts timeouts,
        int gitConcurrency,
        @Nullable String githubToken,
        String githubApiBase,
        String forgeScheme,
        String nixExecutable,
        Path cacheDir) {
    private static final Logger logger = LogManager.getLogger(ServiceConfig.class);

    public static final int DEFAULT_GIT_CONCURRENCY = 10;
    public static final String DEFAULT_GITHUB_API = "https://api.github.com";

    public ServiceConfig {
        if (gitConcurrency <= 0) {
            throw new IllegalArgumentException("gitConcurrency must be positive: " + gitConcurrency);
        }
        githubApiBase = githubApiBase.endsWith("/")
                ? githubApiBase.substring(0, githubApiBase.length() - 1)
                : githubApiBase;
    }

    /** Independent timeout per operation category. */
    public record Timeouts(Duration nixCommand, Duration gitUpdateCheck, Duration gitChangelog, Duration httpRequest) {
        public static Timeouts defaults() {
            return new Timeouts(
                    Duration.ofSeconds(120), Duration.ofSeconds(120), Duration.ofSeconds(120), Duration.ofSeconds(30));
        }
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig(
                Timeouts.defaults(),
                DEFAULT_GIT_CONCURRENCY,
                null,
                DEFAULT_GITHUB_API,
                "https",
                "nix",
                MeltPaths.defaults().getCacheDir());
    }

    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), MeltPaths.defaults());
    }

    static ServiceConfig fromEnvironment(Map<String, String> env, MeltPaths paths) {
        String token = firstNonBlank(env.get("GITHUB_TOKEN"), env.get("GH_TOKEN"));
        int concurrency = DEFAULT_GIT_CONCURRENCY;
        String raw = env.get("MELT_GIT_CONCURRENCY");
        if (raw != null && !raw.isBlank()) {
            try {
                int parsed = Integer.parseInt(raw.trim());
                if (parsed > 0) {
                    concurrency = parsed;
                } else {
                    logger.warn("Ignoring non-positive MELT_GIT_CONCURRENCY={}", raw);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid MELT_GIT_CONCURRENCY={}", raw);
            }
        }
        return new ServiceConfig(
                Timeouts.defaults(), concurrency, token, DEFAULT_GITHUB_API, "https", "nix", paths.getCacheDir());
    }

    public ServiceConfig withGitConcurrency(int concurrency) {
        return new ServiceConfig(
                timeouts, concurrency, githubToken, githubApiBase, forgeScheme, nixExecutable, cacheDir);
    }

    public ServiceConfig withCacheDir(Path dir) {
        return new ServiceConfig(timeouts, gitConcurrency, githubToken, githubApiBase, forgeScheme, nixExecutable, dir);
    }

    public ServiceConfig withTimeouts(Timeouts newTimeouts) {
        return new ServiceConfig(
                newTimeouts, gitConcurrency, githubToken, githubApiBase, forgeScheme, nixExecutable, cacheDir);
    }

    public ServiceConfig withForgeEndpoints(String apiBase, String scheme) {
        return new ServiceConfig(timeouts, gitConcurrency, githubToken, apiBase, scheme, nixExecutable, cacheDir);
    }

    public ServiceConfig withGithubToken(@Nullable String token) {
        return new ServiceConfig(timeouts, gitConcurrency, token, githubApiBase, forgeScheme, nixExecutable, cacheDir);
    }

    public ServiceConfig withNixExecutable(String executable) {
        return new ServiceConfig(timeouts, gitConcurrency, githubToken, githubApiBase, forgeScheme, executable, cacheDir);
    }

    private static @Nullable String firstNonBlank(@Nullable String... values) {
        for (var v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }
}
