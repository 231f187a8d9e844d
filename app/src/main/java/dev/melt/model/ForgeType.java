package dev.melt.model;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Git hosting provider family of a {@link GitInput}. Resolved once when metadata is parsed and selects the
 * {@code ForgeClient} strategy.
 */
public enum ForgeType {
    GITHUB,
    GITLAB,
    SOURCEHUT,
    CODEBERG,
    GITEA,
    GENERIC;

    public static final String DEFAULT_GITLAB_HOST = "gitlab.com";
    public static final String DEFAULT_SOURCEHUT_HOST = "git.sr.ht";
    public static final String DEFAULT_GITEA_HOST = "gitea.com";

    /**
     * Resolves the forge from the lock file's declared input type. Plain {@code git} inputs are sniffed by URL
     * substring.
     */
    public static ForgeType resolve(String declaredType, @Nullable String url) {
        return switch (declaredType) {
            case "github" -> GITHUB;
            case "gitlab" -> GITLAB;
            case "sourcehut" -> SOURCEHUT;
            case "git" -> sniff(url == null ? "" : url);
            default -> GENERIC;
        };
    }

    static ForgeType sniff(String url) {
        var lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("github.com")) {
            return GITHUB;
        } else if (lower.contains("gitlab")) {
            return GITLAB;
        } else if (lower.contains("sr.ht") || lower.contains("sourcehut")) {
            return SOURCEHUT;
        } else if (lower.contains("codeberg.org")) {
            return CODEBERG;
        } else if (lower.contains("gitea") || lower.contains("forgejo")) {
            return GITEA;
        }
        return GENERIC;
    }

    /**
     * HTTPS clone URL for the repository, or an empty string when it cannot be built from the locator alone
     * ({@link #GENERIC}).
     */
    public String cloneUrl(String owner, String repo, @Nullable String host) {
        return switch (this) {
            case GITHUB -> "https://github.com/" + owner + "/" + repo + ".git";
            case GITLAB -> "https://" + orDefault(host, DEFAULT_GITLAB_HOST) + "/" + owner + "/" + repo + ".git";
            case SOURCEHUT -> "https://" + orDefault(host, DEFAULT_SOURCEHUT_HOST) + "/" + tilde(owner) + "/" + repo;
            case CODEBERG -> "https://codeberg.org/" + owner + "/" + repo + ".git";
            case GITEA -> "https://" + orDefault(host, DEFAULT_GITEA_HOST) + "/" + owner + "/" + repo + ".git";
            case GENERIC -> "";
        };
    }

    /**
     * Flake locator pinning the repository to {@code rev}, suitable for {@code --override-input}. Empty for
     * {@link #GENERIC}: callers treat that as "locking unsupported".
     */
    public String lockUrl(String owner, String repo, String rev, @Nullable String host) {
        return switch (this) {
            case GITHUB -> "github:" + owner + "/" + repo + "/" + rev;
            case GITLAB -> {
                if (host == null || host.equals(DEFAULT_GITLAB_HOST)) {
                    yield "gitlab:" + owner + "/" + repo + "/" + rev;
                }
                yield "git+https://" + host + "/" + owner + "/" + repo + "?rev=" + rev;
            }
            case SOURCEHUT -> "sourcehut:" + tilde(owner) + "/" + repo + "/" + rev;
            case CODEBERG -> "git+https://codeberg.org/" + owner + "/" + repo + "?rev=" + rev;
            case GITEA -> "git+https://" + orDefault(host, DEFAULT_GITEA_HOST) + "/" + owner + "/" + repo + "?rev="
                    + rev;
            case GENERIC -> "";
        };
    }

    /** SourceHut owners are addressed as {@code ~user}. */
    public static String tilde(String owner) {
        return owner.startsWith("~") ? owner : "~" + owner;
    }

    private static String orDefault(@Nullable String host, String fallback) {
        return host == null || host.isBlank() ? fallback : host;
    }
}
