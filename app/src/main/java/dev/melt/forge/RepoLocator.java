package dev.melt.forge;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Extracts owner, repository and host from the URL forms found in flake lock files: {@code git+https://...},
 * {@code ssh://git@host/...}, scp-style {@code git@host:owner/repo.git} and {@code file://} paths.
 */
public final class RepoLocator {
    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final Joiner OWNER_JOINER = Joiner.on('/');
    private static final List<String> SCHEMES = List.of("https://", "http://", "ssh://", "file://");

    /**
     * @param owner everything before the last path segment, joined with '/'
     * @param repo last path segment without a trailing {@code .git}
     * @param host authority without credentials (and without the port for ssh remotes), or null for plain paths
     */
    public record Location(String owner, String repo, @Nullable String host) {}

    private RepoLocator() {}

    public static Optional<Location> parse(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        var rest = url.trim();
        if (rest.startsWith("git+")) {
            rest = rest.substring(4);
        }
        rest = cutAt(rest, '?');
        rest = cutAt(rest, '#');

        String host = null;
        String path = null;
        for (var scheme : SCHEMES) {
            if (rest.startsWith(scheme)) {
                var afterScheme = rest.substring(scheme.length());
                int slash = afterScheme.indexOf('/');
                var authority = slash >= 0 ? afterScheme.substring(0, slash) : afterScheme;
                path = slash >= 0 ? afterScheme.substring(slash + 1) : "";
                host = hostOf(authority, scheme.startsWith("http"));
                break;
            }
        }
        if (path == null) {
            int colon = rest.indexOf(':');
            int at = rest.indexOf('@');
            if (at >= 0 && colon > at) {
                host = hostOf(rest.substring(0, colon), false);
                path = rest.substring(colon + 1);
            } else if (rest.contains("://")) {
                return Optional.empty();
            } else {
                path = rest;
            }
        }

        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }
        var segments = PATH_SPLITTER.splitToList(path);
        if (segments.size() < 2) {
            return Optional.empty();
        }
        var repo = segments.get(segments.size() - 1);
        var owner = OWNER_JOINER.join(segments.subList(0, segments.size() - 1));
        return Optional.of(new Location(owner, repo, host == null || host.isEmpty() ? null : host));
    }

    private static String hostOf(String authority, boolean keepPort) {
        var hostPart = authority;
        int at = hostPart.lastIndexOf('@');
        if (at >= 0) {
            hostPart = hostPart.substring(at + 1);
        }
        int colon = hostPart.indexOf(':');
        if (colon >= 0 && !keepPort) {
            hostPart = hostPart.substring(0, colon);
        }
        return hostPart;
    }

    private static String cutAt(String s, char c) {
        int idx = s.indexOf(c);
        return idx >= 0 ? s.substring(0, idx) : s;
    }
}
