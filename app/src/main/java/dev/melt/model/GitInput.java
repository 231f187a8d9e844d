package dev.melt.model;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Git-backed flake input hosted on one of the supported forges.
 *
 * @param name input name as declared in the flake
 * @param owner repository owner; may contain slashes for nested GitLab groups
 * @param repo repository name
 * @param forge provider family
 * @param host explicit host for self-hosted forges, or null for the provider default
 * @param reference branch or tag the input follows, or null for the remote HEAD
 * @param rev locked commit sha
 * @param lastModifiedEpoch unix timestamp of the locked revision
 * @param url display/source URL as found in the lock file
 */
public record GitInput(
        String name,
        String owner,
        String repo,
        ForgeType forge,
        @Nullable String host,
        @Nullable String reference,
        String rev,
        long lastModifiedEpoch,
        String url)
        implements FlakeInput {

    @Override
    public String typeDisplay() {
        return "git";
    }

    @Override
    public Optional<String> shortRev() {
        return Optional.of(FlakeInput.shorten(rev));
    }

    @Override
    public Optional<Long> lastModified() {
        return Optional.of(lastModifiedEpoch);
    }

    /** Ref to compare against, defaulting to the remote HEAD. */
    public String referenceOrHead() {
        return reference == null || reference.isBlank() ? "HEAD" : reference;
    }

    /** Provider clone URL; empty for {@link ForgeType#GENERIC}. */
    public String cloneUrl() {
        return forge.cloneUrl(owner, repo, host);
    }

    /** Provider lock locator for {@code rev}; empty when locking is unsupported. */
    public String lockUrl(String targetRev) {
        return forge.lockUrl(owner, repo, targetRev, host);
    }

    /**
     * URL the local mirror is cloned from. Generic inputs have no provider URL, so their own source URL is used
     * with the {@code git+} prefix and query removed. Empty when neither is available.
     */
    public String mirrorUrl() {
        var provider = cloneUrl();
        if (!provider.isEmpty()) {
            return provider;
        }
        var raw = url.startsWith("git+") ? url.substring(4) : url;
        int query = raw.indexOf('?');
        if (query >= 0) {
            raw = raw.substring(0, query);
        }
        return raw.contains("://") || raw.contains("@") ? raw : "";
    }

    /** True when {@code sha} is the locked revision, allowing either side to be abbreviated. */
    public boolean isLockedRev(String sha) {
        if (rev.isEmpty() || sha.isEmpty()) {
            return false;
        }
        return sha.equals(rev) || sha.startsWith(rev) || rev.startsWith(sha);
    }
}
