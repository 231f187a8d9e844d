package dev.melt.git;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.errors.NoRemoteRepositoryException;
import org.jetbrains.annotations.Nullable;

/** Maps JGit failures onto the {@link GitServiceException} family with user-facing messages. */
final class GitErrors {
    static final String CREDENTIAL_HINT =
            "load a key into your SSH agent (SSH_AUTH_SOCK) or set GITHUB_TOKEN for GitHub HTTPS remotes";

    private GitErrors() {}

    static GitServiceException classify(GitAPIException e, String url, String operation) {
        if (isAuthError(e)) {
            return new GitServiceException.AuthFailed("Authentication failed for " + url + ": " + CREDENTIAL_HINT, e);
        }
        if (isRepositoryNotFound(e)) {
            return new GitServiceException.RepositoryNotFound("Repository not found: " + url, e);
        }
        if (isNetworkError(e)) {
            return new GitServiceException.Network("Network error during " + operation + " of " + url, e);
        }
        return new GitServiceException.CloneFailed(
                "Failed to " + operation + " " + url + ": " + rootMessage(e), e);
    }

    static boolean isAuthError(@Nullable Throwable cause) {
        while (cause != null) {
            var msg = cause.getMessage();
            if (msg != null) {
                var lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("not authorized")
                        || lower.contains("authentication is required")
                        || lower.contains("auth fail")
                        || lower.contains("no more authentication methods")
                        || lower.contains("permission denied")
                        || lower.contains("credentialsprovider")) {
                    return true;
                }
            }
            cause = cause.getCause();
        }
        return false;
    }

    static boolean isRepositoryNotFound(@Nullable Throwable cause) {
        while (cause != null) {
            if (cause instanceof NoRemoteRepositoryException || cause instanceof InvalidRemoteException) {
                return true;
            }
            var msg = cause.getMessage();
            if (msg != null && msg.toLowerCase(Locale.ROOT).contains("repository not found")) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    static boolean isNetworkError(@Nullable Throwable cause) {
        while (cause != null) {
            if (cause instanceof UnknownHostException
                    || cause instanceof ConnectException
                    || cause instanceof SocketTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
