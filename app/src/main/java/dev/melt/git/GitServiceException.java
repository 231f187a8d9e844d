package dev.melt.git;

/**
 * Failure of a remote check, changelog fetch or mirror operation. Every subclass carries a message suitable for the
 * status bar.
 */
public abstract sealed class GitServiceException extends Exception {

    protected GitServiceException(String message) {
        super(message);
    }

    protected GitServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Transport-level failure talking to a forge or remote. */
    public static final class Network extends GitServiceException {
        public Network(String message) {
            super(message);
        }

        public Network(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The provider refused the request because the API quota is exhausted. */
    public static final class RateLimited extends GitServiceException {
        public RateLimited(String message) {
            super(message);
        }
    }

    /** The ref to compare against does not exist in the remote. */
    public static final class RevisionNotFound extends GitServiceException {
        public RevisionNotFound(String message) {
            super(message);
        }
    }

    public static final class AuthFailed extends GitServiceException {
        public AuthFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class RepositoryNotFound extends GitServiceException {
        public RepositoryNotFound(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class CloneFailed extends GitServiceException {
        public CloneFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Local mirror cache could not be created, opened or read. */
    public static final class CacheError extends GitServiceException {
        public CacheError(String message) {
            super(message);
        }

        public CacheError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The input carries nothing a remote check could be made against. */
    public static final class Unsupported extends GitServiceException {
        public Unsupported(String message) {
            super(message);
        }
    }

    public static final class Timeout extends GitServiceException {
        public Timeout(String message) {
            super(message);
        }
    }

    /** The user cancelled the batch; never shown as an error. */
    public static final class Cancelled extends GitServiceException {
        public Cancelled() {
            super("Operation cancelled");
        }
    }
}
