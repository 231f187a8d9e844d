package dev.melt.nix;

import java.nio.file.Path;

/** Failure running nix or interpreting its output. */
public abstract sealed class NixException extends Exception {

    protected NixException(String message) {
        super(message);
    }

    protected NixException(String message, Throwable cause) {
        super(message, cause);
    }

    /** No {@code flake.nix} at the requested location. */
    public static final class FlakeNotFound extends NixException {
        private final Path path;

        public FlakeNotFound(Path path) {
            super("No flake.nix found at " + path);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /** nix exited with a non-zero status or could not be started; the message is its trimmed stderr. */
    public static final class CommandFailed extends NixException {
        public CommandFailed(String message) {
            super(message);
        }

        public CommandFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class MetadataParse extends NixException {
        public MetadataParse(String message, Throwable cause) {
            super("Failed to parse flake metadata: " + message, cause);
        }
    }

    public static final class Timeout extends NixException {
        public Timeout(String message) {
            super(message);
        }
    }

    public static final class Cancelled extends NixException {
        public Cancelled() {
            super("Operation cancelled");
        }
    }
}
