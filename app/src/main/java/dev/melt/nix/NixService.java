package dev.melt.nix;

import dev.melt.config.ServiceConfig;
import dev.melt.model.FlakeData;
import dev.melt.util.CancellationToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@link NixOperations} backed by the {@code nix} executable. */
public final class NixService implements NixOperations {
    private static final Logger logger = LogManager.getLogger(NixService.class);

    private final String nixExecutable;
    private final Duration timeout;
    private final CancellationToken cancel;

    public NixService(ServiceConfig config, CancellationToken cancel) {
        this.nixExecutable = config.nixExecutable();
        this.timeout = config.timeouts().nixCommand();
        this.cancel = cancel;
    }

    @Override
    public FlakeData loadMetadata(Path path) throws NixException {
        var flakeDir = resolveFlakePath(path);
        var output = run(List.of("flake", "metadata", "--json", "--no-update-lock-file", flakeDir.toString()));
        return FlakeMetadataParser.parse(flakeDir, output);
    }

    @Override
    public void updateInputs(Path path, List<String> names) throws NixException {
        if (names.isEmpty()) {
            return;
        }
        var flakeDir = resolveFlakePath(path);
        var args = new ArrayList<String>();
        args.add("flake");
        args.add("update");
        args.addAll(names);
        args.add("--flake");
        args.add(flakeDir.toString());
        run(args);
    }

    @Override
    public void updateAll(Path path) throws NixException {
        var flakeDir = resolveFlakePath(path);
        run(List.of("flake", "update", "--flake", flakeDir.toString()));
    }

    @Override
    public void lockInput(Path path, String name, String locator) throws NixException {
        var flakeDir = resolveFlakePath(path);
        run(List.of("flake", "update", name, "--override-input", name, locator, "--flake", flakeDir.toString()));
    }

    /**
     * Maps a user-supplied location to the canonical flake directory. A path naming {@code flake.nix} resolves to
     * its parent; the directory must contain a {@code flake.nix}.
     */
    static Path resolveFlakePath(Path path) throws NixException.FlakeNotFound {
        var candidate = path.toString().isEmpty() ? Path.of(".") : path;
        var fileName = candidate.getFileName();
        if (fileName != null && fileName.toString().equals("flake.nix")) {
            var parent = candidate.toAbsolutePath().getParent();
            if (parent == null) {
                throw new NixException.FlakeNotFound(candidate);
            }
            candidate = parent;
        }
        Path resolved;
        try {
            resolved = candidate.toRealPath();
        } catch (IOException e) {
            throw new NixException.FlakeNotFound(candidate.toAbsolutePath().normalize());
        }
        if (!Files.isRegularFile(resolved.resolve("flake.nix"))) {
            throw new NixException.FlakeNotFound(resolved);
        }
        return resolved;
    }

    private String run(List<String> args) throws NixException {
        if (cancel.isCancelled()) {
            throw new NixException.Cancelled();
        }
        var command = new ArrayList<String>(args.size() + 1);
        command.add(nixExecutable);
        command.addAll(args);
        logger.info("Running {}", String.join(" ", command));

        var pb = new ProcessBuilder(command);
        pb.redirectInput(ProcessBuilder.Redirect.from(Path.of("/dev/null").toFile()));
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new NixException.CommandFailed("Failed to start " + nixExecutable + ": " + e.getMessage(), e);
        }

        var stdout = new ByteArrayOutputStream();
        var stderr = new ByteArrayOutputStream();
        var outThread = new Thread(() -> copyFully(p.getInputStream(), stdout), "nix-stdout");
        var errThread = new Thread(() -> copyFully(p.getErrorStream(), stderr), "nix-stderr");
        outThread.setDaemon(true);
        errThread.setDaemon(true);
        outThread.start();
        errThread.start();

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                logger.warn("nix {} timed out after {}", args.get(0) + " " + args.get(1), timeout);
                throw new NixException.Timeout("Command timed out after " + timeout.toSeconds() + "s");
            }
            outThread.join(1000);
            errThread.join(1000);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new NixException.Cancelled();
        }

        if (cancel.isCancelled()) {
            throw new NixException.Cancelled();
        }
        int exit = p.exitValue();
        if (exit != 0) {
            var err = stderr.toString(StandardCharsets.UTF_8).trim();
            logger.warn("nix exited with {}: {}", exit, err);
            throw new NixException.CommandFailed(err.isEmpty() ? "nix exited with status " + exit : err);
        }
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private static void copyFully(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            in.transferTo(out);
        } catch (IOException e) {
            logger.debug("Stream from nix closed early: {}", e.getMessage());
        }
    }
}
