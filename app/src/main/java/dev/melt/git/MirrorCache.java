package dev.melt.git;

import dev.melt.util.CancellationToken;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.TransportCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.transport.SshSessionFactory;
import org.eclipse.jgit.transport.SshTransport;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.transport.sshd.JGitKeyCache;
import org.eclipse.jgit.transport.sshd.SshdSessionFactoryBuilder;
import org.eclipse.jgit.util.FS;
import org.eclipse.jgit.util.FileUtils;
import org.jetbrains.annotations.Nullable;

/**
 * Persistent store of bare mirrors, one per clone URL. Entries are created on first use, fetched on every later
 * use and never evicted.
 */
public final class MirrorCache {
    private static final Logger logger = LogManager.getLogger(MirrorCache.class);

    private final Path cacheDir;
    private final @Nullable String githubToken;
    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
    private volatile @Nullable SshSessionFactory sshSessionFactory;

    public MirrorCache(Path cacheDir, @Nullable String githubToken) {
        this.cacheDir = cacheDir;
        this.githubToken = githubToken;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    /**
     * Deterministic mirror location for a URL: up to 32 filename-safe characters of the URL followed by a
     * SHA-256 prefix of the full URL.
     */
    public Path cachePath(String url) {
        var safe = new StringBuilder();
        for (int i = 0; i < url.length() && safe.length() < 32; i++) {
            char c = url.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                safe.append(c);
            }
        }
        return cacheDir.resolve(safe + "_" + sha256Prefix(url));
    }

    /**
     * Opens the mirror for {@code url} and fetches {@code origin}, or clones a new bare mirror when none exists.
     * Operations on the same mirror are serialized. The caller owns the returned repository and must close it.
     *
     * @param reference branch or tag to use as the mirror's HEAD on clone, or null for the remote default
     */
    public Repository ensureRepo(String url, @Nullable String reference, CancellationToken cancel)
            throws GitServiceException {
        if (cancel.isCancelled()) {
            throw new GitServiceException.Cancelled();
        }
        var path = cachePath(url);
        var lock = locks.computeIfAbsent(path, p -> new ReentrantLock());
        lock.lock();
        try {
            if (cancel.isCancelled()) {
                throw new GitServiceException.Cancelled();
            }
            if (Files.isDirectory(path)) {
                return fetch(path, url);
            }
            return cloneMirror(path, url, reference);
        } finally {
            lock.unlock();
        }
    }

    private Repository fetch(Path path, String url) throws GitServiceException {
        Git git;
        try {
            git = Git.open(path.toFile());
        } catch (IOException e) {
            throw new GitServiceException.CacheError("Cannot open cached mirror " + path + ": " + e.getMessage(), e);
        }
        try {
            logger.debug("Fetching {} into {}", url, path);
            var fetch = git.fetch().setRemote("origin");
            applyCredentials(fetch, url);
            fetch.call();
            return git.getRepository();
        } catch (GitAPIException e) {
            git.close();
            logger.warn("Fetch of {} failed: {}", url, e.getMessage());
            throw GitErrors.classify(e, url, "fetch");
        } catch (RuntimeException e) {
            git.close();
            throw e;
        }
    }

    private Repository cloneMirror(Path path, String url, @Nullable String reference) throws GitServiceException {
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new GitServiceException.CacheError("Cannot create cache directory " + cacheDir, e);
        }
        logger.info("Cloning {} into {}", url, path);
        var clone = Git.cloneRepository().setURI(url).setDirectory(path.toFile()).setBare(true);
        if (reference != null && !reference.isBlank() && !reference.equals("HEAD")) {
            clone.setBranch(reference);
        }
        applyCredentials(clone, url);
        try {
            var git = clone.call();
            return git.getRepository();
        } catch (GitAPIException | RuntimeException e) {
            logger.warn("Clone of {} failed: {}", url, e.getMessage());
            deletePartial(path);
            if (e instanceof GitAPIException gae) {
                throw GitErrors.classify(gae, url, "clone");
            }
            throw new GitServiceException.CloneFailed("Failed to clone " + url + ": " + e.getMessage(), e);
        }
    }

    private void deletePartial(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            FileUtils.delete(path.toFile(), FileUtils.RECURSIVE | FileUtils.RETRY | FileUtils.SKIP_MISSING);
        } catch (IOException e) {
            logger.error("Could not remove partial mirror {}: {}", path, e.getMessage(), e);
        }
    }

    private void applyCredentials(TransportCommand<?, ?> command, String url) {
        command.setTransportConfigCallback(transport -> {
            if (transport instanceof SshTransport sshTransport) {
                sshTransport.setSshSessionFactory(sshFactory());
            }
        });
        if (githubToken != null && isGitHubHttpsUrl(url)) {
            command.setCredentialsProvider(new UsernamePasswordCredentialsProvider("token", githubToken));
        }
    }

    private SshSessionFactory sshFactory() {
        var factory = sshSessionFactory;
        if (factory == null) {
            synchronized (this) {
                factory = sshSessionFactory;
                if (factory == null) {
                    File home = FS.DETECTED.userHome();
                    factory = new SshdSessionFactoryBuilder()
                            .setHomeDirectory(home)
                            .setSshDirectory(new File(home, ".ssh"))
                            .build(new JGitKeyCache());
                    sshSessionFactory = factory;
                }
            }
        }
        return factory;
    }

    static boolean isGitHubHttpsUrl(String url) {
        return url.startsWith("https://github.com/");
    }

    private static String sha256Prefix(String url) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
