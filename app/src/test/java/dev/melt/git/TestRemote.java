package dev.melt.git;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.TimeZone;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;

/** A local non-bare repository used as the remote of a mirror. Commits get strictly increasing timestamps. */
final class TestRemote implements AutoCloseable {
    private final Git git;
    private final Path dir;
    private long clockSeconds = 1_700_000_000L;
    private int counter;

    private TestRemote(Git git, Path dir) {
        this.git = git;
        this.dir = dir;
    }

    static TestRemote init(Path dir) throws GitAPIException {
        var git = Git.init().setDirectory(dir.toFile()).setInitialBranch("main").call();
        return new TestRemote(git, dir);
    }

    /** Commits a new file and returns the commit id. */
    String commit(String message) throws Exception {
        counter++;
        clockSeconds += 60;
        Files.writeString(dir.resolve("file" + counter + ".txt"), message);
        git.add().addFilepattern(".").call();
        var ident = new PersonIdent("Test Author", "test@example.com", new Date(clockSeconds * 1000), TimeZone.getTimeZone("UTC"));
        return git.commit()
                .setMessage(message + "\n\nBody of " + message)
                .setAuthor(ident)
                .setCommitter(ident)
                .setSign(false)
                .call()
                .getName();
    }

    void createBranch(String name) throws GitAPIException {
        git.branchCreate().setName(name).call();
    }

    void checkout(String name) throws GitAPIException {
        git.checkout().setName(name).call();
    }

    String url() {
        return dir.toUri().toString();
    }

    @Override
    public void close() {
        git.close();
    }
}
