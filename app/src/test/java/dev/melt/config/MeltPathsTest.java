package dev.melt.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MeltPathsTest {

    @TempDir
    Path tmp;

    @Test
    void forBaseDirProducesCacheAndDataPaths() throws Exception {
        var paths = MeltPaths.forBaseDir(tmp);

        assertEquals(tmp.resolve("cache").resolve("git"), paths.getCacheDir());
        assertEquals("melt.log", paths.getLogFile().getFileName().toString());
        assertEquals(paths.getDataDir(), paths.getLogFile().getParent());

        Path created = paths.ensureDataDirExists();
        assertTrue(Files.isDirectory(created));
        // idempotent
        assertEquals(created, paths.ensureDataDirExists());
    }

    @Test
    void defaultsEndInMeltDirectories() {
        var paths = MeltPaths.defaults();
        assertEquals("git", paths.getCacheDir().getFileName().toString());
        assertEquals("melt", paths.getCacheDir().getParent().getFileName().toString());
        assertEquals("melt", paths.getDataDir().getFileName().toString());
    }
}
