package dev.melt.cli;

import dev.melt.app.App;
import dev.melt.app.StateMachine;
import dev.melt.app.TaskDispatcher;
import dev.melt.config.MeltPaths;
import dev.melt.config.ServiceConfig;
import dev.melt.forge.ForgeHttp;
import dev.melt.git.GitService;
import dev.melt.nix.NixService;
import dev.melt.util.CancellationToken;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

// No static logger here: Log4j must not initialize before the log directory and level are set.
@CommandLine.Command(
        name = "melt",
        mixinStandardHelpOptions = true,
        versionProvider = MeltCli.VersionProvider.class,
        description = "Browse, check and update the inputs of a Nix flake.")
public final class MeltCli implements Callable<Integer> {

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "FLAKE",
            defaultValue = ".",
            description = "Flake directory or flake.nix file (default: current directory).")
    private Path flakePath = Path.of(".");

    @CommandLine.Option(
            names = "--concurrency",
            description = "Maximum concurrent git operations (default: MELT_GIT_CONCURRENCY or 10).")
    @Nullable
    private Integer concurrency;

    @CommandLine.Option(names = "--cache-dir", description = "Directory for bare git mirrors.")
    @Nullable
    private Path cacheDir;

    @CommandLine.Option(
            names = "--log-level",
            defaultValue = "${env:MELT_LOG_LEVEL:-info}",
            description = "Log level for the log file (default: ${DEFAULT-VALUE}).")
    private String logLevel = "info";

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"melt " + ForgeHttp.version()};
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new MeltCli()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        if (concurrency != null && concurrency <= 0) {
            System.err.println("--concurrency must be positive");
            return 2;
        }
        if (System.console() == null) {
            System.err.println("melt needs an interactive terminal");
            return 1;
        }

        var paths = MeltPaths.defaults();
        try {
            paths.ensureDataDirExists();
        } catch (IOException e) {
            System.err.println("Cannot create " + paths.getDataDir() + ": " + e.getMessage());
            return 1;
        }
        System.setProperty("melt.logDir", paths.getDataDir().toString());
        System.setProperty("melt.logLevel", logLevel);
        var logger = LogManager.getLogger(MeltCli.class);

        var config = ServiceConfig.fromEnvironment();
        if (concurrency != null) {
            config = config.withGitConcurrency(concurrency);
        }
        if (cacheDir != null) {
            config = config.withCacheDir(cacheDir.toAbsolutePath());
        }
        logger.info(
                "Starting melt {} for {} (concurrency {}, cache {})",
                ForgeHttp.version(),
                flakePath,
                config.gitConcurrency(),
                config.cacheDir());

        var out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        var cancel = new CancellationToken();
        var keys = new KeyReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (var terminal = TerminalMode.enterRaw();
                var git = new GitService(config, cancel);
                var dispatcher = new TaskDispatcher()) {
            var nix = new NixService(config, cancel);
            var machine = new StateMachine(flakePath, nix, git, cancel, dispatcher);
            var view = new TuiConsole(out, TerminalMode::size);
            Ansi.enterFullScreen(out);
            keys.start();
            new App(machine, dispatcher, view, keys).run();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted; shutting down");
            return 130;
        } finally {
            cancel.cancel();
            keys.stop();
            logger.info("melt exited");
        }
    }
}
