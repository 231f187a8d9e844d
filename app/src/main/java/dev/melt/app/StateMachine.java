package dev.melt.app;

import dev.melt.git.GitOperations;
import dev.melt.git.GitServiceException;
import dev.melt.model.GitInput;
import dev.melt.model.StatusMessage;
import dev.melt.nix.NixException;
import dev.melt.nix.NixOperations;
import dev.melt.util.CancellationToken;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the application state. Every method is called from the control thread only; background work is handed to
 * the {@link TaskDispatcher} and its outcome comes back through {@link #handleResult(TaskResult)}.
 */
public final class StateMachine {
    private static final Logger logger = LogManager.getLogger(StateMachine.class);

    private final Path flakePath;
    private final NixOperations nix;
    private final GitOperations git;
    private final CancellationToken cancel;
    private final TaskDispatcher dispatcher;

    private AppState state = AppState.LOADING;
    private @Nullable StatusMessage status;
    private long generation;
    private long changelogRequests;

    public StateMachine(
            Path flakePath,
            NixOperations nix,
            GitOperations git,
            CancellationToken cancel,
            TaskDispatcher dispatcher) {
        this.flakePath = flakePath;
        this.nix = nix;
        this.git = git;
        this.cancel = cancel;
        this.dispatcher = dispatcher;
    }

    public AppState state() {
        return state;
    }

    public @Nullable StatusMessage status() {
        return status;
    }

    public boolean isQuitting() {
        return state instanceof AppState.Quitting;
    }

    /** Current pass number of the update checker; statuses from older passes are dropped. */
    public long generation() {
        return generation;
    }

    public void start() {
        spawnLoadFlake();
    }

    public void handleKey(Key key) {
        execute(KeyHandler.handle(state, key));
    }

    /** Drops the status message once it has expired. */
    public void tick(Instant now) {
        if (status != null && status.isExpired(now)) {
            status = null;
        }
    }

    void execute(Action action) {
        if (action instanceof Action.None) {
            return;
        }
        logger.debug("Executing {}", action);
        if (action instanceof Action.Quit) {
            state = AppState.QUITTING;
        } else if (action instanceof Action.CancelAndQuit) {
            cancel.cancel();
            state = AppState.QUITTING;
        } else if (action instanceof Action.UpdateSelected update) {
            var list = listView();
            if (list == null) {
                return;
            }
            list.setBusy(true);
            status = StatusMessage.info("Updating " + update.names().size() + " input(s)...");
            spawnUpdate(update.names());
        } else if (action instanceof Action.UpdateAll) {
            var list = listView();
            if (list == null) {
                return;
            }
            list.setBusy(true);
            status = StatusMessage.info("Updating all inputs...");
            spawnUpdate(List.of());
        } else if (action instanceof Action.Refresh) {
            var list = listView();
            if (list != null) {
                list.setBusy(true);
            }
            status = StatusMessage.info("Refreshing...");
            spawnLoadFlake();
        } else if (action instanceof Action.OpenChangelog open) {
            openChangelog(open.inputIndex());
        } else if (action instanceof Action.CloseChangelog) {
            if (state instanceof AppState.ChangelogView cv) {
                state = new AppState.ListView(cv.changelog().parent());
            }
        } else if (action instanceof Action.ConfirmLock lock) {
            if (state instanceof AppState.ChangelogView cv) {
                cv.changelog().parent().setBusy(true);
                cv.changelog().hideConfirm();
                status = StatusMessage.info("Locking " + lock.inputName() + " to " + lock.shortSha() + "...");
                spawnLock(lock.inputName(), lock.lockUrl());
            }
        } else if (action instanceof Action.ShowWarning warning) {
            status = StatusMessage.warning(warning.message());
        }
    }

    private void openChangelog(int index) {
        var list = listView();
        if (list == null || index < 0 || index >= list.inputCount()) {
            return;
        }
        if (!(list.inputs().get(index) instanceof GitInput input)) {
            return;
        }
        list.setBusy(true);
        long requestId = ++changelogRequests;
        state = new AppState.LoadingChangelog(list, requestId);
        status = StatusMessage.info("Loading changelog...");
        dispatcher.spawn(
                "changelog " + input.name(),
                sink -> {
                    try {
                        return new TaskResult.ChangelogLoaded(requestId, input, git.getChangelog(input));
                    } catch (GitServiceException e) {
                        return new TaskResult.ChangelogFailed(requestId, e.getMessage());
                    }
                },
                e -> new TaskResult.ChangelogFailed(requestId, String.valueOf(e.getMessage())));
    }

    public void handleResult(TaskResult result) {
        if (result instanceof TaskResult.FlakeLoaded loaded) {
            onFlakeLoaded(loaded);
        } else if (result instanceof TaskResult.FlakeLoadFailed failed) {
            if (!isQuitting()) {
                state = new AppState.ErrorScreen("Failed to load flake: " + failed.message());
            }
        } else if (result instanceof TaskResult.UpdateComplete update) {
            var list = ownedList();
            if (update.error() == null) {
                status = StatusMessage.success("Update complete");
                if (list != null) {
                    list.clearSelection();
                }
                spawnLoadFlake();
            } else {
                status = StatusMessage.error("Update failed: " + update.error());
                if (list != null) {
                    list.setBusy(false);
                }
            }
        } else if (result instanceof TaskResult.ChangelogLoaded loaded) {
            if (state instanceof AppState.LoadingChangelog lc && lc.requestId() == loaded.requestId()) {
                lc.list().setBusy(false);
                state = new AppState.ChangelogView(new ChangelogState(loaded.input(), loaded.data(), lc.list()));
                status = null;
            } else {
                logger.debug("Ignoring stale changelog for {}", loaded.input().name());
            }
        } else if (result instanceof TaskResult.ChangelogFailed failed) {
            if (state instanceof AppState.LoadingChangelog lc && lc.requestId() == failed.requestId()) {
                lc.list().setBusy(false);
                state = new AppState.ListView(lc.list());
                status = StatusMessage.error("Failed to load changelog: " + failed.message());
            }
        } else if (result instanceof TaskResult.LockComplete lock) {
            onLockComplete(lock);
        } else if (result instanceof TaskResult.InputStatus inputStatus) {
            if (inputStatus.generation() != generation) {
                return;
            }
            var list = ownedList();
            if (list != null) {
                list.setStatus(inputStatus.name(), inputStatus.status());
            }
        }
    }

    private void onFlakeLoaded(TaskResult.FlakeLoaded loaded) {
        var flake = loaded.flake();
        if (state instanceof AppState.ListView lv) {
            lv.list().updateFlake(flake);
        } else if (state instanceof AppState.Loading) {
            state = new AppState.ListView(new ListState(flake));
        } else {
            logger.debug("Ignoring flake load in state {}", state.getClass().getSimpleName());
            return;
        }
        if (status != null && status.level() == StatusMessage.Level.INFO) {
            status = null;
        }
        long pass = ++generation;
        dispatcher.spawn(
                "check updates",
                sink -> {
                    git.checkUpdates(
                            flake.inputs(), (name, s) -> sink.accept(new TaskResult.InputStatus(pass, name, s)));
                    return null;
                },
                e -> null);
    }

    /** Applied wherever the list lives: the changelog may have been closed while the lock was running. */
    private void onLockComplete(TaskResult.LockComplete lock) {
        var list = ownedList();
        if (list == null) {
            return;
        }
        if (lock.error() == null) {
            status = StatusMessage.success("Locked successfully");
            list.setBusy(true);
            if (state instanceof AppState.ChangelogView) {
                state = new AppState.ListView(list);
            }
            spawnLoadFlake();
        } else {
            status = StatusMessage.error("Lock failed: " + lock.error());
            list.setBusy(false);
            if (state instanceof AppState.ChangelogView cv) {
                cv.changelog().hideConfirm();
            }
        }
    }

    private @Nullable ListState listView() {
        return state instanceof AppState.ListView lv ? lv.list() : null;
    }

    /** The list state wherever it currently lives. */
    private @Nullable ListState ownedList() {
        if (state instanceof AppState.ListView lv) {
            return lv.list();
        } else if (state instanceof AppState.LoadingChangelog lc) {
            return lc.list();
        } else if (state instanceof AppState.ChangelogView cv) {
            return cv.changelog().parent();
        }
        return null;
    }

    private void spawnLoadFlake() {
        dispatcher.spawn(
                "load flake",
                sink -> {
                    try {
                        return new TaskResult.FlakeLoaded(nix.loadMetadata(flakePath));
                    } catch (NixException e) {
                        return new TaskResult.FlakeLoadFailed(e.getMessage());
                    }
                },
                e -> new TaskResult.FlakeLoadFailed(String.valueOf(e.getMessage())));
    }

    /** Updates the named inputs, or every input when {@code names} is empty. */
    private void spawnUpdate(List<String> names) {
        var path = currentFlakePath();
        dispatcher.spawn(
                "update",
                sink -> {
                    try {
                        if (names.isEmpty()) {
                            nix.updateAll(path);
                        } else {
                            nix.updateInputs(path, names);
                        }
                        return new TaskResult.UpdateComplete(null);
                    } catch (NixException e) {
                        return new TaskResult.UpdateComplete(e.getMessage());
                    }
                },
                e -> new TaskResult.UpdateComplete(String.valueOf(e.getMessage())));
    }

    private void spawnLock(String name, String lockUrl) {
        var path = currentFlakePath();
        dispatcher.spawn(
                "lock " + name,
                sink -> {
                    try {
                        nix.lockInput(path, name, lockUrl);
                        return new TaskResult.LockComplete(null);
                    } catch (NixException e) {
                        return new TaskResult.LockComplete(e.getMessage());
                    }
                },
                e -> new TaskResult.LockComplete(String.valueOf(e.getMessage())));
    }

    private Path currentFlakePath() {
        var list = ownedList();
        return list == null ? flakePath : list.flake().path();
    }
}
