package dev.melt.app;

import dev.melt.model.GitInput;

/**
 * Maps key presses to cursor movement (applied directly) and {@link Action}s (executed by the state machine).
 * Actions that start background work are suppressed while the list is busy.
 */
public final class KeyHandler {
    static final String NO_SELECTION = "No inputs selected";
    static final String CHANGELOG_GIT_ONLY = "Changelog only available for git inputs";
    static final String NO_LOCK_URL = "Cannot generate lock URL for this input";

    private KeyHandler() {}

    public static Action handle(AppState state, Key key) {
        if (key.isCtrlC() && !(state instanceof AppState.Loading) && !(state instanceof AppState.LoadingChangelog)) {
            return new Action.Quit();
        }
        if (state instanceof AppState.Loading || state instanceof AppState.LoadingChangelog) {
            return key.isQuit() ? new Action.CancelAndQuit() : Action.NONE;
        } else if (state instanceof AppState.ErrorScreen) {
            return new Action.Quit();
        } else if (state instanceof AppState.ListView lv) {
            return handleList(lv.list(), key);
        } else if (state instanceof AppState.ChangelogView cv) {
            var changelog = cv.changelog();
            return changelog.isConfirming() ? handleConfirm(changelog, key) : handleChangelog(changelog, key);
        }
        return Action.NONE;
    }

    private static Action handleList(ListState list, Key key) {
        if (list.inputCount() == 0) {
            return key.isQuit() ? new Action.Quit() : Action.NONE;
        }
        if (key.isChar('q') || key.code() == Key.Code.ESCAPE) {
            if (list.hasSelection()) {
                list.clearSelection();
                return Action.NONE;
            }
            return new Action.Quit();
        }
        if (key.isChar('j') || key.code() == Key.Code.DOWN) {
            list.cursorDown();
            return Action.NONE;
        }
        if (key.isChar('k') || key.code() == Key.Code.UP) {
            list.cursorUp();
            return Action.NONE;
        }
        if (key.isChar(' ')) {
            if (!list.isBusy()) {
                list.toggleSelection();
            }
            return Action.NONE;
        }
        if (list.isBusy()) {
            return Action.NONE;
        }
        if (key.isChar('u')) {
            var names = list.selectedNames();
            return names.isEmpty() ? new Action.ShowWarning(NO_SELECTION) : new Action.UpdateSelected(names);
        }
        if (key.isChar('U')) {
            return new Action.UpdateAll();
        }
        if (key.isChar('r')) {
            return new Action.Refresh();
        }
        if (key.isChar('c') || key.code() == Key.Code.ENTER) {
            var current = list.currentInput();
            if (current.isPresent() && current.get() instanceof GitInput) {
                return new Action.OpenChangelog(list.cursor());
            }
            return new Action.ShowWarning(CHANGELOG_GIT_ONLY);
        }
        return Action.NONE;
    }

    private static Action handleChangelog(ChangelogState changelog, Key key) {
        if (key.isChar('q') || key.code() == Key.Code.ESCAPE) {
            return new Action.CloseChangelog();
        }
        if (key.isChar('j') || key.code() == Key.Code.DOWN) {
            changelog.cursorDown();
        } else if (key.isChar('k') || key.code() == Key.Code.UP) {
            changelog.cursorUp();
        } else if (key.isChar(' ') && !changelog.parent().isBusy()) {
            changelog.showConfirm();
        }
        return Action.NONE;
    }

    private static Action handleConfirm(ChangelogState changelog, Key key) {
        if (key.isChar('y')) {
            if (changelog.parent().isBusy()) {
                return Action.NONE;
            }
            var target = changelog.confirmTarget();
            if (target.isEmpty()) {
                return Action.NONE;
            }
            var commit = target.get();
            var lockUrl = changelog.input().lockUrl(commit.sha());
            if (lockUrl.isEmpty()) {
                changelog.hideConfirm();
                return new Action.ShowWarning(NO_LOCK_URL);
            }
            return new Action.ConfirmLock(changelog.input().name(), lockUrl, commit.shortSha());
        }
        if (key.isChar('n') || key.isChar('q') || key.code() == Key.Code.ESCAPE) {
            changelog.hideConfirm();
        }
        return Action.NONE;
    }
}
