package dev.melt.app;

import java.util.List;

/** What a key press asks the state machine to do beyond local cursor movement. */
public sealed interface Action {

    Action NONE = new None();

    record None() implements Action {}

    record Quit() implements Action {}

    record CancelAndQuit() implements Action {}

    record UpdateSelected(List<String> names) implements Action {}

    record UpdateAll() implements Action {}

    record Refresh() implements Action {}

    record OpenChangelog(int inputIndex) implements Action {}

    record CloseChangelog() implements Action {}

    record ConfirmLock(String inputName, String lockUrl, String shortSha) implements Action {}

    record ShowWarning(String message) implements Action {}
}
