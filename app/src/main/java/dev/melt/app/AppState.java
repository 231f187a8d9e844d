package dev.melt.app;

/**
 * Top-level screen state. The {@link ListState} is owned by exactly one state at a time: it moves into
 * {@link LoadingChangelog} and {@link ChangelogView} when a changelog is opened and back when it closes.
 */
public sealed interface AppState {

    AppState LOADING = new Loading();
    AppState QUITTING = new Quitting();

    record Loading() implements AppState {}

    record ErrorScreen(String message) implements AppState {}

    record ListView(ListState list) implements AppState {}

    /** @param requestId identifies the changelog request whose result may leave this state */
    record LoadingChangelog(ListState list, long requestId) implements AppState {}

    record ChangelogView(ChangelogState changelog) implements AppState {}

    record Quitting() implements AppState {}
}
