package dev.melt.app;

import dev.melt.model.ChangelogData;
import dev.melt.model.Commit;
import dev.melt.model.GitInput;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Changelog screen for one input, holding the list state it was opened from. */
public final class ChangelogState {
    private final GitInput input;
    private final ChangelogData data;
    private final ListState parent;
    private int cursor;
    private @Nullable Integer confirmLock;

    public ChangelogState(GitInput input, ChangelogData data, ListState parent) {
        this.input = input;
        this.data = data;
        this.parent = parent;
        this.cursor = data.lockedIndex().orElse(0);
    }

    public GitInput input() {
        return input;
    }

    public ChangelogData data() {
        return data;
    }

    public ListState parent() {
        return parent;
    }

    public int cursor() {
        return cursor;
    }

    public void cursorDown() {
        if (cursor < data.commits().size() - 1) {
            cursor++;
        }
    }

    public void cursorUp() {
        if (cursor > 0) {
            cursor--;
        }
    }

    /** Asks for confirmation to lock the commit under the cursor. */
    public void showConfirm() {
        if (!data.commits().isEmpty()) {
            confirmLock = cursor;
        }
    }

    public void hideConfirm() {
        confirmLock = null;
    }

    public boolean isConfirming() {
        return confirmLock != null;
    }

    public Optional<Commit> confirmTarget() {
        if (confirmLock == null || confirmLock >= data.commits().size()) {
            return Optional.empty();
        }
        return Optional.of(data.commits().get(confirmLock));
    }
}
