package dev.melt.app;

import dev.melt.model.FlakeData;
import dev.melt.model.FlakeInput;
import dev.melt.model.UpdateStatus;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/** Mutable state of the input list. Only touched from the control thread. */
public final class ListState {
    private FlakeData flake;
    private int cursor;
    private final TreeSet<Integer> selected = new TreeSet<>();
    private final Map<String, UpdateStatus> statuses = new HashMap<>();
    private boolean busy;

    public ListState(FlakeData flake) {
        this.flake = flake;
    }

    public FlakeData flake() {
        return flake;
    }

    public List<FlakeInput> inputs() {
        return flake.inputs();
    }

    public int inputCount() {
        return flake.inputs().size();
    }

    public int cursor() {
        return cursor;
    }

    public void cursorDown() {
        if (cursor < inputCount() - 1) {
            cursor++;
        }
    }

    public void cursorUp() {
        if (cursor > 0) {
            cursor--;
        }
    }

    public Optional<FlakeInput> currentInput() {
        return cursor < inputCount() ? Optional.of(flake.inputs().get(cursor)) : Optional.empty();
    }

    public boolean isSelected(int index) {
        return selected.contains(index);
    }

    public void toggleSelection() {
        if (inputCount() == 0) {
            return;
        }
        if (!selected.remove(cursor)) {
            selected.add(cursor);
        }
    }

    public void clearSelection() {
        selected.clear();
    }

    public boolean hasSelection() {
        return !selected.isEmpty();
    }

    /** Names of the selected inputs in list order. */
    public List<String> selectedNames() {
        var names = new ArrayList<String>(selected.size());
        for (int i : selected) {
            if (i < inputCount()) {
                names.add(flake.inputs().get(i).name());
            }
        }
        return names;
    }

    public UpdateStatus status(String inputName) {
        return statuses.getOrDefault(inputName, UpdateStatus.UNKNOWN);
    }

    public void setStatus(String inputName, UpdateStatus status) {
        statuses.put(inputName, status);
    }

    public boolean isBusy() {
        return busy;
    }

    public void setBusy(boolean busy) {
        this.busy = busy;
    }

    /**
     * Replaces the snapshot after a reload: clears busy and stale statuses, clamps the cursor and drops selections
     * past the end of the new list.
     */
    public void updateFlake(FlakeData newFlake) {
        this.flake = newFlake;
        this.busy = false;
        if (cursor >= inputCount()) {
            cursor = Math.max(0, inputCount() - 1);
        }
        selected.removeIf(i -> i >= inputCount());
        statuses.clear();
    }
}
