package dev.melt.app;

import dev.melt.model.ChangelogData;
import dev.melt.model.FlakeData;
import dev.melt.model.GitInput;
import dev.melt.model.UpdateStatus;
import org.jetbrains.annotations.Nullable;

/** Message from a background task to the control loop. Failures carry a display message. */
public sealed interface TaskResult {

    record FlakeLoaded(FlakeData flake) implements TaskResult {}

    record FlakeLoadFailed(String message) implements TaskResult {}

    /** @param error null on success */
    record UpdateComplete(@Nullable String error) implements TaskResult {}

    record ChangelogLoaded(long requestId, GitInput input, ChangelogData data) implements TaskResult {}

    record ChangelogFailed(long requestId, String message) implements TaskResult {}

    /** @param error null on success */
    record LockComplete(@Nullable String error) implements TaskResult {}

    /** @param generation the update-check pass that produced this status */
    record InputStatus(long generation, String name, UpdateStatus status) implements TaskResult {}
}
