package dev.melt.git;

import dev.melt.model.ChangelogData;
import dev.melt.model.FlakeInput;
import dev.melt.model.GitInput;
import dev.melt.model.UpdateStatus;
import java.util.List;
import java.util.function.BiConsumer;

/** Remote-facing operations the application drives from its worker tasks. */
public interface GitOperations {

    /**
     * Checks every git input for new commits, reporting {@code (name, status)} pairs as they become known. Blocks
     * until all started checks have reported.
     */
    void checkUpdates(List<FlakeInput> inputs, BiConsumer<String, UpdateStatus> onStatus);

    /** Commits ahead of the locked revision followed by the locked commit and its history. */
    ChangelogData getChangelog(GitInput input) throws GitServiceException;
}
