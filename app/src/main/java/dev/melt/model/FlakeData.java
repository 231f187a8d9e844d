package dev.melt.model;

import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of a flake's metadata.
 *
 * @param path resolved flake directory
 * @param description flake description, if declared
 * @param inputs direct inputs sorted case-insensitively by name
 */
public record FlakeData(Path path, @Nullable String description, List<FlakeInput> inputs) {
    public FlakeData {
        inputs = List.copyOf(inputs);
    }
}
