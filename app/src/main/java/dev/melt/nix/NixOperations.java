package dev.melt.nix;

import dev.melt.model.FlakeData;
import java.nio.file.Path;
import java.util.List;

/** Operations on a flake that go through the nix command line. */
public interface NixOperations {

    /** Reads the flake's metadata without touching its lock file. */
    FlakeData loadMetadata(Path path) throws NixException;

    /** Updates the named inputs to their latest revisions. A no-op for an empty list. */
    void updateInputs(Path path, List<String> names) throws NixException;

    void updateAll(Path path) throws NixException;

    /** Pins {@code name} to {@code locator}, a flake reference such as {@code github:owner/repo/<rev>}. */
    void lockInput(Path path, String name, String locator) throws NixException;
}
