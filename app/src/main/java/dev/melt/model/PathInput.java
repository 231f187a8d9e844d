package dev.melt.model;

/** Local path input; no remote to check. */
public record PathInput(String name, String path) implements FlakeInput {
    @Override
    public String typeDisplay() {
        return "path";
    }
}
