package dev.melt.app;

import dev.melt.model.StatusMessage;
import org.jetbrains.annotations.Nullable;

/** Render surface driven by the control loop. */
public interface TuiView {

    /** Draws one frame. {@code tick} advances once per frame and drives the spinner. */
    void render(AppState state, @Nullable StatusMessage status, long tick);

    void shutdown();
}
