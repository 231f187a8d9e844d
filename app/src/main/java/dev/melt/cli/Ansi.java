package dev.melt.cli;

import java.io.PrintStream;
import java.util.Objects;

public final class Ansi {
    private static final String CLEAR_SCREEN = "\u001b[2J";
    private static final String CURSOR_HOME = "\u001b[H";
    private static final String HIDE_CURSOR = "\u001b[?25l";
    private static final String SHOW_CURSOR = "\u001b[?25h";
    private static final String ALT_SCREEN_ON = "\u001b[?1049h";
    private static final String ALT_SCREEN_OFF = "\u001b[?1049l";

    static final String RESET = "\u001b[0m";
    static final String BOLD = "\u001b[1m";
    static final String DIM = "\u001b[2m";
    static final String REVERSE = "\u001b[7m";
    static final String RED = "\u001b[31m";
    static final String GREEN = "\u001b[32m";
    static final String YELLOW = "\u001b[33m";
    static final String BLUE = "\u001b[34m";
    static final String CYAN = "\u001b[36m";
    static final String CLEAR_TO_EOL = "\u001b[K";

    private Ansi() {}

    public static void clearScreen(PrintStream out) {
        Objects.requireNonNull(out, "out");
        out.print(CLEAR_SCREEN);
    }

    public static void home(PrintStream out) {
        Objects.requireNonNull(out, "out");
        out.print(CURSOR_HOME);
    }

    public static void reset(PrintStream out) {
        Objects.requireNonNull(out, "out");
        out.print(RESET);
    }

    /** Switches to the alternate screen buffer and hides the cursor. */
    public static void enterFullScreen(PrintStream out) {
        Objects.requireNonNull(out, "out");
        out.print(ALT_SCREEN_ON);
        out.print(HIDE_CURSOR);
        out.flush();
    }

    public static void leaveFullScreen(PrintStream out) {
        Objects.requireNonNull(out, "out");
        out.print(RESET);
        out.print(SHOW_CURSOR);
        out.print(ALT_SCREEN_OFF);
        out.flush();
    }

    static String styled(String style, String text) {
        return style + text + RESET;
    }
}
