package dev.melt.app;

/** A decoded key press. {@code ch} is meaningful only for {@link Code#CHAR}. */
public record Key(Code code, char ch, boolean ctrl) {

    public enum Code {
        CHAR,
        ENTER,
        ESCAPE,
        UP,
        DOWN,
        TAB,
        BACKSPACE
    }

    public static Key of(char ch) {
        return new Key(Code.CHAR, ch, false);
    }

    public static Key of(Code code) {
        return new Key(code, '\0', false);
    }

    public static Key ctrl(char ch) {
        return new Key(Code.CHAR, Character.toLowerCase(ch), true);
    }

    public boolean isChar(char c) {
        return code == Code.CHAR && !ctrl && ch == c;
    }

    /** {@code q}, escape or ctrl-c. */
    public boolean isQuit() {
        return isChar('q') || code == Code.ESCAPE || isCtrlC();
    }

    public boolean isCtrlC() {
        return code == Code.CHAR && ctrl && ch == 'c';
    }
}
