package dev.melt.cli;

import dev.melt.app.AppState;
import dev.melt.app.ChangelogState;
import dev.melt.app.ListState;
import dev.melt.app.TuiView;
import dev.melt.model.Commit;
import dev.melt.model.FlakeInput;
import dev.melt.model.GitInput;
import dev.melt.model.StatusMessage;
import dev.melt.model.UpdateStatus;
import dev.melt.util.TimeFormat;
import java.io.PrintStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

/**
 * ANSI renderer for the melt terminal UI. A frame is only written when it differs from the previous one.
 */
public final class TuiConsole implements TuiView {
    private static final String SECTION_INDENT = "  ";
    private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};
    private static final int CHROME_LINES = 7;

    private final PrintStream out;
    private final Supplier<TerminalMode.Size> size;
    private final Object renderLock = new Object();
    private String lastFrame = "";

    public TuiConsole(PrintStream out, Supplier<TerminalMode.Size> size) {
        this.out = Objects.requireNonNull(out, "out");
        this.size = Objects.requireNonNull(size, "size");
    }

    @Override
    public void render(AppState state, @Nullable StatusMessage status, long tick) {
        var lines = frame(state, status, tick, size.get(), Instant.now());
        var frame = String.join("\r\n", lines);
        synchronized (renderLock) {
            if (frame.equals(lastFrame)) {
                return;
            }
            lastFrame = frame;
            Ansi.home(out);
            Ansi.clearScreen(out);
            out.print(frame);
            Ansi.reset(out);
            out.flush();
        }
    }

    @Override
    public void shutdown() {
        synchronized (renderLock) {
            Ansi.leaveFullScreen(out);
        }
    }

    /** Lines of one frame, without trailing line breaks. */
    static List<String> frame(
            AppState state, @Nullable StatusMessage status, long tick, TerminalMode.Size size, Instant now) {
        var lines = new ArrayList<String>();
        if (state instanceof AppState.Loading) {
            lines.add("");
            lines.add(SECTION_INDENT + spinner(tick) + " Loading flake...");
        } else if (state instanceof AppState.ErrorScreen error) {
            lines.add("");
            lines.add(SECTION_INDENT + Ansi.styled(Ansi.BOLD + Ansi.RED, "Error"));
            lines.add("");
            for (var line : error.message().split("\n")) {
                lines.add(SECTION_INDENT + line);
            }
            lines.add("");
            lines.add(SECTION_INDENT + Ansi.styled(Ansi.DIM, "Press any key to exit"));
        } else if (state instanceof AppState.ListView lv) {
            renderList(lines, lv.list(), tick, size, now);
            renderStatus(lines, status, tick, lv.list().isBusy());
            lines.add(Ansi.styled(
                    Ansi.DIM, "j/k move  space select  u update  U update all  c changelog  r refresh  q quit"));
        } else if (state instanceof AppState.LoadingChangelog lc) {
            renderList(lines, lc.list(), tick, size, now);
            renderStatus(lines, status, tick, true);
            lines.add(Ansi.styled(Ansi.DIM, "q cancel"));
        } else if (state instanceof AppState.ChangelogView cv) {
            renderChangelog(lines, cv.changelog(), size, now);
            renderStatus(lines, status, tick, cv.changelog().parent().isBusy());
            if (cv.changelog().isConfirming()) {
                var target = cv.changelog().confirmTarget();
                var sha = target.map(Commit::shortSha).orElse("?");
                lines.add(Ansi.styled(
                        Ansi.BOLD + Ansi.YELLOW,
                        "Lock " + cv.changelog().input().name() + " to " + sha + "? [y/n]"));
            } else {
                lines.add(Ansi.styled(Ansi.DIM, "j/k move  space lock to commit  q back"));
            }
        }
        return lines;
    }

    private static void renderList(List<String> lines, ListState list, long tick, TerminalMode.Size size, Instant now) {
        var flake = list.flake();
        lines.add(Ansi.styled(Ansi.BOLD, "melt") + "  " + flake.path());
        lines.add(flake.description() == null ? "" : Ansi.styled(Ansi.DIM, flake.description()));
        lines.add(Ansi.styled(
                Ansi.BOLD,
                String.format("    %-24s %-6s %-9s %-16s %s", "INPUT", "TYPE", "REV", "UPDATED", "STATUS")));
        if (list.inputCount() == 0) {
            lines.add(SECTION_INDENT + "(no inputs)");
            return;
        }
        int visible = Math.max(1, size.rows() - CHROME_LINES);
        int first = windowStart(list.cursor(), list.inputCount(), visible);
        for (int i = first; i < Math.min(list.inputCount(), first + visible); i++) {
            var input = list.inputs().get(i);
            var marker = list.isSelected(i) ? "[x]" : "[ ]";
            var row = String.format(
                    " %s %-24s %-6s %-9s %-16s %s",
                    marker,
                    truncate(input.name(), 24),
                    input.typeDisplay(),
                    input.shortRev().orElse("-"),
                    input.lastModified().map(t -> TimeFormat.relative(t, now)).orElse("-"),
                    statusCell(input, list.status(input.name()), tick));
            lines.add(i == list.cursor() ? Ansi.styled(Ansi.REVERSE, truncate(row, size.columns())) : truncate(row, size.columns()));
        }
    }

    private static void renderChangelog(List<String> lines, ChangelogState changelog, TerminalMode.Size size, Instant now) {
        var input = changelog.input();
        var data = changelog.data();
        lines.add(Ansi.styled(Ansi.BOLD, "Changelog: " + input.name()) + "  " + input.owner() + "/" + input.repo());
        var summary = data.lockedIndex().isPresent()
                ? data.commitsAhead() + " new commit(s) since locked revision"
                : data.commitsAhead() + " commit(s); locked revision not found";
        lines.add(Ansi.styled(Ansi.DIM, summary));
        lines.add(Ansi.styled(
                Ansi.BOLD, String.format("  %-8s %-7s %-18s %s", "SHA", "DATE", "AUTHOR", "MESSAGE")));
        if (data.commits().isEmpty()) {
            lines.add(SECTION_INDENT + "(no commits)");
            return;
        }
        int visible = Math.max(1, size.rows() - CHROME_LINES);
        int first = windowStart(changelog.cursor(), data.commits().size(), visible);
        for (int i = first; i < Math.min(data.commits().size(), first + visible); i++) {
            var commit = data.commits().get(i);
            var prefix = commit.locked() ? "*" : " ";
            var row = String.format(
                    "%s %-8s %-7s %-18s %s",
                    prefix,
                    commit.shortSha(),
                    TimeFormat.relativeShort(commit.date(), now),
                    truncate(commit.author(), 18),
                    commit.message());
            row = truncate(row, size.columns());
            if (i == changelog.cursor()) {
                lines.add(Ansi.styled(Ansi.REVERSE, row));
            } else if (commit.locked()) {
                lines.add(Ansi.styled(Ansi.CYAN, row));
            } else if (data.lockedIndex().isPresent() && i < data.lockedIndex().getAsInt()) {
                lines.add(Ansi.styled(Ansi.GREEN, row));
            } else {
                lines.add(Ansi.styled(Ansi.DIM, row));
            }
        }
    }

    private static void renderStatus(List<String> lines, @Nullable StatusMessage status, long tick, boolean busy) {
        if (status == null) {
            lines.add(busy ? spinner(tick) : "");
            return;
        }
        var color = switch (status.level()) {
            case INFO -> Ansi.BLUE;
            case SUCCESS -> Ansi.GREEN;
            case WARNING -> Ansi.YELLOW;
            case ERROR -> Ansi.RED;
        };
        var prefix = busy && status.level() == StatusMessage.Level.INFO ? spinner(tick) + " " : "";
        lines.add(prefix + Ansi.styled(color, status.text()));
    }

    private static String statusCell(FlakeInput input, UpdateStatus status, long tick) {
        if (!(input instanceof GitInput)) {
            return "";
        }
        if (status instanceof UpdateStatus.Checking) {
            return spinner(tick);
        } else if (status instanceof UpdateStatus.Behind) {
            return Ansi.styled(Ansi.YELLOW, status.display());
        } else if (status instanceof UpdateStatus.UpToDate) {
            return Ansi.styled(Ansi.GREEN, status.display());
        } else if (status instanceof UpdateStatus.Error error) {
            return Ansi.styled(Ansi.RED, status.display() + " " + truncate(error.reason(), 40));
        }
        return status.display();
    }

    static int windowStart(int cursor, int total, int visible) {
        if (total <= visible) {
            return 0;
        }
        int start = cursor - visible / 2;
        return Math.max(0, Math.min(start, total - visible));
    }

    private static String spinner(long tick) {
        return SPINNER[(int) ((tick / 5) % SPINNER.length)];
    }

    private static String truncate(String s, int max) {
        if (s.length() <= max) {
            return s;
        }
        return max <= 1 ? s.substring(0, max) : s.substring(0, max - 1) + "…";
    }
}
