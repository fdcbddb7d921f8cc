package xyz.jphil.profile_resume.tools;

import java.io.PrintStream;

/**
 * Categorized log lines on stderr: {@code [CATEGORY] message}.
 * Everything but completion is shown only in verbose mode.
 */
public class LogFormatter {

    private final boolean verbose;
    private final PrintStream out;

    public LogFormatter(boolean verbose, PrintStream out) {
        this.verbose = verbose;
        this.out = out;
    }

    public boolean verbose() {
        return verbose;
    }

    public void info(String category, String message) {
        if (!verbose) return;
        print("", category, message);
    }

    public void success(String category, String message) {
        if (!verbose) return;
        print("✅ ", category, message);
    }

    public void warning(String category, String message) {
        if (!verbose) return;
        print("⚠️ ", category, message);
    }

    public void debug(String category, String message) {
        if (!verbose) return;
        print("🔍 ", category, message);
    }

    public void step(String category, String message) {
        if (!verbose) return;
        print("▶️ ", category, message);
    }

    /**
     * Always shown
     */
    public void complete(String category, String message) {
        print("🏁 ", category, message);
    }

    private void print(String icon, String category, String message) {
        out.printf("%s[%s] %s%n", icon, category, message);
    }

    public static LogFormatter standard(boolean verbose) {
        return new LogFormatter(verbose, System.err);
    }
}
