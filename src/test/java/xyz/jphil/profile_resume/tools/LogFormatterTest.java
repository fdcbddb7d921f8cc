package xyz.jphil.profile_resume.tools;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class LogFormatterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private LogFormatter formatter(boolean verbose) {
        return new LogFormatter(verbose, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void quietModeOnlyShowsCompletion() {
        var log = formatter(false);
        log.info("PDF", "loading");
        log.step("PDF", "loading");
        log.success("JSON", "written");
        log.warning("SIDECAR", "missing");
        log.debug("SECTION", "lines");
        log.complete("RESUME", "done");

        assertEquals("🏁 [RESUME] done" + System.lineSeparator(), output());
    }

    @Test
    void verboseModeShowsEverything() {
        var log = formatter(true);
        log.info("PDF", "1 pages");
        log.warning("SIDECAR", "Skipping missing file x.csv");

        var lines = output().split(System.lineSeparator());
        assertEquals("[PDF] 1 pages", lines[0]);
        assertTrue(lines[1].endsWith("[SIDECAR] Skipping missing file x.csv"));
        assertTrue(log.verbose());
    }
}
