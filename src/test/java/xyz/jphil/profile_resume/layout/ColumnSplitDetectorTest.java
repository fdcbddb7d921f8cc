package xyz.jphil.profile_resume.layout;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.model.Line;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.profile_resume.LineFixtures.line;

public class ColumnSplitDetectorTest {

    private final ColumnSplitDetector detector = new ColumnSplitDetector(ParserSettings.defaults());

    private static List<Line> twoColumns(int perColumn, double leftEdge, double rightEdge) {
        var lines = new ArrayList<Line>();
        for (int i = 0; i < perColumn; i++) {
            lines.add(line("Sidebar " + i, i * 12, leftEdge));
            lines.add(line("Main " + i, i * 12, rightEdge));
        }
        return lines;
    }

    @Test
    void splitIsMidpointOfWidestGap() {
        var split = detector.detect(twoColumns(20, 30, 250));
        assertTrue(split.isPresent());
        assertEquals(140, split.getAsDouble(), 1e-9);
    }

    @Test
    void shortDocumentsStaySingleColumn() {
        var lines = twoColumns(20, 30, 250);
        lines.remove(lines.size() - 1);
        assertTrue(detector.detect(lines).isEmpty());
    }

    @Test
    void gapMustExceedThreshold() {
        assertTrue(detector.detect(twoColumns(20, 30, 110)).isEmpty());
        assertEquals(70.5, detector.detect(twoColumns(20, 30, 111)).getAsDouble(), 1e-9);
    }

    @Test
    void detectionCanBeSwitchedOff() {
        var singleColumn = new ColumnSplitDetector(ParserSettings.defaults().withDetectColumns(false));
        assertTrue(singleColumn.detect(twoColumns(20, 30, 250)).isEmpty());
    }
}
