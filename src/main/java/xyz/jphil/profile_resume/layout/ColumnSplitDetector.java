package xyz.jphil.profile_resume.layout;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.model.Line;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Finds the boundary of a two-column layout from the distribution of line left edges.
 * The boundary is the midpoint of the widest gap between sorted left edges, accepted only when
 * that gap exceeds the configured column gap and the document has enough lines to judge.
 */
@RequiredArgsConstructor
public class ColumnSplitDetector {

    private final ParserSettings settings;

    public OptionalDouble detect(List<Line> lines) {
        if (!settings.detectColumns() || lines.size() < settings.minLinesForColumns()) {
            return OptionalDouble.empty();
        }
        var lefts = lines.stream().mapToDouble(Line::left).sorted().toArray();
        double widest = 0;
        int at = -1;
        for (int i = 0; i + 1 < lefts.length; i++) {
            double gap = lefts[i + 1] - lefts[i];
            if (gap >= widest) {
                widest = gap;
                at = i;
            }
        }
        if (at < 0 || widest <= settings.columnSplitGap()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((lefts[at] + lefts[at + 1]) / 2);
    }
}
