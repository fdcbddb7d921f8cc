package xyz.jphil.profile_resume.layout;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.Vocabulary;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.SectionKind;
import xyz.jphil.profile_resume.parse.TextRules;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Assigns lines to sections. Each column keeps its own active section, switched by heading
 * lines, so a sidebar can hold "Top Skills" while the main column is inside "Experience".
 * Lines seen in a column before its first heading are dropped.
 */
@RequiredArgsConstructor
public class SectionClassifier {

    private final Vocabulary vocabulary;
    private final TextRules rules;

    public Sections classify(List<Line> lines, OptionalDouble split) {
        var bySection = new EnumMap<SectionKind, List<Line>>(SectionKind.class);
        var cursors = new EnumMap<Column, ColumnCursor>(Column.class);
        for (var column : Column.values()) {
            cursors.put(column, new ColumnCursor());
        }

        for (var line : lines) {
            if (rules.isFooter(line.text())) continue;
            var cursor = cursors.get(Column.of(line, split));
            var heading = headingOf(line.text());
            if (heading.isPresent()) {
                cursor.active = heading;
                continue;
            }
            cursor.active.ifPresent(kind ->
                bySection.computeIfAbsent(kind, k -> new ArrayList<>()).add(line));
        }
        return new Sections(bySection);
    }

    /**
     * Section a line opens, if it is a known heading that also has a heading's shape
     */
    public Optional<SectionKind> headingOf(String text) {
        if (!rules.looksLikeHeading(text)) return Optional.empty();
        return vocabulary.sectionFor(text);
    }

    private static final class ColumnCursor {
        Optional<SectionKind> active = Optional.empty();
    }
}
