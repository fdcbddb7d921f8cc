package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.layout.BlockSegmenter;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.ProjectEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects section parser: first line of a block is the name, a line holding only dates sets the
 * dates, everything else is the description.
 */
@RequiredArgsConstructor
public class ProjectParser {

    private final TextRules rules;
    private final BlockSegmenter segmenter;

    public List<ProjectEntry> parse(List<Line> lines) {
        var entries = new ArrayList<ProjectEntry>();
        for (var block : segmenter.split(lines)) {
            var texts = rules.contentTexts(block.stream().map(Line::text).toList(), false, false);
            if (texts.isEmpty()) continue;

            var name = texts.get(0);
            var dates = DateRange.EMPTY;
            var description = new ArrayList<String>();
            for (var text : texts.subList(1, texts.size())) {
                if (dates.isEmpty() && rules.dates().isDateOnly(text)) {
                    dates = rules.dates().parseRange(text);
                    continue;
                }
                description.add(text);
            }
            entries.add(new ProjectEntry(name, String.join(" ", description).strip(), "", dates.start(), dates.end()));
        }
        return entries;
    }
}
