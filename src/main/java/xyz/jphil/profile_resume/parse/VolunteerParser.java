package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.layout.BlockSegmenter;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.VolunteerEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Volunteer section parser. The first line is the position, or "position at organization";
 * otherwise the second line is the organization (cut at a "·" cause separator).
 */
@RequiredArgsConstructor
public class VolunteerParser {

    private static final Pattern AT = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);

    private final TextRules rules;
    private final BlockSegmenter segmenter;

    public List<VolunteerEntry> parse(List<Line> lines) {
        var entries = new ArrayList<VolunteerEntry>();
        for (var block : segmenter.split(lines)) {
            var texts = rules.contentTexts(block.stream().map(Line::text).toList(), true, true);
            if (texts.isEmpty()) continue;

            var dateLine = rules.dates().findDateLine(texts);
            var dates = rules.dates().parseRange(dateLine);
            var cleaned = texts.stream().filter(t -> !t.equals(dateLine)).toList();
            if (cleaned.isEmpty()) continue;

            String position;
            String organization;
            int summaryFrom;
            var parts = AT.split(cleaned.get(0), 2);
            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
                position = parts[0].strip();
                organization = parts[1].strip();
                summaryFrom = 1;
            } else {
                position = cleaned.get(0);
                organization = cleaned.size() > 1 ? cleaned.get(1).split("·", 2)[0].strip() : "";
                summaryFrom = 2;
            }
            var summary = cleaned.size() > summaryFrom
                ? String.join(" ", cleaned.subList(summaryFrom, cleaned.size())).strip()
                : "";

            var entry = new VolunteerEntry(organization, position, dates.start(), dates.end(), summary);
            if (!entry.isEmpty()) entries.add(entry);
        }
        return entries;
    }
}
