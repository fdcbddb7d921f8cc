package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.layout.BlockSegmenter;
import xyz.jphil.profile_resume.model.EducationEntry;
import xyz.jphil.profile_resume.model.Line;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Education section parser: institution line, optional degree line, dates from anywhere in the block
 */
@RequiredArgsConstructor
public class EducationParser {

    private static final Pattern PAREN_WITH_YEAR = Pattern.compile("\\s*\\([^)]*?\\d{4}[^)]*\\)?");
    private static final Pattern IN = Pattern.compile("\\s+in\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final TextRules rules;
    private final BlockSegmenter segmenter;

    public List<EducationEntry> parse(List<Line> lines) {
        var entries = new ArrayList<EducationEntry>();
        for (var block : segmenter.splitEducation(lines)) {
            var texts = rules.contentTexts(block.stream().map(Line::text).toList(), false, false);
            if (texts.isEmpty()) continue;

            var dates = rules.dates().parseRange(rules.dates().findDateLine(texts));
            var cleaned = texts.stream().filter(t -> !rules.dates().isDateOnly(t)).toList();
            var institution = cleaned.isEmpty() ? "" : cleaned.get(0);
            var degree = parseDegree(cleaned.size() > 1 ? cleaned.get(1) : "");

            var entry = new EducationEntry(institution, degree.studyType(), degree.area(), dates.start(), dates.end());
            if (!entry.isEmpty()) entries.add(entry);
        }
        return entries;
    }

    /**
     * Split a degree line into study type and area.
     * "Master of Science - MS, Computer Science · (2015 - 2017)" gives
     * ("Master of Science - MS", "Computer Science"); "BSc in Physics" gives ("BSc", "Physics").
     */
    public Degree parseDegree(String line) {
        if (line == null || line.isBlank()) return Degree.NONE;
        var text = PAREN_WITH_YEAR.matcher(line).replaceAll("");
        text = rules.dates().removeRanges(text.replace('·', ' '));
        text = SPACES.matcher(text).replaceAll(" ").strip();
        if (text.isEmpty()) return Degree.NONE;

        int comma = text.indexOf(',');
        if (comma >= 0) {
            var left = text.substring(0, comma).strip();
            var right = text.substring(comma + 1).strip();
            if (rules.hasDegreeKeyword(left)) return new Degree(left, right);
            if (rules.hasDegreeKeyword(right)) return new Degree(right, left);
        }
        var parts = IN.split(text, 2);
        if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
            return new Degree(parts[0].strip(), parts[1].strip());
        }
        return new Degree(text, "");
    }

    public record Degree(String studyType, String area) {
        static final Degree NONE = new Degree("", "");
    }
}
