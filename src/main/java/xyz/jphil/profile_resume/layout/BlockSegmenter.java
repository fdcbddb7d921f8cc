package xyz.jphil.profile_resume.layout;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.parse.TaggedLine;
import xyz.jphil.profile_resume.parse.TextRules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits the lines of one section into entry blocks.
 */
@RequiredArgsConstructor
public class BlockSegmenter {

    private static final int ENTRY_START_MAX_LENGTH = 60;
    private static final Pattern TRAILING_YEAR = Pattern.compile("^\\d{4}\\)?$");
    private static final Pattern PAREN_YEAR = Pattern.compile("\\(\\d{4}");
    private static final Pattern TITLE_AT_COMPANY = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);

    private final TextRules rules;
    private final ParserSettings settings;

    /**
     * Gap-based split: a new block starts when the vertical gap exceeds the block gap factor
     * times the median line height. Blocks that read as a continuation (bullet, achievements
     * label, footer, orphaned duration) are folded back into the previous block.
     */
    public List<List<Line>> split(List<Line> lines) {
        var blocks = new ArrayList<List<Line>>();
        if (lines.isEmpty()) return blocks;

        double threshold = medianHeight(lines) * settings.blockGapFactor();
        var current = new ArrayList<Line>();
        current.add(lines.get(0));
        double lastBottom = lines.get(0).bottom();
        for (var line : lines.subList(1, lines.size())) {
            if (line.top() - lastBottom > threshold) {
                blocks.add(current);
                current = new ArrayList<>();
            }
            current.add(line);
            lastBottom = line.bottom();
        }
        blocks.add(current);

        var merged = new ArrayList<List<Line>>();
        for (var block : blocks) {
            if (!merged.isEmpty() && isContinuation(block)) {
                merged.get(merged.size() - 1).addAll(block);
            } else {
                merged.add(new ArrayList<>(block));
            }
        }
        return merged;
    }

    /**
     * Experience split driven by entry starts: a short plain line followed, within the lookahead
     * window, by a date range or a bare duration. A new block only opens once the current one has
     * its date, so a multi-line header stays together. When a role line follows a company that
     * carried an overall duration, that company line is repeated at the head of the new block.
     */
    public List<List<Line>> splitExperience(List<Line> lines) {
        var cleaned = lines.stream()
            .filter(l -> !l.text().isBlank() && !rules.isFooter(l.text()))
            .toList();
        var tags = cleaned.stream().map(l -> rules.tag(l.text())).toList();

        var blocks = new ArrayList<List<Line>>();
        var current = new ArrayList<Line>();
        boolean currentHasDate = false;
        Line lastCompany = null;
        for (int idx = 0; idx < cleaned.size(); idx++) {
            var line = cleaned.get(idx);
            if (isEntryStart(tags, idx) && (current.isEmpty() || currentHasDate)) {
                if (!current.isEmpty()) {
                    blocks.add(current);
                    current = new ArrayList<>();
                    currentHasDate = false;
                }
                if (lastCompany != null && isPositionOnlyStart(tags, idx)
                        && !TITLE_AT_COMPANY.matcher(line.text()).find()) {
                    current.add(lastCompany);
                }
            }
            current.add(line);
            if (tags.get(idx).dateRange()) currentHasDate = true;
            if (isCompanyLine(tags, idx)) lastCompany = line;
        }
        if (!current.isEmpty()) blocks.add(current);
        return blocks;
    }

    /**
     * Education split: institution line, then an optional degree line (with a wrapped trailing
     * year folded in), then any date-only lines.
     */
    public List<List<Line>> splitEducation(List<Line> lines) {
        var cleaned = lines.stream()
            .filter(l -> !l.text().isBlank() && !rules.isFooter(l.text()))
            .toList();
        var dates = rules.dates();
        var blocks = new ArrayList<List<Line>>();
        int i = 0;
        while (i < cleaned.size()) {
            var line = cleaned.get(i++);
            if (dates.isDateOnly(line.text()) && !blocks.isEmpty()) {
                blocks.get(blocks.size() - 1).add(line);
                continue;
            }
            var block = new ArrayList<Line>();
            block.add(line);
            if (i < cleaned.size() && !dates.isDateOnly(cleaned.get(i).text())
                    && looksLikeDegreeLine(cleaned.get(i).text())) {
                var degree = cleaned.get(i++);
                if (i < cleaned.size() && TRAILING_YEAR.matcher(cleaned.get(i).text().strip()).matches()) {
                    degree = degree.withText(degree.text().strip() + " " + cleaned.get(i++).text().strip());
                }
                block.add(degree);
            }
            while (i < cleaned.size() && dates.isDateOnly(cleaned.get(i).text())) {
                block.add(cleaned.get(i++));
            }
            blocks.add(block);
        }
        return blocks;
    }

    /**
     * Contains a date, a parenthesized year, or a degree keyword
     */
    public boolean looksLikeDegreeLine(String text) {
        return rules.dates().hasRange(text)
            || PAREN_YEAR.matcher(text).find()
            || rules.hasDegreeKeyword(text);
    }

    boolean isContinuation(List<Line> block) {
        var texts = block.stream().map(l -> l.text().strip()).filter(t -> !t.isEmpty()).toList();
        if (texts.isEmpty()) return false;
        var first = texts.get(0);
        if (first.toLowerCase(Locale.ROOT).startsWith("achievements") || rules.vocabulary().isAchievementLabel(first)) {
            return true;
        }
        if (rules.isBullet(first) || rules.isFooter(first)) return true;
        boolean hasRange = texts.stream().anyMatch(rules.dates()::hasRange);
        return !hasRange && texts.stream().anyMatch(rules::isDuration);
    }

    double medianHeight(List<Line> lines) {
        var heights = lines.stream()
            .mapToDouble(Line::height)
            .filter(h -> h > 0)
            .sorted()
            .toArray();
        if (heights.length == 0) return settings.fallbackLineHeight();
        int mid = heights.length / 2;
        return heights.length % 2 == 0 ? (heights[mid - 1] + heights[mid]) / 2 : heights[mid];
    }

    private boolean isEntryStart(List<TaggedLine> tags, int idx) {
        var tag = tags.get(idx);
        if (tag.isBlank() || tag.achievementLabel() || tag.bullet() || tag.dateRange() || tag.duration()) {
            return false;
        }
        if (tag.text().length() > ENTRY_START_MAX_LENGTH) return false;
        if (idx + 1 >= tags.size()) return false;

        var next = tags.get(idx + 1);
        if (next.duration()) return true;
        if (next.dateRange()) {
            return idx == 0 || !tags.get(idx - 1).duration();
        }
        for (int offset = 2; offset <= settings.entryLookahead() && idx + offset < tags.size(); offset++) {
            var between = tags.get(idx + offset - 1);
            if (between.duration() || between.dateRange() || between.bullet()) return false;
            if (tags.get(idx + offset).dateRange()) return true;
        }
        return false;
    }

    private boolean isPositionOnlyStart(List<TaggedLine> tags, int idx) {
        if (tags.get(idx).dateRange() || idx + 1 >= tags.size()) return false;
        boolean prevDuration = idx > 0 && tags.get(idx - 1).duration();
        return tags.get(idx + 1).dateRange() && !prevDuration;
    }

    private boolean isCompanyLine(List<TaggedLine> tags, int idx) {
        return idx + 1 < tags.size() && tags.get(idx + 1).duration();
    }
}
