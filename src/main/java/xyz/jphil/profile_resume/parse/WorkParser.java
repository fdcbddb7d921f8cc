package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.layout.BlockSegmenter;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.WorkEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Experience section parser.
 * <p>
 * Within each entry block a date-range line is the pivot: the lines gathered before it form the
 * header (organization + position), the lines after it form the body (location, summary,
 * highlights). A header of one line is the position; the organization then carries over from the
 * previous entry, which is how several roles at one company are listed.
 */
@RequiredArgsConstructor
public class WorkParser {

    private static final Pattern AT = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);
    private static final List<String> COMPANY_SUFFIXES = List.of(" Oy", " Inc", " LLC", " Ltd", " GmbH", " S.A.", " AG", " SA");
    private static final int HEADER_MAX_LENGTH = 50;
    private static final int HEADER_DATE_LOOKAHEAD = 3;
    private static final int LOCATION_MAX_LENGTH = 60;
    private static final int SINGLE_WORD_LOCATION_MAX_LENGTH = 20;

    private final TextRules rules;
    private final BlockSegmenter segmenter;

    public List<WorkEntry> parse(List<Line> lines) {
        var scan = new Scan();
        boolean firstBlock = true;
        for (var block : segmenter.splitExperience(lines)) {
            var texts = block.stream().map(l -> l.text().strip()).filter(t -> !t.isEmpty()).toList();
            var tags = rules.tagAll(texts);
            if (!firstBlock) scan.returnPendingHeader();
            firstBlock = false;

            int pivot = firstPivot(tags);
            if (pivot < 0) {
                texts.forEach(scan::addUnplaced);
                continue;
            }
            texts.subList(0, pivot).forEach(scan.header::add);
            for (int i = pivot; i < texts.size(); i++) {
                var tag = tags.get(i);
                if (tag.dateRange()) {
                    scan.open(tag.text());
                } else if (tag.duration() && !scan.header.isEmpty()) {
                    scan.header.add(tag.text());
                } else if (looksLikeHeaderStart(tags, i)) {
                    scan.header.add(tag.text());
                } else {
                    scan.addUnplaced(tag.text());
                }
            }
        }
        scan.close();
        return scan.entries.stream()
            .filter(e -> !e.name().isEmpty() || !e.position().isEmpty())
            .toList();
    }

    /**
     * Header lines without durations and achievement labels. Employment types are dropped, or cut
     * off when they share a line with the organization ("Acme Corp · Full-time").
     */
    List<String> cleanHeader(List<String> header) {
        var cleaned = new ArrayList<String>();
        for (var text : header) {
            if (text.isBlank() || rules.vocabulary().isAchievementLabel(text) || rules.isDuration(text)) continue;
            if (rules.isEmploymentType(text)) {
                text = Stream.of(text.split("·"))
                    .map(String::strip)
                    .filter(part -> !part.isEmpty() && !rules.isEmploymentType(part) && !rules.isDuration(part))
                    .collect(Collectors.joining(" · "));
                if (text.isEmpty()) continue;
            }
            cleaned.add(text);
        }
        return cleaned;
    }

    /**
     * [organization, position] from a cleaned header
     */
    String[] companyAndPosition(List<String> header, String lastCompany) {
        if (header.isEmpty()) return new String[]{lastCompany, ""};
        var first = header.get(0);
        var titleAtCompany = splitTitleAtCompany(first);
        if (titleAtCompany != null) {
            return new String[]{titleAtCompany[1], titleAtCompany[0]};
        }
        if (header.size() == 1) return new String[]{lastCompany, first};
        return new String[]{first, header.get(1)};
    }

    /**
     * Location heuristic over the body lines: a short comma-separated line that is not a date range,
     * or a single capitalized alphabetic word without a role keyword ("Berlin").
     * Bullets never count. A one-word title such as "Freelancer" still reads as a location.
     */
    String findLocation(List<String> body) {
        for (var text : body) {
            if (rules.isBullet(text)) continue;
            if (text.contains(",") && text.length() <= LOCATION_MAX_LENGTH && !rules.dates().hasRange(text)) {
                return text;
            }
            if (text.length() <= SINGLE_WORD_LOCATION_MAX_LENGTH
                    && Character.isUpperCase(text.codePointAt(0))
                    && text.codePoints().allMatch(Character::isLetter)
                    && !rules.hasRoleKeyword(text)) {
                return text;
            }
        }
        return "";
    }

    /**
     * Bulleted lines become highlights; a non-bulleted line right after a highlight is its
     * soft-wrapped continuation; other lines go to the summary.
     */
    Body splitBody(List<String> body) {
        var highlights = new ArrayList<String>();
        var summary = new ArrayList<String>();
        boolean lastWasHighlight = false;
        for (var text : body) {
            if (rules.vocabulary().isAchievementLabel(text)) continue;
            if (rules.isBullet(text)) {
                highlights.add(rules.stripBullet(text));
                lastWasHighlight = true;
            } else if (lastWasHighlight) {
                int last = highlights.size() - 1;
                highlights.set(last, (highlights.get(last) + " " + text).strip());
            } else {
                summary.add(text);
            }
        }
        return new Body(String.join(" ", summary).strip(), highlights);
    }

    record Body(String summary, List<String> highlights) {
    }

    private boolean looksLikeHeaderStart(List<TaggedLine> tags, int idx) {
        var tag = tags.get(idx);
        if (tag.isBlank() || tag.achievementLabel() || tag.bullet()) return false;
        var text = tag.text();

        var next = idx + 1 < tags.size() ? tags.get(idx + 1) : null;
        if (next != null && next.duration()) return true;
        if (next != null && rules.hasRoleKeyword(next.text())
                && idx + 2 < tags.size() && tags.get(idx + 2).dateRange()) {
            return isSingleCapitalizedWord(text) || isHeaderCandidate(text);
        }
        if (text.length() > HEADER_MAX_LENGTH || !isHeaderCandidate(text)) return false;
        for (int offset = 1; offset <= HEADER_DATE_LOOKAHEAD && idx + offset < tags.size(); offset++) {
            if (tags.get(idx + offset).dateRange()) return true;
        }
        return false;
    }

    private boolean isHeaderCandidate(String text) {
        if (text.endsWith(".") || text.endsWith(":")) return false;
        if (rules.hasRoleKeyword(text)) return true;
        if (COMPANY_SUFFIXES.stream().anyMatch(text::contains)) return true;
        var words = text.split("\\s+");
        if (words.length < 2) return false;
        long caps = 0;
        for (var word : words) {
            if (!word.isEmpty() && Character.isUpperCase(word.codePointAt(0))) caps++;
        }
        return caps >= Math.max(1, words.length / 2);
    }

    private static boolean isSingleCapitalizedWord(String text) {
        var stripped = text.strip();
        if (stripped.endsWith(".") || stripped.endsWith(":")) return false;
        var parts = stripped.split("\\s+");
        return parts.length == 1 && Character.isUpperCase(parts[0].codePointAt(0));
    }

    private static String[] splitTitleAtCompany(String text) {
        var parts = AT.split(text, 2);
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) return null;
        return new String[]{parts[0].strip(), parts[1].strip()};
    }

    private static int firstPivot(List<TaggedLine> tags) {
        for (int i = 0; i < tags.size(); i++) {
            if (tags.get(i).dateRange()) return i;
        }
        return -1;
    }

    /**
     * Running state of the pivot scan across blocks
     */
    private final class Scan {
        final List<WorkEntry> entries = new ArrayList<>();
        final List<String> header = new ArrayList<>();
        final List<String> body = new ArrayList<>();
        String lastCompany = "";
        String name;
        String position;
        DateRange dates;

        boolean hasEntry() {
            return dates != null;
        }

        void addUnplaced(String text) {
            if (hasEntry()) body.add(text);
            else header.add(text);
        }

        /**
         * A header still waiting at a block boundary belonged to the entry before it
         */
        void returnPendingHeader() {
            if (hasEntry() && !header.isEmpty()) {
                body.addAll(header);
                header.clear();
            }
        }

        void open(String dateLine) {
            close();
            var fields = companyAndPosition(cleanHeader(header), lastCompany);
            header.clear();
            name = fields[0];
            position = fields[1];
            dates = rules.dates().parseRange(dateLine);
            if (!name.isEmpty()) lastCompany = name;
        }

        void close() {
            if (!hasEntry()) return;
            var location = findLocation(body);
            var rest = body.stream().filter(t -> !t.equals(location)).toList();
            var split = splitBody(rest);
            entries.add(new WorkEntry(name, position, location, dates.start(), dates.end(),
                split.summary(), split.highlights()));
            body.clear();
            dates = null;
        }
    }
}
