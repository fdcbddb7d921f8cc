package xyz.jphil.profile_resume.parse;

import xyz.jphil.profile_resume.Vocabulary;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-text date expressions into canonical "YYYY" / "YYYY-MM" strings.
 * Never rejects input: anything it cannot read normalizes to "".
 */
public class DateNormalizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // "2021-06", "Jan 2020", "janvier 2020", "янв. 2020", "2019"
    private static final String SIDE = "(?:\\d{4}-(?:0[1-9]|1[0-2])(?!\\d)|(?:\\p{L}{3,9}\\.?\\s+)?\\d{4})";
    private static final Pattern CANONICAL = Pattern.compile("\\d{4}(?:-(?:0[1-9]|1[0-2]))?");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern SINGLE = Pattern.compile(SIDE, FLAGS);
    private static final Pattern WHOLE_DATE_LINE = Pattern.compile(
        "^\\(?\\s*" + SIDE + "\\s*\\)?(?:\\s*\\([^)]*\\))?$", FLAGS);
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)?");

    private final Vocabulary vocabulary;
    private final Set<String> openEnded;
    private final Pattern range;

    public DateNormalizer(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
        this.openEnded = Set.copyOf(vocabulary.openEndedMarkers());
        var markers = vocabulary.openEndedMarkers().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        var end = markers.isEmpty() ? SIDE : SIDE + "|(?:" + markers + ")(?!\\p{L})";
        this.range = Pattern.compile(
            "(?<start>" + SIDE + ")\\s*(?:-|–|—|to(?!\\p{L}))\\s*(?<end>" + end + ")", FLAGS);
    }

    /**
     * Normalize one side of a range (or a lone date).
     * Open-ended markers and unreadable text give "".
     */
    public String normalize(String value) {
        if (value == null) return "";
        var text = SPACES.matcher(value.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
        if (text.isEmpty() || openEnded.contains(text)) return "";
        if (CANONICAL.matcher(text).matches()) return text;

        var parts = text.split(" ");
        if (parts.length == 1) {
            return YEAR.matcher(parts[0]).matches() ? parts[0] : "";
        }
        var year = parts[parts.length - 1];
        if (!YEAR.matcher(year).matches()) return "";
        int month = vocabulary.monthOf(parts[0]);
        return month > 0 ? String.format(Locale.ROOT, "%s-%02d", year, month) : year;
    }

    /**
     * First date range in the text, else the first lone date as start, else {@link DateRange#EMPTY}
     */
    public DateRange parseRange(String text) {
        if (text == null || text.isBlank()) return DateRange.EMPTY;
        Matcher m = range.matcher(text);
        if (m.find()) {
            return new DateRange(normalize(m.group("start")), normalize(m.group("end")));
        }
        m = SINGLE.matcher(text);
        if (m.find()) {
            return new DateRange(normalize(m.group()), "");
        }
        return DateRange.EMPTY;
    }

    public boolean hasRange(String text) {
        return text != null && range.matcher(text).find();
    }

    /**
     * Range or any lone date anywhere in the text
     */
    public boolean hasDate(String text) {
        return text != null && (range.matcher(text).find() || SINGLE.matcher(text).find());
    }

    /**
     * Line that carries nothing but dates: a range, or a lone date with an optional parenthetical
     */
    public boolean isDateLine(String text) {
        if (text == null) return false;
        return hasRange(text) || WHOLE_DATE_LINE.matcher(text.strip()).matches();
    }

    /**
     * Stricter than {@link #isDateLine}: once the dates and any parentheticals are removed,
     * no letter or digit is left. "2010 - 2014" qualifies, "BSc, Physics (2010 - 2014)" and
     * "Stanford 2014" do not.
     */
    public boolean isDateOnly(String text) {
        if (text == null || text.isBlank()) return false;
        var rest = cut(SINGLE, cut(range, text.strip()));
        return PARENTHETICAL.matcher(rest).replaceAll(" ").codePoints().noneMatch(Character::isLetterOrDigit);
    }

    /**
     * First line carrying a date range, else the first carrying any date, else ""
     */
    public String findDateLine(List<String> texts) {
        return texts.stream().filter(this::hasRange).findFirst()
            .or(() -> texts.stream().filter(this::hasDate).findFirst())
            .orElse("");
    }

    /**
     * Text with every date range cut out, whitespace collapsed
     */
    public String removeRanges(String text) {
        if (text == null) return "";
        return SPACES.matcher(cut(range, text)).replaceAll(" ").strip();
    }

    /**
     * Removes every match of a date pattern. A word the pattern took for a month name but that is
     * none ("Diploma 2001") stays in the text.
     */
    private String cut(Pattern datePattern, String text) {
        var m = datePattern.matcher(text);
        var out = new StringBuilder();
        while (m.find()) {
            var parts = SPACES.split(m.group().strip(), 2);
            boolean wordFirst = parts.length > 1 && Character.isLetter(parts[0].codePointAt(0));
            var kept = wordFirst && vocabulary.monthOf(parts[0]) == 0 ? parts[0] : "";
            m.appendReplacement(out, Matcher.quoteReplacement(" " + kept + " "));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Sidecar date cell: anything {@link #normalize} reads, plus ISO dates cut to "YYYY-MM"
     */
    public String normalizeLoose(String value) {
        if (value == null || value.isBlank()) return "";
        var text = value.strip();
        try {
            var date = LocalDate.parse(text);
            return String.format(Locale.ROOT, "%04d-%02d", date.getYear(), date.getMonthValue());
        } catch (DateTimeParseException e) {
            return normalize(text);
        }
    }
}
