package xyz.jphil.profile_resume.parse;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.Vocabulary;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text-shape predicates shared by the segmenter and the category parsers
 */
@Accessors(fluent = true)
public class TextRules {

    public static final Pattern EMAIL = Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}", Pattern.CASE_INSENSITIVE);
    public static final Pattern URL = Pattern.compile(
        "https?://\\S+|www\\.\\S+|linkedin\\.com/\\S+|github\\.com/\\S+|gitlab\\.com/\\S+",
        Pattern.CASE_INSENSITIVE);
    public static final Pattern PHONE = Pattern.compile(
        "(?:\\+?\\d{1,3}[\\s.-]?)?(?:\\(?\\d{2,3}\\)?[\\s.-]?)?\\d{3}[\\s.-]?\\d{4}");

    private static final Pattern PAGE_FOOTER = Pattern.compile(
        "^(?:page|seite|página|pagina|страница)\\s+\\d+\\s*(?:of|/|von|sur|de|di|из)\\s*\\d+$",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern DURATION = Pattern.compile(
        "(?<![\\p{L}\\p{N}])\\d+\\s+(?:years?|yrs?|months?|mos?|jahre?|monate?|ans?|mois|años?|meses|mes|anos?|anni|anno|mesi|mese|лет|года?|мес(?:яц(?:а|ев)?)?\\.?)(?!\\p{L})",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)\\d{4}(?!\\d)");
    private static final List<String> BULLETS = List.of("-", "•", "–", "●", "▪");

    private static final int LOCATION_MAX_LENGTH = 60;

    @Getter private final Vocabulary vocabulary;
    @Getter private final ParserSettings settings;
    @Getter private final DateNormalizer dates;
    private final KeywordMatcher roles;
    private final KeywordMatcher degrees;
    private final KeywordMatcher locations;
    private final KeywordMatcher employmentTypes;

    public TextRules(Vocabulary vocabulary, ParserSettings settings) {
        this.vocabulary = vocabulary;
        this.settings = settings;
        this.dates = new DateNormalizer(vocabulary);
        this.roles = KeywordMatcher.wordStart(vocabulary.roleKeywords());
        this.degrees = KeywordMatcher.wordStart(vocabulary.degreeKeywords());
        this.locations = KeywordMatcher.wordStart(vocabulary.locationKeywords());
        this.employmentTypes = KeywordMatcher.wholeWord(vocabulary.employmentTypes());
    }

    public TaggedLine tag(String raw) {
        var text = raw == null ? "" : raw.strip();
        return new TaggedLine(
            text,
            isFooter(text),
            isBullet(text),
            dates.hasRange(text),
            isDuration(text),
            vocabulary.isAchievementLabel(text));
    }

    public List<TaggedLine> tagAll(List<String> texts) {
        return texts.stream().map(this::tag).toList();
    }

    /**
     * "Page 2 of 3" style footer
     */
    public boolean isFooter(String text) {
        return text != null && PAGE_FOOTER.matcher(text.strip()).matches();
    }

    /**
     * Footers and contact-block headings that carry no content
     */
    public boolean isNoise(String text) {
        if (text == null) return true;
        var lowered = text.strip().toLowerCase(Locale.ROOT);
        if (lowered.startsWith("page ") || isFooter(lowered)) return true;
        if (lowered.startsWith("contact ")) return true;
        return vocabulary.isContactHeading(lowered);
    }

    public boolean isBullet(String text) {
        return text != null && BULLETS.stream().anyMatch(text.strip()::startsWith);
    }

    public String stripBullet(String text) {
        var stripped = text.strip();
        while (!stripped.isEmpty() && (BULLETS.stream().anyMatch(stripped::startsWith) || stripped.charAt(0) == ' ')) {
            stripped = stripped.substring(1);
        }
        return stripped.strip();
    }

    /**
     * Bare duration such as "3 years 2 months" with no explicit year
     */
    public boolean isDuration(String text) {
        if (text == null || YEAR_TOKEN.matcher(text).find()) return false;
        return DURATION.matcher(text).find();
    }

    public boolean isEmploymentType(String text) {
        return employmentTypes.find(text);
    }

    public boolean hasRoleKeyword(String text) {
        return roles.find(text);
    }

    public boolean hasDegreeKeyword(String text) {
        return degrees.find(text);
    }

    public boolean hasLocationKeyword(String text) {
        return locations.find(text);
    }

    /**
     * Short line with a comma or a region-like keyword
     */
    public boolean isLocationText(String text) {
        if (text == null || text.length() > LOCATION_MAX_LENGTH) return false;
        return text.contains(",") || hasLocationKeyword(text);
    }

    /**
     * Heading shape: no digits, short, one to five words
     */
    public boolean looksLikeHeading(String text) {
        if (text == null || text.length() > settings.headingMaxLength()) return false;
        if (text.chars().anyMatch(Character::isDigit)) return false;
        var words = text.strip().split("\\s+");
        return !text.isBlank() && words.length >= 1 && words.length <= settings.headingMaxWords();
    }

    /**
     * Non-blank, non-footer, non-noise texts of the given lines; optionally without
     * bare durations and employment-type lines
     */
    public List<String> contentTexts(List<String> texts, boolean dropDuration, boolean dropEmployment) {
        return texts.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(String::strip)
            .filter(t -> !isFooter(t) && !isNoise(t))
            .filter(t -> !vocabulary.isAchievementLabel(t))
            .filter(t -> !dropDuration || !isDuration(t))
            .filter(t -> !dropEmployment || !isEmploymentType(t))
            .toList();
    }
}
