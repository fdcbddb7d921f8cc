package xyz.jphil.profile_resume.parse;

import xyz.jphil.profile_resume.layout.Column;
import xyz.jphil.profile_resume.model.InterestEntry;
import xyz.jphil.profile_resume.model.Line;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Final pass making interests visible in the summary. A two-column profile sometimes renders a
 * "Hobbies:" aside in one column while the hobby text itself sits in the other; that text is the
 * marker. The summary gets an explicit "Hobbies: " label where the interests (or the marker)
 * already appear, or a "Hobbies: ..." clause appended.
 */
public final class HobbiesSummary {

    static final String LABEL = "Hobbies: ";
    private static final String ASIDE = "hobbies:";
    private static final Pattern MENTIONS_HOBBIES = Pattern.compile("\\bhobbies\\b", Pattern.CASE_INSENSITIVE);

    private HobbiesSummary() {
    }

    /**
     * Text of the nearest line at or below a "hobbies:" aside, on the same page, in the opposite
     * column. "" for single-column documents or when no aside exists.
     */
    public static String findMarker(List<Line> lines, OptionalDouble split) {
        if (split.isEmpty()) return "";
        var best = "";
        var bestGap = Double.MAX_VALUE;
        for (var aside : lines) {
            if (!aside.text().toLowerCase(Locale.ROOT).contains(ASIDE)) continue;
            var otherColumn = Column.of(aside, split).opposite();
            for (var line : lines) {
                if (line.page() != aside.page() || Column.of(line, split) != otherColumn) continue;
                if (line.top() < aside.top()) continue;
                var text = line.text().strip();
                if (text.isEmpty() || text.toLowerCase(Locale.ROOT).contains("hobbies")) continue;
                var gap = line.top() - aside.top();
                if (gap < bestGap) {
                    bestGap = gap;
                    best = text;
                }
            }
        }
        return best;
    }

    /**
     * Summary with the hobbies label applied; unchanged when it is empty, already mentions hobbies,
     * or there is nothing to label
     */
    public static String apply(String summary, List<InterestEntry> interests, String marker) {
        var text = summary == null ? "" : summary.strip();
        if (text.isEmpty() || MENTIONS_HOBBIES.matcher(text).find()) return text;

        var names = interests.stream()
            .map(InterestEntry::name)
            .filter(n -> !n.isBlank())
            .map(String::strip)
            .collect(Collectors.joining(", "));
        if (!names.isEmpty()) return labelAt(text, names);
        if (marker != null && !marker.isBlank()) return labelAt(text, marker.strip());
        return text;
    }

    private static String labelAt(String summary, String fragment) {
        int at = summary.toLowerCase(Locale.ROOT).indexOf(fragment.toLowerCase(Locale.ROOT));
        if (at >= 0) {
            return (summary.substring(0, at) + LABEL + summary.substring(at)).strip();
        }
        return summary + " " + LABEL + fragment;
    }
}
