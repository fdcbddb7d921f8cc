package xyz.jphil.profile_resume;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import xyz.jphil.profile_resume.model.SectionKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Multilingual lookup data of the pipeline: section headings, month names and the
 * keyword lists the category parsers match against.
 * Loaded from the bundled {@code vocabulary.json}; all collections are immutable.
 */
public record Vocabulary(
    Map<String, SectionKind> headings,
    Map<String, Integer> months,
    List<String> openEndedMarkers,
    List<String> locationKeywords,
    Set<String> contactHeadings,
    List<String> degreeKeywords,
    List<String> roleKeywords,
    List<String> employmentTypes,
    Set<String> achievementLabels
) {

    public static final String RESOURCE = "vocabulary.json";

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s&]+");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final int MIN_ABBREVIATION = 3;

    /**
     * Bundled vocabulary, parsed once
     */
    public static Vocabulary defaults() {
        return Holder.DEFAULTS;
    }

    /**
     * Heading category for a line, if its normalized text is a known heading
     */
    public Optional<SectionKind> sectionFor(String text) {
        return Optional.ofNullable(headings.get(normalizeHeading(text)));
    }

    /**
     * Month number for a month name or abbreviation, 0 when unknown.
     * A token of three or more letters that starts a known name also resolves ("septemb", "decem");
     * other words never do, so "Junior" and "Marketing" are not months.
     */
    public int monthOf(String token) {
        if (token == null) return 0;
        var key = token.strip().toLowerCase(Locale.ROOT);
        while (key.endsWith(".")) key = key.substring(0, key.length() - 1);
        if (key.isEmpty()) return 0;
        var month = months.get(key);
        if (month != null) return month;
        if (key.length() < MIN_ABBREVIATION) return 0;
        var prefix = key;
        return months.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix))
            .mapToInt(Map.Entry::getValue)
            .min()
            .orElse(0);
    }

    public boolean isContactHeading(String text) {
        return contactHeadings.contains(text.strip().toLowerCase(Locale.ROOT));
    }

    public boolean isAchievementLabel(String text) {
        return achievementLabels.contains(text.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Unicode-normalize, lower-case, drop accents and punctuation (except '&'), collapse whitespace.
     * "EXPÉRIENCE:" and "Expérience" both become "experience".
     */
    public static String normalizeHeading(String text) {
        if (text == null) return "";
        var normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = MARKS.matcher(Normalizer.normalize(normalized, Normalizer.Form.NFD)).replaceAll("");
        normalized = NON_WORD.matcher(normalized).replaceAll(" ");
        return SPACES.matcher(normalized).replaceAll(" ").strip();
    }

    public static Vocabulary load(InputStream in) throws IOException {
        try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(new JSONObject(new JSONTokener(reader)));
        } catch (JSONException | IllegalArgumentException e) {
            throw new IOException("Malformed vocabulary: " + e.getMessage(), e);
        }
    }

    static Vocabulary fromJson(JSONObject root) {
        var headings = new LinkedHashMap<String, SectionKind>();
        var headingsJson = root.getJSONObject("headings");
        for (var key : headingsJson.keySet()) {
            var kind = SectionKind.fromKey(key);
            for (var alias : strings(headingsJson.getJSONArray(key))) {
                headings.putIfAbsent(normalizeHeading(alias), kind);
            }
        }

        var months = new HashMap<String, Integer>();
        var monthsJson = root.getJSONObject("months");
        for (var key : monthsJson.keySet()) {
            int month = Integer.parseInt(key);
            for (var name : strings(monthsJson.getJSONArray(key))) {
                months.putIfAbsent(name.toLowerCase(Locale.ROOT), month);
            }
        }

        return new Vocabulary(
            Map.copyOf(headings),
            Map.copyOf(months),
            lowerList(root, "openEndedMarkers"),
            lowerList(root, "locationKeywords"),
            Set.copyOf(lowerList(root, "contactHeadings")),
            lowerList(root, "degreeKeywords"),
            lowerList(root, "roleKeywords"),
            lowerList(root, "employmentTypes"),
            Set.copyOf(lowerList(root, "achievementLabels"))
        );
    }

    private static List<String> lowerList(JSONObject root, String key) {
        var values = root.optJSONArray(key);
        if (values == null) return List.of();
        return strings(values).stream()
            .map(s -> s.toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }

    private static List<String> strings(JSONArray array) {
        var values = new ArrayList<String>();
        for (int i = 0; i < array.length(); i++) {
            var value = array.optString(i, "").strip();
            if (!value.isEmpty()) values.add(value);
        }
        return values;
    }

    private static final class Holder {
        static final Vocabulary DEFAULTS = loadBundled();

        private static Vocabulary loadBundled() {
            try (var in = Vocabulary.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Bundled " + RESOURCE + " not found on classpath");
                }
                return load(in);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load bundled " + RESOURCE, e);
            }
        }
    }
}
