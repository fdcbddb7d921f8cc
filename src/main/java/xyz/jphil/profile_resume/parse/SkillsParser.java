package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.SkillEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Skills section parser.
 * Delimited text is split on its delimiters; undelimited lines made of three or more capitalized
 * or acronym tokens ("Java Kotlin SQL") are split into tokens; anything else stays one skill per line.
 */
@RequiredArgsConstructor
public class SkillsParser {

    static final Pattern DELIMITERS = Pattern.compile("[•·,;|]");
    private static final int MIN_TOKENS_FOR_SPLIT = 3;

    private final TextRules rules;

    public List<SkillEntry> parse(List<Line> lines) {
        var texts = rules.contentTexts(lines.stream().map(Line::text).toList(), false, false);
        var joined = String.join(" ", texts);
        if (joined.isBlank()) return List.of();

        var parts = new ArrayList<String>();
        if (DELIMITERS.matcher(joined).find()) {
            parts.addAll(List.of(DELIMITERS.split(joined)));
        } else {
            for (var text : texts) {
                var tokens = text.split("\\s+");
                if (tokens.length >= MIN_TOKENS_FOR_SPLIT && List.of(tokens).stream().allMatch(SkillsParser::isTitleToken)) {
                    parts.addAll(List.of(tokens));
                } else {
                    parts.add(text);
                }
            }
        }
        return dedupe(parts);
    }

    /**
     * Non-blank names, first spelling wins among case-insensitive duplicates
     */
    public static List<SkillEntry> dedupe(List<String> names) {
        var seen = new LinkedHashMap<String, String>();
        for (var name : names) {
            var stripped = name == null ? "" : name.strip();
            if (!stripped.isEmpty()) seen.putIfAbsent(stripped.toLowerCase(Locale.ROOT), stripped);
        }
        return seen.values().stream().map(SkillEntry::new).toList();
    }

    static boolean isTitleToken(String token) {
        if (token.startsWith(".") && token.length() > 1) return true;
        if (token.codePoints().noneMatch(Character::isLowerCase)) return true;
        return Character.isUpperCase(token.codePointAt(0));
    }
}
