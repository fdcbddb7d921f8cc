package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.model.LanguageEntry;
import xyz.jphil.profile_resume.model.Line;

import java.util.List;
import java.util.regex.Pattern;

/**
 * "English (Native or Bilingual)" per line; a line without parentheses is a bare language name
 */
@RequiredArgsConstructor
public class LanguagesParser {

    private static final Pattern WITH_FLUENCY = Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)$");

    private final TextRules rules;

    public List<LanguageEntry> parse(List<Line> lines) {
        return rules.contentTexts(lines.stream().map(Line::text).toList(), false, false).stream()
            .map(this::parseLine)
            .toList();
    }

    LanguageEntry parseLine(String text) {
        var m = WITH_FLUENCY.matcher(text);
        if (m.matches()) {
            return new LanguageEntry(m.group(1).strip(), m.group(2).strip());
        }
        return new LanguageEntry(text, "");
    }
}
