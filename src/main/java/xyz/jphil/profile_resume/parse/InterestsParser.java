package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.model.InterestEntry;
import xyz.jphil.profile_resume.model.Line;

import java.util.List;
import java.util.stream.Stream;

@RequiredArgsConstructor
public class InterestsParser {

    private final TextRules rules;

    public List<InterestEntry> parse(List<Line> lines) {
        var joined = String.join(" ", rules.contentTexts(lines.stream().map(Line::text).toList(), false, false));
        return Stream.of(SkillsParser.DELIMITERS.split(joined))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .map(InterestEntry::new)
            .toList();
    }
}
