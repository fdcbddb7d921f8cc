package xyz.jphil.profile_resume.parse;

import java.util.Collection;
import java.util.Comparator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive keyword search anchored on word boundaries.
 * Keywords of up to three characters ("ba", "cto") must be whole words, longer ones
 * only need to start a word so inflected forms ("engineering", "магистра") still match.
 */
final class KeywordMatcher {

    private static final String BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String AFTER = "(?![\\p{L}\\p{N}])";

    private final Pattern pattern;

    private KeywordMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    static KeywordMatcher wordStart(Collection<String> keywords) {
        return build(keywords, false);
    }

    static KeywordMatcher wholeWord(Collection<String> keywords) {
        return build(keywords, true);
    }

    private static KeywordMatcher build(Collection<String> keywords, boolean whole) {
        if (keywords.isEmpty()) {
            return new KeywordMatcher(Pattern.compile("(?!)"));
        }
        var alternatives = keywords.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(k -> BEFORE + Pattern.quote(k) + (whole || k.length() <= 3 ? AFTER : ""))
            .collect(Collectors.joining("|"));
        return new KeywordMatcher(Pattern.compile(alternatives,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    boolean find(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
