package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.model.CertificateEntry;
import xyz.jphil.profile_resume.model.Line;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Certifications section parser. Each line opens a certificate unless it continues the previous
 * name: starts with "(" or "-", or mentions a specialization.
 */
@RequiredArgsConstructor
public class CertificateParser {

    static final String HOBBIES_MARKER = "Hobbies:";

    private final TextRules rules;

    public List<CertificateEntry> parse(List<Line> lines) {
        var texts = rules.contentTexts(lines.stream().map(Line::text).toList(), false, false);
        var entries = new ArrayList<CertificateEntry>();
        var current = "";
        for (var text : texts) {
            var cleaned = cutHobbies(text);
            if (cleaned.isEmpty()) continue;
            if (!current.isEmpty() && isContinuation(cleaned)) {
                current = (current + " " + cleaned).strip();
                continue;
            }
            if (!current.isEmpty()) entries.add(CertificateEntry.named(current));
            current = cleaned;
        }
        if (!current.isEmpty()) entries.add(CertificateEntry.named(current));
        return entries;
    }

    /**
     * A sidebar "Hobbies:" aside sometimes lands on the same line as a certificate
     */
    static String cutHobbies(String text) {
        int at = text.indexOf(HOBBIES_MARKER);
        return (at >= 0 ? text.substring(0, at) : text).strip();
    }

    private static boolean isContinuation(String text) {
        var lowered = text.toLowerCase(Locale.ROOT);
        return lowered.startsWith("(") || lowered.startsWith("-") || lowered.contains("specialization");
    }
}
