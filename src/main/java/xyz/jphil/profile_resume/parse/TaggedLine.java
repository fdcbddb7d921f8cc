package xyz.jphil.profile_resume.parse;

/**
 * Line text with its shape classified once, so parsers branch on flags instead of re-testing raw text
 */
public record TaggedLine(
    String text,
    boolean footer,
    boolean bullet,
    boolean dateRange,
    boolean duration,
    boolean achievementLabel
) {

    public boolean isBlank() {
        return text.isBlank();
    }
}
