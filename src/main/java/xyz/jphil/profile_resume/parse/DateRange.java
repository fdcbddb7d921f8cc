package xyz.jphil.profile_resume.parse;

/**
 * Canonical start/end pair; each side is "", "YYYY" or "YYYY-MM". An empty end means open-ended or unknown.
 */
public record DateRange(String start, String end) {

    public static final DateRange EMPTY = new DateRange("", "");

    public boolean isEmpty() {
        return start.isEmpty() && end.isEmpty();
    }

    /**
     * Start if known, otherwise end (single-date fields such as a certificate date)
     */
    public String first() {
        return start.isEmpty() ? end : start;
    }
}
