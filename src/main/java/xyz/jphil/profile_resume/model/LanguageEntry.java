package xyz.jphil.profile_resume.model;

/**
 * Spoken language, fluency is "" when the profile does not state it
 */
public record LanguageEntry(String language, String fluency) {

    public LanguageEntry {
        language = Fields.text(language);
        fluency = Fields.text(fluency);
    }
}
