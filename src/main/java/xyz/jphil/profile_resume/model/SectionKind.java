package xyz.jphil.profile_resume.model;

import java.util.Locale;

public enum SectionKind {
    ABOUT, EXPERIENCE, EDUCATION, SKILLS, CERTIFICATIONS, PROJECTS, VOLUNTEER, LANGUAGES, INTERESTS;

    /**
     * Lower-case key as used in the vocabulary resource
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SectionKind fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
