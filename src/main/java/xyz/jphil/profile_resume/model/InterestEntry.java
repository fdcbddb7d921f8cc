package xyz.jphil.profile_resume.model;

public record InterestEntry(String name) {

    public InterestEntry {
        name = Fields.text(name);
    }
}
