package xyz.jphil.profile_resume.model;

public record SkillEntry(String name) {

    public SkillEntry {
        name = Fields.text(name);
    }
}
