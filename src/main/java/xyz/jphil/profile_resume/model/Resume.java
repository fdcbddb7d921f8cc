package xyz.jphil.profile_resume.model;

import java.util.List;

/**
 * Structured record assembled from a profile document.
 * Immutable; every field is present, absent values are "" or an empty list.
 */
public record Resume(
    Basics basics,
    List<WorkEntry> work,
    List<EducationEntry> education,
    List<SkillEntry> skills,
    List<CertificateEntry> certificates,
    List<ProjectEntry> projects,
    List<VolunteerEntry> volunteer,
    List<LanguageEntry> languages,
    List<InterestEntry> interests
) {

    public Resume {
        basics = basics == null ? Basics.empty() : basics;
        work = Fields.list(work);
        education = Fields.list(education);
        skills = Fields.list(skills);
        certificates = Fields.list(certificates);
        projects = Fields.list(projects);
        volunteer = Fields.list(volunteer);
        languages = Fields.list(languages);
        interests = Fields.list(interests);
    }

    public static Resume empty() {
        return new Resume(Basics.empty(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of());
    }

    public Resume withBasics(Basics newBasics) {
        return new Resume(newBasics, work, education, skills, certificates, projects, volunteer, languages, interests);
    }

    public Resume withSkills(List<SkillEntry> newSkills) {
        return new Resume(basics, work, education, newSkills, certificates, projects, volunteer, languages, interests);
    }

    public Resume withCertificates(List<CertificateEntry> newCertificates) {
        return new Resume(basics, work, education, skills, newCertificates, projects, volunteer, languages, interests);
    }

    public Resume withProjects(List<ProjectEntry> newProjects) {
        return new Resume(basics, work, education, skills, certificates, newProjects, volunteer, languages, interests);
    }
}
