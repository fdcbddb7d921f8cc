package xyz.jphil.profile_resume.model;

public record ProjectEntry(String name, String description, String url, String startDate, String endDate) {

    public ProjectEntry {
        name = Fields.text(name);
        description = Fields.text(description);
        url = Fields.text(url);
        startDate = Fields.text(startDate);
        endDate = Fields.text(endDate);
    }
}
