package xyz.jphil.profile_resume.model;

public record VolunteerEntry(
    String organization,
    String position,
    String startDate,
    String endDate,
    String summary
) {

    public VolunteerEntry {
        organization = Fields.text(organization);
        position = Fields.text(position);
        startDate = Fields.text(startDate);
        endDate = Fields.text(endDate);
        summary = Fields.text(summary);
    }

    public boolean isEmpty() {
        return Fields.allBlank(organization, position, startDate, endDate, summary);
    }
}
