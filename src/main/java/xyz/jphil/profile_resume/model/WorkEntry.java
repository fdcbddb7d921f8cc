package xyz.jphil.profile_resume.model;

import java.util.List;

/**
 * One position held at one organization; {@code name} is the organization
 */
public record WorkEntry(
    String name,
    String position,
    String location,
    String startDate,
    String endDate,
    String summary,
    List<String> highlights
) {

    public WorkEntry {
        name = Fields.text(name);
        position = Fields.text(position);
        location = Fields.text(location);
        startDate = Fields.text(startDate);
        endDate = Fields.text(endDate);
        summary = Fields.text(summary);
        highlights = Fields.list(highlights);
    }
}
