package xyz.jphil.profile_resume.model;

public record EducationEntry(
    String institution,
    String studyType,
    String area,
    String startDate,
    String endDate
) {

    public EducationEntry {
        institution = Fields.text(institution);
        studyType = Fields.text(studyType);
        area = Fields.text(area);
        startDate = Fields.text(startDate);
        endDate = Fields.text(endDate);
    }

    public boolean isEmpty() {
        return Fields.allBlank(institution, studyType, area, startDate, endDate);
    }
}
