package xyz.jphil.profile_resume.model;

import java.util.List;

/**
 * Identity and contact block of a resume
 */
public record Basics(
    String name,
    String label,
    String email,
    String phone,
    String location,
    List<Profile> profiles,
    String summary
) {

    public Basics {
        name = Fields.text(name);
        label = Fields.text(label);
        email = Fields.text(email);
        phone = Fields.text(phone);
        location = Fields.text(location);
        profiles = Fields.list(profiles);
        summary = Fields.text(summary);
    }

    public static Basics empty() {
        return new Basics("", "", "", "", "", List.of(), "");
    }

    public Basics withSummary(String newSummary) {
        return new Basics(name, label, email, phone, location, profiles, newSummary);
    }

    public Basics withPhone(String newPhone) {
        return new Basics(name, label, email, newPhone, location, profiles, summary);
    }
}
