package xyz.jphil.profile_resume.tools;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.model.Basics;
import xyz.jphil.profile_resume.model.Profile;
import xyz.jphil.profile_resume.model.Resume;
import xyz.jphil.profile_resume.model.WorkEntry;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ResumeJsonSerializerTest {

    @Test
    void emptyResumeStillHasEveryKey() {
        var json = ResumeJsonSerializer.toJson(Resume.empty());

        assertEquals(Set.of("basics", "work", "education", "skills", "certificates", "projects",
            "volunteer", "languages", "interests"), json.keySet());
        var basics = json.getJSONObject("basics");
        assertEquals(Set.of("name", "label", "email", "phone", "location", "profiles", "summary"), basics.keySet());
        assertEquals("", basics.getJSONObject("location").getString("address"));
        assertTrue(json.getJSONArray("work").isEmpty());
    }

    @Test
    void entriesAreWrittenWithAllFields() {
        var basics = new Basics("Jane Doe", "Engineer", "", "", "Berlin", List.of(new Profile("GitHub", "github.com/jd")), "");
        var work = new WorkEntry("Acme", "Engineer", "", "2019-01", "", "", List.of("Shipped"));
        var resume = Resume.empty().withBasics(basics);
        resume = new Resume(resume.basics(), List.of(work), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

        var json = ResumeJsonSerializer.toJson(resume);

        assertEquals("Berlin", json.getJSONObject("basics").getJSONObject("location").getString("address"));
        assertEquals("GitHub", json.getJSONObject("basics").getJSONArray("profiles").getJSONObject(0).getString("network"));
        var entry = json.getJSONArray("work").getJSONObject(0);
        assertEquals(Set.of("name", "position", "location", "startDate", "endDate", "summary", "highlights"), entry.keySet());
        assertEquals("", entry.getString("endDate"));
        assertEquals("Shipped", entry.getJSONArray("highlights").getString(0));
    }

    @Test
    void compactAndIndentedOutput() {
        assertFalse(ResumeJsonSerializer.toJsonString(Resume.empty(), true).contains("\n"));
        assertTrue(ResumeJsonSerializer.toJsonString(Resume.empty(), false).contains("\n  \"basics\""));
    }
}
