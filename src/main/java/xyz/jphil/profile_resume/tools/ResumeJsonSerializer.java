package xyz.jphil.profile_resume.tools;

import org.json.JSONArray;
import org.json.JSONObject;
import xyz.jphil.profile_resume.model.*;

import java.util.List;
import java.util.function.Function;

/**
 * JSON Resume output using org.json. Every key is written, absent values as "" or [].
 */
public class ResumeJsonSerializer {

    private static final int INDENT = 2;

    public static String toJsonString(Resume resume, boolean compact) {
        var root = toJson(resume);
        return compact ? root.toString() : root.toString(INDENT);
    }

    public static JSONObject toJson(Resume resume) {
        return new JSONObject()
            .put("basics", basics(resume.basics()))
            .put("work", array(resume.work(), ResumeJsonSerializer::work))
            .put("education", array(resume.education(), ResumeJsonSerializer::education))
            .put("skills", array(resume.skills(), s -> new JSONObject().put("name", s.name())))
            .put("certificates", array(resume.certificates(), ResumeJsonSerializer::certificate))
            .put("projects", array(resume.projects(), ResumeJsonSerializer::project))
            .put("volunteer", array(resume.volunteer(), ResumeJsonSerializer::volunteer))
            .put("languages", array(resume.languages(), l -> new JSONObject()
                .put("language", l.language())
                .put("fluency", l.fluency())))
            .put("interests", array(resume.interests(), i -> new JSONObject().put("name", i.name())));
    }

    private static JSONObject basics(Basics basics) {
        return new JSONObject()
            .put("name", basics.name())
            .put("label", basics.label())
            .put("email", basics.email())
            .put("phone", basics.phone())
            .put("location", new JSONObject().put("address", basics.location()))
            .put("profiles", array(basics.profiles(), p -> new JSONObject()
                .put("network", p.network())
                .put("url", p.url())))
            .put("summary", basics.summary());
    }

    private static JSONObject work(WorkEntry w) {
        return new JSONObject()
            .put("name", w.name())
            .put("position", w.position())
            .put("location", w.location())
            .put("startDate", w.startDate())
            .put("endDate", w.endDate())
            .put("summary", w.summary())
            .put("highlights", new JSONArray(w.highlights()));
    }

    private static JSONObject education(EducationEntry e) {
        return new JSONObject()
            .put("institution", e.institution())
            .put("studyType", e.studyType())
            .put("area", e.area())
            .put("startDate", e.startDate())
            .put("endDate", e.endDate());
    }

    private static JSONObject certificate(CertificateEntry c) {
        return new JSONObject()
            .put("name", c.name())
            .put("issuer", c.issuer())
            .put("date", c.date())
            .put("url", c.url());
    }

    private static JSONObject project(ProjectEntry p) {
        return new JSONObject()
            .put("name", p.name())
            .put("description", p.description())
            .put("url", p.url())
            .put("startDate", p.startDate())
            .put("endDate", p.endDate());
    }

    private static JSONObject volunteer(VolunteerEntry v) {
        return new JSONObject()
            .put("organization", v.organization())
            .put("position", v.position())
            .put("startDate", v.startDate())
            .put("endDate", v.endDate())
            .put("summary", v.summary());
    }

    private static <T> JSONArray array(List<T> items, Function<T, JSONObject> mapper) {
        var array = new JSONArray();
        items.forEach(item -> array.put(mapper.apply(item)));
        return array;
    }
}
