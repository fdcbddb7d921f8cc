package xyz.jphil.profile_resume.tools.sidecar;

import lombok.RequiredArgsConstructor;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.json.JSONException;
import org.json.JSONObject;
import xyz.jphil.profile_resume.model.CertificateEntry;
import xyz.jphil.profile_resume.model.ProjectEntry;
import xyz.jphil.profile_resume.model.Resume;
import xyz.jphil.profile_resume.model.SkillEntry;
import xyz.jphil.profile_resume.parse.DateNormalizer;
import xyz.jphil.profile_resume.parse.SkillsParser;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Enriches a parsed resume with the files of a profile data export: a personal-info JSON and the
 * Skills, Certifications and Projects CSVs. Only fills gaps; a value already parsed from the
 * document is never overwritten. Every merge returns a new {@link Resume}.
 */
@RequiredArgsConstructor
public class SidecarMerger {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .build();
    private static final char BOM = '\uFEFF';

    private final DateNormalizer dates;

    /**
     * {@code phone} fills an empty phone, {@code additional_skills} adds skills
     */
    public Resume mergePersonalInfo(Resume resume, Path path) throws IOException {
        JSONObject personal;
        try {
            personal = new JSONObject(read(path));
        } catch (JSONException e) {
            throw new IOException("Malformed personal info " + path + ": " + e.getMessage(), e);
        }

        var merged = resume;
        var extra = personal.optJSONArray("additional_skills");
        if (extra != null) {
            var names = new ArrayList<String>();
            for (int i = 0; i < extra.length(); i++) {
                names.add(extra.optString(i, ""));
            }
            merged = withExtraSkills(merged, names);
        }
        var phone = personal.optString("phone", "").strip();
        if (!phone.isEmpty() && merged.basics().phone().isEmpty()) {
            merged = merged.withBasics(merged.basics().withPhone(phone));
        }
        return merged;
    }

    /**
     * Adds the {@code Name} column, skipping skills already present in any letter case
     */
    public Resume mergeSkillsCsv(Resume resume, Path path) throws IOException {
        var names = new ArrayList<String>();
        readCsv(path, row -> names.add(cell(row, "Name")));
        return withExtraSkills(resume, names);
    }

    /**
     * Matches certificates by name (case-insensitive); fills issuer, date and url or appends a new one
     */
    public Resume mergeCertificationsCsv(Resume resume, Path path) throws IOException {
        var certificates = new ArrayList<>(resume.certificates());
        readCsv(path, row -> {
            var name = cell(row, "Name");
            if (name.isEmpty()) return;
            var issuer = cell(row, "Authority");
            var url = cell(row, "Url");
            var started = cell(row, "Started On");
            var date = dates.normalizeLoose(started.isEmpty() ? cell(row, "Finished On") : started);

            int at = indexOf(certificates, CertificateEntry::name, name);
            if (at < 0) {
                certificates.add(new CertificateEntry(name, issuer, date, url));
            } else {
                var existing = certificates.get(at);
                certificates.set(at, new CertificateEntry(existing.name(),
                    fill(existing.issuer(), issuer), fill(existing.date(), date), fill(existing.url(), url)));
            }
        });
        return resume.withCertificates(certificates);
    }

    /**
     * Matches projects by title (case-insensitive); fills description, url and dates or appends a new one
     */
    public Resume mergeProjectsCsv(Resume resume, Path path) throws IOException {
        var projects = new ArrayList<>(resume.projects());
        readCsv(path, row -> {
            var name = cell(row, "Title");
            if (name.isEmpty()) return;
            var description = cell(row, "Description");
            var url = cell(row, "Url");
            var start = dates.normalizeLoose(cell(row, "Started On"));
            var end = dates.normalizeLoose(cell(row, "Finished On"));

            int at = indexOf(projects, ProjectEntry::name, name);
            if (at < 0) {
                projects.add(new ProjectEntry(name, description, url, start, end));
            } else {
                var existing = projects.get(at);
                projects.set(at, new ProjectEntry(existing.name(), fill(existing.description(), description),
                    fill(existing.url(), url), fill(existing.startDate(), start), fill(existing.endDate(), end)));
            }
        });
        return resume.withProjects(projects);
    }

    private static Resume withExtraSkills(Resume resume, List<String> names) {
        var all = new ArrayList<String>();
        resume.skills().forEach(s -> all.add(s.name()));
        all.addAll(names);
        List<SkillEntry> skills = SkillsParser.dedupe(all);
        return resume.withSkills(skills);
    }

    private void readCsv(Path path, Consumer<CSVRecord> rowHandler) throws IOException {
        try (var parser = FORMAT.parse(new StringReader(read(path)))) {
            for (var row : parser) {
                rowHandler.accept(row);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Malformed CSV " + path + ": " + e.getMessage(), e);
        }
    }

    private static String read(Path path) throws IOException {
        var text = Files.readString(path, StandardCharsets.UTF_8);
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    private static String cell(CSVRecord row, String column) {
        return row.isSet(column) ? row.get(column).strip() : "";
    }

    private static String fill(String current, String candidate) {
        return current.isEmpty() ? candidate : current;
    }

    private static <T> int indexOf(List<T> entries, Function<T, String> name, String wanted) {
        var key = wanted.strip().toLowerCase(Locale.ROOT);
        for (int i = 0; i < entries.size(); i++) {
            if (name.apply(entries.get(i)).strip().toLowerCase(Locale.ROOT).equals(key)) return i;
        }
        return -1;
    }
}
