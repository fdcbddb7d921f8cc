package xyz.jphil.profile_resume.layout;

import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.SectionKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lines assigned to each section, in reading order
 */
public record Sections(Map<SectionKind, List<Line>> bySection) {

    public Sections {
        var copy = new EnumMap<SectionKind, List<Line>>(SectionKind.class);
        bySection.forEach((kind, lines) -> copy.put(kind, List.copyOf(lines)));
        bySection = copy;
    }

    public static Sections empty() {
        return new Sections(Map.of());
    }

    public List<Line> lines(SectionKind kind) {
        return bySection.getOrDefault(kind, List.of());
    }

    public int size(SectionKind kind) {
        return lines(kind).size();
    }
}
