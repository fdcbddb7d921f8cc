package xyz.jphil.profile_resume;

import xyz.jphil.profile_resume.layout.Sections;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.Resume;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Resume plus the intermediate pipeline state, for diagnostics
 *
 * @param lines    reconstructed lines, page-major
 * @param split    detected column boundary, empty for single-column layouts
 * @param sections lines assigned to each section
 * @param resume   assembled record
 */
public record ParseResult(List<Line> lines, OptionalDouble split, Sections sections, Resume resume) {

    public ParseResult {
        lines = List.copyOf(lines);
    }

    public boolean twoColumns() {
        return split.isPresent();
    }
}
