package xyz.jphil.profile_resume.layout;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.LineFixtures;
import xyz.jphil.profile_resume.model.BoundingBox;
import xyz.jphil.profile_resume.model.Line;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.profile_resume.LineFixtures.line;
import static xyz.jphil.profile_resume.LineFixtures.stacked;

public class BlockSegmenterTest {

    private final BlockSegmenter segmenter = LineFixtures.segmenter();

    private static List<List<String>> texts(List<List<Line>> blocks) {
        return blocks.stream().map(b -> b.stream().map(Line::text).toList()).toList();
    }

    @Test
    void largeVerticalGapStartsNewBlock() {
        var lines = List.of(
            line("Resume Parser", 0, 30),
            line("Jan 2022 - Mar 2022", 12, 30),
            line("Built a parser", 24, 30),
            line("Budget App", 60, 30),
            line("Tracks spending", 72, 30));

        assertEquals(List.of(
                List.of("Resume Parser", "Jan 2022 - Mar 2022", "Built a parser"),
                List.of("Budget App", "Tracks spending")),
            texts(segmenter.split(lines)));
    }

    @Test
    void continuationBlocksAreFoldedBack() {
        var lines = List.of(
            line("Mentor", 0, 30),
            line("Jan 2019 - Present", 12, 30),
            line("- Taught kids", 60, 30),
            line("2 yrs", 100, 30),
            line("Achievements:", 140, 30),
            line("Ran the club", 152, 30));

        assertEquals(1, segmenter.split(lines).size());
    }

    @Test
    void medianHeightFallsBackWhenLinesHaveNoHeight() {
        var flat = new Line("x", new BoundingBox(5, 5, 0, 10), 0);
        assertEquals(10, segmenter.medianHeight(List.of(flat)), 1e-9);
        assertEquals(10, segmenter.medianHeight(stacked("a", "b")), 1e-9);
    }

    @Test
    void experienceRolesAtOneCompanyRepeatTheCompany() {
        var blocks = segmenter.splitExperience(stacked(
            "Acme Corp", "3 years 2 months",
            "Senior Engineer", "Jan 2021 - Present", "- Led the team",
            "Engineer", "Jan 2019 - Dec 2020", "- Built the platform"));

        assertEquals(List.of(
                List.of("Acme Corp", "3 years 2 months", "Senior Engineer", "Jan 2021 - Present", "- Led the team"),
                List.of("Acme Corp", "Engineer", "Jan 2019 - Dec 2020", "- Built the platform")),
            texts(blocks));
    }

    @Test
    void experienceNewCompanyStartsCleanBlock() {
        var blocks = segmenter.splitExperience(stacked(
            "Acme Corp", "2 yrs", "Engineer", "Jan 2019 - Dec 2020",
            "Globex", "Developer", "Mar 2018 - Dec 2018"));

        assertEquals(List.of(
                List.of("Acme Corp", "2 yrs", "Engineer", "Jan 2019 - Dec 2020"),
                List.of("Globex", "Developer", "Mar 2018 - Dec 2018")),
            texts(blocks));
    }

    @Test
    void titleAtCompanyIsNotPrefixed() {
        var blocks = segmenter.splitExperience(stacked(
            "Acme Corp", "2 yrs", "Engineer", "Jan 2019 - Dec 2020",
            "Developer at Initech", "Jan 2021 - Present"));

        assertEquals(List.of("Developer at Initech", "Jan 2021 - Present"), texts(blocks).get(1));
    }

    @Test
    void experienceDropsFootersAndBlankLines() {
        var blocks = segmenter.splitExperience(stacked("Acme Corp", "", "Engineer", "Page 1 of 2", "2019 - 2020"));
        assertEquals(List.of(List.of("Acme Corp", "Engineer", "2019 - 2020")), texts(blocks));
    }

    @Test
    void educationFoldsWrappedYearIntoDegreeLine() {
        var blocks = segmenter.splitEducation(stacked(
            "MIT", "Bachelor of Science, Physics · (2010 -", "2014)",
            "Stanford", "2015 - 2017"));

        assertEquals(List.of(
                List.of("MIT", "Bachelor of Science, Physics · (2010 - 2014)"),
                List.of("Stanford", "2015 - 2017")),
            texts(blocks));
    }

    @Test
    void educationInstitutionsWithoutDegrees() {
        var blocks = segmenter.splitEducation(stacked("Harvard", "MBA (2019)", "Oxford", "Cambridge"));
        assertEquals(List.of(List.of("Harvard", "MBA (2019)"), List.of("Oxford"), List.of("Cambridge")), texts(blocks));
    }

    @Test
    void degreeLineShapes() {
        assertTrue(segmenter.looksLikeDegreeLine("BSc in Physics"));
        assertTrue(segmenter.looksLikeDegreeLine("Physics (2010"));
        assertTrue(segmenter.looksLikeDegreeLine("2010 - 2014"));
        assertFalse(segmenter.looksLikeDegreeLine("Stanford University"));
    }
}
