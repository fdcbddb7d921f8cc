package xyz.jphil.profile_resume.parse;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.LineFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextRulesTest {

    private final TextRules rules = LineFixtures.rules();

    @Test
    void footers() {
        assertTrue(rules.isFooter("Page 1 of 3"));
        assertTrue(rules.isFooter("Seite 2 von 3"));
        assertFalse(rules.isFooter("Page one"));
    }

    @Test
    void durationsWithoutYears() {
        assertTrue(rules.isDuration("3 years 2 months"));
        assertTrue(rules.isDuration("2 yrs"));
        assertTrue(rules.isDuration("1 год 3 мес."));
        assertFalse(rules.isDuration("Jan 2019 - Dec 2021 (3 years)"));
        assertFalse(rules.isDuration("Senior Engineer"));
    }

    @Test
    void employmentTypesAreWholeWords() {
        assertTrue(rules.isEmploymentType("Full-time"));
        assertTrue(rules.isEmploymentType("Acme Corp · Freelance"));
        assertFalse(rules.isEmploymentType("Contractor"));
    }

    @Test
    void shortKeywordsNeedWordBoundaries() {
        assertTrue(rules.hasRoleKeyword("Senior Software Engineer"));
        assertTrue(rules.hasRoleKeyword("CTO"));
        assertFalse(rules.hasRoleKeyword("Victory Lap"));
        assertTrue(rules.hasDegreeKeyword("BA in Economics"));
        assertFalse(rules.hasDegreeKeyword("Banking"));
        assertTrue(rules.hasDegreeKeyword("Bachelor's degree"));
    }

    @Test
    void bullets() {
        assertTrue(rules.isBullet("• Shipped it"));
        assertTrue(rules.isBullet("  - Shipped it"));
        assertFalse(rules.isBullet("Shipped it"));
        assertEquals("Shipped it", rules.stripBullet("- • Shipped it"));
    }

    @Test
    void headingShape() {
        assertTrue(rules.looksLikeHeading("Experience"));
        assertTrue(rules.looksLikeHeading("Licenses & Certifications"));
        assertFalse(rules.looksLikeHeading("Experience 2020"));
        assertFalse(rules.looksLikeHeading("one two three four five six"));
        assertFalse(rules.looksLikeHeading(" "));
    }

    @Test
    void locationText() {
        assertTrue(rules.isLocationText("Berlin, Germany"));
        assertTrue(rules.isLocationText("Greater Boston Area"));
        assertFalse(rules.isLocationText("Software Engineer"));
    }

    @Test
    void contentTextsDropNoise() {
        var texts = List.of("Contact", "Page 1 of 2", "", "Achievements:", "3 years", "Full-time", "  Java ");
        assertEquals(List.of("Java"), rules.contentTexts(texts, true, true));
        assertEquals(List.of("3 years", "Full-time", "Java"), rules.contentTexts(texts, false, false));
    }

    @Test
    void tagging() {
        var tag = rules.tag("  Jan 2020 - Present ");
        assertEquals("Jan 2020 - Present", tag.text());
        assertTrue(tag.dateRange());
        assertFalse(tag.duration());
        assertTrue(rules.tag(null).isBlank());
    }
}
