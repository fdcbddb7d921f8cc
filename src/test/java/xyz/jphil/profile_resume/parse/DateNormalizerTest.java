package xyz.jphil.profile_resume.parse;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.Vocabulary;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class DateNormalizerTest {

    private final DateNormalizer dates = new DateNormalizer(Vocabulary.defaults());

    @Test
    void normalizesSingleDates() {
        assertEquals("2020-01", dates.normalize("Jan 2020"));
        assertEquals("2020-01", dates.normalize("janvier 2020"));
        assertEquals("2018-09", dates.normalize("Sept. 2018"));
        assertEquals("2019", dates.normalize("2019"));
        assertEquals("2021-06", dates.normalize("2021-06"));
    }

    @Test
    void unknownMonthKeepsYear() {
        assertEquals("2020", dates.normalize("Spring 2020"));
    }

    @Test
    void unreadableAndOpenEndedGiveEmpty() {
        assertEquals("", dates.normalize("Present"));
        assertEquals("", dates.normalize("heute"));
        assertEquals("", dates.normalize("someday"));
        assertEquals("", dates.normalize(""));
        assertEquals("", dates.normalize(null));
    }

    @Test
    void parsesRangesInSeveralLanguages() {
        assertEquals(new DateRange("2019-01", "2021-12"), dates.parseRange("Jan 2019 - Dec 2021"));
        assertEquals(new DateRange("2020-03", ""), dates.parseRange("März 2020 – heute"));
        assertEquals(new DateRange("2020-01", ""), dates.parseRange("янв. 2020 - настоящее время"));
        assertEquals(new DateRange("2010", "2014"), dates.parseRange("(2010 - 2014)"));
        assertEquals(new DateRange("2015-02", "2016"), dates.parseRange("Feb 2015 to 2016 (1 year)"));
    }

    @Test
    void loneDateBecomesStart() {
        assertEquals(new DateRange("2021-03", ""), dates.parseRange("Issued Mar 2021"));
        assertTrue(dates.parseRange("no dates here").isEmpty());
        assertTrue(dates.parseRange(null).isEmpty());
    }

    @Test
    void dateOnlyLines() {
        assertTrue(dates.isDateOnly("2010 - 2014"));
        assertTrue(dates.isDateOnly("(2010 - 2014)"));
        assertTrue(dates.isDateOnly("Jan 2019 - Present (2 years)"));
        assertTrue(dates.isDateOnly("2019"));
        assertFalse(dates.isDateOnly("Bachelor, Physics (2010 - 2014)"));
        assertFalse(dates.isDateOnly("Stanford"));
        assertFalse(dates.isDateOnly("Stanford 2014"));
        assertFalse(dates.isDateOnly("MBA (2019)"));
        assertFalse(dates.isDateOnly(""));
    }

    @Test
    void dateLineFinderPrefersRanges() {
        assertEquals("2015 - 2017", dates.findDateLine(List.of("Graduated 2017", "2015 - 2017")));
        assertEquals("Graduated 2017", dates.findDateLine(List.of("MIT", "Graduated 2017")));
        assertEquals("", dates.findDateLine(List.of("MIT", "Physics")));
    }

    @Test
    void rangesAreCutOut() {
        assertEquals("BSc, Physics,", dates.removeRanges("BSc, Physics, 2010 - 2014"));
        assertEquals("Diploma", dates.removeRanges("Diploma 2001 - 2003"));
        assertEquals("Joined", dates.removeRanges("Joined Mar 2020 - Present"));
    }

    @Test
    void looseSidecarDates() {
        assertEquals("2021-03", dates.normalizeLoose("2021-03-15"));
        assertEquals("2021-03", dates.normalizeLoose("Mar 2021"));
        assertEquals("", dates.normalizeLoose("15/03/2021"));
        assertEquals("", dates.normalizeLoose(" "));
    }

    @Test
    void canonicalDigitsUnderNativeDigitLocale() {
        var saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("ar-SA"));
            assertEquals("2020-01", dates.normalize("Jan 2020"));
            assertEquals("2021-03", dates.normalizeLoose("2021-03-15"));
            assertEquals(new DateRange("2019-01", "2021-12"), dates.parseRange("Jan 2019 - Dec 2021"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void wordBeforeYearIsNotReadAsMonth() {
        assertEquals(new DateRange("2019", "2020"), dates.parseRange("Junior 2019 - 2020"));
        assertEquals(new DateRange("2018", "2020"), dates.parseRange("Marketing 2018 - 2020"));
        assertEquals(new DateRange("2018-09", "2019"), dates.parseRange("Septemb 2018 - 2019"));
    }
}
