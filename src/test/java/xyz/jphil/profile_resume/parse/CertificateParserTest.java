package xyz.jphil.profile_resume.parse;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.LineFixtures;
import xyz.jphil.profile_resume.model.CertificateEntry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.profile_resume.LineFixtures.stacked;

public class CertificateParserTest {

    private final CertificateParser parser = new CertificateParser(LineFixtures.rules());

    @Test
    void continuationsMergeIntoPreviousName() {
        var certificates = parser.parse(stacked(
            "AWS Certified Solutions Architect",
            "(Associate)",
            "Deep Learning",
            "Specialization",
            "Scrum Master Hobbies: chess"));

        assertEquals(List.of(
            CertificateEntry.named("AWS Certified Solutions Architect (Associate)"),
            CertificateEntry.named("Deep Learning Specialization"),
            CertificateEntry.named("Scrum Master")), certificates);
    }

    @Test
    void onlyOtherFieldsAreEmpty() {
        var certificate = parser.parse(stacked("CKA")).get(0);
        assertEquals("", certificate.issuer());
        assertEquals("", certificate.date());
        assertEquals("", certificate.url());
    }

    @Test
    void hobbiesAsideAloneIsDropped() {
        assertTrue(parser.parse(stacked("Hobbies: sailing")).isEmpty());
        assertEquals("Scrum Master", CertificateParser.cutHobbies("Scrum Master Hobbies: chess"));
    }
}
