package xyz.jphil.profile_resume.parse;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.LineFixtures;
import xyz.jphil.profile_resume.model.LanguageEntry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.profile_resume.LineFixtures.stacked;

public class LanguagesParserTest {

    private final LanguagesParser parser = new LanguagesParser(LineFixtures.rules());

    @Test
    void fluencyInParentheses() {
        assertEquals(List.of(
                new LanguageEntry("English", "Native or Bilingual"),
                new LanguageEntry("German", "")),
            parser.parse(stacked("English (Native or Bilingual)", "German", "Page 1 of 2")));
    }

    @Test
    void unbalancedParenthesesKeepWholeText() {
        assertEquals(new LanguageEntry("French (Elementary", ""), parser.parseLine("French (Elementary"));
    }
}
