package xyz.jphil.profile_resume.parse;

import org.junit.jupiter.api.Test;
import xyz.jphil.profile_resume.model.InterestEntry;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.profile_resume.LineFixtures.line;

public class HobbiesSummaryTest {

    private static final List<InterestEntry> CHESS_AND_RUNNING = List.of(new InterestEntry("Chess"), new InterestEntry("Running"));

    @Test
    void labelInsertedBeforeInterestsAlreadyInSummary() {
        assertEquals("I like building things. Hobbies: Chess, Running",
            HobbiesSummary.apply("I like building things. Chess, Running", CHESS_AND_RUNNING, ""));
    }

    @Test
    void clauseAppendedWhenInterestsAreMissing() {
        assertEquals("Engineer. Hobbies: Chess, Running", HobbiesSummary.apply("Engineer.", CHESS_AND_RUNNING, ""));
    }

    @Test
    void markerUsedWithoutInterests() {
        assertEquals("Engineer. Hobbies: Sailing on weekends",
            HobbiesSummary.apply("Engineer. Sailing on weekends", List.of(), "Sailing on weekends"));
        assertEquals("Engineer. Hobbies: Sailing", HobbiesSummary.apply("Engineer.", List.of(), "Sailing"));
    }

    @Test
    void unchangedCases() {
        assertEquals("My hobbies are chess", HobbiesSummary.apply("My hobbies are chess", CHESS_AND_RUNNING, ""));
        assertEquals("", HobbiesSummary.apply("", CHESS_AND_RUNNING, ""));
        assertEquals("Engineer.", HobbiesSummary.apply("Engineer.", List.of(), ""));
    }

    @Test
    void markerIsNearestLineBelowAsideInOtherColumn() {
        var lines = List.of(
            line("Earlier text", 490, 250),
            line("Hobbies:", 500, 30),
            line("Sailing on weekends", 505, 250),
            line("Other text", 520, 250),
            line("Left column text", 502, 30));

        assertEquals("Sailing on weekends", HobbiesSummary.findMarker(lines, OptionalDouble.of(140)));
        assertEquals("", HobbiesSummary.findMarker(lines, OptionalDouble.empty()));
    }

    @Test
    void markerOnlyOnSamePage() {
        var lines = List.of(line("Hobbies:", 500, 30, 0), line("Sailing", 505, 250, 1));
        assertEquals("", HobbiesSummary.findMarker(lines, OptionalDouble.of(140)));
    }
}
