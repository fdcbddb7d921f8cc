package xyz.jphil.profile_resume;

import xyz.jphil.profile_resume.layout.BlockSegmenter;
import xyz.jphil.profile_resume.layout.ColumnSplitDetector;
import xyz.jphil.profile_resume.layout.LineReconstructor;
import xyz.jphil.profile_resume.layout.SectionClassifier;
import xyz.jphil.profile_resume.model.PageTokens;
import xyz.jphil.profile_resume.model.Resume;
import xyz.jphil.profile_resume.parse.*;

import java.util.List;

import static xyz.jphil.profile_resume.model.SectionKind.*;

/**
 * Converts the word tokens of a profile document into a {@link Resume}.
 * <p>
 * Stages run strictly in sequence: lines are reconstructed for every page, the column boundary is
 * detected over all lines, lines are assigned to sections, each section goes through its category
 * parser, and a final pass labels hobbies in the summary. The parser holds no per-document state,
 * so one instance may be shared.
 * <p>
 * Never throws on a token stream: empty or sparse input gives a resume with every field present
 * and empty.
 */
public class ResumeParser {

    private final LineReconstructor reconstructor;
    private final ColumnSplitDetector columns;
    private final SectionClassifier classifier;
    private final BasicsParser basics;
    private final WorkParser work;
    private final EducationParser education;
    private final SkillsParser skills;
    private final CertificateParser certificates;
    private final ProjectParser projects;
    private final VolunteerParser volunteer;
    private final LanguagesParser languages;
    private final InterestsParser interests;

    public ResumeParser() {
        this(Vocabulary.defaults(), ParserSettings.defaults());
    }

    public ResumeParser(Vocabulary vocabulary, ParserSettings settings) {
        var rules = new TextRules(vocabulary, settings);
        var segmenter = new BlockSegmenter(rules, settings);
        this.reconstructor = new LineReconstructor(settings);
        this.columns = new ColumnSplitDetector(settings);
        this.classifier = new SectionClassifier(vocabulary, rules);
        this.basics = new BasicsParser(rules);
        this.work = new WorkParser(rules, segmenter);
        this.education = new EducationParser(rules, segmenter);
        this.skills = new SkillsParser(rules);
        this.certificates = new CertificateParser(rules);
        this.projects = new ProjectParser(rules, segmenter);
        this.volunteer = new VolunteerParser(rules, segmenter);
        this.languages = new LanguagesParser(rules);
        this.interests = new InterestsParser(rules);
    }

    public Resume parse(List<PageTokens> pages) {
        return analyze(pages).resume();
    }

    /**
     * Full pipeline run keeping the intermediate lines, column boundary and sections
     */
    public ParseResult analyze(List<PageTokens> pages) {
        var lines = reconstructor.reconstruct(pages == null ? List.of() : pages);
        var split = columns.detect(lines);
        var sections = classifier.classify(lines, split);

        var interestEntries = interests.parse(sections.lines(INTERESTS));
        var parsedBasics = basics.parse(lines, sections.lines(ABOUT));
        var summary = HobbiesSummary.apply(parsedBasics.summary(), interestEntries,
            HobbiesSummary.findMarker(lines, split));

        var resume = new Resume(
            parsedBasics.withSummary(summary),
            work.parse(sections.lines(EXPERIENCE)),
            education.parse(sections.lines(EDUCATION)),
            skills.parse(sections.lines(SKILLS)),
            certificates.parse(sections.lines(CERTIFICATIONS)),
            projects.parse(sections.lines(PROJECTS)),
            volunteer.parse(sections.lines(VOLUNTEER)),
            languages.parse(sections.lines(LANGUAGES)),
            interestEntries);
        return new ParseResult(lines, split, sections, resume);
    }
}
