package xyz.jphil.profile_resume.tools;

import org.apache.pdfbox.Loader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.profile_resume.ParseResult;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.ResumeParser;
import xyz.jphil.profile_resume.Vocabulary;
import xyz.jphil.profile_resume.model.Resume;
import xyz.jphil.profile_resume.model.SectionKind;
import xyz.jphil.profile_resume.parse.DateNormalizer;
import xyz.jphil.profile_resume.tools.pdf.PdfInfoUtil;
import xyz.jphil.profile_resume.tools.pdf.PdfWordExtractor;
import xyz.jphil.profile_resume.tools.sidecar.SidecarMerger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Command-line converter from a profile PDF to a JSON Resume file.
 * Built with PicoCLI for argument parsing and help generation.
 */
@Command(
    name = "profile-resume",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Convert a profile PDF export into a JSON Resume document"
)
public class ResumeTool implements Callable<Integer> {

    @Parameters(index = "0", description = "Input profile PDF")
    private File pdfFile;

    @Option(names = {"-o", "--output"}, description = "Output JSON file (default: input.pdf.resume.json)")
    private File outputFile;

    @Option(names = {"--personal-info"}, description = "Optional personal-info JSON to merge (phone, additional_skills)")
    private File personalInfo;

    @Option(names = {"--skills-csv"}, description = "Optional Skills.csv export to merge into skills")
    private File skillsCsv;

    @Option(names = {"--certifications-csv"}, description = "Optional Certifications.csv export to enrich certificates")
    private File certificationsCsv;

    @Option(names = {"--projects-csv"}, description = "Optional Projects.csv export to enrich projects")
    private File projectsCsv;

    @Option(names = {"--single-column"}, description = "Treat every page as a single column")
    private boolean singleColumn;

    @Option(names = {"--compact"}, description = "Write single-line JSON")
    private boolean compact;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ResumeTool()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            if (!pdfFile.isFile()) {
                System.err.println("Error: Input file does not exist: " + pdfFile);
                return 1;
            }

            var vocabulary = Vocabulary.defaults();
            var settings = ParserSettings.defaults().withDetectColumns(!singleColumn);

            ParseResult result;
            log.step("PDF", "Loading " + pdfFile.getAbsolutePath());
            try (var document = Loader.loadPDF(pdfFile)) {
                log.info("PDF", PdfInfoUtil.getPdfInfo(document, pdfFile).describe());
                var pages = new PdfWordExtractor().extract(document);
                log.debug("PDF", pages.stream().mapToInt(p -> p.words().size()).sum() + " word tokens");
                result = new ResumeParser(vocabulary, settings).analyze(pages);
            }
            reportLayout(log, result);

            var resume = mergeSidecars(log, result.resume(), new SidecarMerger(new DateNormalizer(vocabulary)));

            var target = outputFile != null ? outputFile : defaultOutputFile();
            var json = ResumeJsonSerializer.toJsonString(resume, compact);
            Files.writeString(target.toPath(), json, StandardCharsets.UTF_8);
            log.success("JSON", String.format("Written to %s (%d bytes)", target.getName(), json.length()));
            log.complete("RESUME", summarize(resume));
            return 0;

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    /**
     * Default output name in pattern: input.pdf.resume.json
     */
    private File defaultOutputFile() {
        return new File(pdfFile.getAbsoluteFile().getParentFile(), pdfFile.getName() + ".resume.json");
    }

    private Resume mergeSidecars(LogFormatter log, Resume resume, SidecarMerger merger) throws IOException {
        var merged = resume;
        if (present(log, personalInfo)) {
            merged = merger.mergePersonalInfo(merged, personalInfo.toPath());
            log.success("SIDECAR", "Merged " + personalInfo.getName());
        }
        if (present(log, skillsCsv)) {
            merged = merger.mergeSkillsCsv(merged, skillsCsv.toPath());
            log.success("SIDECAR", "Merged " + skillsCsv.getName());
        }
        if (present(log, certificationsCsv)) {
            merged = merger.mergeCertificationsCsv(merged, certificationsCsv.toPath());
            log.success("SIDECAR", "Merged " + certificationsCsv.getName());
        }
        if (present(log, projectsCsv)) {
            merged = merger.mergeProjectsCsv(merged, projectsCsv.toPath());
            log.success("SIDECAR", "Merged " + projectsCsv.getName());
        }
        return merged;
    }

    private static boolean present(LogFormatter log, File file) {
        if (file == null) return false;
        if (!file.isFile()) {
            log.warning("SIDECAR", "Skipping missing file " + file);
            return false;
        }
        return true;
    }

    private static void reportLayout(LogFormatter log, ParseResult result) {
        if (!log.verbose()) return;
        log.info("LAYOUT", result.lines().size() + " lines, " + (result.twoColumns()
            ? String.format("two columns split at x=%.1f", result.split().getAsDouble())
            : "single column"));
        for (var kind : SectionKind.values()) {
            int size = result.sections().size(kind);
            if (size > 0) log.debug("SECTION", kind.key() + ": " + size + " lines");
        }
    }

    static String summarize(Resume resume) {
        return String.format("%s: %d work, %d education, %d skills, %d certificates, %d projects, "
                + "%d volunteer, %d languages, %d interests",
            resume.basics().name().isEmpty() ? "(no name)" : resume.basics().name(),
            resume.work().size(), resume.education().size(), resume.skills().size(),
            resume.certificates().size(), resume.projects().size(), resume.volunteer().size(),
            resume.languages().size(), resume.interests().size());
    }
}
