package xyz.jphil.profile_resume.tools.pdf;

import org.apache.pdfbox.Loader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.jphil.profile_resume.ResumeParser;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.WordToken;
import xyz.jphil.profile_resume.tools.SamplePdf;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PdfWordExtractorTest {

    @TempDir
    Path tempDir;

    @Test
    void wordsCarryTopDownPositions() throws Exception {
        var pdf = SamplePdf.write(tempDir.resolve("profile.pdf"), "Jane Doe", "Staff Engineer");

        var pages = PdfWordExtractor.extract(pdf.toFile());

        assertEquals(1, pages.size());
        var page = pages.get(0);
        assertEquals(0, page.pageIndex());
        assertEquals(612, page.width(), 0.5);
        assertEquals(List.of("Jane", "Doe", "Staff", "Engineer"), page.words().stream().map(WordToken::text).toList());

        var jane = page.words().get(0);
        assertEquals(792 - SamplePdf.FIRST_BASELINE, jane.box().bottom(), 1.0);
        assertTrue(jane.box().top() < jane.box().bottom());
        assertEquals(SamplePdf.MARGIN, jane.box().left(), 1.0);
        assertTrue(page.words().get(1).box().left() > jane.box().right());
        assertTrue(page.words().get(2).box().top() > jane.box().bottom());
    }

    @Test
    void extractedWordsRebuildTheLines() throws Exception {
        var pdf = SamplePdf.write(tempDir.resolve("profile.pdf"), "Jane Doe", "Jan 2019 - Dec 2021");

        try (var document = Loader.loadPDF(pdf.toFile())) {
            var result = new ResumeParser().analyze(new PdfWordExtractor().extract(document));
            assertEquals(List.of("Jane Doe", "Jan 2019 - Dec 2021"), result.lines().stream().map(Line::text).toList());
        }
    }

    @Test
    void infoDescribesFirstPage() throws Exception {
        var pdf = SamplePdf.write(tempDir.resolve("profile.pdf"), "Jane Doe");

        try (var document = Loader.loadPDF(pdf.toFile())) {
            var info = PdfInfoUtil.getPdfInfo(document, pdf.toFile());
            assertEquals(1, info.pageCount());
            assertEquals(612, info.pg0Width(), 0.5);
            assertEquals(792, info.pg0Height(), 0.5);
            assertTrue(info.describe().startsWith("1 pages, "));
        }
    }

    @Test
    void byteSizes() {
        assertEquals("512B", PdfInfoUtil.formatBytes(512));
        assertEquals("1.5KB", PdfInfoUtil.formatBytes(1536));
        assertEquals("2.0MB", PdfInfoUtil.formatBytes(2 * 1024 * 1024));
    }
}
